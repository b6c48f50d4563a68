package io.github.yok.flexpipeline.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexpipeline.exception.SourceUnreadableException;
import io.github.yok.flexpipeline.model.DataRecord;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvDatasetReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void read_正常ケース_BOM付きCSVを読み込む_列順と行番号と空セルのnullが保持されること()
            throws Exception {
        Path csv = tempDir.resolve("employees.csv");
        Files.writeString(csv,
                "\uFEFFemployee_id,name,ends_on\n1,Ana,\n2,\"Dupont, Marc\",2024-01-01\n",
                StandardCharsets.UTF_8);

        TabularDataset dataset = new CsvDatasetReader().read(csv);

        assertEquals(List.of("employee_id", "name", "ends_on"), dataset.getColumns());
        assertEquals(2, dataset.size());
        DataRecord first = dataset.getRecords().get(0);
        assertEquals(1, first.getRowIndex());
        assertEquals("1", first.getValue("employee_id"));
        assertNull(first.getValue("ends_on"));
        DataRecord second = dataset.getRecords().get(1);
        assertEquals(2, second.getRowIndex());
        assertEquals("Dupont, Marc", second.getValue("name"));
    }

    @Test
    void read_正常ケース_ヘッダのみのCSVを読み込む_空のデータセットが返ること() throws Exception {
        Path csv = tempDir.resolve("empty.csv");
        Files.writeString(csv, "a,b\n", StandardCharsets.UTF_8);

        TabularDataset dataset = new CsvDatasetReader().read(csv);

        assertTrue(dataset.isEmpty());
        assertEquals(List.of("a", "b"), dataset.getColumns());
    }

    @Test
    void read_正常ケース_セミコロン区切りを指定する_区切り文字で分割されること() throws Exception {
        Path csv = tempDir.resolve("semi.csv");
        Files.writeString(csv, "a;b\nx;y\n", StandardCharsets.UTF_8);

        TabularDataset dataset = new CsvDatasetReader(';').read(csv);

        assertEquals("y", dataset.getRecords().get(0).getValue("b"));
    }

    @Test
    void read_異常ケース_存在しないファイルを指定する_SourceUnreadableExceptionが送出されること() {
        Path missing = tempDir.resolve("missing.csv");
        SourceUnreadableException ex = assertThrows(SourceUnreadableException.class,
                () -> new CsvDatasetReader().read(missing));
        assertTrue(ex.getMessage().contains("missing.csv"));
    }
}
