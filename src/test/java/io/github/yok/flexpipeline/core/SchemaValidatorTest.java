package io.github.yok.flexpipeline.core;

import static io.github.yok.flexpipeline.core.TestRecords.dataset;
import static io.github.yok.flexpipeline.core.TestRecords.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexpipeline.config.PipelineConfig;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.ErrorRecord;
import io.github.yok.flexpipeline.model.FieldRule;
import io.github.yok.flexpipeline.model.FieldSchema;
import io.github.yok.flexpipeline.model.FieldType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator(new PipelineConfig());

    private static FieldSchema schema() {
        Map<String, FieldRule> rules = new LinkedHashMap<>();
        rules.put("employee_id", new FieldRule(FieldType.INTEGER, true, null, null));
        rules.put("email", new FieldRule(FieldType.STRING, true, "^[^@]+@[^@]+$", null));
        rules.put("salary_amount", new FieldRule(FieldType.FLOAT, false, null, 0.0));
        rules.put("ends_on", new FieldRule(FieldType.STRING, false, "^\\d{4}-\\d{2}-\\d{2}$",
                null));
        return new FieldSchema(rules);
    }

    private static final List<String> COLUMNS =
            List.of("employee_id", "email", "salary_amount", "ends_on", "extra");

    @Test
    void validate_正常ケース_5行中1行の必須項目が欠落している_有効4行とエラー1行に分割されること() {
        TabularDataset input = dataset(COLUMNS,
                row("1", "a@x.io", "100.5", "2024-01-01", "e1"),
                row("2", "b@x.io", "200", null, "e2"),
                row("3", null, "300", null, "e3"),
                row("4", "d@x.io", null, null, "e4"),
                row("5", "e@x.io", "500", "2024-12-31", "e5"));

        SchemaValidationResult result = validator.validate(input, schema());

        assertEquals(4, result.getValid().size());
        assertEquals(1, result.getErrors().size());
        ErrorRecord error = result.getErrors().get(0);
        assertEquals(3, error.getRowIndex());
        assertEquals(List.of("email: field required"), error.getMessages());
        assertEquals("e3", error.getData().get("extra"));
        assertEquals(List.of(1, 2, 4, 5), TestRecords.rowIndices(result.getValid().getRecords()));
    }

    @Test
    void validate_正常ケース_有効なレコードを検証する_スキーマ列のみ型変換されて残ること() {
        TabularDataset input =
                dataset(COLUMNS, row("7", "a@x.io", "100.5", "2024-01-01", "dropped"));

        SchemaValidationResult result = validator.validate(input, schema());

        assertFalse(result.hasErrors());
        assertEquals(List.of("employee_id", "email", "salary_amount", "ends_on"),
                result.getValid().getColumns());
        DataRecord record = result.getValid().getRecords().get(0);
        assertEquals(7L, record.getValue("employee_id"));
        assertEquals(100.5d, record.getValue("salary_amount"));
        assertFalse(record.getValues().containsKey("extra"));
    }

    @Test
    void validate_異常ケース_複数項目が不正である_項目ごとに最初の失敗メッセージが記録されること() {
        TabularDataset input =
                dataset(COLUMNS, row("x1", "not-an-email", "-5", "31/12/2024", null));

        SchemaValidationResult result = validator.validate(input, schema());

        assertEquals(List.of("employee_id: value is not a valid integer",
                "email: string does not match regex \"^[^@]+@[^@]+$\"",
                "salary_amount: ensure this value is greater than or equal to 0",
                "ends_on: string does not match regex \"^\\d{4}-\\d{2}-\\d{2}$\""),
                result.getErrors().get(0).getMessages());
        assertTrue(result.getValid().isEmpty());
    }

    @Test
    void validate_正常ケース_任意項目が欠落している_パターン検査をせずnullとして受理されること() {
        SchemaValidator plain = new SchemaValidator(Collections.emptyMap());
        TabularDataset input = dataset(COLUMNS, row("1", "a@x.io", null, null, null));

        SchemaValidationResult result = plain.validate(input, schema());

        assertFalse(result.hasErrors());
        assertNull(result.getValid().getRecords().get(0).getValue("ends_on"));
        assertNull(result.getValid().getRecords().get(0).getValue("salary_amount"));
    }

    @Test
    void validate_正常ケース_既定値対象の項目が欠落している_既定値で補完されること() {
        Map<String, FieldRule> rules = new LinkedHashMap<>();
        rules.put("employee_id", new FieldRule(FieldType.INTEGER, true, null, null));
        rules.put("pt_contract_type_id", new FieldRule(FieldType.INTEGER, true, null, null));
        rules.put("es_contract_observations", new FieldRule(FieldType.STRING, false, null, null));
        TabularDataset input = dataset(
                List.of("employee_id", "pt_contract_type_id", "es_contract_observations"),
                row("1", null, null));

        SchemaValidationResult result = validator.validate(input, new FieldSchema(rules));

        assertFalse(result.hasErrors());
        DataRecord record = result.getValid().getRecords().get(0);
        assertEquals(0L, record.getValue("pt_contract_type_id"));
        assertEquals("", record.getValue("es_contract_observations"));
    }

    @Test
    void validate_正常ケース_全行を検証する_各行が有効かエラーのどちらか一方にのみ含まれること() {
        TabularDataset input = dataset(COLUMNS,
                row("1", "a@x.io", "1", null, null),
                row("2", "bad", "1", null, null),
                row(null, "c@x.io", "1", null, null));

        SchemaValidationResult result = validator.validate(input, schema());

        assertEquals(input.size(), result.getValid().size() + result.getErrors().size());
    }
}
