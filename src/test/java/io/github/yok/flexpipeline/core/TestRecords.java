package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.dataset.InMemoryTabularDataset;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.model.DataRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds small datasets for stage tests.
 */
final class TestRecords {

    private TestRecords() {}

    /**
     * Creates a dataset from rows of cell values; row indices start at 1.
     */
    static TabularDataset dataset(List<String> columns, Object[]... rows) {
        List<DataRecord> records = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                values.put(columns.get(c), rows[i][c]);
            }
            records.add(new DataRecord(i + 1, values));
        }
        return new InMemoryTabularDataset(columns, records);
    }

    static Object[] row(Object... cells) {
        return Arrays.copyOf(cells, cells.length);
    }

    static List<Integer> rowIndices(List<DataRecord> records) {
        List<Integer> indices = new ArrayList<>();
        records.forEach(r -> indices.add(r.getRowIndex()));
        return indices;
    }
}
