package io.github.yok.flexpipeline.dataset;

import io.github.yok.flexpipeline.model.DataRecord;
import java.util.List;

/**
 * Ordered, bounded, in-memory table of {@link DataRecord}s.
 *
 * <p>
 * Every stage consumes one dataset and produces another through {@link #derive(List)}; the
 * original row indexes travel with the records.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TabularDataset {

    /**
     * Returns the column names in order.
     *
     * @return column names
     */
    List<String> getColumns();

    /**
     * Returns the records in current order.
     *
     * @return records
     */
    List<DataRecord> getRecords();

    /**
     * Creates a dataset with the given columns and records.
     *
     * @param columns column names
     * @param records records
     * @return new dataset
     */
    TabularDataset derive(List<String> columns, List<DataRecord> records);

    /**
     * Creates a dataset with the same columns and different records.
     *
     * @param records records
     * @return new dataset
     */
    default TabularDataset derive(List<DataRecord> records) {
        return derive(getColumns(), records);
    }

    default int size() {
        return getRecords().size();
    }

    default boolean isEmpty() {
        return getRecords().isEmpty();
    }
}
