package io.github.yok.flexpipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of a dataset.
 *
 * <p>
 * The row index is 1-based and refers to the original input order; it is kept unchanged through
 * every stage so that error artifacts can point back at the source file. Values may be
 * {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DataRecord {

    private final int rowIndex;

    private final Map<String, Object> values;

    /**
     * Creates a record. The value map is copied and its iteration order preserved.
     *
     * @param rowIndex 1-based original row index
     * @param values field name → value
     */
    public DataRecord(int rowIndex, Map<String, Object> values) {
        this.rowIndex = rowIndex;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of a field.
     *
     * @param field field name
     * @return value, or {@code null} if absent or null
     */
    public Object getValue(String field) {
        return values.get(field);
    }

    /**
     * Returns a copy of this record with the same row index and different values.
     *
     * @param newValues replacement values
     * @return new record
     */
    public DataRecord withValues(Map<String, Object> newValues) {
        return new DataRecord(rowIndex, newValues);
    }
}
