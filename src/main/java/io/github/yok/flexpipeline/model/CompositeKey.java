package io.github.yok.flexpipeline.model;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Ordered list of field names whose combined value must be unique across a dataset.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class CompositeKey {

    private final List<String> fields;

    /**
     * Creates a composite key.
     *
     * @param fields key fields in order; must not be empty
     * @throws IllegalArgumentException if {@code fields} is empty
     */
    public CompositeKey(List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Composite key must contain at least one field.");
        }
        this.fields = ImmutableList.copyOf(fields);
    }

    /**
     * Extracts the key tuple of a record.
     *
     * <p>
     * The returned list may contain {@code null} elements; two records with {@code null} in the
     * same position belong to the same group. Floating point values compare numerically:
     * {@code -0.0} is grouped with {@code 0.0}, and {@code NaN} values form one group.
     * </p>
     *
     * @param record source record
     * @return key values in field order
     */
    public List<Object> extract(DataRecord record) {
        List<Object> tuple = new ArrayList<>(fields.size());
        for (String field : fields) {
            tuple.add(normalize(record.getValue(field)));
        }
        return tuple;
    }

    private static Object normalize(Object value) {
        if (value instanceof Double && (Double) value == 0.0d) {
            return 0.0d;
        }
        return value;
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
