package io.github.yok.flexpipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Ordered mapping from field name to {@link FieldRule}.
 *
 * <p>
 * The declaration order is preserved; it defines the column order of the validated dataset and of
 * the base relation loaded into the query engine.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
@EqualsAndHashCode
public final class FieldSchema {

    private final Map<String, FieldRule> rules;

    /**
     * Creates a schema from an ordered map. The map is copied.
     *
     * @param rules field name → rule, in declaration order
     */
    public FieldSchema(Map<String, FieldRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * Returns whether the schema declares the given field.
     *
     * @param field field name (case-sensitive)
     * @return {@code true} if declared
     */
    public boolean contains(String field) {
        return rules.containsKey(field);
    }

    /**
     * Returns the rule of a declared field.
     *
     * @param field field name
     * @return rule, or {@code null} if the field is not declared
     */
    public FieldRule getRule(String field) {
        return rules.get(field);
    }

    /**
     * Returns the declared field names in order.
     *
     * @return unmodifiable list of field names
     */
    public List<String> getFieldNames() {
        return Collections.unmodifiableList(new ArrayList<>(rules.keySet()));
    }

    /**
     * Returns the full field → rule map in declaration order.
     *
     * @return unmodifiable map
     */
    public Map<String, FieldRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
