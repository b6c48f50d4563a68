package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.config.PipelineConfig;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.ErrorRecord;
import io.github.yok.flexpipeline.model.FieldRule;
import io.github.yok.flexpipeline.model.FieldSchema;
import io.github.yok.flexpipeline.model.FieldType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates every record of a dataset against a {@link FieldSchema}.
 *
 * <p>
 * Before validation, missing values of a fixed set of fields are replaced by configured defaults
 * ({@link PipelineConfig#getNullableDefaults()}). Each schema field is then checked in declaration
 * order: presence, type coercion, pattern, minimum. The first failing check of a field yields its
 * message; a record with at least one message becomes an {@link ErrorRecord}, otherwise its coerced
 * values (schema fields only) form a valid record.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaValidator {

    private final Map<String, Object> nullableDefaults;

    public SchemaValidator(PipelineConfig pipelineConfig) {
        this(pipelineConfig.getNullableDefaults());
    }

    /**
     * Creates a validator with an explicit default map.
     *
     * @param nullableDefaults field → substitute for a missing value
     */
    public SchemaValidator(Map<String, Object> nullableDefaults) {
        this.nullableDefaults = nullableDefaults == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(nullableDefaults));
    }

    /**
     * Partitions the dataset into valid and error records.
     *
     * @param dataset input records
     * @param schema field rules
     * @return result; every input record appears exactly once
     */
    public SchemaValidationResult validate(TabularDataset dataset, FieldSchema schema) {
        List<DataRecord> valid = new ArrayList<>();
        List<ErrorRecord> errors = new ArrayList<>();

        for (DataRecord record : dataset.getRecords()) {
            Map<String, Object> values = applyDefaults(record.getValues());
            Map<String, Object> coerced = new LinkedHashMap<>();
            List<String> messages = new ArrayList<>();

            for (Map.Entry<String, FieldRule> e : schema.getRules().entrySet()) {
                String field = e.getKey();
                FieldRule rule = e.getValue();
                Object raw = values.get(field);
                try {
                    coerced.put(field, check(rule, raw));
                } catch (IllegalArgumentException ex) {
                    messages.add(field + ": " + ex.getMessage());
                }
            }

            if (messages.isEmpty()) {
                valid.add(new DataRecord(record.getRowIndex(), coerced));
            } else {
                log.debug("Row {} failed schema validation: {}", record.getRowIndex(), messages);
                errors.add(new ErrorRecord(record.getRowIndex(), record.getValues(), messages));
            }
        }

        log.info("Schema validation: valid={}, errors={}", valid.size(), errors.size());
        return new SchemaValidationResult(dataset.derive(schema.getFieldNames(), valid), errors);
    }

    private Map<String, Object> applyDefaults(Map<String, Object> values) {
        if (nullableDefaults.isEmpty()) {
            return values;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        nullableDefaults.forEach((field, def) -> {
            if (isMissing(copy.get(field))) {
                copy.put(field, def);
            }
        });
        return copy;
    }

    /**
     * Runs the checks of one field.
     *
     * @return coerced value ({@code null} for an absent optional value)
     * @throws IllegalArgumentException with the message of the first failing check
     */
    private static Object check(FieldRule rule, Object raw) {
        if (isMissing(raw)) {
            if (rule.isRequired()) {
                throw new IllegalArgumentException("field required");
            }
            return rule.getType() == FieldType.STRING && raw != null ? raw.toString() : null;
        }

        Object value = rule.getType().coerce(raw);

        Optional<Pattern> pattern = rule.getPattern();
        if (pattern.isPresent() && !pattern.get().matcher(value.toString()).matches()) {
            throw new IllegalArgumentException(
                    "string does not match regex \"" + pattern.get().pattern() + "\"");
        }

        Optional<Double> minimum = rule.getMinimum();
        if (minimum.isPresent() && value instanceof Number
                && ((Number) value).doubleValue() < minimum.get()) {
            throw new IllegalArgumentException(
                    "ensure this value is greater than or equal to " + formatBound(minimum.get()));
        }
        return value;
    }

    private static boolean isMissing(Object value) {
        return value == null || (value instanceof CharSequence && StringUtils.isBlank(
                (CharSequence) value));
    }

    private static String formatBound(double bound) {
        if (bound == Math.rint(bound) && !Double.isInfinite(bound)) {
            return BigDecimal.valueOf(bound).toBigInteger().toString();
        }
        return Double.toString(bound);
    }
}
