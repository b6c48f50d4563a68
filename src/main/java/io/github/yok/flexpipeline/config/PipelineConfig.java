package io.github.yok.flexpipeline.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings that tune pipeline behavior, bound from the {@code pipeline} section.
 *
 * <ul>
 * <li>{@code pipeline.nullable-defaults}: fixed set of fields whose missing values are replaced
 * before schema validation</li>
 * <li>{@code pipeline.write-summary-json}: also write {@code summary.json} under the output
 * root</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
@NoArgsConstructor
public class PipelineConfig {

    /**
     * Field name → substitute for a missing value. Applied only to these fields.
     */
    private Map<String, Object> nullableDefaults = defaultNullableFields();

    /**
     * Whether the run summary is also written as JSON.
     */
    private boolean writeSummaryJson = false;

    private static Map<String, Object> defaultNullableFields() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("trial_period_ends_on", "");
        defaults.put("ends_on", "");
        defaults.put("es_contract_observations", "");
        defaults.put("pt_contract_type_id", 0);
        return defaults;
    }
}
