package io.github.yok.flexpipeline.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Complete, validated definition of one entity for a single pipeline run.
 *
 * <p>
 * Instances are immutable; collections are copied on construction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class EntitySpec {

    private final String name;

    private final String source;

    private final FieldSchema schema;

    private final List<CustomRule> customRules;

    private final List<CompositeKey> compositeKeys;

    private final DuplicateResolutionPolicy duplicateResolution;

    private final RuleEnforcementMode enforcementMode;

    private final List<ProjectionSpec> projections;

    @Builder
    private EntitySpec(String name, String source, FieldSchema schema,
            List<CustomRule> customRules, List<CompositeKey> compositeKeys,
            DuplicateResolutionPolicy duplicateResolution, RuleEnforcementMode enforcementMode,
            List<ProjectionSpec> projections) {
        this.name = name;
        this.source = source;
        this.schema = schema;
        this.customRules =
                customRules == null ? ImmutableList.of() : ImmutableList.copyOf(customRules);
        this.compositeKeys =
                compositeKeys == null ? ImmutableList.of() : ImmutableList.copyOf(compositeKeys);
        this.duplicateResolution = duplicateResolution;
        this.enforcementMode = enforcementMode;
        this.projections =
                projections == null ? ImmutableList.of() : ImmutableList.copyOf(projections);
    }
}
