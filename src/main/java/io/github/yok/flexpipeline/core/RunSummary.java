package io.github.yok.flexpipeline.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Counts and outcome of a pipeline run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class RunSummary {

    private final String entity;

    private final RunStatus status;

    private final int totalRows;

    private final int validRows;

    private final int schemaErrors;

    private final int duplicatesRemoved;

    // field -> violating row count, in rule order
    private final Map<String, Integer> ruleViolations;

    private final int customInvalidRows;

    private final List<ProjectionSummary> projections;

    // projection name -> reason, for build and export failures
    private final Map<String, String> projectionFailures;

    @Builder
    private RunSummary(String entity, RunStatus status, int totalRows, int validRows,
            int schemaErrors, int duplicatesRemoved, Map<String, Integer> ruleViolations,
            int customInvalidRows, List<ProjectionSummary> projections,
            Map<String, String> projectionFailures) {
        this.entity = entity;
        this.status = status;
        this.totalRows = totalRows;
        this.validRows = validRows;
        this.schemaErrors = schemaErrors;
        this.duplicatesRemoved = duplicatesRemoved;
        this.ruleViolations =
                ruleViolations == null ? ImmutableMap.of() : ImmutableMap.copyOf(ruleViolations);
        this.customInvalidRows = customInvalidRows;
        this.projections =
                projections == null ? ImmutableList.of() : ImmutableList.copyOf(projections);
        this.projectionFailures = projectionFailures == null ? ImmutableMap.of()
                : ImmutableMap.copyOf(projectionFailures);
    }
}
