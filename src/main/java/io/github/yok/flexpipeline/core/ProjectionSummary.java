package io.github.yok.flexpipeline.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.yok.flexpipeline.model.ProjectionKind;
import lombok.Getter;
import lombok.ToString;

/**
 * Row count of one projection at the end of a run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ProjectionSummary {

    static final String ERROR = "error";

    static final String SKIPPED = "skipped";

    private final String name;

    private final String type;

    // Long row count, "skipped" when no query was defined, or "error" when it could not be fetched
    private final Object rows;

    private ProjectionSummary(String name, ProjectionKind kind, Object rows) {
        this.name = name;
        this.type = kind.label();
        this.rows = rows;
    }

    public static ProjectionSummary counted(String name, ProjectionKind kind, long rows) {
        return new ProjectionSummary(name, kind, rows);
    }

    public static ProjectionSummary failed(String name, ProjectionKind kind) {
        return new ProjectionSummary(name, kind, ERROR);
    }

    public static ProjectionSummary skipped(String name, ProjectionKind kind) {
        return new ProjectionSummary(name, kind, SKIPPED);
    }

    @JsonIgnore
    public boolean isCounted() {
        return rows instanceof Long;
    }

    @JsonIgnore
    public boolean isSkipped() {
        return SKIPPED.equals(rows);
    }
}
