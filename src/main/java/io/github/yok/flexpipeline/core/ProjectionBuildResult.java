package io.github.yok.flexpipeline.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.flexpipeline.model.ProjectionSpec;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Projections that were built, those skipped for lack of a query, and the reasons the others
 * failed.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ProjectionBuildResult {

    private final List<ProjectionSpec> built;

    // names of projections without a query
    private final List<String> skipped;

    // projection name -> reason
    private final Map<String, String> failed;

    public ProjectionBuildResult(List<ProjectionSpec> built, List<String> skipped,
            Map<String, String> failed) {
        this.built = ImmutableList.copyOf(built);
        this.skipped = ImmutableList.copyOf(skipped);
        this.failed = ImmutableMap.copyOf(failed);
    }
}
