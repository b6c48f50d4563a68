package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.engine.QueryEngineSession;
import io.github.yok.flexpipeline.engine.query.Identifiers;
import io.github.yok.flexpipeline.engine.query.ProjectionExpressionParser;
import io.github.yok.flexpipeline.engine.query.ProjectionQuery;
import io.github.yok.flexpipeline.exception.ProjectionBuildException;
import io.github.yok.flexpipeline.model.FieldSchema;
import io.github.yok.flexpipeline.model.ProjectionSpec;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Materializes the configured projections of an entity.
 *
 * <p>
 * The final dataset is loaded once as {@code <entity>_stage}. Each projection expression is parsed,
 * checked against the schema and rendered with quoted identifiers; the reference to the entity is
 * rebound to the stage relation. A failing projection is recorded and skipped, the others are
 * still built. A projection without a query is skipped with a warning and is not a failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ProjectionBuilder {

    static final String STAGE_SUFFIX = "_stage";

    private final ProjectionExpressionParser parser;

    public ProjectionBuilder() {
        this(new ProjectionExpressionParser());
    }

    public ProjectionBuilder(ProjectionExpressionParser parser) {
        this.parser = parser;
    }

    /**
     * Returns the name of the base relation of an entity.
     *
     * @param entity entity name
     * @return {@code <entity>_stage}
     */
    public static String stageRelation(String entity) {
        return entity + STAGE_SUFFIX;
    }

    /**
     * Loads the dataset and builds every projection.
     *
     * @param session open engine session
     * @param entity entity name
     * @param dataset final (validated, deduplicated, rule-checked) dataset
     * @param projections projections in configuration order
     * @param schema entity schema
     * @return built, skipped and failed projections
     * @throws SQLException if the base relation cannot be loaded
     */
    public ProjectionBuildResult build(QueryEngineSession session, String entity,
            TabularDataset dataset, List<ProjectionSpec> projections, FieldSchema schema)
            throws SQLException {
        String stage = stageRelation(entity);
        session.loadTable(stage, schema, dataset.getRecords());
        log.info("Loaded {} rows into {}", dataset.size(), stage);

        List<ProjectionSpec> built = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        for (ProjectionSpec projection : projections) {
            if (StringUtils.isBlank(projection.getExpression())) {
                log.warn("No query defined for {} '{}' of '{}'. Skipping.",
                        projection.getKind().label(), projection.getName(), entity);
                skipped.add(projection.getName());
                continue;
            }
            try {
                claimName(projection.getName(), stage, claimed);
                buildOne(session, entity, stage, projection, schema);
                built.add(projection);
                log.info("Created {} '{}' for '{}'", projection.getKind().label(),
                        projection.getName(), entity);
            } catch (ProjectionBuildException e) {
                log.warn("Skipping {} '{}': {}", projection.getKind().label(),
                        projection.getName(), e.getMessage());
                failed.put(projection.getName(), e.getMessage());
            }
        }
        return new ProjectionBuildResult(built, skipped, failed);
    }

    // The base relation and earlier projections must not be replaced by a later projection.
    private static void claimName(String name, String stage, Set<String> claimed) {
        if (name.equalsIgnoreCase(stage)) {
            throw new ProjectionBuildException(name,
                    "Projection name '" + name + "' is reserved for the base relation");
        }
        if (!claimed.add(name.toLowerCase(Locale.ROOT))) {
            throw new ProjectionBuildException(name, "Duplicate projection name '" + name + "'");
        }
    }

    private void buildOne(QueryEngineSession session, String entity, String stage,
            ProjectionSpec projection, FieldSchema schema) {
        String name = projection.getName();
        if (!Identifiers.isPlain(name)) {
            throw new ProjectionBuildException(name, "Invalid projection name '" + name + "'");
        }

        for (Map.Entry<String, String> alias : projection.getAliases().entrySet()) {
            if (!schema.contains(alias.getKey())) {
                throw new ProjectionBuildException(name, "Field '" + alias.getKey()
                        + "' in aliases is not defined in the schema.");
            }
            if (!Identifiers.isPlain(alias.getValue())) {
                throw new ProjectionBuildException(name,
                        "Invalid alias '" + alias.getValue() + "' for field '" + alias.getKey()
                                + "'");
            }
        }

        ProjectionQuery query = parse(name, projection.getExpression());
        if (!entity.equals(query.getEntity())) {
            throw new ProjectionBuildException(name, "Query must select from '" + entity
                    + "' but selects from '" + query.getEntity() + "'");
        }
        for (String field : query.referencedFields()) {
            if (!schema.contains(field)) {
                throw new ProjectionBuildException(name,
                        "Field '" + field + "' is not defined in the schema.");
            }
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        projection.getAliases().forEach((source, alias) -> {
            if (query.isSelectAll() || query.getFields().contains(source)) {
                aliases.put(source, alias);
            } else {
                log.debug("Alias {} -> {} ignored; '{}' is not selected by '{}'", source, alias,
                        source, name);
            }
        });

        try {
            session.createRelation(name, projection.getKind(), query, stage,
                    schema.getFieldNames(), aliases);
        } catch (SQLException e) {
            throw new ProjectionBuildException(name,
                    "Failed to create " + projection.getKind().label() + ": " + e.getMessage(),
                    e);
        }
    }

    private ProjectionQuery parse(String name, String expression) {
        try {
            return parser.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new ProjectionBuildException(name, "Invalid query: " + e.getMessage(), e);
        }
    }
}
