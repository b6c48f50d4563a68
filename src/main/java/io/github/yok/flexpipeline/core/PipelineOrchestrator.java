package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.config.PathsConfig;
import io.github.yok.flexpipeline.config.PipelineConfig;
import io.github.yok.flexpipeline.dataset.CsvDatasetReader;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.engine.QueryEngine;
import io.github.yok.flexpipeline.engine.QueryEngineSession;
import io.github.yok.flexpipeline.exception.PipelineException;
import io.github.yok.flexpipeline.exception.RuleViolationException;
import io.github.yok.flexpipeline.model.EntitySpec;
import io.github.yok.flexpipeline.model.RuleEnforcementMode;
import io.github.yok.flexpipeline.model.RuleViolation;
import io.github.yok.flexpipeline.store.ConfigStore;
import io.github.yok.flexpipeline.store.YamlConfigStore;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the pipeline for one entity.
 *
 * <p>
 * <strong>Stages:</strong>
 * </p>
 * <ol>
 * <li>Resolve the entity definition (configuration errors surface before anything else).</li>
 * <li>Open a query engine session; it is closed on every path.</li>
 * <li>Read the source CSV.</li>
 * <li>Schema validation. Errors are written; in {@code stop} mode the run ends here.</li>
 * <li>Deduplication. Removed rows are written; never fatal.</li>
 * <li>Custom rules. In {@code stop} mode the first violation is written and then rethrown.</li>
 * <li>Projections are built, exported and counted; the summary is reported.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PipelineOrchestrator {

    private final PathsConfig pathsConfig;
    private final Function<Path, ConfigStore> configStoreFactory;
    private final QueryEngine queryEngine;
    private final CsvDatasetReader reader;
    private final SchemaValidator schemaValidator;
    private final DeduplicationEngine deduplicationEngine;
    private final RuleValidator ruleValidator;
    private final ProjectionBuilder projectionBuilder;
    private final ExportReporter reporter;

    /**
     * Creates an orchestrator with the standard stages.
     *
     * @param pathsConfig configuration file and output locations
     * @param pipelineConfig pipeline settings
     * @param queryEngine engine used for projections
     */
    public PipelineOrchestrator(PathsConfig pathsConfig, PipelineConfig pipelineConfig,
            QueryEngine queryEngine) {
        this(pathsConfig, YamlConfigStore::new, queryEngine, new CsvDatasetReader(),
                new SchemaValidator(pipelineConfig), new DeduplicationEngine(),
                new RuleValidator(Clock.systemDefaultZone()), new ProjectionBuilder(),
                new ExportReporter(pathsConfig, pipelineConfig));
    }

    /**
     * Creates an orchestrator from explicit stages.
     *
     * @param pathsConfig configuration file and output locations
     * @param configStoreFactory opens the configuration file
     * @param queryEngine engine used for projections
     * @param reader source reader
     * @param schemaValidator schema stage
     * @param deduplicationEngine deduplication stage
     * @param ruleValidator custom rule stage
     * @param projectionBuilder projection stage
     * @param reporter artifact writer and summary printer
     */
    public PipelineOrchestrator(PathsConfig pathsConfig,
            Function<Path, ConfigStore> configStoreFactory, QueryEngine queryEngine,
            CsvDatasetReader reader, SchemaValidator schemaValidator,
            DeduplicationEngine deduplicationEngine, RuleValidator ruleValidator,
            ProjectionBuilder projectionBuilder, ExportReporter reporter) {
        this.pathsConfig = pathsConfig;
        this.configStoreFactory = configStoreFactory;
        this.queryEngine = queryEngine;
        this.reader = reader;
        this.schemaValidator = schemaValidator;
        this.deduplicationEngine = deduplicationEngine;
        this.ruleValidator = ruleValidator;
        this.projectionBuilder = projectionBuilder;
        this.reporter = reporter;
    }

    /**
     * Runs the pipeline.
     *
     * @param entity entity name in the configuration
     * @return summary of the run
     * @throws io.github.yok.flexpipeline.exception.ConfigurationException if the entity
     *         definition is missing or invalid
     * @throws io.github.yok.flexpipeline.exception.SourceUnreadableException if the source cannot
     *         be read
     * @throws RuleViolationException if a custom rule is violated in {@code stop} mode
     */
    public RunSummary run(String entity) {
        ConfigStore store = configStoreFactory.apply(Paths.get(pathsConfig.getConfigFile()));
        EntitySpec spec = store.getEntity(entity);
        log.info("Entity[{}] source={}, policy={}, mode={}", entity, spec.getSource(),
                spec.getDuplicateResolution().label(), spec.getEnforcementMode());

        try (QueryEngineSession session = queryEngine.openSession()) {
            return execute(spec, session);
        } catch (SQLException e) {
            throw new PipelineException("Query engine failure: " + e.getMessage(), e);
        }
    }

    private RunSummary execute(EntitySpec spec, QueryEngineSession session)
            throws SQLException {
        String entity = spec.getName();
        TabularDataset input = reader.read(Paths.get(spec.getSource()));
        RunSummary.RunSummaryBuilder summary =
                RunSummary.builder().entity(entity).totalRows(input.size());

        log.info("Validating schema...");
        SchemaValidationResult schema = schemaValidator.validate(input, spec.getSchema());
        TabularDataset valid = schema.getValid();
        summary.validRows(valid.size()).schemaErrors(schema.getErrors().size());
        if (schema.hasErrors()) {
            reporter.writeSchemaErrors(entity, schema.getErrors(), input.getColumns());
            log.warn("Schema validation errors found. {} records failed.",
                    schema.getErrors().size());
            if (spec.getEnforcementMode() == RuleEnforcementMode.STOP) {
                return finish(summary.status(RunStatus.HALTED_SCHEMA));
            }
        }

        log.info("Removing duplicates...");
        DeduplicationResult dedup = deduplicationEngine.deduplicate(valid,
                spec.getCompositeKeys(), spec.getDuplicateResolution());
        reporter.writeRemoved(entity, dedup.getRemoved(), valid.getColumns());
        summary.duplicatesRemoved(dedup.getRemoved().size());

        log.info("Executing custom validations...");
        RuleValidationResult rules;
        try {
            rules = ruleValidator.apply(dedup.getKept(), spec.getCustomRules(),
                    spec.getEnforcementMode());
        } catch (RuleViolationException e) {
            RuleViolation violation = e.getViolation();
            reporter.writeRuleViolation(entity, violation, valid.getColumns());
            finish(summary.status(RunStatus.HALTED_RULE)
                    .ruleViolations(Map.of(violation.getField(), violation.size()))
                    .customInvalidRows(violation.size()));
            throw e;
        }
        Map<String, Integer> violationCounts = new LinkedHashMap<>();
        for (RuleViolation violation : rules.getViolations()) {
            reporter.writeRuleViolation(entity, violation, valid.getColumns());
            violationCounts.put(violation.getField(), violation.size());
        }
        summary.ruleViolations(violationCounts).customInvalidRows(rules.getInvalidRowCount());

        log.info("Creating projections...");
        ProjectionBuildResult projections = projectionBuilder.build(session, entity,
                rules.getRemaining(), spec.getProjections(), spec.getSchema());

        log.info("Exporting projections to CSV...");
        Map<String, String> failures = new LinkedHashMap<>(projections.getFailed());
        failures.putAll(reporter.exportProjections(session, projections.getBuilt()));

        List<ProjectionSummary> counts = reporter.countProjections(session,
                spec.getProjections(), projections.getSkipped());
        return finish(summary.status(RunStatus.COMPLETED).projections(counts)
                .projectionFailures(failures));
    }

    private RunSummary finish(RunSummary.RunSummaryBuilder builder) {
        RunSummary summary = builder.build();
        reporter.report(summary);
        log.info("Entity[{}] finished with status {}", summary.getEntity(), summary.getStatus());
        return summary;
    }
}
