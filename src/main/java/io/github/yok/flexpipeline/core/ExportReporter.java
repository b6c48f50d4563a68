package io.github.yok.flexpipeline.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.yok.flexpipeline.config.PathsConfig;
import io.github.yok.flexpipeline.config.PipelineConfig;
import io.github.yok.flexpipeline.engine.QueryEngineSession;
import io.github.yok.flexpipeline.engine.RelationRows;
import io.github.yok.flexpipeline.exception.PipelineException;
import io.github.yok.flexpipeline.model.ErrorRecord;
import io.github.yok.flexpipeline.model.ProjectionSpec;
import io.github.yok.flexpipeline.model.RemovedRecord;
import io.github.yok.flexpipeline.model.RuleViolation;
import io.github.yok.flexpipeline.util.CsvUtils;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the files a run emits and prints its summary.
 *
 * <ul>
 * <li>{@code errors/<entity>_<stage>_errors.csv}: schema errors, removed duplicates and custom rule
 * violations, only when there is something to write</li>
 * <li>{@code exports/<projection>.csv}: full contents of each built projection</li>
 * <li>{@code summary.json}: optional machine-readable summary</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ExportReporter {

    static final String STAGE_SCHEMA = "schema_validation";
    static final String STAGE_DUPLICATES = "duplicates";
    static final String STAGE_CUSTOM_PREFIX = "custom_";
    static final String SUMMARY_JSON = "summary.json";

    private final PathsConfig pathsConfig;

    private final boolean writeSummaryJson;

    private final PrintStream out;

    private final ObjectMapper mapper =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ExportReporter(PathsConfig pathsConfig, PipelineConfig pipelineConfig) {
        this(pathsConfig, pipelineConfig, System.out);
    }

    /**
     * Creates a reporter printing its summary to the given stream.
     *
     * @param pathsConfig output locations
     * @param pipelineConfig pipeline settings
     * @param out summary destination
     */
    public ExportReporter(PathsConfig pathsConfig, PipelineConfig pipelineConfig,
            PrintStream out) {
        this.pathsConfig = pathsConfig;
        this.writeSummaryJson = pipelineConfig.isWriteSummaryJson();
        this.out = out;
    }

    /**
     * Writes the schema error artifact.
     *
     * @param entity entity name
     * @param errors error records
     * @param columns source columns, in file order
     * @return written file, or empty when there were no errors
     */
    public Optional<Path> writeSchemaErrors(String entity, List<ErrorRecord> errors,
            List<String> columns) {
        if (errors.isEmpty()) {
            log.info("No schema validation errors to save.");
            return Optional.empty();
        }
        List<String> headers = new ArrayList<>();
        headers.add("row");
        headers.add("errors");
        headers.addAll(columns);

        List<List<String>> rows = new ArrayList<>(errors.size());
        for (ErrorRecord error : errors) {
            List<String> row = new ArrayList<>(headers.size());
            row.add(String.valueOf(error.getRowIndex()));
            row.add(String.join("; ", error.getMessages()));
            columns.forEach(c -> row.add(CsvUtils.formatCell(error.getData().get(c))));
            rows.add(row);
        }
        return Optional.of(writeErrors(entity, STAGE_SCHEMA, headers, rows));
    }

    /**
     * Writes the removed-duplicates artifact.
     *
     * @param entity entity name
     * @param removed removed records
     * @param columns record columns
     * @return written file, or empty when nothing was removed
     */
    public Optional<Path> writeRemoved(String entity, List<RemovedRecord> removed,
            List<String> columns) {
        if (removed.isEmpty()) {
            log.info("No duplicates to save.");
            return Optional.empty();
        }
        return Optional.of(writeRows(entity, STAGE_DUPLICATES, removed, columns));
    }

    /**
     * Writes the artifact of one violated custom rule.
     *
     * @param entity entity name
     * @param violation violated rule and its rows
     * @param columns record columns
     * @return written file, or empty when the violation has no rows
     */
    public Optional<Path> writeRuleViolation(String entity, RuleViolation violation,
            List<String> columns) {
        if (violation.getRows().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(writeRows(entity, STAGE_CUSTOM_PREFIX + violation.getField(),
                violation.getRows(), columns));
    }

    private Path writeRows(String entity, String stage, List<RemovedRecord> records,
            List<String> columns) {
        List<String> headers = new ArrayList<>();
        headers.add("row");
        headers.addAll(columns);
        List<List<String>> rows = new ArrayList<>(records.size());
        for (RemovedRecord record : records) {
            List<String> row = new ArrayList<>(headers.size());
            row.add(String.valueOf(record.getRowIndex()));
            columns.forEach(c -> row.add(CsvUtils.formatCell(record.getData().get(c))));
            rows.add(row);
        }
        return writeErrors(entity, stage, headers, rows);
    }

    private Path writeErrors(String entity, String stage, List<String> headers,
            List<List<String>> rows) {
        Path file = pathsConfig.getErrorsDir().resolve(entity + "_" + stage + "_errors.csv");
        try {
            CsvUtils.writeCsvUtf8(file, headers, rows);
        } catch (IOException e) {
            throw new PipelineException("Failed to write error file: " + file, e);
        }
        log.info("{} errors saved to '{}' ({} rows)", stage, file, rows.size());
        return file;
    }

    /**
     * Exports every built projection. A failing export is logged and recorded; the remaining
     * projections are still exported.
     *
     * @param session open engine session holding the projections
     * @param projections successfully built projections
     * @return projection name → failure reason
     */
    public Map<String, String> exportProjections(QueryEngineSession session,
            List<ProjectionSpec> projections) {
        Map<String, String> failures = new LinkedHashMap<>();
        for (ProjectionSpec projection : projections) {
            Path file = pathsConfig.getExportsDir().resolve(projection.getName() + ".csv");
            try {
                RelationRows contents = session.fetchAll(projection.getName());
                List<List<String>> rows = new ArrayList<>(contents.size());
                for (List<Object> r : contents.getRows()) {
                    List<String> row = new ArrayList<>(r.size());
                    r.forEach(v -> row.add(CsvUtils.formatCell(v)));
                    rows.add(row);
                }
                CsvUtils.writeCsvUtf8(file, contents.getColumns(), rows);
                log.info("Exported {} '{}' to '{}'", projection.getKind().label(),
                        projection.getName(), file);
            } catch (SQLException | IOException e) {
                log.error("Failed to export {} '{}': {}", projection.getKind().label(),
                        projection.getName(), e.getMessage(), e);
                failures.put(projection.getName(), "export failed: " + e.getMessage());
            }
        }
        return failures;
    }

    /**
     * Counts the rows of every configured projection.
     *
     * @param session open engine session
     * @param projections all configured projections
     * @param skipped names of projections that were skipped for lack of a query
     * @return one summary per projection; {@code "skipped"} for skipped projections and
     *         {@code "error"} when the count failed
     */
    public List<ProjectionSummary> countProjections(QueryEngineSession session,
            List<ProjectionSpec> projections, Collection<String> skipped) {
        List<ProjectionSummary> counts = new ArrayList<>(projections.size());
        for (ProjectionSpec projection : projections) {
            if (skipped.contains(projection.getName())) {
                counts.add(ProjectionSummary.skipped(projection.getName(), projection.getKind()));
                continue;
            }
            try {
                counts.add(ProjectionSummary.counted(projection.getName(), projection.getKind(),
                        session.countRows(projection.getName())));
            } catch (SQLException e) {
                log.warn("Could not fetch row count for {}: {}", projection.getName(),
                        e.getMessage());
                counts.add(ProjectionSummary.failed(projection.getName(), projection.getKind()));
            }
        }
        return counts;
    }

    /**
     * Prints the summary and, when enabled, writes it as JSON.
     *
     * @param summary run summary
     */
    public void report(RunSummary summary) {
        out.print(render(summary));
        out.flush();
        if (writeSummaryJson) {
            Path file = pathsConfig.outputRoot().resolve(SUMMARY_JSON);
            try {
                Files.createDirectories(file.getParent());
                mapper.writeValue(file.toFile(), summary);
                log.info("Summary written to '{}'", file);
            } catch (IOException e) {
                throw new PipelineException("Failed to write summary: " + file, e);
            }
        }
    }

    /**
     * Renders the human-readable summary.
     *
     * @param summary run summary
     * @return summary text
     */
    public String render(RunSummary summary) {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append(nl).append("Processing Summary (").append(summary.getEntity()).append("):")
                .append(nl);
        sb.append("Status: ").append(summary.getStatus()).append(nl);
        sb.append("Total rows processed: ").append(summary.getTotalRows()).append(nl);
        sb.append("Total valid rows after schema validation: ").append(summary.getValidRows())
                .append(nl);
        sb.append("Total rows with schema validation errors: ")
                .append(summary.getSchemaErrors()).append(nl);
        sb.append("Total duplicate rows removed: ").append(summary.getDuplicatesRemoved())
                .append(nl);
        sb.append("Total rows with custom validation errors: ")
                .append(summary.getCustomInvalidRows()).append(nl);
        summary.getRuleViolations().forEach((field, count) -> sb.append("  ").append(field)
                .append(": ").append(count).append(" row(s)").append(nl));

        sb.append(nl).append("Projection Summary:").append(nl);
        if (summary.getProjections().isEmpty()) {
            sb.append("  (none)").append(nl);
        }
        for (ProjectionSummary p : summary.getProjections()) {
            sb.append("  ").append(p.getName()).append(" (").append(p.getType()).append("): ");
            if (p.isCounted()) {
                sb.append(p.getRows()).append(" rows");
            } else if (p.isSkipped()) {
                sb.append("skipped (no query defined)");
            } else {
                sb.append("Error fetching row count");
            }
            sb.append(nl);
        }
        summary.getProjectionFailures().forEach((name, reason) -> sb.append("  ! ").append(name)
                .append(": ").append(reason).append(nl));
        return sb.toString();
    }
}
