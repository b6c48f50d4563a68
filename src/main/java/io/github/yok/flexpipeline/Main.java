package io.github.yok.flexpipeline;

import io.github.yok.flexpipeline.config.PathsConfig;
import io.github.yok.flexpipeline.config.PipelineConfig;
import io.github.yok.flexpipeline.core.PipelineOrchestrator;
import io.github.yok.flexpipeline.core.RunSummary;
import io.github.yok.flexpipeline.engine.QueryEngine;
import io.github.yok.flexpipeline.exception.ConfigurationException;
import io.github.yok.flexpipeline.exception.RuleViolationException;
import io.github.yok.flexpipeline.exception.SourceUnreadableException;
import io.github.yok.flexpipeline.util.ErrorHandler;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Usage: {@code <entity> [--config <file>] [--output-dir <dir>]}. The options override
 * {@code paths.config-file} and {@code paths.output-dir} of {@code application.yml}; the underscore
 * spelling {@code --output_dir} is accepted too.
 * </p>
 *
 * <p>
 * Every failure is reported through {@link ErrorHandler#errorAndExit(String, Throwable)} with a
 * prefix naming its category (configuration, validation, file, unexpected).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final PipelineConfig pipelineConfig;
    private final QueryEngine queryEngine;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Parses the arguments and runs the pipeline for the requested entity.
     *
     * @param args command-line arguments
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String entity = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    if (i + 1 < args.length) {
                        pathsConfig.setConfigFile(args[++i]);
                    }
                    break;
                case "--output-dir":
                case "--output_dir":
                case "-o":
                    if (i + 1 < args.length) {
                        pathsConfig.setOutputDir(args[++i]);
                    }
                    break;
                default:
                    if (args[i].startsWith("-") || entity != null) {
                        log.warn("Unknown argument: {}", args[i]);
                    } else {
                        entity = args[i];
                    }
            }
        }

        if (entity == null) {
            ErrorHandler.errorAndExit(
                    "Entity name is required. Usage: <entity> [--config <file>] "
                            + "[--output-dir <dir>]");
            return;
        }
        log.info("Entity: {}, Config: {}, Output: {}", entity, pathsConfig.getConfigFile(),
                pathsConfig.getOutputDir());

        try {
            RunSummary summary =
                    new PipelineOrchestrator(pathsConfig, pipelineConfig, queryEngine)
                            .run(entity);
            log.info("Pipeline finished. Entity [{}], Status [{}]", entity, summary.getStatus());
        } catch (ConfigurationException e) {
            ErrorHandler.errorAndExit("Configuration Error: " + e.getMessage(), e);
        } catch (RuleViolationException e) {
            ErrorHandler.errorAndExit("Validation Error: " + e.getMessage(), e);
        } catch (SourceUnreadableException e) {
            ErrorHandler.errorAndExit("File Error: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("Fatal error occurred (entity={}): {}", entity, e.getMessage(), e);
            ErrorHandler.errorAndExit("An unexpected error occurred: " + e.getMessage(), e);
        }
    }
}
