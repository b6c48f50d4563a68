package io.github.yok.flexpipeline.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code paths} section of {@code application.yml} and composes
 * the output directories of a run.
 *
 * <p>
 * Error artifacts are written under {@code <output-dir>/errors} and projection exports under
 * {@code <output-dir>/exports}. Both values can be overridden from the command line
 * ({@code --config}, {@code --output-dir}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "paths")
@Data
public class PathsConfig {

    // Transformations configuration file (YAML)
    private String configFile = "config.yaml";

    // Root directory of all emitted files
    private String outputDir = "output";

    /**
     * Returns the directory for error artifacts.
     *
     * @return {@code <output-dir>/errors}
     * @throws IllegalStateException if {@code outputDir} has not been set
     */
    public Path getErrorsDir() {
        return outputRoot().resolve("errors");
    }

    /**
     * Returns the directory for projection exports.
     *
     * @return {@code <output-dir>/exports}
     * @throws IllegalStateException if {@code outputDir} has not been set
     */
    public Path getExportsDir() {
        return outputRoot().resolve("exports");
    }

    /**
     * Returns the output root directory.
     *
     * @return output root
     * @throws IllegalStateException if {@code outputDir} has not been set
     */
    public Path outputRoot() {
        if (StringUtils.isBlank(outputDir)) {
            throw new IllegalStateException(
                    "paths.output-dir is not configured. Please set it in application.yml.");
        }
        return Paths.get(outputDir);
    }
}
