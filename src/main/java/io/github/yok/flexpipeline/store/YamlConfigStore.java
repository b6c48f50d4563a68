package io.github.yok.flexpipeline.store;

import io.github.yok.flexpipeline.exception.ConfigurationException;
import io.github.yok.flexpipeline.model.EntitySpec;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * {@link ConfigStore} backed by a YAML transformations file.
 *
 * <pre>
 * transformations_config:
 *   employees:
 *     source: "./input_data/employees.csv"
 *     settings:
 *       duplicate_resolution: "last"
 *       custom_validation_mode: "skip"
 *       unique_composite:
 *         - ["employee_id", "company_id"]
 *     validations:
 *       schema:
 *         fields:
 *           employee_id: {"type": "int", "required": true}
 *       custom:
 *         rules:
 *           - field: birthday_on
 *             validation: "age_gte"
 *             params: {min_age: 18}
 *     projections:
 *       - name: contract_data
 *         type: "table"
 *         query: SELECT employee_id FROM employees
 *         aliases: {employee_id: emp_id}
 * </pre>
 *
 * <p>
 * The file is parsed once on construction; entity definitions are validated lazily by
 * {@link #getEntity(String)}. Relative {@code source} paths are resolved against the working
 * directory first, then against the directory of the configuration file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class YamlConfigStore implements ConfigStore {

    static final String ROOT_KEY = "transformations_config";

    private final Path configFile;

    private final Map<String, Object> entities;

    private final EntitySpecParser parser = new EntitySpecParser();

    /**
     * Loads the configuration file.
     *
     * @param configFile YAML file
     * @throws ConfigurationException if the file is missing, unreadable or has no
     *         {@code transformations_config} section
     */
    public YamlConfigStore(Path configFile) {
        this.configFile = configFile;
        this.entities = loadEntities(configFile);
        log.info("Loaded configuration '{}': entities={}", configFile, entities.keySet());
    }

    @Override
    public Set<String> getEntityNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(entities.keySet()));
    }

    @Override
    public EntitySpec getEntity(String entity) {
        if (!entities.containsKey(entity)) {
            throw new ConfigurationException(
                    "Entity '" + entity + "' not found in the configuration.");
        }
        EntitySpec spec = parser.parse(entity, entities.get(entity), this::resolveSource);
        log.debug("Entity[{}] parsed: {}", entity, spec);
        return spec;
    }

    /**
     * Resolves a configured source locator to a path string.
     *
     * @param source locator as written in the configuration
     * @return locator to read from
     */
    String resolveSource(String source) {
        Path direct = Path.of(source);
        if (direct.isAbsolute() || Files.exists(direct)) {
            return direct.toString();
        }
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Path sibling = parent.resolve(source).normalize();
            if (Files.exists(sibling)) {
                return sibling.toString();
            }
        }
        return direct.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadEntities(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Configuration file not found: " + configFile);
        }
        Object root;
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException(
                    "Failed to read configuration file: " + configFile + " (" + e.getMessage()
                            + ")", e);
        }
        Object section = root instanceof Map ? ((Map<String, Object>) root).get(ROOT_KEY) : null;
        if (!(section instanceof Map)) {
            throw new ConfigurationException(
                    "Missing '" + ROOT_KEY + "' section in configuration file: " + configFile);
        }
        return (Map<String, Object>) section;
    }
}
