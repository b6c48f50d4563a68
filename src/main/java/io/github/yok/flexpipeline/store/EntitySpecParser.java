package io.github.yok.flexpipeline.store;

import io.github.yok.flexpipeline.core.ProjectionBuilder;
import io.github.yok.flexpipeline.engine.query.Identifiers;
import io.github.yok.flexpipeline.exception.ConfigurationException;
import io.github.yok.flexpipeline.model.CompositeKey;
import io.github.yok.flexpipeline.model.CustomRule;
import io.github.yok.flexpipeline.model.DuplicateResolutionPolicy;
import io.github.yok.flexpipeline.model.EntitySpec;
import io.github.yok.flexpipeline.model.FieldRule;
import io.github.yok.flexpipeline.model.FieldSchema;
import io.github.yok.flexpipeline.model.FieldType;
import io.github.yok.flexpipeline.model.ProjectionKind;
import io.github.yok.flexpipeline.model.ProjectionSpec;
import io.github.yok.flexpipeline.model.RuleEnforcementMode;
import io.github.yok.flexpipeline.model.RuleKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.PatternSyntaxException;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts the raw YAML tree of one entity into a validated {@link EntitySpec}.
 *
 * <p>
 * Required keys are {@code source}, {@code settings}, {@code validations},
 * {@code settings.duplicate_resolution} and {@code settings.custom_validation_mode}. Composite key
 * fields and custom rule fields must be declared in the schema. Projection names are unique
 * (case-insensitive) and may not take the name of the base relation. Alias sources are not checked
 * here; an unknown alias source only fails its projection at build time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class EntitySpecParser {

    private static final List<String> REQUIRED_KEYS = List.of("source", "settings", "validations");

    /**
     * Parses one entity definition.
     *
     * @param entity entity name
     * @param raw raw YAML node of the entity
     * @param sourceResolver maps the configured source locator to the one to read
     * @return validated definition
     * @throws ConfigurationException if the definition is incomplete or inconsistent
     */
    EntitySpec parse(String entity, Object raw, UnaryOperator<String> sourceResolver) {
        if (!Identifiers.isPlain(entity)) {
            throw new ConfigurationException("Invalid entity name '" + entity
                    + "': only letters, digits and underscores are allowed.");
        }
        Map<String, Object> details = asMap(raw, "entity '" + entity + "'");
        for (String key : REQUIRED_KEYS) {
            if (!details.containsKey(key) || details.get(key) == null) {
                throw new ConfigurationException(
                        "Missing required configuration '" + key + "' for entity '" + entity
                                + "'.");
            }
        }

        Map<String, Object> settings = asMap(details.get("settings"), "settings of " + entity);
        for (String key : List.of("duplicate_resolution", "custom_validation_mode")) {
            if (settings.get(key) == null) {
                throw new ConfigurationException(
                        "Missing '" + key + "' in settings for entity '" + entity + "'.");
            }
        }

        Map<String, Object> validations =
                asMap(details.get("validations"), "validations of " + entity);
        FieldSchema schema = parseSchema(entity, validations);

        DuplicateResolutionPolicy policy;
        RuleEnforcementMode mode;
        try {
            policy = DuplicateResolutionPolicy
                    .fromValue(String.valueOf(settings.get("duplicate_resolution")));
            mode = RuleEnforcementMode
                    .fromValue(String.valueOf(settings.get("custom_validation_mode")));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    e.getMessage() + " (entity '" + entity + "')", e);
        }

        return EntitySpec.builder().name(entity)
                .source(sourceResolver.apply(String.valueOf(details.get("source"))))
                .schema(schema)
                .customRules(parseCustomRules(entity, validations, schema))
                .compositeKeys(parseCompositeKeys(entity, settings, schema))
                .duplicateResolution(policy).enforcementMode(mode)
                .projections(parseProjections(entity, details.get("projections"))).build();
    }

    private FieldSchema parseSchema(String entity, Map<String, Object> validations) {
        Map<String, Object> schemaNode =
                asMap(validations.getOrDefault("schema", Collections.emptyMap()), "schema");
        Map<String, Object> fields =
                asMap(schemaNode.getOrDefault("fields", Collections.emptyMap()), "schema.fields");

        Map<String, FieldRule> rules = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            String field = e.getKey();
            Map<String, Object> def = asMap(e.getValue() == null ? Collections.emptyMap()
                    : e.getValue(), "field '" + field + "'");
            try {
                FieldType type = FieldType.fromName(
                        def.get("type") == null ? null : String.valueOf(def.get("type")));
                boolean required = Boolean.parseBoolean(String.valueOf(def.get("required")));
                String pattern = def.get("pattern") == null ? null
                        : String.valueOf(def.get("pattern"));
                Double minimum = null;
                if (def.get("min") != null && type.isNumeric()) {
                    minimum = Double.valueOf(String.valueOf(def.get("min")));
                }
                rules.put(field, new FieldRule(type, required, pattern, minimum));
            } catch (PatternSyntaxException e2) {
                throw new ConfigurationException("Invalid pattern for field '" + field
                        + "' of entity '" + entity + "': " + e2.getDescription(), e2);
            } catch (IllegalArgumentException e2) {
                throw new ConfigurationException("Invalid definition for field '" + field
                        + "' of entity '" + entity + "': " + e2.getMessage(), e2);
            }
        }
        return new FieldSchema(rules);
    }

    private List<CustomRule> parseCustomRules(String entity, Map<String, Object> validations,
            FieldSchema schema) {
        Map<String, Object> custom =
                asMap(validations.getOrDefault("custom", Collections.emptyMap()), "custom");
        List<CustomRule> rules = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Object item : asList(custom.get("rules"), "custom.rules")) {
            Map<String, Object> node = asMap(item, "custom rule");
            String field = node.get("field") == null ? null : String.valueOf(node.get("field"));
            if (StringUtils.isBlank(field)) {
                throw new ConfigurationException(
                        "Custom rule without 'field' for entity '" + entity + "'.");
            }
            if (!schema.contains(field)) {
                throw new ConfigurationException("Custom rule field '" + field
                        + "' is not defined in the schema of entity '" + entity + "'.");
            }
            if (!seen.add(field)) {
                throw new ConfigurationException("Duplicate custom rule for field '" + field
                        + "' of entity '" + entity + "'.");
            }
            RuleKind kind;
            try {
                kind = RuleKind.fromValue(
                        node.get("validation") == null ? null
                                : String.valueOf(node.get("validation")));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(
                        e.getMessage() + " (field '" + field + "', entity '" + entity + "')", e);
            }
            Map<String, Object> params = node.get("params") == null ? Collections.emptyMap()
                    : asMap(node.get("params"), "params of rule '" + field + "'");
            CustomRule rule = new CustomRule(field, kind, params);
            for (String param : kind.getNumericParams()) {
                try {
                    rule.getDecimalParam(param, null);
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(
                            e.getMessage() + " (entity '" + entity + "')", e);
                }
            }
            rules.add(rule);
        }
        return rules;
    }

    private List<CompositeKey> parseCompositeKeys(String entity, Map<String, Object> settings,
            FieldSchema schema) {
        List<CompositeKey> keys = new ArrayList<>();
        for (Object item : asList(settings.get("unique_composite"), "unique_composite")) {
            List<String> fields = new ArrayList<>();
            for (Object f : asList(item, "unique_composite entry")) {
                String field = String.valueOf(f);
                if (!schema.contains(field)) {
                    throw new ConfigurationException("Composite key field '" + field
                            + "' is not defined in the schema of entity '" + entity + "'.");
                }
                fields.add(field);
            }
            if (fields.isEmpty()) {
                throw new ConfigurationException(
                        "Empty composite key in unique_composite of entity '" + entity + "'.");
            }
            keys.add(new CompositeKey(fields));
        }
        return keys;
    }

    private List<ProjectionSpec> parseProjections(String entity, Object raw) {
        List<ProjectionSpec> projections = new ArrayList<>();
        Set<String> names = new HashSet<>();
        String stage = ProjectionBuilder.stageRelation(entity);
        for (Object item : asList(raw, "projections")) {
            Map<String, Object> node = asMap(item, "projection");
            String name = node.get("name") == null ? null : String.valueOf(node.get("name"));
            if (StringUtils.isBlank(name)) {
                throw new ConfigurationException(
                        "Projection without 'name' for entity '" + entity + "'.");
            }
            if (name.equalsIgnoreCase(stage)) {
                throw new ConfigurationException("Projection name '" + name
                        + "' is reserved for the base relation of entity '" + entity + "'.");
            }
            if (!names.add(name.toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Duplicate projection name '" + name
                        + "' for entity '" + entity + "'.");
            }
            ProjectionKind kind;
            try {
                kind = ProjectionKind.fromValue(
                        node.get("type") == null ? null : String.valueOf(node.get("type")));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(
                        e.getMessage() + " (projection '" + name + "', entity '" + entity + "')",
                        e);
            }
            String query = node.get("query") == null ? "" : String.valueOf(node.get("query"));
            Map<String, String> aliases = new LinkedHashMap<>();
            if (node.get("aliases") != null) {
                asMap(node.get("aliases"), "aliases of '" + name + "'")
                        .forEach((k, v) -> aliases.put(k, String.valueOf(v)));
            }
            projections.add(new ProjectionSpec(name, kind, query, aliases));
        }
        return projections;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map)) {
            throw new ConfigurationException("Expected a mapping for " + context + ".");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) node).forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static List<?> asList(Object node, String context) {
        if (node == null) {
            return Collections.emptyList();
        }
        if (!(node instanceof List)) {
            throw new ConfigurationException("Expected a list for " + context + ".");
        }
        return (List<?>) node;
    }
}
