package campaign.schema;

import campaign.mapping.Transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a parsed schema definition (nested maps and lists, as produced by a YAML or
 * JSON parser) into a typed {@link PlatformSchema}.
 *
 * <p>Every rule is checked while it is built:
 * <ul>
 *   <li>the root and every rule must be maps, with no keys outside the rule vocabulary</li>
 *   <li>{@code version} is required, and at least one of {@code mapping} / {@code validation}</li>
 *   <li>{@code field_type} / {@code type} literals must name a known type</li>
 *   <li>{@code transform} names must resolve in the {@link Transform} registry</li>
 *   <li>bounds only on numeric types, {@code nested_schema} only on objects</li>
 * </ul>
 * Any violation raises {@link SchemaLoadException} naming the offending path.
 *
 * <h2>Definition format:</h2>
 * <pre>
 * platform: facebook
 * version: 3
 * mapping:
 *   daily_cap:
 *     source_field: daily_budget
 *     field_type: float
 * validation:
 *   daily_budget:
 *     type: number
 *     min_value: 1
 * </pre>
 */
public final class SchemaDefinitionParser {

    private static final Set<String> ROOT_KEYS = Set.of("platform", "version", "mapping", "validation");
    private static final Set<String> MAPPING_KEYS =
            Set.of("source_field", "default", "field_type", "transform", "warning");
    private static final Set<String> VALIDATION_KEYS = Set.of(
            "type", "required", "description", "min_value", "max_value", "allowed_values", "nested_schema");

    private SchemaDefinitionParser() {}

    /**
     * Builds a platform schema from a parsed definition.
     *
     * @param platform the platform the definition belongs to
     * @param definition the parsed root of the definition
     * @return the typed schema
     * @throws SchemaLoadException if the definition is malformed
     */
    public static PlatformSchema parse(String platform, Object definition) {
        Map<String, Object> root = asMap(definition, platform);
        checkKeys(root, ROOT_KEYS, platform);

        Object version = root.get("version");
        if (version == null) {
            throw new SchemaLoadException(platform + ": missing 'version'");
        }
        if (!root.containsKey("mapping") && !root.containsKey("validation")) {
            throw new SchemaLoadException(platform + ": definition has neither 'mapping' nor 'validation'");
        }

        MappingSchema mapping = root.get("mapping") == null
                ? MappingSchema.EMPTY
                : parseMapping(asMap(root.get("mapping"), platform + ".mapping"), platform + ".mapping");
        ValidationSchema validation = root.get("validation") == null
                ? ValidationSchema.EMPTY
                : new ValidationSchema(parseFields(
                        asMap(root.get("validation"), platform + ".validation"), platform + ".validation"));

        return new PlatformSchema(platform, String.valueOf(version), mapping, validation);
    }

    // ===== mapping rules =====

    private static MappingSchema parseMapping(Map<String, Object> node, String path) {
        Map<String, MappingRule> rules = new LinkedHashMap<>();
        for (var entry : node.entrySet()) {
            String rulePath = path + "." + entry.getKey();
            rules.put(entry.getKey(), parseMappingRule(asMap(entry.getValue(), rulePath), rulePath));
        }
        return new MappingSchema(rules);
    }

    private static MappingRule parseMappingRule(Map<String, Object> node, String path) {
        checkKeys(node, MAPPING_KEYS, path);

        TargetType fieldType;
        try {
            fieldType = TargetType.fromLiteral(optionalString(node, "field_type", path));
        } catch (IllegalArgumentException e) {
            throw new SchemaLoadException(path + ": " + e.getMessage(), e);
        }

        String transformName = optionalString(node, "transform", path);
        Transform transform = null;
        if (transformName != null) {
            transform = Transform.byName(transformName)
                    .orElseThrow(() -> new SchemaLoadException(
                            path + ": unknown transform '" + transformName + "'"));
        }

        return new MappingRule(
                optionalString(node, "source_field", path),
                node.get("default"),
                fieldType,
                transform,
                optionalString(node, "warning", path));
    }

    // ===== validation rules =====

    private static Map<String, FieldDefinition> parseFields(Map<String, Object> node, String path) {
        Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        for (var entry : node.entrySet()) {
            String fieldPath = path + "." + entry.getKey();
            fields.put(entry.getKey(), parseField(entry.getKey(), asMap(entry.getValue(), fieldPath), fieldPath));
        }
        return fields;
    }

    private static FieldDefinition parseField(String name, Map<String, Object> node, String path) {
        checkKeys(node, VALIDATION_KEYS, path);

        String typeLiteral = optionalString(node, "type", path);
        if (typeLiteral == null) {
            throw new SchemaLoadException(path + ": missing 'type'");
        }
        FieldType type;
        try {
            type = FieldType.fromLiteral(typeLiteral);
        } catch (IllegalArgumentException e) {
            throw new SchemaLoadException(path + ": " + e.getMessage(), e);
        }

        boolean required = true;
        Object requiredNode = node.get("required");
        if (requiredNode != null) {
            if (!(requiredNode instanceof Boolean)) {
                throw new SchemaLoadException(path + ".required: expected boolean, got " + requiredNode);
            }
            required = (Boolean) requiredNode;
        }

        List<?> allowed = null;
        Object allowedNode = node.get("allowed_values");
        if (allowedNode != null) {
            if (!(allowedNode instanceof List)) {
                throw new SchemaLoadException(path + ".allowed_values: expected a list");
            }
            allowed = new ArrayList<>((List<?>) allowedNode);
            if (allowed.contains(null)) {
                throw new SchemaLoadException(path + ".allowed_values: null is not an allowed value");
            }
        }

        Map<String, FieldDefinition> nested = null;
        if (node.get("nested_schema") != null) {
            nested = parseFields(asMap(node.get("nested_schema"), path + ".nested_schema"), path + ".nested_schema");
        }

        try {
            return FieldDefinition.create(
                    name,
                    type,
                    required,
                    optionalString(node, "description", path),
                    optionalNumber(node, "min_value", path),
                    optionalNumber(node, "max_value", path),
                    allowed,
                    nested);
        } catch (IllegalArgumentException e) {
            throw new SchemaLoadException(path + ": " + e.getMessage(), e);
        }
    }

    // ===== helpers =====

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node, String path) {
        if (!(node instanceof Map)) {
            throw new SchemaLoadException(path + ": expected a map but got "
                    + (node == null ? "nothing" : node.getClass().getSimpleName()));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (var entry : ((Map<Object, Object>) node).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private static void checkKeys(Map<String, Object> node, Set<String> allowed, String path) {
        for (String key : node.keySet()) {
            if (!allowed.contains(key)) {
                throw new SchemaLoadException(path + ": unknown key '" + key + "'");
            }
        }
    }

    private static String optionalString(Map<String, Object> node, String key, String path) {
        Object value = node.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new SchemaLoadException(path + "." + key + ": expected a scalar");
        }
        return value.toString();
    }

    private static Double optionalNumber(Map<String, Object> node, String key, String path) {
        Object value = node.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new SchemaLoadException(path + "." + key + ": expected a number, got " + value);
        }
        return ((Number) value).doubleValue();
    }
}
