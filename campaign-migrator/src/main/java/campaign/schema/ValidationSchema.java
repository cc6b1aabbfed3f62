package campaign.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable rule set describing what a valid source record looks like, keyed by
 * source field name. Iteration order follows the schema definition.
 *
 * @see FieldDefinition
 * @see PlatformSchema#validation()
 */
public final class ValidationSchema {

    public static final ValidationSchema EMPTY = new ValidationSchema(Map.of());

    private final Map<String, FieldDefinition> fields;

    public ValidationSchema(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, FieldDefinition> fields() {
        return fields;
    }

    public Optional<FieldDefinition> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Converts the schema to a Map for reporting.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        fields.forEach((name, def) -> map.put(name, def.toMap()));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValidationSchema && fields.equals(((ValidationSchema) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }
}
