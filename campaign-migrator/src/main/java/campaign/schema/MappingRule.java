package campaign.schema;

import campaign.mapping.Transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable rule describing how one canonical target field is produced.
 *
 * @param sourceField key read from the source record, or null if the field is default-only
 * @param defaultValue value used when the source yields nothing, or null for no default;
 *                     lists and maps are held as unmodifiable copies
 * @param fieldType type the produced value is coerced to
 * @param transform named transform applied before coercion, or null
 * @param warning static advisory attached every time the field is processed, or null
 * @see MappingSchema
 * @see campaign.mapping.FieldMapper
 */
public record MappingRule(
        String sourceField,
        Object defaultValue,
        TargetType fieldType,
        Transform transform,
        String warning
) {
    public MappingRule {
        Objects.requireNonNull(fieldType, "fieldType");
        defaultValue = freeze(defaultValue);
    }

    /** Plain copy of a source field into a string-typed target. */
    public static MappingRule copy(String sourceField) {
        return new MappingRule(sourceField, null, TargetType.STRING, null, null);
    }

    public boolean hasSourceField() {
        return sourceField != null;
    }

    /**
     * Converts the rule to a Map for reporting, using the schema definition key names.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (sourceField != null) map.put("source_field", sourceField);
        if (defaultValue != null) map.put("default", defaultValue);
        map.put("field_type", fieldType.literal());
        if (transform != null) map.put("transform", transform.literal());
        if (warning != null) map.put("warning", warning);
        return map;
    }

    private static Object freeze(Object value) {
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (var entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }
}
