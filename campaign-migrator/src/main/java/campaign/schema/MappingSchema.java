package campaign.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, immutable rule set from canonical target field name to {@link MappingRule}.
 *
 * <p>The field mapper iterates this schema rather than the source record, so every
 * canonical field is considered on every record, including fields the source lacks.
 *
 * @see campaign.mapping.FieldMapper
 */
public final class MappingSchema {

    public static final MappingSchema EMPTY = new MappingSchema(Map.of());

    private final Map<String, MappingRule> rules;

    public MappingSchema(Map<String, MappingRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public Map<String, MappingRule> rules() {
        return rules;
    }

    public MappingRule rule(String targetField) {
        return rules.get(targetField);
    }

    public Set<String> targetFields() {
        return rules.keySet();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Converts the schema to a Map for reporting.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        rules.forEach((name, rule) -> map.put(name, rule.toMap()));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MappingSchema && rules.equals(((MappingSchema) o).rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }
}
