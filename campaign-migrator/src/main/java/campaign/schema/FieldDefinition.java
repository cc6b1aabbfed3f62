package campaign.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable validation rule for a single source field.
 *
 * <p>The rule is tagged by its {@link FieldType}. Attributes that only make sense for
 * some types are only ever populated for those types:
 * <ul>
 *   <li>bounds ({@code min_value}/{@code max_value}, inclusive) - {@code number} and {@code integer}</li>
 *   <li>nested rules - {@code object}</li>
 *   <li>allowed values - any type</li>
 * </ul>
 *
 * <p>Instances are created through the per-type factories, which reject attributes the
 * type cannot carry. {@link SchemaDefinitionParser} uses them while loading a definition,
 * so a malformed rule never reaches the validator.
 *
 * <h2>Usage:</h2>
 * <pre>
 * FieldDefinition budget = FieldDefinition.numeric("daily_budget", FieldType.NUMBER, true,
 *         "Daily budget in USD", 1.0, 100000.0);
 * FieldDefinition targeting = FieldDefinition.object("targeting", false, "Targeting",
 *         Map.of("age_min", FieldDefinition.numeric("age_min", FieldType.INTEGER, false, "", 13.0, 65.0)));
 * </pre>
 *
 * @see ValidationSchema
 * @see campaign.validation.StructuralValidator
 */
public final class FieldDefinition {

    private final String name;
    private final FieldType type;
    private final boolean required;
    private final String description;
    private final Double minValue;
    private final Double maxValue;
    private final List<Object> allowedValues;
    private final Map<String, FieldDefinition> nestedSchema;

    private FieldDefinition(String name,
                            FieldType type,
                            boolean required,
                            String description,
                            Double minValue,
                            Double maxValue,
                            List<Object> allowedValues,
                            Map<String, FieldDefinition> nestedSchema) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.required = required;
        this.description = description == null ? "" : description;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.allowedValues = allowedValues == null ? null : List.copyOf(allowedValues);
        this.nestedSchema = nestedSchema == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(nestedSchema));
    }

    // ---------------- factories ----------------

    /**
     * Creates a rule with no bounds, allowed values or nesting.
     */
    public static FieldDefinition of(String name, FieldType type, boolean required, String description) {
        return of(name, type, required, description, null);
    }

    /**
     * Creates a rule restricted to a closed set of values.
     *
     * @param allowedValues the accepted values, or null for no restriction
     */
    public static FieldDefinition of(String name, FieldType type, boolean required, String description,
                                     List<?> allowedValues) {
        return create(name, type, required, description, null, null, allowedValues, null);
    }

    /**
     * Creates a bounded numeric rule. Either bound may be null.
     *
     * @throws IllegalArgumentException if the type is not numeric or {@code min > max}
     */
    public static FieldDefinition numeric(String name, FieldType type, boolean required, String description,
                                          Double minValue, Double maxValue) {
        return create(name, type, required, description, minValue, maxValue, null, null);
    }

    /**
     * Creates an object rule whose present keys are validated against {@code nestedSchema}.
     *
     * @param nestedSchema the nested rules, or null to accept any object
     */
    public static FieldDefinition object(String name, boolean required, String description,
                                         Map<String, FieldDefinition> nestedSchema) {
        return create(name, FieldType.OBJECT, required, description, null, null, null, nestedSchema);
    }

    /**
     * General factory used by the schema parser; every constraint between the type and
     * its attributes is checked here.
     *
     * @throws IllegalArgumentException if an attribute does not fit the type
     */
    public static FieldDefinition create(String name,
                                         FieldType type,
                                         boolean required,
                                         String description,
                                         Double minValue,
                                         Double maxValue,
                                         List<?> allowedValues,
                                         Map<String, FieldDefinition> nestedSchema) {
        Objects.requireNonNull(type, "type");
        if ((minValue != null || maxValue != null) && !type.isNumeric()) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' of type " + type.literal() + " cannot declare min_value/max_value");
        }
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' has min_value " + minValue + " greater than max_value " + maxValue);
        }
        if (nestedSchema != null && type != FieldType.OBJECT) {
            throw new IllegalArgumentException(
                    "Field '" + name + "' of type " + type.literal() + " cannot declare nested_schema");
        }
        List<Object> allowed = allowedValues == null || allowedValues.isEmpty()
                ? null
                : List.copyOf(allowedValues);
        return new FieldDefinition(name, type, required, description, minValue, maxValue, allowed, nestedSchema);
    }

    // ---------------- accessors ----------------

    public String name() { return name; }

    public FieldType type() { return type; }

    public boolean required() { return required; }

    public String description() { return description; }

    /** Inclusive lower bound; only present on numeric rules. */
    public Optional<Double> minValue() { return Optional.ofNullable(minValue); }

    /** Inclusive upper bound; only present on numeric rules. */
    public Optional<Double> maxValue() { return Optional.ofNullable(maxValue); }

    /** Closed set of accepted values; empty when unrestricted. */
    public Optional<List<Object>> allowedValues() { return Optional.ofNullable(allowedValues); }

    /** Nested rules; only present on object rules. */
    public Optional<Map<String, FieldDefinition>> nestedSchema() { return Optional.ofNullable(nestedSchema); }

    /**
     * Converts the rule to a Map for reporting.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.literal());
        map.put("required", required);
        map.put("description", description);
        if (minValue != null) map.put("min_value", minValue);
        if (maxValue != null) map.put("max_value", maxValue);
        if (allowedValues != null) map.put("allowed_values", allowedValues);
        if (nestedSchema != null) {
            Map<String, Object> nested = new LinkedHashMap<>();
            nestedSchema.forEach((k, v) -> nested.put(k, v.toMap()));
            map.put("nested_schema", nested);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldDefinition)) return false;
        FieldDefinition that = (FieldDefinition) o;
        return required == that.required
                && name.equals(that.name)
                && type == that.type
                && description.equals(that.description)
                && Objects.equals(minValue, that.minValue)
                && Objects.equals(maxValue, that.maxValue)
                && Objects.equals(allowedValues, that.allowedValues)
                && Objects.equals(nestedSchema, that.nestedSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, description, minValue, maxValue, allowedValues, nestedSchema);
    }

    @Override
    public String toString() {
        return "FieldDefinition{" +
                "name=" + name +
                ", type=" + type.literal() +
                ", required=" + required +
                '}';
    }
}
