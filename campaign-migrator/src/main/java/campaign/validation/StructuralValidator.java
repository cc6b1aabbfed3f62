package campaign.validation;

import campaign.schema.FieldDefinition;
import campaign.schema.FieldType;
import campaign.schema.ValidationSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a single record against a {@link ValidationSchema} and collects every issue.
 *
 * <p>Per schema field:
 * <ol>
 *   <li>required and absent: {@code missing_required_field}, nothing else is checked</li>
 *   <li>wrong type: {@code type_mismatch}, nothing else is checked</li>
 *   <li>numeric bounds (inclusive): {@code value_too_small} / {@code value_too_large}</li>
 *   <li>closed value set: {@code invalid_value}</li>
 *   <li>blank string: {@code empty_string}</li>
 *   <li>object with nested rules: the same checks on each present nested key</li>
 * </ol>
 * Every top-level record key the schema does not define is reported as
 * {@code unknown_field}.
 *
 * <p>Issues are returned, never thrown. A record is valid only if the list is empty.
 */
public final class StructuralValidator {

    /**
     * Validates one record.
     *
     * @param record the record to check
     * @param schema the platform's validation rules
     * @param index the record's 0-based position in its batch
     * @return every issue found, in schema order followed by unknown fields
     */
    public List<ValidationIssue> validate(Map<String, Object> record, ValidationSchema schema, int index) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(schema, "schema");

        List<ValidationIssue> issues = new ArrayList<>();

        for (var entry : schema.fields().entrySet()) {
            String name = entry.getKey();
            FieldDefinition def = entry.getValue();

            if (!record.containsKey(name)) {
                if (def.required()) {
                    issues.add(new ValidationIssue(index, name, IssueType.MISSING_REQUIRED_FIELD,
                            "Required field '" + name + "'",
                            "Missing",
                            "Missing required field: " + name + describeSuffix(def)));
                }
                continue;
            }
            validateValue(record.get(name), def, index, name, issues);
        }

        for (var entry : record.entrySet()) {
            if (!schema.contains(entry.getKey())) {
                issues.add(new ValidationIssue(index, entry.getKey(), IssueType.UNKNOWN_FIELD,
                        "Field not in schema",
                        "Field '" + entry.getKey() + "' with value: " + entry.getValue(),
                        "Unknown field '" + entry.getKey() + "' not defined in schema"));
            }
        }

        return issues;
    }

    private void validateValue(Object value, FieldDefinition def, int index, String path,
                               List<ValidationIssue> issues) {
        FieldType type = def.type();

        if (!type.matches(value)) {
            String actualType = FieldType.describe(value);
            issues.add(new ValidationIssue(index, path, IssueType.TYPE_MISMATCH,
                    type.literal(),
                    actualType + ": " + value,
                    "Expected " + type.literal() + ", got " + actualType));
            return;
        }

        if (type.isNumeric()) {
            double number = ((Number) value).doubleValue();
            def.minValue().ifPresent(min -> {
                if (number < min) {
                    issues.add(new ValidationIssue(index, path, IssueType.VALUE_TOO_SMALL,
                            ">= " + formatBound(min),
                            String.valueOf(value),
                            "Value " + value + " is below minimum " + formatBound(min)));
                }
            });
            def.maxValue().ifPresent(max -> {
                if (number > max) {
                    issues.add(new ValidationIssue(index, path, IssueType.VALUE_TOO_LARGE,
                            "<= " + formatBound(max),
                            String.valueOf(value),
                            "Value " + value + " exceeds maximum " + formatBound(max)));
                }
            });
        }

        def.allowedValues().ifPresent(allowed -> {
            if (!isAllowed(value, allowed)) {
                issues.add(new ValidationIssue(index, path, IssueType.INVALID_VALUE,
                        "One of: " + allowed,
                        String.valueOf(value),
                        "Value '" + value + "' not in allowed values: " + allowed));
            }
        });

        if (type == FieldType.STRING && value.toString().isBlank()) {
            issues.add(new ValidationIssue(index, path, IssueType.EMPTY_STRING,
                    "Non-empty string",
                    "Empty string",
                    "Field '" + path + "' cannot be empty"));
        }

        if (type == FieldType.OBJECT && def.nestedSchema().isPresent()) {
            Map<?, ?> object = (Map<?, ?>) value;
            for (var nested : def.nestedSchema().get().entrySet()) {
                if (object.containsKey(nested.getKey())) {
                    validateValue(object.get(nested.getKey()), nested.getValue(), index,
                            path + "." + nested.getKey(), issues);
                }
            }
        }
    }

    // numbers compare by value, so 1 and 1.0 are the same allowed value
    private static boolean isAllowed(Object value, List<Object> allowed) {
        for (Object candidate : allowed) {
            if (value instanceof Number && candidate instanceof Number) {
                if (Double.compare(((Number) value).doubleValue(), ((Number) candidate).doubleValue()) == 0) {
                    return true;
                }
            } else if (Objects.equals(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    static String formatBound(double bound) {
        if (bound == Math.rint(bound) && !Double.isInfinite(bound) && Math.abs(bound) < 1e15) {
            return String.valueOf((long) bound);
        }
        return String.valueOf(bound);
    }

    private static String describeSuffix(FieldDefinition def) {
        return def.description().isEmpty() ? "" : " - " + def.description();
    }
}
