package campaign.mapping;

import campaign.schema.MappingRule;
import campaign.schema.MappingSchema;
import campaign.schema.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a canonical target record from a source record using a {@link MappingSchema}.
 *
 * <p>For each target field, in schema order:
 * <ol>
 *   <li>read {@code source_field} from the source record (absent if missing)</li>
 *   <li>apply the rule's {@link Transform}, if any</li>
 *   <li>coerce a non-null value to the rule's {@link TargetType}; on failure record a
 *       warning and omit the field</li>
 *   <li>otherwise fall back to a fresh copy of the rule's default, if any</li>
 *   <li>otherwise leave the field out and report it as unfilled</li>
 *   <li>append the rule's static warning, whatever the outcome</li>
 * </ol>
 *
 * <p>The mapper is stateless and never mutates its input; the same input always
 * produces an equal result.
 *
 * @see MappingResult
 */
public final class FieldMapper {

    private static final Logger log = LoggerFactory.getLogger(FieldMapper.class);

    /**
     * Maps one source record.
     *
     * @param source the source record
     * @param schema the mapping rules of the source platform
     * @return the canonical record with its warnings and unfilled fields
     */
    public MappingResult map(Map<String, Object> source, MappingSchema schema) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(schema, "schema");

        Map<String, Object> target = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        List<String> unfilled = new ArrayList<>();

        for (var entry : schema.rules().entrySet()) {
            String field = entry.getKey();
            MappingRule rule = entry.getValue();

            Object value = rule.hasSourceField() ? source.get(rule.sourceField()) : null;
            if (rule.transform() != null) {
                value = rule.transform().apply(value);
            }

            if (value != null) {
                try {
                    target.put(field, coerce(field, value, rule.fieldType()));
                } catch (MappingCastException e) {
                    log.debug("Cast failed for {}: {}", field, e.getMessage());
                    warnings.add(e.getMessage());
                }
            } else if (rule.defaultValue() != null) {
                target.put(field, copyOf(rule.defaultValue()));
            } else {
                unfilled.add(field);
            }

            if (rule.warning() != null) {
                warnings.add(rule.warning());
            }
        }

        return new MappingResult(target, warnings, unfilled);
    }

    // Each record gets its own mutable lists and maps; the schema's default stays untouched.
    private static Object copyOf(Object value) {
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(copyOf(element));
            }
            return copy;
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (var entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), copyOf(entry.getValue()));
            }
            return copy;
        }
        return value;
    }

    /**
     * Coerces a value to a target type.
     *
     * @param field target field name, used in the failure message
     * @param value non-null value
     * @param type target type
     * @return the coerced value; strings are returned as-is
     * @throws MappingCastException if the value cannot represent the type
     */
    static Object coerce(String field, Object value, TargetType type) throws MappingCastException {
        switch (type) {
            case INTEGER:
                return toInteger(field, value);
            case FLOAT:
                return toFloat(field, value);
            case BOOLEAN:
                return toBoolean(field, value);
            case STRING:
            default:
                return value;
        }
    }

    private static Object toInteger(String field, Object value) throws MappingCastException {
        long result;
        if (value instanceof Boolean) {
            result = (Boolean) value ? 1L : 0L;
        } else if (value instanceof BigInteger || value instanceof BigDecimal) {
            try {
                result = new BigDecimal(value.toString()).toBigInteger().longValueExact();
            } catch (ArithmeticException e) {
                throw castFailure(field, TargetType.INTEGER, value, e);
            }
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw castFailure(field, TargetType.INTEGER, value, null);
            }
            result = (long) d;
        } else if (value instanceof Number) {
            result = ((Number) value).longValue();
        } else if (value instanceof CharSequence) {
            try {
                result = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw castFailure(field, TargetType.INTEGER, value, e);
            }
        } else {
            throw castFailure(field, TargetType.INTEGER, value, null);
        }
        if (result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
            return (int) result;
        }
        return result;
    }

    private static Double toFloat(String field, Object value) throws MappingCastException {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw castFailure(field, TargetType.FLOAT, value, e);
            }
        }
        throw castFailure(field, TargetType.FLOAT, value, null);
    }

    private static Boolean toBoolean(String field, Object value) throws MappingCastException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        if (value instanceof CharSequence) {
            switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "yes":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "no":
                case "0":
                    return Boolean.FALSE;
                default:
                    throw castFailure(field, TargetType.BOOLEAN, value, null);
            }
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        throw castFailure(field, TargetType.BOOLEAN, value, null);
    }

    private static MappingCastException castFailure(String field, TargetType type, Object value, Throwable cause) {
        String reason = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : "unsupported value " + value.getClass().getSimpleName() + ": " + value;
        return new MappingCastException(field, type,
                "Could not cast " + field + " to " + type.literal() + ". Error: " + reason, cause);
    }
}
