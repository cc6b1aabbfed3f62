package campaign.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of named value transforms a mapping rule can reference.
 *
 * <p>Transforms are pure functions resolved by name when a schema is loaded, so an
 * unknown name is a load error rather than a silent no-op. Every transform maps
 * {@code null} to {@code null} and never throws: input it cannot handle is either
 * passed through unchanged (so the subsequent type coercion reports it) or dropped.
 *
 * <p>Adding a transform means adding a constant here. Platform-specific behaviour is
 * expressed through constructor parameters, never by branching on platform identity.
 *
 * @see campaign.schema.MappingRule#transform()
 */
public enum Transform {

    /** Divides a numeric value (or numeric string) by 100, e.g. cents to currency units. */
    DIVIDE_BY_100("divide_by_100") {
        @Override
        public Object apply(Object value) {
            return scale(value, 100.0);
        }
    },

    /** Flattens Facebook creatives into {@code {photo_url, title}} pairs. */
    EXTRACT_CREATIVE_DATA("extract_creative_data") {
        @Override
        public Object apply(Object value) {
            return extractCreatives(value, "image_url", "headline");
        }
    },

    /** Flattens Twitter tweet creatives into {@code {photo_url, title}} pairs. */
    EXTRACT_TWEET_CREATIVE_DATA("extract_tweet_creative_data") {
        @Override
        public Object apply(Object value) {
            return extractCreatives(value, "media_url", "text");
        }
    };

    private final String literal;

    Transform(String literal) {
        this.literal = literal;
    }

    /** Returns the name used to reference this transform in schema definitions. */
    public String literal() {
        return literal;
    }

    /**
     * Applies the transform.
     *
     * @param value the source value, possibly null
     * @return the transformed value, null if the input was null
     */
    public abstract Object apply(Object value);

    /**
     * Looks up a transform by its schema name, case-insensitively.
     */
    public static Optional<Transform> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Transform t : values()) {
            if (t.literal.equals(normalized)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    private static Object scale(Object value, double divisor) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue() / divisor;
        }
        if (value instanceof CharSequence) {
            try {
                return Double.parseDouble(value.toString().trim()) / divisor;
            } catch (NumberFormatException e) {
                return value;
            }
        }
        return value;
    }

    private static Object extractCreatives(Object value, String photoKey, String titleKey) {
        if (!(value instanceof Collection)) {
            return null;
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (Collection<?>) value) {
            if (item instanceof Map) {
                Map<?, ?> creative = (Map<?, ?>) item;
                Map<String, Object> flat = new LinkedHashMap<>();
                flat.put("photo_url", creative.get(photoKey));
                flat.put("title", creative.get(titleKey));
                result.add(flat);
            }
        }
        return result;
    }
}
