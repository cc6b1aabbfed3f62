package campaign.mapping;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies caller-supplied manual corrections to a mapped record before upload.
 *
 * <p>A {@code null} override value removes the field; any other value replaces the
 * field or adds it if the mapper never produced it.
 */
public final class Overrides {

    private Overrides() {}

    /**
     * @param record the mapped record, left untouched
     * @param overrides field overrides, may be null or empty
     * @return a new record with the overrides applied
     */
    public static Map<String, Object> apply(Map<String, Object> record, Map<String, Object> overrides) {
        Map<String, Object> patched = new LinkedHashMap<>(record);
        if (overrides == null) {
            return patched;
        }
        for (var entry : overrides.entrySet()) {
            if (entry.getValue() == null) {
                patched.remove(entry.getKey());
            } else {
                patched.put(entry.getKey(), entry.getValue());
            }
        }
        return patched;
    }
}
