package campaign.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of mapping one source record.
 *
 * @param record the canonical record, in mapping-schema order
 * @param warnings cast failures and static rule warnings, in processing order
 * @param unfilledFields target fields that got neither a value nor a default
 * @see FieldMapper#map(Map, campaign.schema.MappingSchema)
 */
public record MappingResult(
        Map<String, Object> record,
        List<String> warnings,
        List<String> unfilledFields
) {
    public MappingResult {
        record = Collections.unmodifiableMap(new LinkedHashMap<>(record));
        warnings = List.copyOf(warnings);
        unfilledFields = List.copyOf(unfilledFields);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
