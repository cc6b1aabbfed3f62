package campaign.schema;

import java.util.Objects;

/**
 * A platform's complete declarative schema: the mapping rules that build canonical
 * records and the validation rules that describe valid source records.
 *
 * <p>Loaded once per platform by {@link SchemaRegistry} and never modified afterwards.
 *
 * @param platform lower-case platform identifier
 * @param version version string of the definition the schema was loaded from
 * @param mapping mapping rules, possibly empty
 * @param validation validation rules, possibly empty
 */
public record PlatformSchema(
        String platform,
        String version,
        MappingSchema mapping,
        ValidationSchema validation
) {
    public PlatformSchema {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(version, "version");
        mapping = mapping == null ? MappingSchema.EMPTY : mapping;
        validation = validation == null ? ValidationSchema.EMPTY : validation;
    }
}
