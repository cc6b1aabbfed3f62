package campaign.validation;

/**
 * Closed set of structural defects the {@link StructuralValidator} reports.
 */
public enum IssueType {
    MISSING_REQUIRED_FIELD("missing_required_field"),
    TYPE_MISMATCH("type_mismatch"),
    VALUE_TOO_SMALL("value_too_small"),
    VALUE_TOO_LARGE("value_too_large"),
    INVALID_VALUE("invalid_value"),
    EMPTY_STRING("empty_string"),
    UNKNOWN_FIELD("unknown_field");

    private final String literal;

    IssueType(String literal) {
        this.literal = literal;
    }

    /** Returns the snake_case name used in reports. */
    public String literal() {
        return literal;
    }
}
