package campaign.validation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single structural defect found in one record.
 *
 * @param campaignIndex 0-based position of the record within its batch
 * @param fieldPath field name, dot-joined for nested fields (e.g. {@code targeting.age_min})
 * @param issueType the kind of defect
 * @param expected what the schema expected, human-readable
 * @param actual what the record contained, human-readable
 * @param description one-line explanation
 */
public record ValidationIssue(
        int campaignIndex,
        String fieldPath,
        IssueType issueType,
        String expected,
        String actual,
        String description
) {
    public ValidationIssue {
        Objects.requireNonNull(fieldPath, "fieldPath");
        Objects.requireNonNull(issueType, "issueType");
        if (campaignIndex < 0) {
            throw new IllegalArgumentException("campaignIndex must not be negative: " + campaignIndex);
        }
    }

    /** Returns the 1-based record number shown to users. */
    public int campaignNumber() {
        return campaignIndex + 1;
    }

    /**
     * Converts the issue to a Map for reporting.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("campaign_number", campaignNumber());
        map.put("campaign_index", campaignIndex);
        map.put("field_path", fieldPath);
        map.put("issue_type", issueType.literal());
        map.put("expected", expected);
        map.put("actual", actual);
        map.put("description", description);
        return map;
    }

    @Override
    public String toString() {
        return "#" + campaignNumber() + " " + fieldPath + ": " + issueType.literal() + " (" + description + ")";
    }
}
