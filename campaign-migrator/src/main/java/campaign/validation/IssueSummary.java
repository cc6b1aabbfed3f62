package campaign.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issue counts grouped three ways, for reporting and diagnostics.
 *
 * <p>Groups keep first-seen order. The combined key is {@code field_path:issue_type}.
 */
public final class IssueSummary {

    private final Map<String, Integer> byFieldAndType;
    private final Map<String, Integer> byField;
    private final Map<IssueType, Integer> byType;

    private IssueSummary(Map<String, Integer> byFieldAndType,
                         Map<String, Integer> byField,
                         Map<IssueType, Integer> byType) {
        this.byFieldAndType = Collections.unmodifiableMap(byFieldAndType);
        this.byField = Collections.unmodifiableMap(byField);
        this.byType = Collections.unmodifiableMap(byType);
    }

    /**
     * Groups the given issues.
     */
    public static IssueSummary of(List<ValidationIssue> issues) {
        Map<String, Integer> byFieldAndType = new LinkedHashMap<>();
        Map<String, Integer> byField = new LinkedHashMap<>();
        Map<IssueType, Integer> byType = new LinkedHashMap<>();
        for (ValidationIssue issue : issues) {
            byFieldAndType.merge(issue.fieldPath() + ":" + issue.issueType().literal(), 1, Integer::sum);
            byField.merge(issue.fieldPath(), 1, Integer::sum);
            byType.merge(issue.issueType(), 1, Integer::sum);
        }
        return new IssueSummary(byFieldAndType, byField, byType);
    }

    /** Counts keyed by {@code field_path:issue_type}. */
    public Map<String, Integer> byFieldAndType() { return byFieldAndType; }

    /** Counts keyed by field path. */
    public Map<String, Integer> byField() { return byField; }

    /** Counts keyed by issue type. */
    public Map<IssueType, Integer> byType() { return byType; }

    /**
     * Converts the summary to a Map for reporting.
     */
    public Map<String, Object> toMap() {
        Map<String, Integer> types = new LinkedHashMap<>();
        byType.forEach((k, v) -> types.put(k.literal(), v));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("most_common_issues", byFieldAndType);
        map.put("affected_fields", byField);
        map.put("issue_types", types);
        return map;
    }
}
