package campaign.validation;

import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a batch: the records that passed, in input order, and every
 * issue found across the batch.
 *
 * @param validRecords records with no issues
 * @param issues all issues, grouped by record in input order
 * @param totalRecords size of the validated batch
 */
public record BatchValidationResult(
        List<Map<String, Object>> validRecords,
        List<ValidationIssue> issues,
        int totalRecords
) {
    public BatchValidationResult {
        validRecords = List.copyOf(validRecords);
        issues = List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public int invalidCount() {
        return totalRecords - validRecords.size();
    }

    /** Groups the issues for reporting. */
    public IssueSummary summary() {
        return IssueSummary.of(issues);
    }
}
