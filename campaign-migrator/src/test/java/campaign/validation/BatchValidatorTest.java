package campaign.validation;

import campaign.schema.SchemaNotFoundException;
import campaign.schema.SchemaRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("BatchValidator")
class BatchValidatorTest {

    private final BatchValidator batchValidator = new BatchValidator(SchemaRegistry.classpath("schemas"));

    private static Map<String, Object> promo(String name, Object budgetCents) {
        Map<String, Object> record = new LinkedHashMap<>();
        if (name != null) {
            record.put("name", name);
        }
        record.put("budget_cents", budgetCents);
        return record;
    }

    private static List<Map<String, Object>> batch() {
        return List.of(
                promo("Valid", 5000),
                promo(null, 50),
                promo("Also valid", 100),
                promo("Wrong type", "5000"));
    }

    @Nested
    @DisplayName("validateBatch")
    class ValidateBatch {

        @Test
        @DisplayName("should keep valid records in input order")
        void shouldKeepValidRecordsInOrder() {
            BatchValidationResult result = batchValidator.validateBatch(batch(), "promo");

            assertThat(result.validRecords())
                    .extracting(r -> r.get("name"))
                    .containsExactly("Valid", "Also valid");
            assertThat(result.totalRecords()).isEqualTo(4);
            assertThat(result.invalidCount()).isEqualTo(2);
            assertThat(result.hasIssues()).isTrue();
        }

        @Test
        @DisplayName("should number issues from one by batch position")
        void shouldNumberIssuesByPosition() {
            BatchValidationResult result = batchValidator.validateBatch(batch(), "promo");

            assertThat(result.issues())
                    .extracting(ValidationIssue::campaignNumber, ValidationIssue::fieldPath, ValidationIssue::issueType)
                    .containsExactly(
                            tuple(2, "name", IssueType.MISSING_REQUIRED_FIELD),
                            tuple(2, "budget_cents", IssueType.VALUE_TOO_SMALL),
                            tuple(4, "budget_cents", IssueType.TYPE_MISMATCH));
        }

        @Test
        @DisplayName("should report an empty row as missing its required fields")
        void shouldReportNullRow() {
            List<Map<String, Object>> rows = new ArrayList<>();
            rows.add(promo("Valid", 5000));
            rows.add(null);

            BatchValidationResult result = batchValidator.validateBatch(rows, "promo");

            assertThat(result.validRecords()).extracting(r -> r.get("name")).containsExactly("Valid");
            assertThat(result.issues())
                    .extracting(ValidationIssue::campaignNumber, ValidationIssue::fieldPath, ValidationIssue::issueType)
                    .containsExactly(
                            tuple(2, "name", IssueType.MISSING_REQUIRED_FIELD),
                            tuple(2, "budget_cents", IssueType.MISSING_REQUIRED_FIELD));
        }

        @Test
        @DisplayName("should validate an empty batch")
        void shouldValidateEmptyBatch() {
            BatchValidationResult result = batchValidator.validateBatch(List.of(), "promo");

            assertThat(result.validRecords()).isEmpty();
            assertThat(result.hasIssues()).isFalse();
        }

        @Test
        @DisplayName("should fail for a platform without schema")
        void shouldFailForUnknownPlatform() {
            assertThatThrownBy(() -> batchValidator.validateBatch(batch(), "myspace"))
                    .isInstanceOf(SchemaNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("summaries")
    class Summaries {

        @Test
        @DisplayName("should group issues by field and type")
        void shouldGroupIssues() {
            IssueSummary summary = batchValidator.validateBatch(batch(), "promo").summary();

            assertThat(summary.byField()).containsEntry("budget_cents", 2).containsEntry("name", 1);
            assertThat(summary.byFieldAndType())
                    .containsEntry("budget_cents:value_too_small", 1)
                    .containsEntry("budget_cents:type_mismatch", 1);
            assertThat(summary.byType()).containsEntry(IssueType.MISSING_REQUIRED_FIELD, 1);
            assertThat(summary.toMap()).containsOnlyKeys("most_common_issues", "affected_fields", "issue_types");
        }

        @Test
        @DisplayName("should build a comparison summary with at most three sample records")
        @SuppressWarnings("unchecked")
        void shouldBuildComparisonSummary() {
            List<Map<String, Object>> records = batch();
            List<ValidationIssue> issues = batchValidator.validateBatch(records, "promo").issues();

            Map<String, Object> summary = batchValidator.comparisonSummary(records, issues, "promo");

            assertThat(summary)
                    .containsEntry("platform", "promo")
                    .containsEntry("schema_version", "2")
                    .containsEntry("total_campaigns", 4)
                    .containsEntry("total_issues", 3);
            assertThat((List<Object>) summary.get("sample_data")).hasSize(3);
            assertThat((Map<String, Object>) summary.get("expected_schema")).containsKeys("name", "budget_cents");
            List<Map<String, Object>> serialized = (List<Map<String, Object>>) summary.get("validation_issues");
            assertThat(serialized.get(0))
                    .containsEntry("campaign_number", 2)
                    .containsEntry("campaign_index", 1)
                    .containsEntry("issue_type", "missing_required_field");
        }
    }
}
