package campaign.validation;

import campaign.schema.PlatformSchema;
import campaign.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the {@link StructuralValidator} over a batch of records and partitions the
 * batch into valid records and issues.
 *
 * <h2>Usage:</h2>
 * <pre>
 * BatchValidator validator = new BatchValidator(SchemaRegistry.classpath("schemas"));
 * BatchValidationResult result = validator.validateBatch(rows, "facebook");
 * result.summary().byType();
 * </pre>
 */
public final class BatchValidator {

    private static final Logger log = LoggerFactory.getLogger(BatchValidator.class);
    private static final int SAMPLE_SIZE = 3;

    private final SchemaRegistry registry;
    private final StructuralValidator validator;

    public BatchValidator(SchemaRegistry registry) {
        this(registry, new StructuralValidator());
    }

    public BatchValidator(SchemaRegistry registry, StructuralValidator validator) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Validates every record at its batch index.
     *
     * @param records the batch
     * @param platform the platform whose validation schema applies
     * @return valid records (order preserved) and all issues
     * @throws campaign.schema.SchemaNotFoundException if the platform has no schema
     * @throws campaign.schema.SchemaLoadException if the schema is malformed
     */
    public BatchValidationResult validateBatch(List<Map<String, Object>> records, String platform) {
        Objects.requireNonNull(records, "records");
        PlatformSchema schema = registry.get(platform);

        List<Map<String, Object>> valid = new ArrayList<>();
        List<ValidationIssue> issues = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            // an empty row is checked as a record with no fields
            List<ValidationIssue> recordIssues = validator.validate(
                    record == null ? Map.of() : record, schema.validation(), i);
            if (recordIssues.isEmpty()) {
                valid.add(record);
            } else {
                issues.addAll(recordIssues);
            }
        }

        log.info("Validation complete: {}/{} records valid, {} issues found",
                valid.size(), records.size(), issues.size());
        return new BatchValidationResult(valid, issues, records.size());
    }

    /**
     * Builds the schema comparison summary consumed by diagnostic collaborators: the
     * expected schema, every issue, a sample of the submitted records and the issue
     * patterns.
     *
     * @param records the submitted batch
     * @param issues the issues found in it
     * @param platform the platform whose schema was applied
     * @return a map of plain values, lists and maps
     */
    public Map<String, Object> comparisonSummary(List<Map<String, Object>> records,
                                                 List<ValidationIssue> issues,
                                                 String platform) {
        PlatformSchema schema = registry.get(platform);

        List<Map<String, Object>> serializedIssues = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            serializedIssues.add(issue.toMap());
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("platform", schema.platform());
        summary.put("schema_version", schema.version());
        summary.put("total_campaigns", records.size());
        summary.put("total_issues", issues.size());
        summary.put("expected_schema", schema.validation().toMap());
        summary.put("validation_issues", serializedIssues);
        summary.put("sample_data", new ArrayList<>(records.subList(0, Math.min(SAMPLE_SIZE, records.size()))));
        summary.put("issue_patterns", IssueSummary.of(issues).toMap());
        return summary;
    }
}
