package campaign.report;

import campaign.engine.MigrationStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of one migration invocation (single record or batch).
 *
 * <p>Holds three ordered outcome sequences:
 * <ul>
 *   <li>successes - one entry per record that reached the target</li>
 *   <li>warnings - lossy mappings, cast failures and advisories</li>
 *   <li>failures - one entry per record that did not reach the target, or a single
 *       entry for a whole-operation failure</li>
 * </ul>
 * plus the ordered stage history of every record.
 *
 * <p>A report is owned by the invocation that created it and never merged with another.
 * It is not thread-safe.
 */
public final class MigrationReport {

    private final List<String> successes = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<MigrationFailure> failures = new ArrayList<>();
    private final List<StageTransition> stageHistory = new ArrayList<>();

    public void addSuccess(String message) {
        successes.add(message);
    }

    public void addWarning(String message) {
        warnings.add(message);
    }

    public void addFailure(MigrationFailure failure) {
        failures.add(failure);
    }

    public void addFailure(String message, ErrorKind errorKind) {
        failures.add(MigrationFailure.of(message, errorKind));
    }

    public void recordStage(String recordRef, MigrationStage stage) {
        stageHistory.add(new StageTransition(recordRef, stage));
    }

    public List<String> successes() {
        return Collections.unmodifiableList(successes);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<MigrationFailure> failures() {
        return Collections.unmodifiableList(failures);
    }

    public List<StageTransition> stageHistory() {
        return Collections.unmodifiableList(stageHistory);
    }

    /**
     * Returns the stages one record went through, in order.
     */
    public List<MigrationStage> stagesOf(String recordRef) {
        List<MigrationStage> stages = new ArrayList<>();
        for (StageTransition t : stageHistory) {
            if (t.recordRef().equals(recordRef)) {
                stages.add(t.stage());
            }
        }
        return stages;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Returns a one-line summary of the outcome counts.
     */
    public String summary() {
        return "Successes: " + successes.size()
                + ", Warnings: " + warnings.size()
                + ", Failures: " + failures.size();
    }

    /**
     * Converts the report to a Map for serialization.
     */
    public Map<String, Object> toMap() {
        List<Map<String, Object>> failureMaps = new ArrayList<>();
        for (MigrationFailure f : failures) {
            failureMaps.add(f.toMap());
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("successes", new ArrayList<>(successes));
        map.put("warnings", new ArrayList<>(warnings));
        map.put("failures", failureMaps);
        return map;
    }

    @Override
    public String toString() {
        return "MigrationReport{" + summary() + '}';
    }
}
