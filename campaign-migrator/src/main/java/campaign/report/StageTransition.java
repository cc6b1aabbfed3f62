package campaign.report;

import campaign.engine.MigrationStage;

/**
 * One stage transition of one record, as recorded in a {@link MigrationReport}.
 *
 * @param recordRef campaign id or name
 * @param stage the stage entered
 */
public record StageTransition(String recordRef, MigrationStage stage) {

    @Override
    public String toString() {
        return recordRef + " -> " + stage;
    }
}
