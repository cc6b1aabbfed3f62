package campaign.exceptions;

import campaign.engine.MigrationStage;

/**
 * Thrown by a source adapter when a campaign cannot be fetched from its platform.
 */
public class FetchException extends MigrationException {

    public FetchException(String message, String platform, String campaignId) {
        super(message, MigrationStage.FETCHING, platform, campaignId, null);
    }

    public FetchException(String message, String platform, String campaignId, Throwable cause) {
        super(message, MigrationStage.FETCHING, platform, campaignId, cause);
    }
}
