package campaign.engine;

import campaign.exceptions.FetchException;

import java.util.Map;

/**
 * Collaborator that obtains campaign records from a source platform.
 *
 * <p>Implementations wrap a platform's API client. They return untyped records in the
 * platform's own representation; the engine validates and maps them using the
 * platform's schema.
 */
public interface SourceAdapter {

    /**
     * Returns the platform identifier this adapter serves, e.g. {@code facebook}.
     * The same identifier selects the platform's schema.
     */
    String platform();

    /**
     * Fetches one campaign by id.
     *
     * @param campaignId the platform's campaign id
     * @return the campaign record
     * @throws FetchException if the platform cannot deliver the campaign
     */
    Map<String, Object> fetch(String campaignId) throws FetchException;

    /**
     * Prepares one row of an uploaded file for migration. Returns the row unchanged
     * unless overridden.
     *
     * @param row the uploaded row
     * @return the campaign record
     * @throws FetchException if the row cannot be used
     */
    default Map<String, Object> fromUpload(Map<String, Object> row) throws FetchException {
        return row;
    }
}
