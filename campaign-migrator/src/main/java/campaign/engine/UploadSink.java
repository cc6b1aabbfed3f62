package campaign.engine;

import campaign.exceptions.UploadRejectedException;

import java.util.Map;

/**
 * Collaborator that creates a campaign on the target platform from a canonical record.
 */
@FunctionalInterface
public interface UploadSink {

    /**
     * @param record the canonical record; implementations must not modify it
     * @return the target's description of the created campaign, typically with {@code id} and {@code name}
     * @throws UploadRejectedException if the target refuses the record
     */
    Map<String, Object> create(Map<String, Object> record) throws UploadRejectedException;
}
