package demo;

import campaign.engine.SourceAdapter;
import campaign.exceptions.FetchException;

import java.util.Map;

/**
 * Source adapter backed by {@link FacebookApiClient}.
 */
public class FacebookAdapter implements SourceAdapter {

    private final FacebookApiClient client;

    public FacebookAdapter(FacebookApiClient client) {
        this.client = client;
    }

    @Override
    public String platform() {
        return "facebook";
    }

    @Override
    public Map<String, Object> fetch(String campaignId) throws FetchException {
        try {
            return client.getCampaign(campaignId);
        } catch (PlatformApiException e) {
            throw new FetchException("Facebook API error: " + e.getMessage(), platform(), campaignId, e);
        }
    }
}
