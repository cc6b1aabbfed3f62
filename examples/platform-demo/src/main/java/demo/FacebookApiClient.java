package demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mock Facebook Ads API client returning a canned campaign.
 *
 * <p>Campaign ids registered with {@link #failOn(String)} raise {@link PlatformApiException}
 * instead.
 */
public class FacebookApiClient {

    private static final Logger log = LoggerFactory.getLogger(FacebookApiClient.class);

    private final Set<String> unavailable = new HashSet<>();

    public FacebookApiClient failOn(String campaignId) {
        unavailable.add(campaignId);
        return this;
    }

    public Map<String, Object> getCampaign(String campaignId) throws PlatformApiException {
        log.info("Facebook API: fetching campaign {}", campaignId);
        if (unavailable.contains(campaignId)) {
            throw new PlatformApiException("facebook", "Campaign " + campaignId + " is not accessible");
        }

        Map<String, Object> targeting = new LinkedHashMap<>();
        targeting.put("geo", "US");
        targeting.put("age_min", 25);
        targeting.put("interests", List.of("sports", "finance"));

        Map<String, Object> campaign = new LinkedHashMap<>();
        campaign.put("name", "My Awesome FB Campaign");
        campaign.put("objective", "LINK_CLICKS");
        campaign.put("daily_budget", 20.00);
        campaign.put("targeting", targeting);
        campaign.put("creatives", List.of(Map.of(
                "image_url", "http://facebook.com/img.png",
                "headline", "My FB Ad")));
        return campaign;
    }
}
