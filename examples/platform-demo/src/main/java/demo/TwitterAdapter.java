package demo;

import campaign.engine.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source adapter for Twitter. There is no Twitter client; fetches return a mock campaign.
 */
public class TwitterAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(TwitterAdapter.class);

    @Override
    public String platform() {
        return "twitter";
    }

    @Override
    public Map<String, Object> fetch(String campaignId) {
        log.warn("Fetching from Twitter is a mock, returning a canned campaign for {}", campaignId);
        Map<String, Object> campaign = new LinkedHashMap<>();
        campaign.put("name", "Mock Twitter Campaign");
        campaign.put("total_budget", 5000);
        campaign.put("account_name", "Mock Twitter Brand");
        campaign.put("tweet_creatives", List.of(Map.of(
                "media_url", "http://example.com/tweet_img.jpg",
                "text", "Check out our new product!")));
        return campaign;
    }
}
