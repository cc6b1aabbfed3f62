package demo;

import campaign.engine.UploadSink;
import campaign.exceptions.UploadRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mock Taboola API client. Accepts a canonical campaign record when every required
 * field holds a non-empty value and answers with the created campaign.
 */
public class TaboolaApiClient implements UploadSink {

    private static final Logger log = LoggerFactory.getLogger(TaboolaApiClient.class);

    static final List<String> REQUIRED_FIELDS = List.of("name", "branding_text", "cpc_bid", "daily_cap");
    static final String CAMPAIGN_ID = "taboola_campaign_98765";

    private final List<Map<String, Object>> created = new ArrayList<>();

    @Override
    public Map<String, Object> create(Map<String, Object> record) throws UploadRejectedException {
        log.info("Taboola API: validating data for new campaign '{}'", record.get("name"));

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (isBlank(record.get(field))) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new UploadRejectedException(
                    "Cannot create campaign. Missing required fields: " + missing, missing);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", CAMPAIGN_ID);
        for (String field : REQUIRED_FIELDS) {
            response.put(field, record.get(field));
        }
        response.put("status", "PENDING_APPROVAL");
        created.add(response);
        return response;
    }

    /** Returns the campaigns created so far. */
    public List<Map<String, Object>> createdCampaigns() {
        return List.copyOf(created);
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.toString().isBlank();
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0.0;
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        return false;
    }
}
