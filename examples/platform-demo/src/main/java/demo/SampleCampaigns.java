package demo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Example records in each mock platform's upload format.
 */
public final class SampleCampaigns {

    private SampleCampaigns() {}

    /**
     * Returns a well-formed sample record for a platform, or a generic record for
     * platforms without a dedicated sample.
     */
    public static Map<String, Object> forPlatform(String platform) {
        String key = platform == null ? "" : platform.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "facebook": {
                Map<String, Object> targeting = new LinkedHashMap<>();
                targeting.put("geo", "US");
                targeting.put("age_min", 25);
                targeting.put("age_max", 65);
                targeting.put("interests", List.of("technology", "business"));

                Map<String, Object> creative = new LinkedHashMap<>();
                creative.put("image_url", "https://example.com/image.jpg");
                creative.put("headline", "Sample Ad Headline");
                creative.put("description", "Sample ad description");

                Map<String, Object> campaign = new LinkedHashMap<>();
                campaign.put("name", "Sample Facebook Campaign");
                campaign.put("objective", "LINK_CLICKS");
                campaign.put("daily_budget", 100.0);
                campaign.put("targeting", targeting);
                campaign.put("creatives", List.of(creative));
                return campaign;
            }
            case "twitter": {
                Map<String, Object> creative = new LinkedHashMap<>();
                creative.put("media_url", "https://example.com/tweet_image.jpg");
                creative.put("text", "Sample tweet content");

                Map<String, Object> campaign = new LinkedHashMap<>();
                campaign.put("name", "Sample Twitter Campaign");
                campaign.put("total_budget", 1000.0);
                campaign.put("account_name", "Sample Brand");
                campaign.put("tweet_creatives", List.of(creative));
                return campaign;
            }
            default: {
                Map<String, Object> campaign = new LinkedHashMap<>();
                campaign.put("name", "Sample Campaign");
                campaign.put("budget", 100.0);
                campaign.put("description", "Sample campaign description");
                return campaign;
            }
        }
    }

    /**
     * Returns a Facebook upload of three rows: a valid one, one whose targeting age is
     * below the allowed minimum, and one with an unknown objective and no name.
     */
    public static List<Map<String, Object>> facebookUploadWithIssues() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(forPlatform("facebook"));

        Map<String, Object> tooYoung = forPlatform("facebook");
        tooYoung.put("name", "Teen Audience Campaign");
        @SuppressWarnings("unchecked")
        Map<String, Object> targeting = (Map<String, Object>) tooYoung.get("targeting");
        targeting.put("age_min", 10);
        rows.add(tooYoung);

        Map<String, Object> unnamed = forPlatform("facebook");
        unnamed.remove("name");
        unnamed.put("objective", "APP_INSTALLS");
        rows.add(unnamed);
        return rows;
    }
}
