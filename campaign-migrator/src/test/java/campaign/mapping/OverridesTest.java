package campaign.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Overrides")
class OverridesTest {

    @Test
    @DisplayName("should replace, add and remove fields without touching the original")
    void shouldReplaceAddAndRemove() {
        Map<String, Object> record = Map.of("name", "A", "cpc_bid", 0.5, "creatives", "x");
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("cpc_bid", 0.75);
        overrides.put("status", "PAUSED");
        overrides.put("creatives", null);

        Map<String, Object> patched = Overrides.apply(record, overrides);

        assertThat(patched)
                .containsEntry("name", "A")
                .containsEntry("cpc_bid", 0.75)
                .containsEntry("status", "PAUSED")
                .doesNotContainKey("creatives");
        assertThat(record).containsEntry("cpc_bid", 0.5).containsKey("creatives");
    }

    @Test
    @DisplayName("should return an equal copy when there are no overrides")
    void shouldCopyWithoutOverrides() {
        Map<String, Object> record = Map.of("name", "A");

        assertThat(Overrides.apply(record, null)).isEqualTo(record).isNotSameAs(record);
    }
}
