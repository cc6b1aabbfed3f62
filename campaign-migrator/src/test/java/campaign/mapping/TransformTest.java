package campaign.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Transform")
class TransformTest {

    @Test
    @DisplayName("should divide numbers and numeric strings by 100")
    void shouldDivideBy100() {
        assertThat(Transform.DIVIDE_BY_100.apply(2500)).isEqualTo(25.0);
        assertThat(Transform.DIVIDE_BY_100.apply(" 150 ")).isEqualTo(1.5);
    }

    @Test
    @DisplayName("should pass through values it cannot scale")
    void shouldPassThroughUnscalableValues() {
        assertThat(Transform.DIVIDE_BY_100.apply("n/a")).isEqualTo("n/a");
        assertThat(Transform.DIVIDE_BY_100.apply(null)).isNull();
    }

    @Test
    @DisplayName("should flatten Facebook creatives")
    void shouldFlattenFacebookCreatives() {
        Object result = Transform.EXTRACT_CREATIVE_DATA.apply(List.of(
                Map.of("image_url", "http://img/1.png", "headline", "First", "body", "ignored")));

        assertThat(result).isEqualTo(List.of(Map.of("photo_url", "http://img/1.png", "title", "First")));
    }

    @Test
    @DisplayName("should flatten tweet creatives")
    void shouldFlattenTweetCreatives() {
        Object result = Transform.EXTRACT_TWEET_CREATIVE_DATA.apply(List.of(
                Map.of("media_url", "http://img/t.png", "text", "Tweet")));

        assertThat(result).isEqualTo(List.of(Map.of("photo_url", "http://img/t.png", "title", "Tweet")));
    }

    @Test
    @DisplayName("should yield null when creatives are not a list")
    void shouldYieldNullForNonList() {
        assertThat(Transform.EXTRACT_CREATIVE_DATA.apply("not a list")).isNull();
        assertThat(Transform.EXTRACT_TWEET_CREATIVE_DATA.apply(null)).isNull();
    }

    @Test
    @DisplayName("should look transforms up by schema name")
    void shouldLookUpByName() {
        assertThat(Transform.byName("Divide_By_100")).hasValue(Transform.DIVIDE_BY_100);
        assertThat(Transform.byName("extract_tweet_creative_data")).hasValue(Transform.EXTRACT_TWEET_CREATIVE_DATA);
        assertThat(Transform.byName("reverse")).isEmpty();
        assertThat(Transform.byName(null)).isEmpty();
    }
}
