package campaign.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FieldType")
class FieldTypeTest {

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("should accept any number for number and only integral values for integer")
        void shouldDistinguishNumberAndInteger() {
            assertThat(FieldType.NUMBER.matches(20.5)).isTrue();
            assertThat(FieldType.NUMBER.matches(20)).isTrue();
            assertThat(FieldType.INTEGER.matches(20)).isTrue();
            assertThat(FieldType.INTEGER.matches(20L)).isTrue();
            assertThat(FieldType.INTEGER.matches(BigInteger.TEN)).isTrue();
            assertThat(FieldType.INTEGER.matches(20.0)).isFalse();
        }

        @Test
        @DisplayName("should not treat booleans as numbers")
        void shouldNotTreatBooleansAsNumbers() {
            assertThat(FieldType.NUMBER.matches(true)).isFalse();
            assertThat(FieldType.INTEGER.matches(false)).isFalse();
            assertThat(FieldType.BOOLEAN.matches(true)).isTrue();
        }

        @Test
        @DisplayName("should match containers by kind")
        void shouldMatchContainers() {
            assertThat(FieldType.OBJECT.matches(Map.of())).isTrue();
            assertThat(FieldType.ARRAY.matches(List.of())).isTrue();
            assertThat(FieldType.OBJECT.matches(List.of())).isFalse();
            assertThat(FieldType.ARRAY.matches("[]")).isFalse();
        }

        @Test
        @DisplayName("should match nothing for null")
        void shouldMatchNothingForNull() {
            for (FieldType type : FieldType.values()) {
                assertThat(type.matches(null)).isFalse();
            }
        }
    }

    @Test
    @DisplayName("should resolve literals case-insensitively")
    void shouldResolveLiterals() {
        assertThat(FieldType.fromLiteral("Number")).isEqualTo(FieldType.NUMBER);
        assertThat(FieldType.fromLiteral(" array ")).isEqualTo(FieldType.ARRAY);
        assertThatThrownBy(() -> FieldType.fromLiteral("decimal"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("decimal");
    }

    @Test
    @DisplayName("should describe values with the schema vocabulary")
    void shouldDescribeValues() {
        assertThat(FieldType.describe(null)).isEqualTo("null");
        assertThat(FieldType.describe(5)).isEqualTo("integer");
        assertThat(FieldType.describe(5.5)).isEqualTo("number");
        assertThat(FieldType.describe("x")).isEqualTo("string");
        assertThat(FieldType.describe(List.of(1))).isEqualTo("array");
    }
}
