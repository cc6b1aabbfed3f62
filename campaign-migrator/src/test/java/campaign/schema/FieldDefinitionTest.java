package campaign.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FieldDefinition")
class FieldDefinitionTest {

    @Test
    @DisplayName("should reject bounds on a non-numeric type")
    void shouldRejectBoundsOnNonNumericType() {
        assertThatThrownBy(() -> FieldDefinition.numeric("name", FieldType.STRING, true, null, 1.0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min_value/max_value");
    }

    @Test
    @DisplayName("should reject min greater than max")
    void shouldRejectInvertedBounds() {
        assertThatThrownBy(() -> FieldDefinition.numeric("age", FieldType.INTEGER, true, null, 65.0, 13.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject nested schema on a non-object type")
    void shouldRejectNestedSchemaOnNonObject() {
        Map<String, FieldDefinition> nested = Map.of("geo", FieldDefinition.of("geo", FieldType.STRING, false, null));

        assertThatThrownBy(() -> FieldDefinition.create("targeting", FieldType.ARRAY, true, null,
                null, null, null, nested))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nested_schema");
    }

    @Test
    @DisplayName("should treat an empty allowed-values list as no restriction")
    void shouldTreatEmptyAllowedValuesAsNone() {
        FieldDefinition def = FieldDefinition.of("objective", FieldType.STRING, true, null, List.of());

        assertThat(def.allowedValues()).isEmpty();
    }

    @Test
    @DisplayName("should copy allowed values")
    void shouldCopyAllowedValues() {
        List<Object> values = new ArrayList<>(List.of("REACH"));
        FieldDefinition def = FieldDefinition.of("objective", FieldType.STRING, true, null, values);
        values.add("CONVERSIONS");

        assertThat(def.allowedValues()).hasValue(List.of("REACH"));
    }

    @Test
    @DisplayName("should render schema keys in its map form")
    void shouldRenderSchemaKeys() {
        FieldDefinition def = FieldDefinition.numeric("daily_budget", FieldType.NUMBER, true, "Budget", 1.0, 100000.0);

        assertThat(def.toMap())
                .containsEntry("type", "number")
                .containsEntry("required", true)
                .containsKey("min_value")
                .containsKey("max_value");
    }
}
