package campaign.schema;

import campaign.mapping.Transform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SchemaDefinitionParser")
class SchemaDefinitionParserTest {

    private static PlatformSchema parse(String yaml) {
        return SchemaDefinitionParser.parse("acme", new Yaml().load(yaml));
    }

    @Nested
    @DisplayName("valid definitions")
    class ValidDefinitions {

        @Test
        @DisplayName("should keep mapping rules in declaration order")
        void shouldKeepMappingOrder() {
            PlatformSchema schema = parse("""
                    version: 1
                    mapping:
                      name:
                        source_field: title
                      daily_cap:
                        source_field: budget
                        field_type: float
                        transform: divide_by_100
                      branding_text:
                        default: Acme
                        warning: placeholder brand
                    """);

            assertThat(schema.version()).isEqualTo("1");
            assertThat(schema.mapping().targetFields()).containsExactly("name", "daily_cap", "branding_text");
            MappingRule cap = schema.mapping().rule("daily_cap");
            assertThat(cap.fieldType()).isEqualTo(TargetType.FLOAT);
            assertThat(cap.transform()).isEqualTo(Transform.DIVIDE_BY_100);
            assertThat(schema.mapping().rule("name").fieldType()).isEqualTo(TargetType.STRING);
            assertThat(schema.mapping().rule("branding_text").defaultValue()).isEqualTo("Acme");
            assertThat(schema.validation().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should build nested validation rules with required defaulting to true")
        void shouldBuildNestedValidationRules() {
            PlatformSchema schema = parse("""
                    version: v3
                    validation:
                      targeting:
                        type: object
                        nested_schema:
                          age_min:
                            type: integer
                            required: false
                            min_value: 13
                            max_value: 65
                      objective:
                        type: string
                        allowed_values: [REACH, CONVERSIONS]
                    """);

            FieldDefinition targeting = schema.validation().field("targeting").orElseThrow();
            assertThat(targeting.required()).isTrue();
            FieldDefinition ageMin = targeting.nestedSchema().orElseThrow().get("age_min");
            assertThat(ageMin.required()).isFalse();
            assertThat(ageMin.minValue()).hasValue(13.0);
            assertThat(ageMin.maxValue()).hasValue(65.0);
            assertThat(schema.validation().field("objective").orElseThrow().allowedValues())
                    .hasValue(List.of("REACH", "CONVERSIONS"));
            assertThat(schema.mapping().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should hold list and map defaults as unmodifiable copies")
        @SuppressWarnings("unchecked")
        void shouldFreezeCollectionDefaults() {
            PlatformSchema schema = parse("""
                    version: 1
                    mapping:
                      creatives:
                        default: []
                      targeting:
                        default:
                          geo: [US]
                    """);

            Object creatives = schema.mapping().rule("creatives").defaultValue();
            assertThat(creatives).isEqualTo(List.of());
            assertThatThrownBy(() -> ((List<Object>) creatives).add("extra"))
                    .isInstanceOf(UnsupportedOperationException.class);
            Map<String, Object> targeting = (Map<String, Object>) schema.mapping().rule("targeting").defaultValue();
            assertThatThrownBy(() -> targeting.put("age_min", 18))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> ((List<Object>) targeting.get("geo")).add("CA"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("should reject a root that is not a map")
        void shouldRejectNonMapRoot() {
            assertThatThrownBy(() -> parse("- a\n- b\n"))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("expected a map");
        }

        @Test
        @DisplayName("should require a version")
        void shouldRequireVersion() {
            assertThatThrownBy(() -> parse("mapping:\n  name:\n    source_field: n\n"))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("version");
        }

        @Test
        @DisplayName("should require mapping or validation")
        void shouldRequireMappingOrValidation() {
            assertThatThrownBy(() -> parse("version: 1\n"))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("neither");
        }

        @Test
        @DisplayName("should reject an unknown transform")
        void shouldRejectUnknownTransform() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    mapping:
                      name:
                        source_field: n
                        transform: reverse
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("unknown transform 'reverse'");
        }

        @Test
        @DisplayName("should reject an unknown field type")
        void shouldRejectUnknownFieldType() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    mapping:
                      cap:
                        field_type: decimal
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("acme.mapping.cap");
        }

        @Test
        @DisplayName("should reject nested schema on an array")
        void shouldRejectNestedSchemaOnArray() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    validation:
                      creatives:
                        type: array
                        nested_schema:
                          url:
                            type: string
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("nested_schema");
        }

        @Test
        @DisplayName("should reject bounds on a string")
        void shouldRejectBoundsOnString() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    validation:
                      name:
                        type: string
                        min_value: 3
                    """))
                    .isInstanceOf(SchemaLoadException.class);
        }

        @Test
        @DisplayName("should reject non-numeric bounds")
        void shouldRejectNonNumericBounds() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    validation:
                      budget:
                        type: number
                        max_value: lots
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("expected a number");
        }

        @Test
        @DisplayName("should reject allowed values that are not a list")
        void shouldRejectScalarAllowedValues() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    validation:
                      objective:
                        type: string
                        allowed_values: REACH
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("allowed_values");
        }

        @Test
        @DisplayName("should reject a null among the allowed values")
        void shouldRejectNullAllowedValue() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    validation:
                      objective:
                        type: string
                        allowed_values: [REACH, null]
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("acme.validation.objective.allowed_values");
        }

        @Test
        @DisplayName("should reject unknown rule keys")
        void shouldRejectUnknownRuleKeys() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    validation:
                      name:
                        type: string
                        pattern: "[a-z]+"
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("unknown key 'pattern'");
        }

        @Test
        @DisplayName("should reject a validation rule without a type")
        void shouldRejectMissingType() {
            assertThatThrownBy(() -> parse("""
                    version: 1
                    validation:
                      name:
                        required: true
                    """))
                    .isInstanceOf(SchemaLoadException.class)
                    .hasMessageContaining("missing 'type'");
        }
    }
}
