package io.harmonia.core.operation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.harmonia.core.exception.ParameterValidationException;
import io.harmonia.core.expression.Unset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParameterSchemaTest {

    private final ParameterSchema schema =
            ParameterSchema.builder()
                    .required("input_key", ParameterType.STRING, "dataset to read")
                    .required("limit", ParameterType.INTEGER, "row limit")
                    .optional("threshold", ParameterType.DECIMAL, 0.5, "score cut-off")
                    .optional("strict", ParameterType.BOOLEAN, false, "fail on unmapped ids")
                    .optional("columns", ParameterType.LIST, null, "columns to keep")
                    .optional("options", ParameterType.MAP, null, "extra options")
                    .reads(ContextSlot.DATASETS)
                    .writes(ContextSlot.DATASETS, ContextSlot.STATISTICS)
                    .build();

    @Nested
    class Accepted {

        @Test
        void shouldApplyDefaultsForAbsentOptionalParameters() throws Exception {
            ResolvedParameters params =
                    schema.validate("FILTER", Map.of("input_key", "genes", "limit", 10));

            assertThat(params.getString("input_key")).isEqualTo("genes");
            assertThat(params.getInt("limit")).isEqualTo(10);
            assertThat(params.getDouble("threshold")).isEqualTo(0.5);
            assertThat(params.getBoolean("strict")).isFalse();
            assertThat(params.getList("columns")).isNull();
            assertThat(params.find("options")).isEmpty();
        }

        @Test
        void shouldWidenCompatibleValues() throws Exception {
            ResolvedParameters params =
                    schema.validate(
                            "FILTER",
                            Map.of(
                                    "input_key", 42,
                                    "limit", "25",
                                    "threshold", 1,
                                    "strict", "TRUE",
                                    "columns", "symbol"));

            assertThat(params.get("input_key")).isEqualTo("42");
            assertThat(params.get("limit")).isEqualTo(25L);
            assertThat(params.get("threshold")).isEqualTo(1.0);
            assertThat(params.get("strict")).isEqualTo(true);
            assertThat(params.getList("columns")).containsExactly("symbol");
        }

        @Test
        void shouldTreatUnsetAndNullAsAbsent() throws Exception {
            Map<String, Object> raw = new HashMap<>();
            raw.put("input_key", "genes");
            raw.put("limit", 1);
            raw.put("threshold", Unset.INSTANCE);
            raw.put("columns", null);

            ResolvedParameters params = schema.validate("FILTER", raw);

            assertThat(params.getDouble("threshold")).isEqualTo(0.5);
            assertThat(params.getList("columns")).isNull();
        }

        @Test
        void shouldPassUndeclaredParametersThrough() throws Exception {
            ResolvedParameters params =
                    schema.validate(
                            "FILTER",
                            Map.of("input_key", "g", "limit", 1, "note", List.of("free", "form")));

            assertThat(params.get("note")).isEqualTo(List.of("free", "form"));
        }

        @Test
        void shouldDescribeContextAccess() {
            assertThat(schema.getReads()).containsExactly(ContextSlot.DATASETS);
            assertThat(schema.getWrites())
                    .containsExactlyInAnyOrder(ContextSlot.DATASETS, ContextSlot.STATISTICS);
            assertThat(schema.getParameters()).extracting(ParameterSpec::name).startsWith("input_key", "limit");
        }
    }

    @Nested
    class Rejected {

        @Test
        void shouldReportEveryViolation() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("limit", "ten");
            raw.put("input_key", Unset.INSTANCE);
            raw.put("options", "not-a-map");

            assertThatThrownBy(() -> schema.validate("FILTER", raw))
                    .isInstanceOfSatisfying(
                            ParameterValidationException.class,
                            e ->
                                    assertThat(e.getViolations())
                                            .containsExactly(
                                                    "missing required parameter 'input_key'",
                                                    "parameter 'limit' expected INTEGER but got String 'ten'",
                                                    "parameter 'options' expected MAP but got String 'not-a-map'"))
                    .hasMessageStartingWith("Invalid parameters for FILTER");
        }

        @Test
        void shouldRejectNonBooleanWords() {
            assertThatThrownBy(
                            () ->
                                    schema.validate(
                                            "FILTER",
                                            Map.of("input_key", "g", "limit", 1, "strict", "maybe")))
                    .isInstanceOf(ParameterValidationException.class)
                    .hasMessageContaining("'strict' expected BOOLEAN");
        }

        @Test
        void shouldRejectDuplicateDeclarations() {
            ParameterSchema.Builder builder =
                    ParameterSchema.builder().required("a", ParameterType.ANY, "");

            assertThatThrownBy(() -> builder.required("a", ParameterType.STRING, ""))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
