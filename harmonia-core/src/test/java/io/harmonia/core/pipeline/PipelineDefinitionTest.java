package io.harmonia.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.harmonia.core.exception.ConfigurationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PipelineDefinitionTest {

    @Nested
    class Validation {

        @Test
        void shouldAcceptWellFormedDefinition() throws Exception {
            PipelineDefinition definition =
                    PipelineDefinition.builder()
                            .name("ok")
                            .step(Step.of("a", "ECHO", Map.of()))
                            .step(Step.of("b", "ECHO", Map.of()))
                            .build();

            definition.validate();

            assertThat(definition.getVersion()).isEqualTo("1.0");
            assertThat(definition.getSteps()).extracting(Step::name).containsExactly("a", "b");
        }

        @Test
        void shouldRejectEmptyStepList() {
            PipelineDefinition definition = PipelineDefinition.builder().name("empty").build();

            assertThatThrownBy(definition::validate)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("declares no steps");
        }

        @Test
        void shouldRejectBlankOperationType() {
            PipelineDefinition definition =
                    PipelineDefinition.builder().name("p").step(Step.of("a", " ", Map.of())).build();

            assertThatThrownBy(definition::validate).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void shouldRejectBlankName() {
            PipelineDefinition definition =
                    PipelineDefinition.builder().name("").step(Step.of("a", "ECHO", Map.of())).build();

            assertThatThrownBy(definition::validate).isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    void shouldKeepNullParameterValuesAndOrder() {
        Map<String, Object> params = new HashMap<>();
        params.put("optional", null);

        Step step = new Step("s", "ECHO", params, null);
        PipelineDefinition copy =
                PipelineDefinition.builder()
                        .name("p")
                        .parameter("z", 1)
                        .parameter("a", 2)
                        .step(step)
                        .build()
                        .toBuilder()
                        .version("2.0")
                        .build();

        assertThat(step.params()).containsEntry("optional", null);
        assertThat(step.onFailure()).isEqualTo(FailurePolicy.STRICT);
        assertThat(copy.getParameters().keySet()).containsExactly("z", "a");
        assertThat(copy.getVersion()).isEqualTo("2.0");
        assertThat(copy.getSteps()).isEqualTo(List.of(step));
    }

    @ParameterizedTest
    @CsvSource({"strict,STRICT", "FAIL,STRICT", "warn,WARN", "continue,WARN", " Ignore ,IGNORE", "skip,IGNORE"})
    void shouldParseFailurePolicies(String text, FailurePolicy expected) {
        assertThat(FailurePolicy.fromString(text)).isEqualTo(expected);
    }

    @Test
    void shouldDefaultMissingPolicyToStrictAndRejectUnknown() {
        assertThat(FailurePolicy.fromString(null)).isEqualTo(FailurePolicy.STRICT);
        assertThat(FailurePolicy.fromString("")).isEqualTo(FailurePolicy.STRICT);
        assertThatThrownBy(() -> FailurePolicy.fromString("retry"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
