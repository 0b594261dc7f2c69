package io.harmonia.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One entry in a pipeline's ordered step list.
///
/// Parameters are kept raw: strings may still contain `${...}` references,
/// which are resolved immediately before the step runs.
///
/// @param name unique name within the pipeline, not null
/// @param operationType registered operation type this step invokes, not null
/// @param params raw parameter mapping, never null, may contain null values
/// @param onFailure failure policy for this step, never null
public record Step(
        String name, String operationType, Map<String, Object> params, FailurePolicy onFailure) {

    public Step {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(operationType, "operationType must not be null");
        params =
                params == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        onFailure = onFailure == null ? FailurePolicy.STRICT : onFailure;
    }

    /// Creates a step with the default strict failure policy.
    public static Step of(String name, String operationType, Map<String, Object> params) {
        return new Step(name, operationType, params, FailurePolicy.STRICT);
    }
}
