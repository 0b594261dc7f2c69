package io.harmonia.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Everything needed to reproduce a failed step without re-running the pipeline.
///
/// @param stepName name of the failing step, not null
/// @param stepIndex zero-based position of the step
/// @param operationType operation type the step invoked, not null
/// @param resolvedParameters parameters in effect after substitution, never null
/// @param message the underlying error message, not null
/// @param cause the underlying exception, may be null
/// @param kind which stage of the step failed, not null
public record StepFailure(
        String stepName,
        int stepIndex,
        String operationType,
        Map<String, Object> resolvedParameters,
        String message,
        Throwable cause,
        Kind kind) {

    public enum Kind {
        /// Parameters could not be resolved or did not satisfy the schema.
        PARAMETER_VALIDATION,
        /// The operation threw or reported failure.
        OPERATION_EXECUTION,
        /// The step overran the pipeline deadline.
        DEADLINE_EXCEEDED
    }

    public StepFailure {
        Objects.requireNonNull(stepName, "stepName must not be null");
        Objects.requireNonNull(operationType, "operationType must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        resolvedParameters =
                resolvedParameters == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(resolvedParameters));
        message = message == null ? "" : message;
    }

    @Override
    public String toString() {
        return "Step '"
                + stepName
                + "' (#"
                + (stepIndex + 1)
                + ", "
                + operationType
                + ") failed ["
                + kind
                + "]: "
                + message
                + " with parameters "
                + resolvedParameters;
    }
}
