package io.harmonia.core.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Outcome of one operation invocation.
///
/// @param success whether the operation completed its work
/// @param error human-readable error when `success` is false, otherwise null
/// @param summary operation-specific summary fields, never null
public record OperationResult(boolean success, String error, Map<String, Object> summary) {

    public OperationResult {
        summary =
                summary == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(summary));
    }

    public static OperationResult ok() {
        return new OperationResult(true, null, Map.of());
    }

    public static OperationResult ok(Map<String, Object> summary) {
        return new OperationResult(true, null, summary);
    }

    public static OperationResult failure(String error) {
        return new OperationResult(false, error, Map.of());
    }

    public static OperationResult failure(String error, Map<String, Object> summary) {
        return new OperationResult(false, error, summary);
    }

    /// One-line description used as the provenance detail of a successful step.
    public String describe() {
        if (!success) {
            return "failed: " + error;
        }
        return summary.isEmpty() ? "completed" : summary.toString();
    }
}
