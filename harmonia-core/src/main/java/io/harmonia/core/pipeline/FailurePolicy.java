package io.harmonia.core.pipeline;

import java.util.Locale;

/// How a step failure affects the rest of the run.
public enum FailurePolicy {
    /// Abort the run and report the failing step. The default.
    STRICT,
    /// Record a warning provenance entry and continue with the next step.
    WARN,
    /// Continue silently.
    IGNORE;

    /// Parses a policy name as written in pipeline documents.
    ///
    /// Accepts `strict`, `warn` and `ignore` in any case; `continue` is read as
    /// `warn`. A null or blank value yields {@link #STRICT}.
    ///
    /// @param value the policy name, may be null
    /// @return the matching policy, never null
    /// @throws IllegalArgumentException if the name is not recognized
    public static FailurePolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return STRICT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "strict", "fail", "stop" -> STRICT;
            case "warn", "continue" -> WARN;
            case "ignore", "skip" -> IGNORE;
            default -> throw new IllegalArgumentException("Unknown failure policy: " + value);
        };
    }
}
