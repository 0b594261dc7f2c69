package io.harmonia.core.context;

import java.util.Objects;

/// Non-fatal problem found while resolving a value.
///
/// Warnings never stop a run. The executor logs them and appends them to
/// provenance against the step (or `parameters` / `metadata`) that produced them.
///
/// @param kind what went wrong, not null
/// @param subject the reference text or path expression concerned, not null
/// @param message human-readable explanation, not null
public record ResolutionWarning(Kind kind, String subject, String message) {

    public enum Kind {
        /// A `${...}` marker could not be resolved and was left in place.
        UNRESOLVED_REFERENCE,
        /// An input path could not be located, or the filename-only fallback was used.
        PATH_RESOLUTION,
        /// The substitution pass limit was hit and a partially resolved value was kept.
        SUBSTITUTION_LIMIT
    }

    public ResolutionWarning {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ResolutionWarning unresolved(String reference, String message) {
        return new ResolutionWarning(Kind.UNRESOLVED_REFERENCE, reference, message);
    }

    public static ResolutionWarning path(String path, String message) {
        return new ResolutionWarning(Kind.PATH_RESOLUTION, path, message);
    }

    @Override
    public String toString() {
        return kind + " " + subject + ": " + message;
    }
}
