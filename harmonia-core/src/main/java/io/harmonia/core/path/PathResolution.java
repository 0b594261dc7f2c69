package io.harmonia.core.path;

import java.nio.file.Path;
import java.util.Objects;

/// Result of resolving a path expression.
///
/// @param path the resolved path; for a failed input lookup, the expression as given
/// @param found whether an existing input file was located (always true for output)
/// @param strategy which rule produced the path, not null
public record PathResolution(Path path, boolean found, Strategy strategy) {

    public enum Strategy {
        ABSOLUTE,
        BASE_DIR,
        DATA_DIR,
        /// Matched by file name alone somewhere under the primary data directory.
        FILENAME_FALLBACK,
        OUTPUT_DIR,
        /// Output root was not writable; a temporary directory was used instead.
        TEMP_FALLBACK,
        NOT_FOUND
    }

    public PathResolution {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
    }

    public boolean isFallback() {
        return strategy == Strategy.FILENAME_FALLBACK || strategy == Strategy.TEMP_FALLBACK;
    }
}
