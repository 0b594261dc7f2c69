package io.harmonia.core.path;

/// Resolves file-system path expressions against a prioritized search strategy.
///
/// @see DefaultPathResolver
public interface PathResolver {

    /// Resolves a path expression.
    ///
    /// ### Input mode
    /// Tries the path as given when absolute, then relative to the base directory,
    /// then relative to each conventional data directory, and finally a file-name-only
    /// match under the primary data directory. A miss returns `found = false`.
    ///
    /// ### Output mode
    /// Never fails. Relative paths are rooted under the output directory and parent
    /// directories are created. An unwritable location falls back to a temporary
    /// directory.
    ///
    /// @param pathExpression the path to resolve, already free of `${...}` markers, not null
    /// @param mode input or output, not null
    /// @return the resolution, never null
    PathResolution resolve(String pathExpression, PathMode mode);
}
