package io.harmonia.core.execution;

/// Lifecycle of one pipeline run.
///
/// ```
/// LOADED -> RESOLVING_PARAMETERS -> RUNNING -> COMPLETED
///                                           \-> FAILED
/// ```
public enum RunState {
    LOADED,
    RESOLVING_PARAMETERS,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
