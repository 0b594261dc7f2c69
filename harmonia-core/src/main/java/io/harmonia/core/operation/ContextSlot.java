package io.harmonia.core.operation;

/// Named slot of the execution context an operation reads or writes.
public enum ContextSlot {
    DATASETS,
    STATISTICS,
    PROVENANCE,
    OUTPUT_FILES
}
