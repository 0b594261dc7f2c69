package io.harmonia.core.chunking;

/// Source of the current memory pressure reading.
@FunctionalInterface
public interface MemoryMonitor {

    /// @return fraction of the maximum heap currently in use, between 0 and 1
    double usedFraction();
}
