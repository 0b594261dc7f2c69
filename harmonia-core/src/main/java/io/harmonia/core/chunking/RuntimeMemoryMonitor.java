package io.harmonia.core.chunking;

/// {@link MemoryMonitor} reading the JVM heap through {@link Runtime}.
public final class RuntimeMemoryMonitor implements MemoryMonitor {

    private final Runtime runtime;

    public RuntimeMemoryMonitor() {
        this(Runtime.getRuntime());
    }

    RuntimeMemoryMonitor(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public double usedFraction() {
        long used = runtime.totalMemory() - runtime.freeMemory();
        return (double) used / runtime.maxMemory();
    }
}
