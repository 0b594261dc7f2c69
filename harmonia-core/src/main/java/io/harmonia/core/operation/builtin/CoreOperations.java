package io.harmonia.core.operation.builtin;

import io.harmonia.core.chunking.MemoryMonitor;
import io.harmonia.core.operation.OperationModule;
import io.harmonia.core.operation.OperationRegistry;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/// Operations shipped with the engine: `ECHO` and `CHUNK_PROCESSOR`.
public final class CoreOperations implements OperationModule {

    private final ExecutorService workerPool;
    private final MemoryMonitor memoryMonitor;

    public CoreOperations(ExecutorService workerPool, MemoryMonitor memoryMonitor) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool must not be null");
        this.memoryMonitor = Objects.requireNonNull(memoryMonitor, "memoryMonitor must not be null");
    }

    @Override
    public void registerAll(OperationRegistry registry) {
        registry.register(EchoOperation.TYPE, EchoOperation::new);
        registry.register(
                ChunkProcessorOperation.TYPE,
                () -> new ChunkProcessorOperation(registry, workerPool, memoryMonitor));
    }
}
