package io.harmonia.core.chunking;

import io.harmonia.core.pipeline.FailurePolicy;
import java.util.Objects;

/// Settings of one {@link ChunkedBatchWrapper} invocation.
///
/// @param targetRows preferred piece size in rows, at least 1
/// @param minRows smallest piece size memory pressure may shrink to, 1..targetRows
/// @param maxWorkers pieces processed concurrently, at least 1
/// @param memoryHighWaterMark used-heap fraction in (0, 1] above which pieces shrink
/// @param failurePolicy what a failed piece does to the invocation, not null
public record ChunkingConfig(
        int targetRows,
        int minRows,
        int maxWorkers,
        double memoryHighWaterMark,
        FailurePolicy failurePolicy) {

    public static final int DEFAULT_TARGET_ROWS = 10_000;
    public static final int DEFAULT_MIN_ROWS = 500;
    public static final int DEFAULT_MAX_WORKERS = 4;
    public static final double DEFAULT_HIGH_WATER_MARK = 0.85;

    public ChunkingConfig {
        if (targetRows < 1) {
            throw new IllegalArgumentException("targetRows must be at least 1");
        }
        if (minRows < 1 || minRows > targetRows) {
            minRows = Math.max(1, Math.min(minRows, targetRows));
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1");
        }
        if (!(memoryHighWaterMark > 0 && memoryHighWaterMark <= 1)) {
            throw new IllegalArgumentException("memoryHighWaterMark must be in (0, 1]");
        }
        Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
    }

    public static ChunkingConfig defaults() {
        return new ChunkingConfig(
                DEFAULT_TARGET_ROWS,
                DEFAULT_MIN_ROWS,
                DEFAULT_MAX_WORKERS,
                DEFAULT_HIGH_WATER_MARK,
                FailurePolicy.STRICT);
    }

    public ChunkingConfig withTargetRows(int rows) {
        return new ChunkingConfig(rows, minRows, maxWorkers, memoryHighWaterMark, failurePolicy);
    }

    public ChunkingConfig withMinRows(int rows) {
        return new ChunkingConfig(targetRows, rows, maxWorkers, memoryHighWaterMark, failurePolicy);
    }

    public ChunkingConfig withMaxWorkers(int workers) {
        return new ChunkingConfig(targetRows, minRows, workers, memoryHighWaterMark, failurePolicy);
    }

    public ChunkingConfig withFailurePolicy(FailurePolicy policy) {
        return new ChunkingConfig(targetRows, minRows, maxWorkers, memoryHighWaterMark, policy);
    }
}
