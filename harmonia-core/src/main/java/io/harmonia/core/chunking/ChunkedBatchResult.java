package io.harmonia.core.chunking;

import io.harmonia.core.context.Dataset;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Outcome of a {@link ChunkedBatchWrapper} invocation.
///
/// @param output concatenated outputs of the successful pieces, in input order
/// @param pieceSizes row count of every piece cut, in order
/// @param failures pieces that failed under a lenient policy, in order
/// @param elapsed wall-clock time of the invocation
public record ChunkedBatchResult(
        Dataset output, List<Integer> pieceSizes, List<PieceFailure> failures, Duration elapsed) {

    public ChunkedBatchResult {
        pieceSizes = List.copyOf(pieceSizes);
        failures = List.copyOf(failures);
    }

    public int pieceCount() {
        return pieceSizes.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /// Summary suitable for the statistics slot.
    public Map<String, Object> toStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("pieces", pieceSizes.size());
        stats.put("rows_in", pieceSizes.stream().mapToInt(Integer::intValue).sum());
        stats.put("rows_out", output.size());
        stats.put("failed_pieces", failures.size());
        stats.put("elapsed_ms", elapsed.toMillis());
        return stats;
    }
}
