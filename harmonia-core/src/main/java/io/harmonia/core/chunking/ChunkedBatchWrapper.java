package io.harmonia.core.chunking;

import io.harmonia.core.context.Dataset;
import io.harmonia.core.context.ExecutionContext;
import io.harmonia.core.exception.OperationExecutionException;
import io.harmonia.core.pipeline.FailurePolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Splits a dataset into bounded pieces, processes them, and recombines the outputs.
///
/// ### Algorithm
/// 1. Before each piece is cut, memory pressure is sampled. Above the high-water
///    mark the piece size halves, never dropping below the configured minimum.
/// 2. Each piece runs against an isolated child context holding only that piece
///    under the input key.
/// 3. Up to `maxWorkers` pieces run concurrently on the supplied executor. Pieces
///    are harvested strictly in index order, so outputs concatenate in input order
///    and child statistics merge into the parent one piece at a time.
/// 4. A failed piece is reported with its index. Under `strict` no further pieces
///    are scheduled, queued pieces are cancelled, and the invocation fails. Under
///    `warn` and `ignore` the failed piece's rows are dropped and processing goes on.
///
/// If the parent context carries a deadline, no piece is scheduled after it
/// passes and the invocation fails. Running pieces are never interrupted; pieces
/// still queued when the invocation fails are cancelled.
///
/// @implNote The caller thread does all recombination; only
/// {@link PieceProcessor#process} runs on worker threads.
public class ChunkedBatchWrapper {

    private static final Logger logger = Logger.getLogger(ChunkedBatchWrapper.class.getName());

    private final ExecutorService executor;
    private final MemoryMonitor memoryMonitor;
    private final ChunkingConfig config;

    public ChunkedBatchWrapper(
            ExecutorService executor, MemoryMonitor memoryMonitor, ChunkingConfig config) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.memoryMonitor = Objects.requireNonNull(memoryMonitor, "memoryMonitor must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    private record Piece(int index, int startRow, Dataset rows, ExecutionContext context) {}

    private record Outcome(Piece piece, Dataset output, String error) {}

    /// Processes `input` piece by piece.
    ///
    /// @param input the full dataset, not null
    /// @param parent context of the enclosing step; receives merged piece statistics
    /// @param inputKey key under which each piece is exposed to its child context
    /// @param processor per-piece work, not null
    /// @return the recombined result, never null
    /// @throws OperationExecutionException if a piece fails under `strict`, the deadline
    ///     passes, or the calling thread is interrupted
    public ChunkedBatchResult process(
            Dataset input, ExecutionContext parent, String inputKey, PieceProcessor processor)
            throws OperationExecutionException {
        Instant started = Instant.now();
        Optional<Instant> deadline = parent.getDeadline();

        List<Integer> pieceSizes = new ArrayList<>();
        List<Dataset> outputs = new ArrayList<>();
        List<PieceFailure> failures = new ArrayList<>();
        Deque<Future<Outcome>> inFlight = new ArrayDeque<>();

        int pieceSize = config.targetRows();
        int offset = 0;
        int index = 0;
        PieceFailure fatal = null;

        try {
            while (offset < input.size() && fatal == null) {
                if (deadline.isPresent() && Instant.now().isAfter(deadline.get())) {
                    cancelPending(inFlight);
                    throw new OperationExecutionException(
                            "Deadline exceeded after scheduling " + index + " pieces");
                }
                pieceSize = adjustForMemory(pieceSize);
                int end = Math.min(input.size(), offset + pieceSize);
                Dataset rows = input.slice(offset, end);
                Piece piece = new Piece(index, offset, rows, parent.isolated(Map.of(inputKey, rows)));
                pieceSizes.add(rows.size());
                inFlight.addLast(executor.submit(() -> run(piece, processor)));
                offset = end;
                index++;

                if (inFlight.size() >= config.maxWorkers()) {
                    fatal = harvest(inFlight.removeFirst(), parent, outputs, failures, deadline);
                }
            }
            while (!inFlight.isEmpty() && fatal == null) {
                fatal = harvest(inFlight.removeFirst(), parent, outputs, failures, deadline);
            }
            if (fatal != null) {
                cancelPending(inFlight);
                throw new OperationExecutionException("Chunked processing failed at " + fatal);
            }
        } catch (InterruptedException e) {
            cancelPending(inFlight);
            Thread.currentThread().interrupt();
            throw new OperationExecutionException("Interrupted during chunked processing", e);
        } catch (TimeoutException e) {
            cancelPending(inFlight);
            throw new OperationExecutionException(
                    "Deadline exceeded while waiting for piece results", e);
        }

        ChunkedBatchResult result =
                new ChunkedBatchResult(
                        outputs.isEmpty()
                                ? Dataset.empty(input.getColumns())
                                : Dataset.concat(outputs),
                        pieceSizes,
                        failures,
                        Duration.between(started, Instant.now()));
        logger.info(
                "Processed "
                        + input.size()
                        + " rows in "
                        + result.pieceCount()
                        + " pieces ("
                        + failures.size()
                        + " failed) in "
                        + result.elapsed().toMillis()
                        + " ms");
        return result;
    }

    private int adjustForMemory(int pieceSize) {
        double used = memoryMonitor.usedFraction();
        if (used > config.memoryHighWaterMark() && pieceSize > config.minRows()) {
            int reduced = Math.max(config.minRows(), pieceSize / 2);
            logger.warning(
                    String.format(
                            "Memory at %.0f%% exceeds high-water mark; piece size %d -> %d",
                            used * 100, pieceSize, reduced));
            return reduced;
        }
        return pieceSize;
    }

    private static Outcome run(Piece piece, PieceProcessor processor) {
        try {
            Dataset output = processor.process(piece.rows(), piece.context());
            if (output == null) {
                return new Outcome(piece, null, "processor returned no output");
            }
            return new Outcome(piece, output, null);
        } catch (Exception e) {
            logger.log(Level.FINE, "Piece " + piece.index() + " failed", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            return new Outcome(piece, null, message);
        }
    }

    private PieceFailure harvest(
            Future<Outcome> future,
            ExecutionContext parent,
            List<Dataset> outputs,
            List<PieceFailure> failures,
            Optional<Instant> deadline)
            throws InterruptedException, TimeoutException {
        Outcome outcome = await(future, deadline);
        Piece piece = outcome.piece();
        if (outcome.error() == null) {
            outputs.add(outcome.output());
            parent.absorbStatistics(piece.context());
            return null;
        }

        PieceFailure failure =
                new PieceFailure(piece.index(), piece.startRow(), piece.rows().size(), outcome.error());
        FailurePolicy policy = config.failurePolicy();
        if (policy == FailurePolicy.STRICT) {
            logger.severe("Chunk " + failure);
            return failure;
        }
        failures.add(failure);
        if (policy == FailurePolicy.WARN) {
            logger.warning("Chunk " + failure + "; continuing");
        } else {
            logger.fine("Chunk " + failure + "; ignored");
        }
        return null;
    }

    private static Outcome await(Future<Outcome> future, Optional<Instant> deadline)
            throws InterruptedException, TimeoutException {
        try {
            if (deadline.isPresent()) {
                long remaining = Duration.between(Instant.now(), deadline.get()).toMillis();
                return future.get(Math.max(0, remaining), TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (ExecutionException e) {
            // run() catches Exception, so only Errors reach here
            throw new IllegalStateException("Piece processing crashed", e.getCause());
        }
    }

    // Pieces not yet started are dropped; running pieces finish on their own.
    private static void cancelPending(Deque<Future<Outcome>> inFlight) {
        for (Future<Outcome> future : inFlight) {
            future.cancel(false);
        }
        inFlight.clear();
    }
}
