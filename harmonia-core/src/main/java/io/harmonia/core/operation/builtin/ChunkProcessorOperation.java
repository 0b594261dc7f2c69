package io.harmonia.core.operation.builtin;

import io.harmonia.core.chunking.ChunkedBatchResult;
import io.harmonia.core.chunking.ChunkedBatchWrapper;
import io.harmonia.core.chunking.ChunkingConfig;
import io.harmonia.core.chunking.MemoryMonitor;
import io.harmonia.core.context.Dataset;
import io.harmonia.core.context.ExecutionContext;
import io.harmonia.core.exception.OperationExecutionException;
import io.harmonia.core.operation.ContextSlot;
import io.harmonia.core.operation.Operation;
import io.harmonia.core.operation.OperationFactory;
import io.harmonia.core.operation.OperationRegistry;
import io.harmonia.core.operation.OperationResult;
import io.harmonia.core.operation.ParameterSchema;
import io.harmonia.core.operation.ParameterType;
import io.harmonia.core.operation.ResolvedParameters;
import io.harmonia.core.pipeline.FailurePolicy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Runs another registered operation over a large dataset in bounded pieces.
///
/// The target operation sees each piece under `input_key` in an isolated context
/// and must publish its output under `output_key`. The recombined output is
/// stored under `output_key` in the step's context, and a summary is merged into
/// statistics under `chunk_processor.<output_key>`.
///
/// ### Parameters
/// - `target_action` (required): operation type to run per piece
/// - `input_key` / `output_key` (required): dataset keys
/// - `target_params`: params for the target, validated once against its schema
/// - `chunk_size`, `min_chunk_size`, `max_workers`, `memory_high_water_mark`
/// - `error_strategy`: `strict` (default), `warn` or `ignore`
///
/// @implNote Pieces run on the shared worker pool. A target that itself submits
/// work to the same pool can starve it when `max_workers` reaches the pool size.
public class ChunkProcessorOperation implements Operation {

    private static final Logger logger = Logger.getLogger(ChunkProcessorOperation.class.getName());

    public static final String TYPE = "CHUNK_PROCESSOR";
    public static final String STATISTICS_KEY = "chunk_processor";

    private static final ParameterSchema SCHEMA =
            ParameterSchema.builder()
                    .required("target_action", ParameterType.STRING, "operation type to run per piece")
                    .required("input_key", ParameterType.STRING, "dataset to split")
                    .required("output_key", ParameterType.STRING, "dataset the target writes")
                    .optional("target_params", ParameterType.MAP, Map.of(), "params for the target")
                    .optional("chunk_size", ParameterType.INTEGER, ChunkingConfig.DEFAULT_TARGET_ROWS,
                            "rows per piece")
                    .optional("min_chunk_size", ParameterType.INTEGER, ChunkingConfig.DEFAULT_MIN_ROWS,
                            "smallest piece under memory pressure")
                    .optional("max_workers", ParameterType.INTEGER, ChunkingConfig.DEFAULT_MAX_WORKERS,
                            "pieces processed concurrently")
                    .optional("memory_high_water_mark", ParameterType.DECIMAL,
                            ChunkingConfig.DEFAULT_HIGH_WATER_MARK, "heap fraction that shrinks pieces")
                    .optional("error_strategy", ParameterType.STRING, "strict", "strict, warn or ignore")
                    .reads(ContextSlot.DATASETS)
                    .writes(ContextSlot.DATASETS, ContextSlot.STATISTICS)
                    .build();

    private final OperationRegistry registry;
    private final ExecutorService workerPool;
    private final MemoryMonitor memoryMonitor;

    public ChunkProcessorOperation(
            OperationRegistry registry, ExecutorService workerPool, MemoryMonitor memoryMonitor) {
        this.registry = registry;
        this.workerPool = workerPool;
        this.memoryMonitor = memoryMonitor;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public ParameterSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public OperationResult execute(ResolvedParameters parameters, ExecutionContext context)
            throws Exception {
        String targetType = parameters.getString("target_action");
        String inputKey = parameters.getString("input_key");
        String outputKey = parameters.getString("output_key");

        Dataset input =
                context.getDataset(inputKey)
                        .orElseThrow(
                                () ->
                                        new OperationExecutionException(
                                                "Input dataset '" + inputKey + "' not found"));
        OperationFactory targetFactory =
                registry.lookup(targetType)
                        .orElseThrow(
                                () ->
                                        new OperationExecutionException(
                                                "Unknown target_action '"
                                                        + targetType
                                                        + "'. Registered types: "
                                                        + registry.knownTypes()));
        ResolvedParameters targetParameters =
                targetFactory
                        .create()
                        .getSchema()
                        .validate(targetType, parameters.getMap("target_params"));

        int chunkSize = parameters.getInt("chunk_size");
        ChunkingConfig config =
                new ChunkingConfig(
                        chunkSize,
                        Math.min(parameters.getInt("min_chunk_size"), chunkSize),
                        parameters.getInt("max_workers"),
                        parameters.getDouble("memory_high_water_mark"),
                        FailurePolicy.fromString(parameters.getString("error_strategy")));
        logger.info(
                "Chunking '" + inputKey + "' (" + input.size() + " rows) through " + targetType
                        + " in pieces of " + chunkSize);

        ChunkedBatchWrapper wrapper = new ChunkedBatchWrapper(workerPool, memoryMonitor, config);
        ChunkedBatchResult result =
                wrapper.process(
                        input,
                        context,
                        inputKey,
                        (piece, pieceContext) -> {
                            OperationResult pieceResult =
                                    targetFactory.create().execute(targetParameters, pieceContext);
                            if (!pieceResult.success()) {
                                throw new OperationExecutionException(pieceResult.error());
                            }
                            return pieceContext
                                    .getDataset(outputKey)
                                    .orElseThrow(
                                            () ->
                                                    new OperationExecutionException(
                                                            targetType
                                                                    + " did not publish dataset '"
                                                                    + outputKey
                                                                    + "'"));
                        });

        context.putDataset(outputKey, result.output());
        Map<String, Object> statistics = result.toStatistics();
        context.mergeStatistics(STATISTICS_KEY, Map.of(outputKey, statistics));

        Map<String, Object> summary = new LinkedHashMap<>(statistics);
        if (result.hasFailures()) {
            List<String> failures = result.failures().stream().map(Object::toString).toList();
            summary.put("failures", failures);
        }
        return OperationResult.ok(summary);
    }
}
