package io.harmonia.core;

import io.harmonia.core.execution.PipelineExecutor;
import io.harmonia.core.expression.ExpressionResolver;
import io.harmonia.core.operation.OperationRegistry;
import io.harmonia.core.path.PathResolver;
import io.harmonia.core.pipeline.PipelineRepository;
import java.util.concurrent.ExecutorService;

/// Container of the wired engine components for one process.
///
/// Owns the worker pool and the step runner; closing the environment shuts both
/// down. Create through {@link HarmoniaFactory}.
public final class HarmoniaEnvironment implements AutoCloseable {

    private final HarmoniaConfig config;
    private final PipelineExecutor pipelineExecutor;
    private final OperationRegistry operationRegistry;
    private final ExpressionResolver expressionResolver;
    private final PathResolver pathResolver;
    private final PipelineRepository pipelineRepository;
    private final ExecutorService workerPool;
    private final ExecutorService stepRunner;

    public HarmoniaEnvironment(
            HarmoniaConfig config,
            PipelineExecutor pipelineExecutor,
            OperationRegistry operationRegistry,
            ExpressionResolver expressionResolver,
            PathResolver pathResolver,
            PipelineRepository pipelineRepository,
            ExecutorService workerPool,
            ExecutorService stepRunner) {
        this.config = config;
        this.pipelineExecutor = pipelineExecutor;
        this.operationRegistry = operationRegistry;
        this.expressionResolver = expressionResolver;
        this.pathResolver = pathResolver;
        this.pipelineRepository = pipelineRepository;
        this.workerPool = workerPool;
        this.stepRunner = stepRunner;
    }

    public HarmoniaConfig getConfig() {
        return config;
    }

    public PipelineExecutor getPipelineExecutor() {
        return pipelineExecutor;
    }

    public OperationRegistry getOperationRegistry() {
        return operationRegistry;
    }

    public ExpressionResolver getExpressionResolver() {
        return expressionResolver;
    }

    public PathResolver getPathResolver() {
        return pathResolver;
    }

    public PipelineRepository getPipelineRepository() {
        return pipelineRepository;
    }

    /// Shared pool for concurrent work inside operations, such as chunk pieces.
    public ExecutorService getWorkerPool() {
        return workerPool;
    }

    @Override
    public void close() {
        stepRunner.shutdown();
        workerPool.shutdown();
    }
}
