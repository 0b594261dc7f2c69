package io.harmonia.core;

import io.harmonia.core.chunking.MemoryMonitor;
import io.harmonia.core.chunking.RuntimeMemoryMonitor;
import io.harmonia.core.execution.PipelineExecutor;
import io.harmonia.core.expression.DefaultExpressionResolver;
import io.harmonia.core.expression.ExpressionResolver;
import io.harmonia.core.operation.DefaultOperationRegistry;
import io.harmonia.core.operation.OperationModule;
import io.harmonia.core.operation.OperationRegistry;
import io.harmonia.core.operation.builtin.CoreOperations;
import io.harmonia.core.path.DefaultPathResolver;
import io.harmonia.core.path.PathResolver;
import io.harmonia.core.pipeline.InMemoryPipelineRepository;
import io.harmonia.core.pipeline.PipelineRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/// Factory for creating a fully wired {@link HarmoniaEnvironment}.
///
/// The operation registry is built here, once, from an explicit list of
/// {@link OperationModule}s: the core module first, then any modules supplied by
/// the host. Nothing registers itself.
///
/// ### Usage
/// {@snippet :
/// try (HarmoniaEnvironment env = HarmoniaFactory.builder()
///         .config(HarmoniaConfig.fromEnvironment(System.getenv()))
///         .operationModule(registry -> registry.register("MY_OP", MyOperation::new))
///         .build()) {
///     PipelineResult result = env.getPipelineExecutor().run(definition, Map.of());
/// }
/// }
public final class HarmoniaFactory {

    private HarmoniaFactory() {}

    public static HarmoniaEnvironment createEnvironment() {
        return builder().config(HarmoniaConfig.fromEnvironment(System.getenv())).build();
    }

    public static HarmoniaEnvironment createEnvironment(HarmoniaConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link HarmoniaEnvironment}.
    public static final class Builder {
        private HarmoniaConfig config = new HarmoniaConfig();
        private final List<Function<ExecutorService, OperationModule>> modules = new ArrayList<>();
        private PipelineRepository pipelineRepository;
        private MemoryMonitor memoryMonitor = new RuntimeMemoryMonitor();
        private Map<String, String> environment;

        private Builder() {}

        public Builder config(HarmoniaConfig config) {
            this.config = config;
            return this;
        }

        /// Adds a module registered after the core operations.
        public Builder operationModule(OperationModule module) {
            this.modules.add(pool -> module);
            return this;
        }

        /// Adds a module that needs the shared worker pool.
        public Builder operationModuleFactory(Function<ExecutorService, OperationModule> moduleFactory) {
            this.modules.add(moduleFactory);
            return this;
        }

        public Builder pipelineRepository(PipelineRepository pipelineRepository) {
            this.pipelineRepository = pipelineRepository;
            return this;
        }

        public Builder memoryMonitor(MemoryMonitor memoryMonitor) {
            this.memoryMonitor = memoryMonitor;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public HarmoniaEnvironment build() {
            ExecutorService workerPool =
                    Executors.newFixedThreadPool(
                            config.getWorkerThreads(), namedThreads("harmonia-worker"));
            ExecutorService stepRunner = Executors.newCachedThreadPool(namedThreads("harmonia-step"));

            try {
                List<OperationModule> resolvedModules = new ArrayList<>();
                resolvedModules.add(new CoreOperations(workerPool, memoryMonitor));
                for (Function<ExecutorService, OperationModule> module : modules) {
                    resolvedModules.add(module.apply(workerPool));
                }
                OperationRegistry registry = new DefaultOperationRegistry(resolvedModules);

                ExpressionResolver expressionResolver =
                        new DefaultExpressionResolver(config.getMaxSubstitutionPasses());
                PathResolver pathResolver = new DefaultPathResolver(config);
                PipelineRepository repository =
                        pipelineRepository != null ? pipelineRepository : new InMemoryPipelineRepository();

                PipelineExecutor executor =
                        PipelineExecutor.builder()
                                .operationRegistry(registry)
                                .expressionResolver(expressionResolver)
                                .pathResolver(pathResolver)
                                .pipelineRepository(repository)
                                .stepRunner(stepRunner)
                                .config(config)
                                .environment(environment)
                                .build();

                return new HarmoniaEnvironment(
                        config,
                        executor,
                        registry,
                        expressionResolver,
                        pathResolver,
                        repository,
                        workerPool,
                        stepRunner);
            } catch (RuntimeException e) {
                workerPool.shutdownNow();
                stepRunner.shutdownNow();
                throw e;
            }
        }

        private static ThreadFactory namedThreads(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
