package io.harmonia.core.execution;

import io.harmonia.core.HarmoniaConfig;
import io.harmonia.core.context.ExecutionContext;
import io.harmonia.core.context.ResolutionWarning;
import io.harmonia.core.exception.ConfigurationException;
import io.harmonia.core.exception.DeadlineExceededException;
import io.harmonia.core.exception.ExpressionSyntaxException;
import io.harmonia.core.exception.OperationExecutionException;
import io.harmonia.core.exception.ParameterValidationException;
import io.harmonia.core.exception.PipelineException;
import io.harmonia.core.exception.UnknownOperationException;
import io.harmonia.core.expression.Builtins;
import io.harmonia.core.expression.DefaultExpressionResolver;
import io.harmonia.core.expression.ExpressionResolver;
import io.harmonia.core.expression.Namespace;
import io.harmonia.core.expression.ReferenceParser;
import io.harmonia.core.operation.Operation;
import io.harmonia.core.operation.OperationRegistry;
import io.harmonia.core.operation.OperationResult;
import io.harmonia.core.operation.ResolvedParameters;
import io.harmonia.core.path.DefaultPathResolver;
import io.harmonia.core.path.PathMode;
import io.harmonia.core.path.PathResolution;
import io.harmonia.core.path.PathResolver;
import io.harmonia.core.pipeline.PipelineDefinition;
import io.harmonia.core.pipeline.PipelineRepository;
import io.harmonia.core.pipeline.Step;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs a pipeline definition to completion or failure.
///
/// ### Run algorithm
/// 1. **Loaded**: structural validation and an eager check that every step's
///    operation type is registered. Problems are thrown before any step runs.
/// 2. **Resolving parameters**: invocation parameters override the definition's
///    raw parameters; the block is resolved in dependency order against `env`,
///    `metadata` and `builtin`. Metadata is then resolved and every `path` of its
///    `source_files` / `target_files` entries goes through the path resolver.
///    Missing files become warnings, not errors.
/// 3. **Running**: for each step in order, params are resolved against the full
///    namespace (including current statistics, datasets and output files),
///    file-path-shaped params go through the path resolver, the result is validated
///    against the operation's schema, and the operation is invoked. Success appends
///    one provenance record named after the step.
/// 4. A failing step follows its policy: `strict` stops the run with
///    {@link PipelineResult.Failed}; `warn` appends a warning record and continues;
///    `ignore` continues silently. The engine never retries a step.
///
/// ### Deadlines
/// When a pipeline timeout is configured, each step runs on the step runner and the
/// executor waits only until the run deadline. The step works on
/// {@link ExecutionContext#workingCopy()}, adopted once the operation returns or throws.
/// Overrunning is a step failure: the operation is not interrupted, and its copy is
/// discarded so late writes never reach the run's context.
///
/// @implNote The executor is single-threaded per run: steps never overlap. One
/// executor instance may serve several runs from different threads.
///
/// @see PipelineResult
/// @see PipelineListener
public class PipelineExecutor {

    private static final Logger logger = Logger.getLogger(PipelineExecutor.class.getName());

    static final String PARAMETERS_SOURCE = "parameters";
    static final String METADATA_SOURCE = "metadata";
    private static final List<String> METADATA_FILE_LISTS = List.of("source_files", "target_files");

    private final OperationRegistry operationRegistry;
    private final ExpressionResolver expressionResolver;
    private final PathResolver pathResolver;
    private final PipelineRepository pipelineRepository;
    private final ExecutorService stepRunner;
    private final HarmoniaConfig config;
    private final Map<String, String> environment;
    private final Clock clock;

    private PipelineExecutor(Builder builder) {
        this.operationRegistry =
                Objects.requireNonNull(builder.operationRegistry, "operationRegistry required");
        this.config = builder.config != null ? builder.config : new HarmoniaConfig();
        this.expressionResolver =
                builder.expressionResolver != null
                        ? builder.expressionResolver
                        : new DefaultExpressionResolver(config.getMaxSubstitutionPasses());
        this.pathResolver =
                builder.pathResolver != null ? builder.pathResolver : new DefaultPathResolver(config);
        this.pipelineRepository = builder.pipelineRepository;
        this.stepRunner = builder.stepRunner;
        this.environment = builder.environment != null ? builder.environment : System.getenv();
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Loads a pipeline by name from the configured repository and runs it.
    ///
    /// @throws ConfigurationException if no repository is configured or the name is unknown
    public PipelineResult run(String pipelineName, Map<String, Object> invocationParams)
            throws PipelineException {
        if (pipelineRepository == null) {
            throw new ConfigurationException("No pipeline repository configured");
        }
        PipelineDefinition definition =
                pipelineRepository
                        .findByName(pipelineName)
                        .orElseThrow(
                                () ->
                                        new ConfigurationException(
                                                "Pipeline not found: " + pipelineName));
        return run(definition, invocationParams);
    }

    public PipelineResult run(PipelineDefinition definition, Map<String, Object> invocationParams)
            throws PipelineException {
        return run(definition, invocationParams, PipelineListener.NOOP);
    }

    /// Runs a pipeline.
    ///
    /// @param definition the pipeline to run, not null
    /// @param invocationParams parameters overriding or extending the definition's, may be null
    /// @param listener receives lifecycle callbacks, may be null
    /// @return the completed or failed result, never null
    /// @throws ConfigurationException if the definition is malformed
    /// @throws io.harmonia.core.exception.CircularReferenceException if parameters form a cycle
    /// @throws UnknownOperationException if a step names an unregistered operation type
    public PipelineResult run(
            PipelineDefinition definition,
            Map<String, Object> invocationParams,
            PipelineListener listener)
            throws PipelineException {
        Objects.requireNonNull(definition, "definition must not be null");
        PipelineListener events = listener != null ? listener : PipelineListener.NOOP;

        definition.validate();
        checkOperationTypes(definition);

        ExecutionContext context =
                ExecutionContext.builder().pipelineName(definition.getName()).clock(clock).build();
        Instant deadline =
                config.getPipelineTimeout() != null
                        ? clock.instant().plus(config.getPipelineTimeout())
                        : null;
        events.onStateChanged(context.getRunId(), RunState.LOADED);
        logger.info(
                "Starting pipeline '"
                        + definition.getName()
                        + "' v"
                        + definition.getVersion()
                        + " (run "
                        + context.getRunId()
                        + ", "
                        + definition.getSteps().size()
                        + " steps)");

        events.onStateChanged(context.getRunId(), RunState.RESOLVING_PARAMETERS);
        Namespace namespace = resolveRunScopes(definition, invocationParams, context, events);

        events.onStateChanged(context.getRunId(), RunState.RUNNING);
        List<Step> steps = definition.getSteps();
        for (int index = 0; index < steps.size(); index++) {
            Step step = steps.get(index);
            context.setDeadline(deadline);
            StepFailure failure = executeStep(step, index, namespace, context, events);
            if (failure == null) {
                continue;
            }

            events.onStepFailed(step, index, failure);
            switch (step.onFailure()) {
                case STRICT -> {
                    logger.log(Level.SEVERE, failure.toString(), failure.cause());
                    events.onStateChanged(context.getRunId(), RunState.FAILED);
                    return new PipelineResult.Failed(context, failure);
                }
                case WARN -> {
                    logger.warning(failure + "; continuing (policy warn)");
                    context.recordWarning(
                            step.name(),
                            "step failed (" + step.operationType() + "): " + failure.message());
                }
                case IGNORE -> logger.fine(failure + "; ignored (policy ignore)");
            }
        }

        events.onStateChanged(context.getRunId(), RunState.COMPLETED);
        logger.info("Pipeline '" + definition.getName() + "' completed (run " + context.getRunId() + ")");
        return new PipelineResult.Completed(context);
    }

    private void checkOperationTypes(PipelineDefinition definition)
            throws UnknownOperationException {
        for (Step step : definition.getSteps()) {
            if (!operationRegistry.contains(step.operationType())) {
                throw new UnknownOperationException(
                        step.name(), step.operationType(), operationRegistry.knownTypes());
            }
        }
    }

    private Namespace resolveRunScopes(
            PipelineDefinition definition,
            Map<String, Object> invocationParams,
            ExecutionContext context,
            PipelineListener events)
            throws PipelineException {
        Map<String, Object> rawParameters = new LinkedHashMap<>(definition.getParameters());
        if (invocationParams != null) {
            rawParameters.putAll(invocationParams);
        }

        Namespace base =
                Namespace.builder()
                        .environment(environment)
                        .environmentDefaults(config.environmentDefaults())
                        .metadata(definition.getMetadata())
                        .builtins(
                                Builtins.create(
                                        config.getBaseDir(),
                                        context.getRunId(),
                                        definition.getName(),
                                        definition.getVersion(),
                                        clock))
                        .build();

        List<ResolutionWarning> warnings = new ArrayList<>();
        Map<String, Object> parameters =
                expressionResolver.resolveParameters(rawParameters, base, warnings);
        recordWarnings(PARAMETERS_SOURCE, warnings, context, events);
        context.setParameters(parameters);

        Namespace withParameters = base.withParameters(parameters);
        warnings.clear();
        Map<String, Object> metadata =
                expressionResolver.resolveAll(definition.getMetadata(), withParameters, warnings);
        metadata = resolveMetadataPaths(metadata, warnings);
        recordWarnings(METADATA_SOURCE, warnings, context, events);
        context.setMetadata(metadata);

        return withParameters.withScope(Namespace.METADATA, metadata);
    }

    private Map<String, Object> resolveMetadataPaths(
            Map<String, Object> metadata, List<ResolutionWarning> warnings) {
        Map<String, Object> result = new LinkedHashMap<>(metadata);
        for (String listKey : METADATA_FILE_LISTS) {
            if (result.get(listKey) instanceof List<?> entries) {
                List<Object> resolvedEntries = new ArrayList<>(entries.size());
                for (Object entry : entries) {
                    resolvedEntries.add(resolveFileEntry(entry, warnings));
                }
                result.put(listKey, resolvedEntries);
            }
        }
        return result;
    }

    private Object resolveFileEntry(Object entry, List<ResolutionWarning> warnings) {
        if (!(entry instanceof Map<?, ?> map) || !(map.get("path") instanceof String path)) {
            return entry;
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        map.forEach((k, v) -> resolved.put(String.valueOf(k), v));
        if (ReferenceParser.containsMarker(path)) {
            resolved.put("resolved", false);
            warnings.add(ResolutionWarning.path(path, "path still holds an unresolved reference"));
            return resolved;
        }
        PathResolution resolution = pathResolver.resolve(path, PathMode.INPUT);
        resolved.put("path", resolution.path().toString());
        resolved.put("resolved", resolution.found());
        if (!resolution.found()) {
            warnings.add(ResolutionWarning.path(path, "file not found"));
        } else if (resolution.isFallback()) {
            warnings.add(
                    ResolutionWarning.path(
                            path, "matched by file name only: " + resolution.path()));
        }
        return resolved;
    }

    private StepFailure executeStep(
            Step step,
            int index,
            Namespace runNamespace,
            ExecutionContext context,
            PipelineListener events)
            throws UnknownOperationException {
        logger.info("Step " + (index + 1) + " '" + step.name() + "' (" + step.operationType() + ")");
        Operation operation = operationRegistry.create(step.name(), step.operationType());

        Namespace namespace =
                runNamespace
                        .withScope(Namespace.STATISTICS, context.getStatistics())
                        .withScope(Namespace.DATASETS, context.getDatasets())
                        .withScope(Namespace.OUTPUTS, context.getOutputFiles());

        List<ResolutionWarning> warnings = new ArrayList<>();
        Map<String, Object> resolved;
        try {
            resolved = expressionResolver.resolveAll(step.params(), namespace, warnings);
        } catch (ExpressionSyntaxException e) {
            return failure(step, index, step.params(), e, StepFailure.Kind.PARAMETER_VALIDATION);
        }
        resolved = resolveParameterPaths(resolved, warnings);
        recordWarnings(step.name(), warnings, context, events);

        ResolvedParameters parameters;
        try {
            parameters = operation.getSchema().validate(step.operationType(), resolved);
        } catch (ParameterValidationException e) {
            return failure(step, index, resolved, e, StepFailure.Kind.PARAMETER_VALIDATION);
        }

        events.onStepStart(step, index, parameters.asMap());
        try {
            OperationResult result = invoke(operation, parameters, context);
            if (!result.success()) {
                return failure(
                        step,
                        index,
                        parameters.asMap(),
                        new OperationExecutionException(result.error()),
                        StepFailure.Kind.OPERATION_EXECUTION);
            }
            context.recordStep(step.name(), result.describe());
            events.onStepComplete(step, index, result);
            return null;
        } catch (DeadlineExceededException e) {
            return failure(step, index, parameters.asMap(), e, StepFailure.Kind.DEADLINE_EXCEEDED);
        } catch (OperationExecutionException e) {
            return failure(step, index, parameters.asMap(), e, StepFailure.Kind.OPERATION_EXECUTION);
        }
    }

    private OperationResult invoke(
            Operation operation, ResolvedParameters parameters, ExecutionContext context)
            throws OperationExecutionException {
        Instant deadline = context.getDeadline().orElse(null);
        if (deadline == null || stepRunner == null) {
            try {
                return operation.execute(parameters, context);
            } catch (OperationExecutionException e) {
                throw e;
            } catch (Exception e) {
                throw new OperationExecutionException(describe(e), e);
            }
        }

        long remaining = Duration.between(clock.instant(), deadline).toMillis();
        if (remaining <= 0) {
            throw new DeadlineExceededException("Pipeline deadline passed before the step started");
        }
        // The step writes to a working copy; an abandoned step keeps running against it.
        ExecutionContext workingCopy = context.workingCopy();
        Future<OperationResult> future =
                stepRunner.submit(() -> operation.execute(parameters, workingCopy));
        try {
            OperationResult result = future.get(remaining, TimeUnit.MILLISECONDS);
            context.adopt(workingCopy);
            return result;
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new DeadlineExceededException(
                    "Step did not finish within the pipeline deadline (" + remaining + " ms left)");
        } catch (ExecutionException e) {
            context.adopt(workingCopy);
            Throwable cause = e.getCause();
            if (cause instanceof OperationExecutionException operationFailure) {
                throw operationFailure;
            }
            throw new OperationExecutionException(describe(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationExecutionException("Interrupted while waiting for the step", e);
        }
    }

    /// Resolves file-path-shaped step params (`file`, `path`, `*_file`, `*_path`).
    ///
    /// Names containing `output` are resolved in output mode, the rest in input mode.
    /// Input paths that cannot be found are passed through unchanged with a warning.
    private Map<String, Object> resolveParameterPaths(
            Map<String, Object> resolved, List<ResolutionWarning> warnings) {
        Map<String, Object> result = new LinkedHashMap<>(resolved);
        for (Map.Entry<String, Object> entry : resolved.entrySet()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            if (!isPathParameter(name)
                    || !(entry.getValue() instanceof String value)
                    || value.isBlank()
                    || value.contains("://")
                    || ReferenceParser.containsMarker(value)) {
                continue;
            }
            PathMode mode = name.contains("output") ? PathMode.OUTPUT : PathMode.INPUT;
            PathResolution resolution = pathResolver.resolve(value, mode);
            if (resolution.found()) {
                result.put(entry.getKey(), resolution.path().toString());
                if (resolution.isFallback()) {
                    warnings.add(
                            ResolutionWarning.path(value, "fallback used: " + resolution.path()));
                }
            } else {
                warnings.add(ResolutionWarning.path(value, "input file not found"));
            }
        }
        return result;
    }

    private static boolean isPathParameter(String name) {
        return name.equals("file")
                || name.equals("path")
                || name.endsWith("_file")
                || name.endsWith("_path");
    }

    private static void recordWarnings(
            String source,
            List<ResolutionWarning> warnings,
            ExecutionContext context,
            PipelineListener events) {
        for (ResolutionWarning warning : warnings) {
            context.recordWarning(source, warning.toString());
            events.onWarning(source, warning);
        }
    }

    private static StepFailure failure(
            Step step,
            int index,
            Map<String, Object> parameters,
            Exception cause,
            StepFailure.Kind kind) {
        return new StepFailure(
                step.name(),
                index,
                step.operationType(),
                parameters,
                describe(cause),
                cause,
                kind);
    }

    private static String describe(Throwable throwable) {
        return throwable.getMessage() != null
                ? throwable.getMessage()
                : throwable.getClass().getSimpleName();
    }

    public static final class Builder {
        private OperationRegistry operationRegistry;
        private ExpressionResolver expressionResolver;
        private PathResolver pathResolver;
        private PipelineRepository pipelineRepository;
        private ExecutorService stepRunner;
        private HarmoniaConfig config;
        private Map<String, String> environment;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder operationRegistry(OperationRegistry operationRegistry) {
            this.operationRegistry = operationRegistry;
            return this;
        }

        public Builder expressionResolver(ExpressionResolver expressionResolver) {
            this.expressionResolver = expressionResolver;
            return this;
        }

        public Builder pathResolver(PathResolver pathResolver) {
            this.pathResolver = pathResolver;
            return this;
        }

        public Builder pipelineRepository(PipelineRepository pipelineRepository) {
            this.pipelineRepository = pipelineRepository;
            return this;
        }

        /// Sets the executor used to bound steps by the pipeline deadline.
        ///
        /// Without one, steps run on the calling thread and deadlines are only
        /// checked by operations that consult {@link ExecutionContext#getDeadline()}.
        public Builder stepRunner(ExecutorService stepRunner) {
            this.stepRunner = stepRunner;
            return this;
        }

        public Builder config(HarmoniaConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the environment variables visible to `${env.*}`; defaults to `System.getenv()`.
        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock != null ? clock : Clock.systemUTC();
            return this;
        }

        public PipelineExecutor build() {
            return new PipelineExecutor(this);
        }
    }
}
