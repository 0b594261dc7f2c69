package io.harmonia.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

import io.harmonia.core.HarmoniaConfig;
import io.harmonia.core.context.Dataset;
import io.harmonia.core.context.ExecutionContext;
import io.harmonia.core.context.ProvenanceRecord;
import io.harmonia.core.context.ProvenanceType;
import io.harmonia.core.context.ResolutionWarning;
import io.harmonia.core.exception.CircularReferenceException;
import io.harmonia.core.exception.ConfigurationException;
import io.harmonia.core.exception.UnknownOperationException;
import io.harmonia.core.operation.DefaultOperationRegistry;
import io.harmonia.core.operation.Operation;
import io.harmonia.core.operation.OperationFactory;
import io.harmonia.core.operation.OperationResult;
import io.harmonia.core.operation.ParameterSchema;
import io.harmonia.core.operation.ParameterType;
import io.harmonia.core.operation.ResolvedParameters;
import io.harmonia.core.operation.builtin.EchoOperation;
import io.harmonia.core.pipeline.FailurePolicy;
import io.harmonia.core.pipeline.InMemoryPipelineRepository;
import io.harmonia.core.pipeline.PipelineDefinition;
import io.harmonia.core.pipeline.Step;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineExecutorTest {

    @Mock private PipelineListener listener;

    private DefaultOperationRegistry registry;
    private AtomicInteger counted;
    private AtomicReference<Map<String, Object>> captured;
    private PipelineExecutor executor;

    @FunctionalInterface
    private interface Body {
        OperationResult apply(ResolvedParameters parameters, ExecutionContext context)
                throws Exception;
    }

    private static OperationFactory operation(String type, ParameterSchema schema, Body body) {
        return () ->
                new Operation() {
                    @Override
                    public String getType() {
                        return type;
                    }

                    @Override
                    public ParameterSchema getSchema() {
                        return schema;
                    }

                    @Override
                    public OperationResult execute(
                            ResolvedParameters parameters, ExecutionContext context)
                            throws Exception {
                        return body.apply(parameters, context);
                    }
                };
    }

    @BeforeEach
    void setUp() {
        counted = new AtomicInteger();
        captured = new AtomicReference<>();
        registry = new DefaultOperationRegistry();
        registry.register(EchoOperation.TYPE, EchoOperation::new);
        registry.register(
                "COUNT",
                operation(
                        "COUNT",
                        ParameterSchema.EMPTY,
                        (p, c) -> {
                            counted.incrementAndGet();
                            return OperationResult.ok();
                        }));
        registry.register(
                "CAPTURE",
                operation(
                        "CAPTURE",
                        ParameterSchema.EMPTY,
                        (p, c) -> {
                            captured.set(p.asMap());
                            return OperationResult.ok();
                        }));
        registry.register(
                "FAIL",
                operation(
                        "FAIL",
                        ParameterSchema.EMPTY,
                        (p, c) -> OperationResult.failure("upstream returned 503")));
        registry.register(
                "THROW",
                operation(
                        "THROW",
                        ParameterSchema.EMPTY,
                        (p, c) -> {
                            throw new IllegalStateException("boom");
                        }));
        registry.register(
                "NEEDS_INT",
                operation(
                        "NEEDS_INT",
                        ParameterSchema.builder()
                                .required("n", ParameterType.INTEGER, "a count")
                                .build(),
                        (p, c) -> {
                            captured.set(p.asMap());
                            return OperationResult.ok(Map.of("n", p.getInt("n")));
                        }));

        executor = PipelineExecutor.builder().operationRegistry(registry).environment(Map.of()).build();
    }

    private static PipelineDefinition pipeline(Step... steps) {
        return PipelineDefinition.builder().name("test-pipeline").steps(List.of(steps)).build();
    }

    private static Step step(String name, String type) {
        return Step.of(name, type, Map.of());
    }

    private static List<String> stepSources(ExecutionContext context) {
        return context.getProvenance().stream()
                .filter(r -> r.type() == ProvenanceType.STEP)
                .map(ProvenanceRecord::source)
                .toList();
    }

    @Nested
    class SuccessfulRuns {

        @Test
        void shouldRunEchoPipelineEndToEnd() throws Exception {
            PipelineDefinition definition =
                    PipelineDefinition.builder()
                            .name("echo")
                            .parameter("species", "human")
                            .parameter("label", "${parameters.species}_map")
                            .step(
                                    Step.of(
                                            "echo",
                                            EchoOperation.TYPE,
                                            Map.of(
                                                    "value", "${parameters.label}",
                                                    "statistics_key", "echo")))
                            .build();

            PipelineResult result = executor.run(definition, Map.of());

            assertThat(result).isInstanceOf(PipelineResult.Completed.class);
            assertThat(result.isSuccess()).isTrue();
            ExecutionContext context = result.context();
            assertThat(context.getStatistic("echo")).contains(Map.of("value", "human_map"));
            assertThat(context.getParameters()).containsEntry("label", "human_map");
            assertThat(context.getProvenance())
                    .singleElement()
                    .satisfies(
                            r -> {
                                assertThat(r.source()).isEqualTo("echo");
                                assertThat(r.type()).isEqualTo(ProvenanceType.STEP);
                            });
        }

        @Test
        void shouldLetInvocationParametersOverrideDefinition() throws Exception {
            PipelineDefinition definition =
                    PipelineDefinition.builder()
                            .name("override")
                            .parameter("species", "human")
                            .parameter("label", "${parameters.species}-genes")
                            .step(Step.of("capture", "CAPTURE", Map.of("label", "${parameters.label}")))
                            .build();

            executor.run(definition, Map.of("species", "mouse"));

            assertThat(captured.get()).containsEntry("label", "mouse-genes");
        }

        @Test
        void shouldExposeEarlierStatisticsToLaterSteps() throws Exception {
            PipelineDefinition definition =
                    pipeline(
                            Step.of(
                                    "first",
                                    EchoOperation.TYPE,
                                    Map.of("count", 3, "statistics_key", "first")),
                            Step.of("second", "NEEDS_INT", Map.of("n", "${statistics.first.count}")));

            PipelineResult result = executor.run(definition, Map.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(captured.get().get("n")).isInstanceOf(Integer.class).isEqualTo(3);
        }

        @Test
        void shouldRecordUnresolvedReferencesAsWarnings() throws Exception {
            PipelineResult result =
                    executor.run(
                            pipeline(
                                    Step.of(
                                            "capture",
                                            "CAPTURE",
                                            Map.of("token", "${env.HARMONIA_TEST_UNSET}"))),
                            Map.of(),
                            listener);

            assertThat(result.isSuccess()).isTrue();
            assertThat(captured.get()).containsEntry("token", "${env.HARMONIA_TEST_UNSET}");
            assertThat(result.context().getProvenance())
                    .anySatisfy(
                            r -> {
                                assertThat(r.isWarning()).isTrue();
                                assertThat(r.source()).isEqualTo("capture");
                                assertThat(r.detail()).contains("${env.HARMONIA_TEST_UNSET}");
                            });
            verify(listener).onWarning(eq("capture"), any(ResolutionWarning.class));
        }

        @Test
        void shouldNotifyListenerInOrder() throws Exception {
            executor.run(pipeline(step("only", "COUNT")), Map.of(), listener);

            InOrder order = inOrder(listener);
            order.verify(listener).onStateChanged(anyString(), eq(RunState.LOADED));
            order.verify(listener).onStateChanged(anyString(), eq(RunState.RESOLVING_PARAMETERS));
            order.verify(listener).onStateChanged(anyString(), eq(RunState.RUNNING));
            order.verify(listener).onStepStart(any(Step.class), eq(0), anyMap());
            order.verify(listener).onStepComplete(any(Step.class), eq(0), any(OperationResult.class));
            order.verify(listener).onStateChanged(anyString(), eq(RunState.COMPLETED));
        }
    }

    @Nested
    class FailurePolicies {

        private PipelineDefinition fiveSteps(FailurePolicy thirdPolicy) {
            return pipeline(
                    step("s1", "COUNT"),
                    step("s2", "COUNT"),
                    new Step("s3", "FAIL", Map.of(), thirdPolicy),
                    step("s4", "COUNT"),
                    step("s5", "COUNT"));
        }

        @Test
        void shouldStopAtFirstStrictFailure() throws Exception {
            PipelineResult result = executor.run(fiveSteps(FailurePolicy.STRICT), Map.of());

            assertThat(result).isInstanceOf(PipelineResult.Failed.class);
            StepFailure failure = ((PipelineResult.Failed) result).failure();
            assertThat(failure.stepName()).isEqualTo("s3");
            assertThat(failure.stepIndex()).isEqualTo(2);
            assertThat(failure.kind()).isEqualTo(StepFailure.Kind.OPERATION_EXECUTION);
            assertThat(failure.message()).isEqualTo("upstream returned 503");
            assertThat(stepSources(result.context())).containsExactly("s1", "s2");
            assertThat(counted.get()).isEqualTo(2);
        }

        @Test
        void shouldContinueWithWarningUnderWarn() throws Exception {
            PipelineResult result = executor.run(fiveSteps(FailurePolicy.WARN), Map.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(counted.get()).isEqualTo(4);
            assertThat(stepSources(result.context())).containsExactly("s1", "s2", "s4", "s5");
            assertThat(result.context().getProvenance())
                    .filteredOn(ProvenanceRecord::isWarning)
                    .singleElement()
                    .satisfies(
                            r -> {
                                assertThat(r.source()).isEqualTo("s3");
                                assertThat(r.detail())
                                        .isEqualTo("step failed (FAIL): upstream returned 503");
                            });
        }

        @Test
        void shouldContinueSilentlyUnderIgnore() throws Exception {
            PipelineResult result = executor.run(fiveSteps(FailurePolicy.IGNORE), Map.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(counted.get()).isEqualTo(4);
            assertThat(result.context().getProvenance()).noneMatch(ProvenanceRecord::isWarning);
        }

        @Test
        void shouldReportValidationFailureWithResolvedParameters() throws Exception {
            PipelineResult result =
                    executor.run(
                            pipeline(Step.of("count", "NEEDS_INT", Map.of("n", "many"))), Map.of());

            StepFailure failure = ((PipelineResult.Failed) result).failure();
            assertThat(failure.kind()).isEqualTo(StepFailure.Kind.PARAMETER_VALIDATION);
            assertThat(failure.resolvedParameters()).containsEntry("n", "many");
            assertThat(failure.message()).contains("'n' expected INTEGER");
        }

        @Test
        void shouldReportMalformedReferenceAsValidationFailure() throws Exception {
            PipelineResult result =
                    executor.run(
                            pipeline(Step.of("capture", "CAPTURE", Map.of("x", "${parameters.a"))),
                            Map.of());

            assertThat(((PipelineResult.Failed) result).failure().kind())
                    .isEqualTo(StepFailure.Kind.PARAMETER_VALIDATION);
        }

        @Test
        void shouldConvertThrownExceptionIntoStepFailure() throws Exception {
            PipelineResult result = executor.run(pipeline(step("explode", "THROW")), Map.of(), listener);

            StepFailure failure = ((PipelineResult.Failed) result).failure();
            assertThat(failure.kind()).isEqualTo(StepFailure.Kind.OPERATION_EXECUTION);
            assertThat(failure.message()).isEqualTo("boom");
            assertThat(failure.cause()).hasRootCauseInstanceOf(IllegalStateException.class);
            verify(listener).onStepFailed(any(Step.class), eq(0), eq(failure));
            verify(listener).onStateChanged(anyString(), eq(RunState.FAILED));
        }
    }

    @Nested
    class PreRunChecks {

        @Test
        void shouldRejectUnknownOperationBeforeAnyStepRuns() {
            PipelineDefinition definition = pipeline(step("s1", "COUNT"), step("s2", "MISSING"));

            assertThatThrownBy(() -> executor.run(definition, Map.of()))
                    .isInstanceOf(UnknownOperationException.class)
                    .hasMessageContaining("s2");
            assertThat(counted.get()).isZero();
        }

        @Test
        void shouldRejectCircularParameters() {
            PipelineDefinition definition =
                    PipelineDefinition.builder()
                            .name("cyclic")
                            .parameter("a", "${parameters.b}")
                            .parameter("b", "${parameters.a}")
                            .step(step("s1", "COUNT"))
                            .build();

            assertThatThrownBy(() -> executor.run(definition, Map.of()))
                    .isInstanceOf(CircularReferenceException.class);
            assertThat(counted.get()).isZero();
        }

        @Test
        void shouldRejectDuplicateStepNames() {
            assertThatThrownBy(
                            () -> executor.run(pipeline(step("s", "COUNT"), step("s", "COUNT")), Map.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate step name 's'");
        }
    }

    @Nested
    class Repository {

        @Test
        void shouldRunPipelineByName() throws Exception {
            InMemoryPipelineRepository repository = new InMemoryPipelineRepository();
            repository.save(pipeline(step("s1", "COUNT")));
            PipelineExecutor withRepository =
                    PipelineExecutor.builder()
                            .operationRegistry(registry)
                            .pipelineRepository(repository)
                            .environment(Map.of())
                            .build();

            assertThat(withRepository.run("test-pipeline", Map.of()).isSuccess()).isTrue();
            assertThatThrownBy(() -> withRepository.run("unknown", Map.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("unknown");
        }

        @Test
        void shouldRequireRepositoryForRunByName() {
            assertThatThrownBy(() -> executor.run("test-pipeline", Map.of()))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    class Paths {

        @TempDir Path root;

        private PipelineExecutor pathAware;
        private Path genes;

        @BeforeEach
        void setUp() throws Exception {
            Path dataDir = Files.createDirectories(root.resolve("data"));
            genes = Files.writeString(dataDir.resolve("genes.csv"), "symbol\nTP53\n");
            HarmoniaConfig config =
                    HarmoniaConfig.builder()
                            .baseDir(Files.createDirectories(root.resolve("base")))
                            .dataDir(dataDir)
                            .outputDir(root.resolve("out"))
                            .filenameFallbackEnabled(false)
                            .build();
            pathAware =
                    PipelineExecutor.builder()
                            .operationRegistry(registry)
                            .config(config)
                            .environment(Map.of())
                            .build();
        }

        @Test
        void shouldAnnotateMetadataFilesWithResolution() throws Exception {
            PipelineDefinition definition =
                    PipelineDefinition.builder()
                            .name("paths")
                            .metadata(
                                    Map.of(
                                            "source_files",
                                            List.of(
                                                    Map.of("name", "genes", "path", "genes.csv"),
                                                    Map.of("name", "gone", "path", "gone.csv"))))
                            .step(step("s1", "COUNT"))
                            .build();

            ExecutionContext context = pathAware.run(definition, Map.of()).context();

            assertThat(context.getMetadata().get("source_files"))
                    .isEqualTo(
                            List.of(
                                    Map.of("name", "genes", "path", genes.toString(), "resolved", true),
                                    Map.of("name", "gone", "path", "gone.csv", "resolved", false)));
            assertThat(context.getProvenance())
                    .anySatisfy(
                            r -> {
                                assertThat(r.source()).isEqualTo("metadata");
                                assertThat(r.detail()).contains("gone.csv");
                            });
        }

        @Test
        void shouldResolvePathShapedStepParameters() throws Exception {
            PipelineResult result =
                    pathAware.run(
                            pipeline(
                                    Step.of(
                                            "capture",
                                            "CAPTURE",
                                            Map.of(
                                                    "input_file", "genes.csv",
                                                    "output_path", "mapped/genes.csv",
                                                    "label", "genes.csv"))),
                            Map.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(captured.get())
                    .containsEntry("input_file", genes.toString())
                    .containsEntry("output_path", root.resolve("out/mapped/genes.csv").toString())
                    .containsEntry("label", "genes.csv");
        }
    }

    @Nested
    class Deadlines {

        @Test
        void shouldFailStepThatOverrunsPipelineTimeout() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            registry.register(
                    "BLOCK",
                    operation(
                            "BLOCK",
                            ParameterSchema.EMPTY,
                            (p, c) -> {
                                release.await(5, TimeUnit.SECONDS);
                                return OperationResult.ok();
                            }));
            ExecutorService stepRunner = Executors.newCachedThreadPool();
            PipelineExecutor bounded =
                    PipelineExecutor.builder()
                            .operationRegistry(registry)
                            .stepRunner(stepRunner)
                            .config(
                                    HarmoniaConfig.builder()
                                            .pipelineTimeout(Duration.ofMillis(100))
                                            .build())
                            .environment(Map.of())
                            .build();
            try {
                PipelineResult result = bounded.run(pipeline(step("slow", "BLOCK")), Map.of());

                StepFailure failure = ((PipelineResult.Failed) result).failure();
                assertThat(failure.kind()).isEqualTo(StepFailure.Kind.DEADLINE_EXCEEDED);
                assertThat(failure.stepName()).isEqualTo("slow");
            } finally {
                release.countDown();
                stepRunner.shutdownNow();
            }
        }

        @Test
        void shouldDiscardWritesOfStepAbandonedAtDeadline() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch finished = new CountDownLatch(1);
            registry.register(
                    "LATE",
                    operation(
                            "LATE",
                            ParameterSchema.EMPTY,
                            (p, c) -> {
                                release.await(5, TimeUnit.SECONDS);
                                c.putDataset("late", Dataset.empty(List.of("id")));
                                c.recordStep("late", "written after the deadline");
                                finished.countDown();
                                return OperationResult.ok();
                            }));
            ExecutorService stepRunner = Executors.newCachedThreadPool();
            try {
                PipelineResult result =
                        bounded(stepRunner, Duration.ofMillis(100))
                                .run(pipeline(step("slow", "LATE")), Map.of());
                ExecutionContext context = result.context();
                List<ProvenanceRecord> atReturn = List.copyOf(context.getProvenance());

                release.countDown();
                assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();

                assertThat(result.isSuccess()).isFalse();
                assertThat(context.hasDataset("late")).isFalse();
                assertThat(context.getProvenance()).isEqualTo(atReturn);
            } finally {
                release.countDown();
                stepRunner.shutdownNow();
            }
        }

        @Test
        void shouldKeepWritesOfStepFinishingInTime() throws Exception {
            registry.register(
                    "QUICK",
                    operation(
                            "QUICK",
                            ParameterSchema.EMPTY,
                            (p, c) -> {
                                c.putDataset("quick", Dataset.empty(List.of("id")));
                                c.mergeStatistics("quick", Map.of("rows", 0));
                                return OperationResult.ok();
                            }));
            ExecutorService stepRunner = Executors.newCachedThreadPool();
            try {
                PipelineResult result =
                        bounded(stepRunner, Duration.ofSeconds(5))
                                .run(pipeline(step("fast", "QUICK"), step("next", "COUNT")), Map.of());

                assertThat(result.isSuccess()).isTrue();
                assertThat(result.context().hasDataset("quick")).isTrue();
                assertThat(result.context().getStatistic("quick")).contains(Map.of("rows", 0));
                assertThat(stepSources(result.context())).containsExactly("fast", "next");
                assertThat(counted.get()).isEqualTo(1);
            } finally {
                stepRunner.shutdownNow();
            }
        }

        private PipelineExecutor bounded(ExecutorService stepRunner, Duration timeout) {
            return PipelineExecutor.builder()
                    .operationRegistry(registry)
                    .stepRunner(stepRunner)
                    .config(HarmoniaConfig.builder().pipelineTimeout(timeout).build())
                    .environment(Map.of())
                    .build();
        }
    }
}
