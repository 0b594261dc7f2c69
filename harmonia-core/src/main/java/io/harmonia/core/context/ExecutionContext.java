package io.harmonia.core.context;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/// Shared, typed state of one pipeline run.
///
/// Steps read and write four slots:
/// - **datasets**: named {@link Dataset}s; writing an existing key overwrites it
/// - **statistics**: nested summary values; writes merge (see {@link #mergeStatistics})
/// - **provenance**: append-only {@link ProvenanceRecord}s
/// - **output files**: named paths of emitted artifacts
///
/// The context also carries the run's resolved parameters and metadata and the
/// deadline, if any, by which the current step must finish.
///
/// ### Isolation
/// {@link #isolated(Map)} creates a child context used for chunked processing.
/// The child sees the parent's parameters, metadata and deadline but owns fresh
/// slots, so a piece can never observe another piece's writes. Merging back is
/// explicit through {@link #absorbStatistics(ExecutionContext)}.
///
/// {@link #workingCopy()} instead copies every slot, for a step that runs under a
/// deadline on another thread; {@link #adopt(ExecutionContext)} takes its writes back.
///
/// @implNote **Not thread-safe.** A context is mutated only by the step currently
/// running. Concurrent chunk pieces each get their own isolated child.
public final class ExecutionContext {

    private final String runId;
    private final String pipelineName;
    private final Clock clock;
    private final Map<String, Dataset> datasets = new LinkedHashMap<>();
    private final Map<String, Object> statistics = new LinkedHashMap<>();
    private final List<ProvenanceRecord> provenance = new ArrayList<>();
    private final Map<String, Path> outputFiles = new LinkedHashMap<>();
    private Map<String, Object> parameters;
    private Map<String, Object> metadata;
    private Instant deadline;

    private ExecutionContext(Builder builder) {
        this.runId = builder.runId != null ? builder.runId : UUID.randomUUID().toString();
        this.pipelineName = Objects.requireNonNull(builder.pipelineName, "pipelineName required");
        this.clock = builder.clock;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.deadline = builder.deadline;
        this.datasets.putAll(builder.datasets);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a child context for a single chunk piece.
    ///
    /// @param pieceDatasets datasets visible to the child, not null
    /// @return a fresh context sharing only read-only run information, never null
    public ExecutionContext isolated(Map<String, Dataset> pieceDatasets) {
        return builder()
                .runId(runId)
                .pipelineName(pipelineName)
                .clock(clock)
                .parameters(parameters)
                .metadata(metadata)
                .deadline(deadline)
                .datasets(pieceDatasets)
                .build();
    }

    /// Creates a working copy holding every slot of this context, for a step that
    /// runs on another thread.
    ///
    /// Writes to the copy stay there until {@link #adopt(ExecutionContext)} is called,
    /// so a step abandoned at its deadline never touches this context.
    public ExecutionContext workingCopy() {
        ExecutionContext copy = isolated(datasets);
        copy.statistics.putAll(statistics);
        copy.provenance.addAll(provenance);
        copy.outputFiles.putAll(outputFiles);
        return copy;
    }

    /// Replaces every slot of this context with the contents of a working copy.
    ///
    /// @param workingCopy a copy created by {@link #workingCopy()} whose step has finished
    public void adopt(ExecutionContext workingCopy) {
        datasets.clear();
        datasets.putAll(workingCopy.datasets);
        statistics.clear();
        statistics.putAll(workingCopy.statistics);
        provenance.clear();
        provenance.addAll(workingCopy.provenance);
        outputFiles.clear();
        outputFiles.putAll(workingCopy.outputFiles);
        parameters = workingCopy.parameters;
        metadata = workingCopy.metadata;
    }

    // === Datasets ===

    public Optional<Dataset> getDataset(String key) {
        return Optional.ofNullable(datasets.get(key));
    }

    public boolean hasDataset(String key) {
        return datasets.containsKey(key);
    }

    /// Stores a dataset, replacing any dataset under the same key.
    public void putDataset(String key, Dataset dataset) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(dataset, "dataset must not be null");
        datasets.put(key, dataset);
    }

    public Map<String, Dataset> getDatasets() {
        return Collections.unmodifiableMap(datasets);
    }

    // === Statistics ===

    /// Merges a value into the statistics slot.
    ///
    /// Map into map merges recursively, list into list appends, anything else replaces.
    ///
    /// @param key top-level statistics key, not null
    /// @param value value to merge, may be null
    public void mergeStatistics(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        StatisticsMerger.merge(statistics, key, value);
    }

    /// Merges every top-level statistics entry of another context into this one.
    public void absorbStatistics(ExecutionContext other) {
        other.statistics.forEach(this::mergeStatistics);
    }

    public Optional<Object> getStatistic(String key) {
        return Optional.ofNullable(statistics.get(key));
    }

    public Map<String, Object> getStatistics() {
        return Collections.unmodifiableMap(statistics);
    }

    // === Provenance ===

    public void appendProvenance(ProvenanceRecord record) {
        provenance.add(Objects.requireNonNull(record, "record must not be null"));
    }

    public void recordStep(String source, String detail) {
        appendProvenance(new ProvenanceRecord(source, clock.instant(), ProvenanceType.STEP, detail));
    }

    public void recordWarning(String source, String detail) {
        appendProvenance(
                new ProvenanceRecord(source, clock.instant(), ProvenanceType.WARNING, detail));
    }

    public List<ProvenanceRecord> getProvenance() {
        return Collections.unmodifiableList(provenance);
    }

    // === Output files ===

    public void putOutputFile(String key, Path path) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(path, "path must not be null");
        outputFiles.put(key, path);
    }

    public Map<String, Path> getOutputFiles() {
        return Collections.unmodifiableMap(outputFiles);
    }

    // === Run information ===

    public String getRunId() {
        return runId;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public Clock getClock() {
        return clock;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /// @return the instant by which the current step must finish, or empty when unbounded
    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public void setDeadline(Instant deadline) {
        this.deadline = deadline;
    }

    public static final class Builder {
        private String runId;
        private String pipelineName;
        private Clock clock = Clock.systemUTC();
        private Map<String, Object> parameters = Map.of();
        private Map<String, Object> metadata = Map.of();
        private Map<String, Dataset> datasets = Map.of();
        private Instant deadline;

        private Builder() {}

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder pipelineName(String pipelineName) {
            this.pipelineName = pipelineName;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock != null ? clock : Clock.systemUTC();
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder datasets(Map<String, Dataset> datasets) {
            this.datasets = datasets;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
