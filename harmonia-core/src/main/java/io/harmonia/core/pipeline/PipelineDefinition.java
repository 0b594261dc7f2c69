package io.harmonia.core.pipeline;

import io.harmonia.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable description of a pipeline: its ordered steps, its raw parameters
/// and its descriptive metadata.
///
/// Values are kept exactly as authored. Expression references inside
/// `parameters`, `metadata` and step params are resolved by the executor at
/// run time, never here.
///
/// ### Contracts
/// - Step order is preserved as declared.
/// - Parameter and metadata maps preserve declaration order and may hold null values.
/// - Structural checks live in {@link #validate()} so loaders and the executor can
///   report them as {@link ConfigurationException}s.
///
/// @see Builder
public final class PipelineDefinition {

    private final String name;
    private final String version;
    private final String description;
    private final List<Step> steps;
    private final Map<String, Object> parameters;
    private final Map<String, Object> metadata;

    private PipelineDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Pipeline name required");
        this.version = builder.version;
        this.description = builder.description;
        this.steps = List.copyOf(builder.steps);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /// Checks the structural rules every runnable pipeline must satisfy.
    ///
    /// @throws ConfigurationException if the name is blank, there are no steps,
    ///     a step has a blank name or operation type, or two steps share a name
    public void validate() throws ConfigurationException {
        if (name.isBlank()) {
            throw new ConfigurationException("Pipeline name must not be blank");
        }
        if (steps.isEmpty()) {
            throw new ConfigurationException("Pipeline '" + name + "' declares no steps");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.name().isBlank()) {
                throw new ConfigurationException(
                        "Step #" + (i + 1) + " of pipeline '" + name + "' has a blank name");
            }
            if (step.operationType().isBlank()) {
                throw new ConfigurationException(
                        "Step '" + step.name() + "' has a blank operation type");
            }
            if (!seen.add(step.name())) {
                throw new ConfigurationException(
                        "Duplicate step name '" + step.name() + "' in pipeline '" + name + "'");
            }
        }
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// Returns a builder initialised with this definition's values.
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .version(version)
                .description(description)
                .steps(steps)
                .parameters(parameters)
                .metadata(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PipelineDefinition{name='" + name + "', version='" + version + "', steps="
                + steps.size() + "}";
    }

    public static final class Builder {
        private String name;
        private String version = "1.0";
        private String description = "";
        private final List<Step> steps = new ArrayList<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(Objects.requireNonNull(step, "step must not be null"));
            return this;
        }

        public Builder steps(List<Step> steps) {
            this.steps.clear();
            steps.forEach(this::step);
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters.clear();
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public PipelineDefinition build() {
            return new PipelineDefinition(this);
        }
    }
}
