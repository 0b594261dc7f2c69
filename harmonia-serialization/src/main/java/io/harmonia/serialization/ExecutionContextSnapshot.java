package io.harmonia.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.harmonia.core.context.ExecutionContext;
import io.harmonia.core.context.ProvenanceRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Writes an {@link ExecutionContext} as JSON for checkpointing and inspection.
///
/// Snapshot layout:
/// {@snippet lang=json :
/// {
///   "run_id": "...",
///   "pipeline": "protein_harmonization",
///   "deadline": "2026-01-01T00:00:00Z",
///   "parameters": {},
///   "metadata": {},
///   "datasets": { "proteins": { "columns": [], "rows": [] } },
///   "statistics": {},
///   "provenance": [ { "source": "load", "timestamp": "...", "type": "STEP", "detail": "..." } ],
///   "output_files": { "report": "/out/report.csv" }
/// }
/// }
///
/// A snapshot is a one-way artifact; the engine never reads it back.
public final class ExecutionContextSnapshot {

    private static final Logger logger = Logger.getLogger(ExecutionContextSnapshot.class.getName());

    private final ObjectMapper mapper;

    public ExecutionContextSnapshot() {
        this(PipelineDefinitionLoader.createJsonMapper());
    }

    public ExecutionContextSnapshot(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// @throws IllegalArgumentException if a context value cannot be serialized
    public String toJson(ExecutionContext context) {
        try {
            return mapper.writeValueAsString(toTree(context));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to snapshot run " + context.getRunId() + ": " + e.getMessage(), e);
        }
    }

    /// Writes the snapshot to `file`, creating parent directories as needed.
    public void write(ExecutionContext context, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), toTree(context));
        logger.info("Wrote context snapshot of run " + context.getRunId() + " to " + file);
    }

    Map<String, Object> toTree(ExecutionContext context) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("run_id", context.getRunId());
        tree.put("pipeline", context.getPipelineName());
        context.getDeadline().ifPresent(deadline -> tree.put("deadline", deadline));
        tree.put("parameters", context.getParameters());
        tree.put("metadata", context.getMetadata());
        tree.put("datasets", context.getDatasets());
        tree.put("statistics", context.getStatistics());

        List<Map<String, Object>> provenance = new ArrayList<>();
        for (ProvenanceRecord record : context.getProvenance()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("source", record.source());
            entry.put("timestamp", record.timestamp());
            entry.put("type", record.type().name());
            entry.put("detail", record.detail());
            provenance.add(entry);
        }
        tree.put("provenance", provenance);

        Map<String, String> outputFiles = new LinkedHashMap<>();
        context.getOutputFiles().forEach((key, path) -> outputFiles.put(key, path.toString()));
        tree.put("output_files", outputFiles);
        return tree;
    }
}
