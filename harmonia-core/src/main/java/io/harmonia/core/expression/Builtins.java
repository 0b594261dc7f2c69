package io.harmonia.core.expression;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/// Values of the `builtin` scope for one run.
public final class Builtins {

    private Builtins() {}

    /// Builds the `builtin` scope.
    ///
    /// @param baseDir configured base directory, not null
    /// @param runId identifier of the current run, not null
    /// @param pipelineName name of the running pipeline, not null
    /// @param pipelineVersion version of the running pipeline, may be null
    /// @param clock time source for `current_time` and `current_date`, not null
    /// @return the scope values, never null
    public static Map<String, Object> create(
            Path baseDir, String runId, String pipelineName, String pipelineVersion, Clock clock) {
        Map<String, Object> builtins = new LinkedHashMap<>();
        builtins.put("base_dir", baseDir.toString());
        builtins.put("current_time", clock.instant().toString());
        builtins.put("current_date", LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).toString());
        builtins.put("user", System.getProperty("user.name", "unknown"));
        builtins.put("run_id", runId);
        builtins.put("pipeline_name", pipelineName);
        builtins.put("pipeline_version", pipelineVersion);
        return builtins;
    }
}
