package io.harmonia.core.operation.builtin;

import io.harmonia.core.context.ExecutionContext;
import io.harmonia.core.operation.ContextSlot;
import io.harmonia.core.operation.Operation;
import io.harmonia.core.operation.OperationResult;
import io.harmonia.core.operation.ParameterSchema;
import io.harmonia.core.operation.ParameterType;
import io.harmonia.core.operation.ResolvedParameters;
import java.util.LinkedHashMap;
import java.util.Map;

/// Returns its resolved parameters as the result summary.
///
/// Useful for checking what a step would receive. With `statistics_key`, the
/// parameters are also merged into the statistics slot under that key.
public class EchoOperation implements Operation {

    public static final String TYPE = "ECHO";

    static final String STATISTICS_KEY = "statistics_key";

    private static final ParameterSchema SCHEMA =
            ParameterSchema.builder()
                    .optional(
                            STATISTICS_KEY,
                            ParameterType.STRING,
                            null,
                            "statistics key to publish the echoed parameters under")
                    .writes(ContextSlot.STATISTICS)
                    .build();

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public ParameterSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public OperationResult execute(ResolvedParameters parameters, ExecutionContext context) {
        Map<String, Object> echoed = new LinkedHashMap<>(parameters.asMap());
        echoed.remove(STATISTICS_KEY);
        String statisticsKey = parameters.getString(STATISTICS_KEY);
        if (statisticsKey != null && !statisticsKey.isBlank()) {
            context.mergeStatistics(statisticsKey, echoed);
        }
        return OperationResult.ok(echoed);
    }
}
