package io.harmonia.core.execution;

import io.harmonia.core.context.ResolutionWarning;
import io.harmonia.core.operation.OperationResult;
import io.harmonia.core.pipeline.Step;
import java.util.Map;

/// Listener for pipeline run lifecycle events.
///
/// All methods have no-op defaults, so implementations override only what they
/// need. Callbacks arrive on the thread that called
/// {@link PipelineExecutor#run}, in execution order.
///
/// ### Callback order for one step
/// ```
/// onStepStart(step, index, params)
/// onStepComplete(step, index, result)   - or - onStepFailed(step, index, failure)
/// ```
public interface PipelineListener {

    /// Called on every run state transition.
    ///
    /// @param runId identifier of the run, not null
    /// @param state the state just entered, not null
    default void onStateChanged(String runId, RunState state) {}

    /// Called after a step's parameters were resolved and validated.
    default void onStepStart(Step step, int index, Map<String, Object> parameters) {}

    /// Called after a step's operation reported success.
    default void onStepComplete(Step step, int index, OperationResult result) {}

    /// Called when a step fails, before its failure policy is applied.
    default void onStepFailed(Step step, int index, StepFailure failure) {}

    /// Called for every non-fatal resolution warning.
    ///
    /// @param source step name, or `parameters` / `metadata`, not null
    /// @param warning the warning, not null
    default void onWarning(String source, ResolutionWarning warning) {}

    /// No-op listener instance that ignores all events.
    PipelineListener NOOP = new PipelineListener() {};
}
