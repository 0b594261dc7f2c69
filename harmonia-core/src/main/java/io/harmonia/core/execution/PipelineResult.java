package io.harmonia.core.execution;

import io.harmonia.core.context.ExecutionContext;

/// Outcome of a pipeline run that got past pre-run validation.
///
/// ### Permitted Subtypes
/// - {@link Completed} - every step ran; lenient failures are visible in provenance
/// - {@link Failed} - a strict step failed and the run stopped there
///
/// Both carry the final {@link ExecutionContext}, so provenance up to the point of
/// failure is always available.
///
/// @see PipelineExecutor
public sealed interface PipelineResult {

    ExecutionContext context();

    default boolean isSuccess() {
        return this instanceof Completed;
    }

    /// The run reached the end of its step list.
    ///
    /// @param context the final context, not null
    record Completed(ExecutionContext context) implements PipelineResult {}

    /// The run stopped at a failing step under the `strict` policy.
    ///
    /// @param context the context as it was when the run stopped, not null
    /// @param failure details of the failing step, not null
    record Failed(ExecutionContext context, StepFailure failure) implements PipelineResult {}
}
