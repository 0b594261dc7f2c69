package io.harmonia.core.operation;

import io.harmonia.core.context.ExecutionContext;

/// A registered unit of work invoked by pipeline steps.
///
/// Implementations read their inputs from validated parameters and the execution
/// context, publish outputs into the context, and report an {@link OperationResult}.
/// Input datasets must be treated as immutable; publish a new key when unsure.
///
/// ### Contracts
/// - {@link #getSchema()} describes every parameter the operation consumes
/// - `execute` may throw; the executor converts exceptions into step failures
/// - a failed result (`success == false`) is handled exactly like a thrown exception
///
/// @see OperationRegistry
public interface Operation {

    /// Returns the registration name, e.g. `ECHO`.
    String getType();

    /// Returns the input contract used to validate resolved step parameters.
    ParameterSchema getSchema();

    /// Runs the operation.
    ///
    /// @param parameters validated step parameters, not null
    /// @param context the shared execution context, not null
    /// @return the outcome, never null
    /// @throws Exception if the operation fails
    OperationResult execute(ResolvedParameters parameters, ExecutionContext context)
            throws Exception;
}
