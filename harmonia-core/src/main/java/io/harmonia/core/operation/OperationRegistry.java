package io.harmonia.core.operation;

import io.harmonia.core.exception.UnknownOperationException;
import java.util.List;
import java.util.Optional;

/// Table mapping operation type names to factories.
///
/// Populated once at startup and passed explicitly to the pipeline executor.
/// Lookups are safe from any thread.
///
/// @see DefaultOperationRegistry
public interface OperationRegistry {

    /// Registers a factory under a type name.
    ///
    /// @param type the operation type name, not null or blank
    /// @param factory creates operation instances, not null
    /// @throws io.harmonia.core.exception.DuplicateOperationException if `type` is taken
    void register(String type, OperationFactory factory);

    /// Looks up a factory by type name.
    ///
    /// @param type the operation type name, not null
    /// @return the factory, or empty if the type is unknown
    Optional<OperationFactory> lookup(String type);

    /// Creates an operation for a step.
    ///
    /// @param stepName name of the step being dispatched, used in the error message
    /// @param type the operation type name, not null
    /// @return a new operation instance, never null
    /// @throws UnknownOperationException naming the step and every known type
    default Operation create(String stepName, String type) throws UnknownOperationException {
        return lookup(type)
                .orElseThrow(() -> new UnknownOperationException(stepName, type, knownTypes()))
                .create();
    }

    default boolean contains(String type) {
        return lookup(type).isPresent();
    }

    /// @return registered type names in sorted order, never null
    List<String> knownTypes();
}
