package io.harmonia.core.pipeline;

import io.harmonia.core.exception.ConfigurationException;
import java.util.List;
import java.util.Optional;

/// Lookup of pipeline definitions by name.
///
/// @see InMemoryPipelineRepository
public interface PipelineRepository {

    /// Finds a pipeline by its declared name.
    ///
    /// @param name the pipeline name, not null
    /// @return the definition, or empty if none is known under that name
    /// @throws ConfigurationException if the name is not acceptable to the repository or
    ///     the stored definition under that name is invalid
    Optional<PipelineDefinition> findByName(String name) throws ConfigurationException;

    /// Lists every pipeline the repository can provide.
    ///
    /// @return immutable list of definitions, never null
    List<PipelineDefinition> findAll();

    default boolean exists(String name) throws ConfigurationException {
        return findByName(name).isPresent();
    }
}
