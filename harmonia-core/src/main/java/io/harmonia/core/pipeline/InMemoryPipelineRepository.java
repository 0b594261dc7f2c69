package io.harmonia.core.pipeline;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe in-memory pipeline store, used by tests and embedded hosts.
public final class InMemoryPipelineRepository implements PipelineRepository {

    private final Map<String, PipelineDefinition> storage = new ConcurrentHashMap<>();

    /// Stores a definition, replacing any previous one with the same name.
    public void save(PipelineDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        storage.put(definition.getName(), definition);
    }

    @Override
    public Optional<PipelineDefinition> findByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(storage.get(name));
    }

    @Override
    public List<PipelineDefinition> findAll() {
        return List.copyOf(storage.values());
    }

    public boolean delete(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return storage.remove(name) != null;
    }

    public void clear() {
        storage.clear();
    }
}
