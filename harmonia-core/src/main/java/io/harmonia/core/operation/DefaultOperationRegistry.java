package io.harmonia.core.operation;

import io.harmonia.core.exception.DuplicateOperationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Default {@link OperationRegistry} backed by a concurrent map.
///
/// Registering a name twice fails fast with {@link DuplicateOperationException}
/// instead of silently replacing the first factory.
public class DefaultOperationRegistry implements OperationRegistry {

    private static final Logger logger =
            Logger.getLogger(DefaultOperationRegistry.class.getName());

    private final Map<String, OperationFactory> factories = new ConcurrentHashMap<>();

    /// Creates an empty registry.
    public DefaultOperationRegistry() {}

    /// Creates a registry populated from the given modules, in order.
    public DefaultOperationRegistry(List<? extends OperationModule> modules) {
        for (OperationModule module : modules) {
            module.registerAll(this);
        }
        logger.info("Operation registry ready with types " + knownTypes());
    }

    @Override
    public void register(String type, OperationFactory factory) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (factories.putIfAbsent(type, factory) != null) {
            throw new DuplicateOperationException(type);
        }
        logger.fine("Registered operation type " + type);
    }

    @Override
    public Optional<OperationFactory> lookup(String type) {
        return Optional.ofNullable(factories.get(type));
    }

    @Override
    public List<String> knownTypes() {
        return factories.keySet().stream().sorted().toList();
    }
}
