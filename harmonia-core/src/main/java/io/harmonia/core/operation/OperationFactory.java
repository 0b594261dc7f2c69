package io.harmonia.core.operation;

/// Creates a fresh {@link Operation} instance for each step invocation.
@FunctionalInterface
public interface OperationFactory {

    Operation create();
}
