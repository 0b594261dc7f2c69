package io.harmonia.core.exception;

import java.io.Serial;

/// Raised when two factories are registered under the same operation type name.
public class DuplicateOperationException extends IllegalStateException {
    @Serial private static final long serialVersionUID = 1538806927345112074L;

    public DuplicateOperationException(String operationType) {
        super("Operation type already registered: " + operationType);
    }
}
