package io.harmonia.core.exception;

import java.io.Serial;

/// Raised when an operation throws, reports failure, or overruns the step deadline.
public class OperationExecutionException extends PipelineException {
    @Serial private static final long serialVersionUID = -3054681127794021905L;

    public OperationExecutionException(String message) {
        super(message);
    }

    public OperationExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
