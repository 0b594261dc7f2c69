package io.harmonia.core.exception;

import java.io.Serial;

/// Raised when a step does not finish before the pipeline deadline.
///
/// The operation itself is not interrupted and may still be running.
public class DeadlineExceededException extends OperationExecutionException {
    @Serial private static final long serialVersionUID = 8120964515233702871L;

    public DeadlineExceededException(String message) {
        super(message);
    }
}
