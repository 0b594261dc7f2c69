package io.harmonia.core.exception;

import java.io.Serial;

/// Base class for every checked failure raised by the pipeline engine.
///
/// Pre-run failures (configuration, circular references, unknown operation
/// types) are thrown out of the executor. Step-scoped failures are wrapped into
/// a {@link io.harmonia.core.execution.StepFailure} and surfaced through the
/// run result instead.
public class PipelineException extends Exception {
    @Serial private static final long serialVersionUID = 4411902379566245018L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
