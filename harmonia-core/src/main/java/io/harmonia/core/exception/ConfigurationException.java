package io.harmonia.core.exception;

import java.io.Serial;

/// Raised when a pipeline definition is malformed: missing or duplicate step
/// names, blank operation types, unparsable documents.
public class ConfigurationException extends PipelineException {
    @Serial private static final long serialVersionUID = -1726404528310938551L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
