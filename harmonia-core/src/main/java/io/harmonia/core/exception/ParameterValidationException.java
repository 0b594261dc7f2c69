package io.harmonia.core.exception;

import java.io.Serial;
import java.util.List;

/// Raised when resolved step parameters do not satisfy the operation's schema.
///
/// Every violation found is reported, not only the first one.
public class ParameterValidationException extends PipelineException {
    @Serial private static final long serialVersionUID = 7390218845502716632L;

    private final List<String> violations;

    public ParameterValidationException(String operationType, List<String> violations) {
        super("Invalid parameters for " + operationType + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
