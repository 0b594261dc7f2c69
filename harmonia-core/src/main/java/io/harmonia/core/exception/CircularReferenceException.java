package io.harmonia.core.exception;

import java.io.Serial;
import java.util.List;

/// Raised when pipeline parameters reference each other in a cycle.
///
/// The cycle is reported as the full chain of names with the first name
/// repeated at the end, for example `[a, b, c, a]`. A self reference reads
/// `[a, a]`.
public class CircularReferenceException extends PipelineException {
    @Serial private static final long serialVersionUID = 2873561094470125830L;

    private final List<String> cycle;

    public CircularReferenceException(List<String> cycle) {
        super("Circular parameter reference: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /// @return the names participating in the cycle, first name repeated last, never null
    public List<String> getCycle() {
        return cycle;
    }
}
