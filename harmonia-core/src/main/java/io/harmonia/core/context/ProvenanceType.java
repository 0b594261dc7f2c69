package io.harmonia.core.context;

/// Kind of a provenance record.
public enum ProvenanceType {
    /// A step completed successfully.
    STEP,
    /// Something went wrong without stopping the run: an unresolved reference, a
    /// path that could not be found, or a step failure under a lenient policy.
    WARNING
}
