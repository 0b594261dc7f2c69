package io.harmonia.core.context;

import java.time.Instant;
import java.util.Objects;

/// Append-only audit entry describing what happened during a run.
///
/// @param source step name, or `metadata` / `parameters` for run-level entries, not null
/// @param timestamp when the entry was recorded, not null
/// @param type entry kind, not null
/// @param detail human-readable description, not null
public record ProvenanceRecord(String source, Instant timestamp, ProvenanceType type, String detail) {

    public ProvenanceRecord {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(type, "type must not be null");
        detail = detail == null ? "" : detail;
    }

    public boolean isWarning() {
        return type == ProvenanceType.WARNING;
    }
}
