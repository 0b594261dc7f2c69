package io.harmonia.core.expression;

import java.util.ArrayList;
import java.util.List;

/// A string split into literal text and reference markers.
///
/// @param source the original string
/// @param parts literal and marker parts in source order
public record Template(String source, List<Part> parts) {

    public Template {
        parts = List.copyOf(parts);
    }

    public sealed interface Part {}

    public record Literal(String text) implements Part {}

    public record Marker(Reference reference) implements Part {}

    public boolean hasMarkers() {
        return parts.stream().anyMatch(Marker.class::isInstance);
    }

    /// True when the whole source is exactly one marker with no surrounding text.
    public boolean isSingleMarker() {
        return parts.size() == 1 && parts.get(0) instanceof Marker;
    }

    public List<Reference> references() {
        List<Reference> references = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof Marker marker) {
                references.add(marker.reference());
            }
        }
        return references;
    }
}
