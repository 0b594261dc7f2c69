package io.harmonia.core.expression;

import java.util.List;

/// A parsed `${...}` reference.
///
/// The first segment is always a {@link PathSegment.Key}: either a scope name
/// (`env`, `parameters`, ...) or, for a bare reference, a variable name.
///
/// @param segments the path, never empty
/// @param text the marker exactly as written, including `${` and `}`
public record Reference(List<PathSegment> segments, String text) {

    public Reference {
        segments = List.copyOf(segments);
        if (segments.isEmpty() || !(segments.get(0) instanceof PathSegment.Key)) {
            throw new IllegalArgumentException("Reference must start with a name: " + text);
        }
    }

    public String head() {
        return ((PathSegment.Key) segments.get(0)).name();
    }

    /// Returns the name of the second segment when it is a key, e.g. `b` for `${parameters.b.c}`.
    public String secondKey() {
        if (segments.size() > 1 && segments.get(1) instanceof PathSegment.Key key) {
            return key.name();
        }
        return null;
    }

    public List<PathSegment> from(int index) {
        return segments.subList(Math.min(index, segments.size()), segments.size());
    }

    @Override
    public String toString() {
        return text;
    }
}
