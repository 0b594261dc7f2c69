package io.harmonia.core.expression;

/// One step of a reference path: a named key or a numeric index.
public sealed interface PathSegment {

    /// Map key, written `.name` or `['name']`.
    record Key(String name) implements PathSegment {
        @Override
        public String toString() {
            return name;
        }
    }

    /// Zero-based list or row index, written `[n]`.
    record Index(int index) implements PathSegment {
        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }
}
