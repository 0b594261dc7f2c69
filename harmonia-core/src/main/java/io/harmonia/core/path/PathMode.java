package io.harmonia.core.path;

/// Whether a path is going to be read or written.
public enum PathMode {
    INPUT,
    OUTPUT
}
