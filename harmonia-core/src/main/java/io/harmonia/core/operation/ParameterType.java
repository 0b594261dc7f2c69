package io.harmonia.core.operation;

/// Declared type of an operation parameter.
public enum ParameterType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    LIST,
    MAP,
    ANY
}
