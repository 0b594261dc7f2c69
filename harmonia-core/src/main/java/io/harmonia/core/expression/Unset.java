package io.harmonia.core.expression;

/// Explicit "no value" produced when a reference walks off the object graph:
/// a missing map key or an out-of-range index.
///
/// Distinct from `null`, which is a legitimate authored value. Parameter
/// validation treats an unset parameter exactly like an absent one.
public enum Unset {
    INSTANCE;

    public static boolean isUnset(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "<unset>";
    }
}
