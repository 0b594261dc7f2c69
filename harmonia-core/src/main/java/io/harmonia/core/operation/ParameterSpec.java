package io.harmonia.core.operation;

import java.util.Objects;

/// Declaration of one operation parameter.
///
/// @param name parameter name as written in step params, not null
/// @param type expected type, not null
/// @param required whether the parameter must be provided when it has no default
/// @param defaultValue value used when the parameter is absent, may be null
/// @param description short human-readable description, not null
public record ParameterSpec(
        String name, ParameterType type, boolean required, Object defaultValue, String description) {

    public ParameterSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        description = description == null ? "" : description;
    }

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return new ParameterSpec(name, type, true, null, description);
    }

    public static ParameterSpec optional(
            String name, ParameterType type, Object defaultValue, String description) {
        return new ParameterSpec(name, type, false, defaultValue, description);
    }
}
