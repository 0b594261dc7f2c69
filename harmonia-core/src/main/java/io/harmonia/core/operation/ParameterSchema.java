package io.harmonia.core.operation;

import io.harmonia.core.exception.ParameterValidationException;
import io.harmonia.core.expression.Unset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Input contract of an operation: its parameters and the context slots it touches.
///
/// Validation is lenient where the widening is lossless: numbers and booleans are
/// accepted for `STRING`, integers for `DECIMAL`, integral strings for `INTEGER`,
/// `true`/`false` strings for `BOOLEAN`, and a single value for `LIST`.
/// Parameters not declared in the schema pass through unchanged.
///
/// Declared slot access is descriptive: it documents data flow between steps and
/// is not enforced at run time.
public final class ParameterSchema {

    public static final ParameterSchema EMPTY = builder().build();

    private final List<ParameterSpec> parameters;
    private final Set<ContextSlot> reads;
    private final Set<ContextSlot> writes;

    private ParameterSchema(Builder builder) {
        this.parameters = List.copyOf(builder.parameters.values());
        this.reads = Collections.unmodifiableSet(EnumSet.copyOf(builder.reads));
        this.writes = Collections.unmodifiableSet(EnumSet.copyOf(builder.writes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    public Set<ContextSlot> getReads() {
        return reads;
    }

    public Set<ContextSlot> getWrites() {
        return writes;
    }

    /// Validates resolved step parameters and applies defaults.
    ///
    /// Values that are null or {@link Unset} count as absent.
    ///
    /// @param operationType type name used in the error message, not null
    /// @param resolved resolved step parameters, not null
    /// @return validated parameters, never null
    /// @throws ParameterValidationException listing every violation found
    public ResolvedParameters validate(String operationType, Map<String, Object> resolved)
            throws ParameterValidationException {
        Map<String, Object> values = new LinkedHashMap<>();
        resolved.forEach(
                (name, value) -> {
                    if (!Unset.isUnset(value)) {
                        values.put(name, value);
                    }
                });

        List<String> violations = new ArrayList<>();
        for (ParameterSpec spec : parameters) {
            Object value = values.get(spec.name());
            if (value == null) {
                if (spec.defaultValue() != null) {
                    values.put(spec.name(), spec.defaultValue());
                } else if (spec.required()) {
                    violations.add("missing required parameter '" + spec.name() + "'");
                }
                continue;
            }
            Object converted = convert(value, spec.type());
            if (converted == null) {
                violations.add(
                        "parameter '"
                                + spec.name()
                                + "' expected "
                                + spec.type()
                                + " but got "
                                + value.getClass().getSimpleName()
                                + " '"
                                + value
                                + "'");
            } else {
                values.put(spec.name(), converted);
            }
        }
        if (!violations.isEmpty()) {
            throw new ParameterValidationException(operationType, violations);
        }
        return new ResolvedParameters(values);
    }

    private static Object convert(Object value, ParameterType type) {
        return switch (type) {
            case ANY -> value;
            case STRING ->
                    value instanceof String || value instanceof Number || value instanceof Boolean
                            ? value.toString()
                            : null;
            case INTEGER -> toInteger(value);
            case DECIMAL -> value instanceof Number number ? number.doubleValue() : null;
            case BOOLEAN -> toBoolean(value);
            case LIST -> value instanceof List<?> ? value : value instanceof Map<?, ?> ? null : List.of(value);
            case MAP -> value instanceof Map<?, ?> ? value : null;
        };
    }

    private static Object toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return value;
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    public static final class Builder {
        private final Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        private final Set<ContextSlot> reads = EnumSet.noneOf(ContextSlot.class);
        private final Set<ContextSlot> writes = EnumSet.noneOf(ContextSlot.class);

        private Builder() {}

        public Builder parameter(ParameterSpec spec) {
            if (parameters.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Parameter declared twice: " + spec.name());
            }
            return this;
        }

        public Builder required(String name, ParameterType type, String description) {
            return parameter(ParameterSpec.required(name, type, description));
        }

        public Builder optional(
                String name, ParameterType type, Object defaultValue, String description) {
            return parameter(ParameterSpec.optional(name, type, defaultValue, description));
        }

        public Builder reads(ContextSlot... slots) {
            reads.addAll(List.of(slots));
            return this;
        }

        public Builder writes(ContextSlot... slots) {
            writes.addAll(List.of(slots));
            return this;
        }

        public ParameterSchema build() {
            return new ParameterSchema(this);
        }
    }
}
