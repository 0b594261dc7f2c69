package io.harmonia.core.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Validated, concrete parameters of one step invocation.
///
/// Getters return values as converted by {@link ParameterSchema#validate}. A getter
/// called for an absent parameter returns null (or empty for {@link #find}).
public final class ResolvedParameters {

    private final Map<String, Object> values;

    public ResolvedParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ResolvedParameters of(Map<String, Object> values) {
        return new ResolvedParameters(values);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    public Integer getInt(String name) {
        Object value = values.get(name);
        return value instanceof Number number ? Math.toIntExact(number.longValue()) : null;
    }

    public Long getLong(String name) {
        Object value = values.get(name);
        return value instanceof Number number ? number.longValue() : null;
    }

    public Double getDouble(String name) {
        Object value = values.get(name);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public boolean getBoolean(String name) {
        return Boolean.TRUE.equals(values.get(name));
    }

    /// @return an unmodifiable copy of the list, or null if absent or not a list
    public List<Object> getList(String name) {
        Object value = values.get(name);
        if (!(value instanceof List<?> list)) {
            return null;
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    /// @return an unmodifiable copy of the mapping with string keys, or null if absent
    ///     or not a mapping
    public Map<String, Object> getMap(String name) {
        Object value = values.get(name);
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return Collections.unmodifiableMap(copy);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
