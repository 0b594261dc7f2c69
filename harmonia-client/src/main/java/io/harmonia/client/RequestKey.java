package io.harmonia.client;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Deterministic cache key of a request.
///
/// The request is rendered canonically and hashed with SHA-256, so two requests with
/// the same logical inputs share a key regardless of map ordering:
/// - maps as `{"k":v,...}` with entries sorted by rendered key
/// - collections as `[v,...]` in iteration order
/// - numbers, booleans and `null` as their literal text
/// - anything else as a quoted string of its `toString`, with `"` and `\` escaped
///
/// Every delimiter inside a quoted string is escaped, so distinct requests never
/// render to the same text.
public final class RequestKey {

    private static final Escaper ESCAPER =
            Escapers.builder().addEscape('"', "\\\"").addEscape('\\', "\\\\").build();

    private final String canonical;
    private final String hash;

    private RequestKey(String canonical) {
        this.canonical = canonical;
        this.hash = Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString();
    }

    /// Key of an endpoint called with named parameters.
    public static RequestKey of(String endpoint, Map<String, ?> params) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        return new RequestKey(
                quoted(endpoint) + ":" + canonicalize(params == null ? Map.of() : params));
    }

    /// Key of an arbitrary request value.
    public static RequestKey of(Object request) {
        return new RequestKey(canonicalize(request));
    }

    static String canonicalize(Object value) {
        StringBuilder out = new StringBuilder();
        append(out, value);
        return out.toString();
    }

    private static void append(StringBuilder out, Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(canonicalize(k), v));
            out.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                if (!first) {
                    out.append(',');
                }
                first = false;
                out.append(entry.getKey()).append(':');
                append(out, entry.getValue());
            }
            out.append('}');
        } else if (value instanceof Collection<?> collection) {
            out.append('[');
            boolean first = true;
            for (Object item : collection) {
                if (!first) {
                    out.append(',');
                }
                first = false;
                append(out, item);
            }
            out.append(']');
        } else if (value == null || value instanceof Number || value instanceof Boolean) {
            out.append(value);
        } else {
            out.append(quoted(value.toString()));
        }
    }

    private static String quoted(String text) {
        return '"' + ESCAPER.escape(text) + '"';
    }

    /// @return the SHA-256 hex digest used as the cache key
    public String hash() {
        return hash;
    }

    public String canonical() {
        return canonical;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RequestKey other && hash.equals(other.hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
