package io.harmonia.core.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/// Converts fully resolved strings into typed values.
///
/// Rules, first match wins:
/// 1. `true`/`yes`/`1`/`on` and `false`/`no`/`0`/`off` (any case) become a `Boolean`
/// 2. integer-looking strings become an `Integer`, or a `Long` when out of int range
/// 3. decimal-looking strings become a `Double`
/// 4. comma-separated strings that do not look like a path, URL or structured literal
///    become a `List<String>` of trimmed items
/// 5. anything else stays a `String`
///
/// Non-string values are returned unchanged, which makes coercion idempotent.
public final class ValueCoercer {

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "0", "off");
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL =
            Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private ValueCoercer() {}

    public static Object coerce(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        String trimmed = text.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(lower)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(lower)) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                long parsed = Long.parseLong(trimmed);
                if (parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE) {
                    return (int) parsed;
                }
                return parsed;
            } catch (NumberFormatException e) {
                return text;
            }
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        if (looksLikeList(trimmed)) {
            List<String> items = new ArrayList<>();
            for (String item : trimmed.split(",", -1)) {
                items.add(item.trim());
            }
            return items;
        }
        return text;
    }

    private static boolean looksLikeList(String value) {
        if (!value.contains(",")) {
            return false;
        }
        return !(value.startsWith("/")
                || value.startsWith("http")
                || value.contains("://")
                || value.startsWith("{")
                || value.startsWith("[")
                || value.contains("\""));
    }
}
