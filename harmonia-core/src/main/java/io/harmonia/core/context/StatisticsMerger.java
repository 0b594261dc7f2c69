package io.harmonia.core.context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Merge rule for the statistics slot.
///
/// Map into map merges key by key, recursively. List into list appends. Any other
/// combination replaces the existing value.
final class StatisticsMerger {

    private StatisticsMerger() {}

    static void merge(Map<String, Object> target, String key, Object value) {
        Object existing = target.get(key);
        target.put(key, mergeValues(existing, value));
    }

    static Object mergeValues(Object existing, Object incoming) {
        if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
            Map<String, Object> merged = new LinkedHashMap<>();
            existingMap.forEach((k, v) -> merged.put(String.valueOf(k), v));
            for (Map.Entry<?, ?> entry : incomingMap.entrySet()) {
                merge(merged, String.valueOf(entry.getKey()), entry.getValue());
            }
            return merged;
        }
        if (existing instanceof List<?> existingList && incoming instanceof List<?> incomingList) {
            List<Object> merged = new ArrayList<>(existingList);
            merged.addAll(incomingList);
            return merged;
        }
        return copyOf(incoming);
    }

    // Callers keep their own maps and lists, so we never alias them into the context.
    private static Object copyOf(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyOf(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(copyOf(v)));
            return copy;
        }
        return value;
    }
}
