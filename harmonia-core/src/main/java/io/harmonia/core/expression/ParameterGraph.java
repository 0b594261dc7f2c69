package io.harmonia.core.expression;

import io.harmonia.core.exception.CircularReferenceException;
import io.harmonia.core.exception.ExpressionSyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Dependency graph between pipeline parameters.
///
/// An edge `a -> b` exists when the raw value of `a` (at any nesting depth)
/// contains a `${parameters.b...}` reference and `b` is a declared parameter.
/// References to undeclared parameters add no edge; they resolve to unset.
///
/// {@link #resolutionOrder()} returns dependencies before dependents. Among
/// independent parameters, declaration order is preserved.
public final class ParameterGraph {

    private final List<String> names;
    private final Map<String, Set<String>> edges;

    private ParameterGraph(List<String> names, Map<String, Set<String>> edges) {
        this.names = names;
        this.edges = edges;
    }

    /// Builds the graph for a raw parameter block.
    ///
    /// @throws ExpressionSyntaxException if any parameter value holds a malformed reference
    public static ParameterGraph of(Map<String, ?> rawParameters) throws ExpressionSyntaxException {
        List<String> names = new ArrayList<>(rawParameters.keySet());
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (String name : names) {
            Set<String> dependencies = new LinkedHashSet<>();
            collect(rawParameters.get(name), rawParameters.keySet(), dependencies);
            edges.put(name, dependencies);
        }
        return new ParameterGraph(names, edges);
    }

    private static void collect(Object value, Set<String> declared, Set<String> out)
            throws ExpressionSyntaxException {
        if (value instanceof String text) {
            if (!ReferenceParser.containsMarker(text)) {
                return;
            }
            for (Reference reference : ReferenceParser.parse(text).references()) {
                String target = reference.secondKey();
                if (Namespace.PARAMETERS.equals(reference.head())
                        && target != null
                        && declared.contains(target)) {
                    out.add(target);
                }
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Object nested : map.values()) {
                collect(nested, declared, out);
            }
        } else if (value instanceof List<?> list) {
            for (Object nested : list) {
                collect(nested, declared, out);
            }
        }
    }

    public Set<String> dependenciesOf(String name) {
        return Set.copyOf(edges.getOrDefault(name, Set.of()));
    }

    /// Orders parameters so every parameter comes after the ones it references.
    ///
    /// @return all parameter names, dependencies first, never null
    /// @throws CircularReferenceException naming the full chain of the first cycle found
    public List<String> resolutionOrder() throws CircularReferenceException {
        List<String> order = new ArrayList<>(names.size());
        Set<String> done = new HashSet<>();
        Map<String, Integer> onPath = new HashMap<>();
        List<String> path = new ArrayList<>();
        for (String name : names) {
            visit(name, done, onPath, path, order);
        }
        return order;
    }

    private void visit(
            String name,
            Set<String> done,
            Map<String, Integer> onPath,
            List<String> path,
            List<String> order)
            throws CircularReferenceException {
        if (done.contains(name)) {
            return;
        }
        Integer position = onPath.get(name);
        if (position != null) {
            List<String> cycle = new ArrayList<>(path.subList(position, path.size()));
            cycle.add(name);
            throw new CircularReferenceException(cycle);
        }
        onPath.put(name, path.size());
        path.add(name);
        for (String dependency : edges.getOrDefault(name, Set.of())) {
            visit(dependency, done, onPath, path, order);
        }
        path.remove(path.size() - 1);
        onPath.remove(name);
        done.add(name);
        order.add(name);
    }
}
