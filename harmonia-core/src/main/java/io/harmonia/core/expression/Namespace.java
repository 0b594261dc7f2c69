package io.harmonia.core.expression;

import io.harmonia.core.context.Dataset;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Layered lookup table that `${...}` references are resolved against.
///
/// ### Scopes
/// - `env`: process environment, falling back to the built-in default table
/// - `parameters`: the pipeline's (resolved) parameters
/// - `metadata`: the pipeline's metadata block
/// - `builtin`: values supplied by the engine, such as `run_id` and `current_time`
/// - `statistics`, `datasets`, `outputs`: execution context slots, present at step time
///
/// A reference whose first name is not a scope is a bare reference. It is looked
/// up as an environment variable (with defaults) and then as a parameter.
///
/// ### Walking
/// After the scope, each key or index walks one level into maps, lists and
/// dataset rows. Walking off the graph (missing key, index out of range, key on a
/// scalar) yields {@link Unset#INSTANCE}.
///
/// Instances are immutable; the `with*` methods return modified copies.
public final class Namespace {

    private static final Logger logger = Logger.getLogger(Namespace.class.getName());

    public static final String ENV = "env";
    public static final String PARAMETERS = "parameters";
    public static final String METADATA = "metadata";
    public static final String BUILTIN = "builtin";
    public static final String STATISTICS = "statistics";
    public static final String DATASETS = "datasets";
    public static final String OUTPUTS = "outputs";

    private static final Set<String> SCOPES =
            Set.of(ENV, PARAMETERS, METADATA, BUILTIN, STATISTICS, DATASETS, OUTPUTS);

    private final Map<String, String> environment;
    private final Map<String, String> environmentDefaults;
    private final Map<String, Map<String, ?>> scopes;

    private Namespace(
            Map<String, String> environment,
            Map<String, String> environmentDefaults,
            Map<String, Map<String, ?>> scopes) {
        this.environment = environment;
        this.environmentDefaults = environmentDefaults;
        this.scopes = scopes;
    }

    /// Outcome of a lookup.
    ///
    /// @param value the resolved value; may be null or {@link Unset#INSTANCE}
    /// @param found false when the reference cannot be resolved at all and its
    ///     literal text must be kept
    public record Lookup(Object value, boolean found) {
        static final Lookup NOT_FOUND = new Lookup(null, false);

        static Lookup of(Object value) {
            return new Lookup(value, true);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static boolean isScope(String name) {
        return SCOPES.contains(name);
    }

    /// Resolves a parsed reference.
    ///
    /// @param reference the reference to look up, not null
    /// @return the lookup outcome, never null
    public Lookup lookup(Reference reference) {
        String head = reference.head();
        if (ENV.equals(head)) {
            String variable = reference.secondKey();
            if (variable == null) {
                return Lookup.NOT_FOUND;
            }
            String value = environmentValue(variable);
            if (value == null) {
                return Lookup.NOT_FOUND;
            }
            return Lookup.of(walk(value, reference.from(2), reference));
        }
        if (isScope(head)) {
            return Lookup.of(walk(scope(head), reference.from(1), reference));
        }

        String envValue = environmentValue(head);
        if (envValue != null) {
            return Lookup.of(walk(envValue, reference.from(1), reference));
        }
        Map<String, ?> parameters = scope(PARAMETERS);
        if (parameters.containsKey(head)) {
            return Lookup.of(walk(parameters.get(head), reference.from(1), reference));
        }
        return Lookup.NOT_FOUND;
    }

    private String environmentValue(String name) {
        String value = environment.get(name);
        return value != null ? value : environmentDefaults.get(name);
    }

    private Map<String, ?> scope(String name) {
        Map<String, ?> scope = scopes.get(name);
        return scope != null ? scope : Map.of();
    }

    private static Object walk(Object root, List<PathSegment> path, Reference reference) {
        Object current = root;
        for (PathSegment segment : path) {
            current = step(current, segment);
            if (current == Unset.INSTANCE) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(
                            "Reference " + reference + " is unset at segment '" + segment + "'");
                }
                return Unset.INSTANCE;
            }
        }
        return current;
    }

    private static Object step(Object current, PathSegment segment) {
        if (segment instanceof PathSegment.Key key) {
            if (current instanceof Map<?, ?> map && map.containsKey(key.name())) {
                return map.get(key.name());
            }
            return Unset.INSTANCE;
        }
        int index = ((PathSegment.Index) segment).index();
        if (current instanceof List<?> list) {
            return index < list.size() ? list.get(index) : Unset.INSTANCE;
        }
        if (current instanceof Dataset dataset) {
            return index < dataset.size() ? dataset.getRow(index) : Unset.INSTANCE;
        }
        if (current instanceof Map<?, ?> map && map.containsKey(String.valueOf(index))) {
            return map.get(String.valueOf(index));
        }
        return Unset.INSTANCE;
    }

    /// Returns a copy with one scope replaced.
    public Namespace withScope(String name, Map<String, ?> values) {
        if (!isScope(name) || ENV.equals(name)) {
            throw new IllegalArgumentException("Not a replaceable scope: " + name);
        }
        Map<String, Map<String, ?>> copy = new HashMap<>(scopes);
        copy.put(name, values);
        return new Namespace(environment, environmentDefaults, copy);
    }

    public Namespace withParameters(Map<String, ?> parameters) {
        return withScope(PARAMETERS, parameters);
    }

    public Map<String, ?> getScope(String name) {
        return Collections.unmodifiableMap(scope(name));
    }

    public static final class Builder {
        private Map<String, String> environment = Map.of();
        private Map<String, String> environmentDefaults = Map.of();
        private final Map<String, Map<String, ?>> scopes = new HashMap<>();

        private Builder() {}

        public Builder environment(Map<String, String> environment) {
            this.environment = Map.copyOf(environment);
            return this;
        }

        public Builder environmentDefaults(Map<String, String> environmentDefaults) {
            this.environmentDefaults = Map.copyOf(environmentDefaults);
            return this;
        }

        public Builder parameters(Map<String, ?> parameters) {
            return scope(PARAMETERS, parameters);
        }

        public Builder metadata(Map<String, ?> metadata) {
            return scope(METADATA, metadata);
        }

        public Builder builtins(Map<String, ?> builtins) {
            return scope(BUILTIN, builtins);
        }

        public Builder scope(String name, Map<String, ?> values) {
            if (!isScope(name) || ENV.equals(name)) {
                throw new IllegalArgumentException("Not a replaceable scope: " + name);
            }
            this.scopes.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
            return this;
        }

        public Namespace build() {
            return new Namespace(environment, environmentDefaults, new HashMap<>(scopes));
        }
    }
}
