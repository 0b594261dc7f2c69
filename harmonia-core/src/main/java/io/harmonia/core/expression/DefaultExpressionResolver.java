package io.harmonia.core.expression;

import io.harmonia.core.context.ResolutionWarning;
import io.harmonia.core.exception.CircularReferenceException;
import io.harmonia.core.exception.ExpressionSyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Default {@link ExpressionResolver}.
///
/// Strings are resolved in passes. Each pass parses the current text and
/// substitutes every marker. When a substituted value itself contains markers
/// (for example a metadata entry written as `${env.DATA_DIR}/x.csv`) another pass
/// runs. Resolution stops when a pass changes nothing or the pass limit is hit,
/// in which case the partially resolved text is returned with a warning.
///
/// @implNote Stateless apart from configuration; thread-safe.
public class DefaultExpressionResolver implements ExpressionResolver {

    private static final Logger logger =
            Logger.getLogger(DefaultExpressionResolver.class.getName());

    public static final int DEFAULT_MAX_PASSES = 10;

    private static final String NO_VALUE = "no value and no default; kept literally";
    private static final String UNSET_IN_TEXT = "unset inside a larger string; kept literally";

    private final int maxPasses;

    public DefaultExpressionResolver() {
        this(DEFAULT_MAX_PASSES);
    }

    public DefaultExpressionResolver(int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be positive");
        }
        this.maxPasses = maxPasses;
    }

    @Override
    public Object resolve(Object raw, Namespace namespace, List<ResolutionWarning> warnings)
            throws ExpressionSyntaxException {
        if (raw instanceof String text) {
            return resolveString(text, namespace, warnings);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(
                        String.valueOf(entry.getKey()),
                        resolve(entry.getValue(), namespace, warnings));
            }
            return resolved;
        }
        if (raw instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(resolve(item, namespace, warnings));
            }
            return resolved;
        }
        return raw;
    }

    @Override
    public Map<String, Object> resolveAll(
            Map<String, ?> raw, Namespace namespace, List<ResolutionWarning> warnings)
            throws ExpressionSyntaxException {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue(), namespace, warnings));
        }
        return resolved;
    }

    @Override
    public Map<String, Object> resolveParameters(
            Map<String, ?> rawParameters, Namespace namespace, List<ResolutionWarning> warnings)
            throws CircularReferenceException, ExpressionSyntaxException {
        List<String> order = ParameterGraph.of(rawParameters).resolutionOrder();

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (String name : order) {
            Namespace scoped = namespace.withParameters(resolved);
            resolved.put(name, resolve(rawParameters.get(name), scoped, warnings));
        }

        Map<String, Object> declarationOrder = new LinkedHashMap<>();
        for (String name : rawParameters.keySet()) {
            declarationOrder.put(name, resolved.get(name));
        }
        return declarationOrder;
    }

    private Object resolveString(
            String raw, Namespace namespace, List<ResolutionWarning> warnings)
            throws ExpressionSyntaxException {
        String text = raw;
        for (int pass = 0; pass < maxPasses; pass++) {
            if (!ReferenceParser.containsMarker(text)) {
                return ValueCoercer.coerce(text);
            }
            Template template = ReferenceParser.parse(text);
            if (template.isSingleMarker()) {
                Reference reference = template.references().get(0);
                Namespace.Lookup lookup = namespace.lookup(reference);
                if (!lookup.found()) {
                    warn(warnings, ResolutionWarning.unresolved(reference.text(), NO_VALUE));
                    return text;
                }
                Object value = lookup.value();
                if (value instanceof String next && !next.equals(text)) {
                    text = next;
                    continue;
                }
                return value instanceof String ? ValueCoercer.coerce(value) : value;
            }

            boolean unresolved = false;
            StringBuilder out = new StringBuilder();
            for (Template.Part part : template.parts()) {
                if (part instanceof Template.Literal literal) {
                    out.append(literal.text());
                    continue;
                }
                Reference reference = ((Template.Marker) part).reference();
                Namespace.Lookup lookup = namespace.lookup(reference);
                if (!lookup.found()) {
                    warn(warnings, ResolutionWarning.unresolved(reference.text(), NO_VALUE));
                    out.append(reference.text());
                    unresolved = true;
                } else if (Unset.isUnset(lookup.value())) {
                    warn(warnings, ResolutionWarning.unresolved(reference.text(), UNSET_IN_TEXT));
                    out.append(reference.text());
                    unresolved = true;
                } else {
                    out.append(stringify(lookup.value()));
                }
            }
            String next = out.toString();
            if (next.equals(text)) {
                return unresolved ? next : ValueCoercer.coerce(next);
            }
            text = next;
        }

        if (!ReferenceParser.containsMarker(text)) {
            return ValueCoercer.coerce(text);
        }
        warn(
                warnings,
                new ResolutionWarning(
                        ResolutionWarning.Kind.SUBSTITUTION_LIMIT,
                        raw,
                        "stopped after " + maxPasses + " passes at '" + text + "'"));
        return text;
    }

    private static void warn(List<ResolutionWarning> warnings, ResolutionWarning warning) {
        if (!warnings.contains(warning)) {
            logger.warning("Resolution warning: " + warning);
            warnings.add(warning);
        }
    }

    private static String stringify(Object value) {
        return value == null ? "" : value.toString();
    }
}
