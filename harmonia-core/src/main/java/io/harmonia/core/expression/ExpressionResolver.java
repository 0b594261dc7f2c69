package io.harmonia.core.expression;

import io.harmonia.core.context.ResolutionWarning;
import io.harmonia.core.exception.CircularReferenceException;
import io.harmonia.core.exception.ExpressionSyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Resolves `${scope.path[index].attr}` references against a {@link Namespace}.
///
/// ### Value rules
/// - Strings without markers are type-coerced (see {@link ValueCoercer}).
/// - A string that is exactly one marker resolves to the referenced value with its
///   type intact. A string with text around markers resolves to a concatenated string.
/// - Maps and lists are resolved element by element; map keys are never resolved.
/// - Other values are returned unchanged and never coerced.
/// - Unresolvable markers are kept literally and reported as warnings.
///
/// @see DefaultExpressionResolver
public interface ExpressionResolver {

    /// Resolves a raw value.
    ///
    /// @param raw the authored value, may be null
    /// @param namespace lookup scopes, not null
    /// @param warnings receives non-fatal resolution problems, not null
    /// @return the resolved value; may be null or {@link Unset#INSTANCE}
    /// @throws ExpressionSyntaxException if a marker is malformed
    Object resolve(Object raw, Namespace namespace, List<ResolutionWarning> warnings)
            throws ExpressionSyntaxException;

    /// Resolves a raw value, logging and discarding warnings.
    default Object resolve(Object raw, Namespace namespace) throws ExpressionSyntaxException {
        return resolve(raw, namespace, new ArrayList<>());
    }

    /// Resolves every value of a map.
    ///
    /// @return a new map in the same key order, never null
    Map<String, Object> resolveAll(
            Map<String, ?> raw, Namespace namespace, List<ResolutionWarning> warnings)
            throws ExpressionSyntaxException;

    /// Resolves a pipeline's top-level parameter block in dependency order.
    ///
    /// While a parameter is resolved, the `parameters` scope holds only the
    /// parameters already resolved before it.
    ///
    /// @param rawParameters the authored parameters, not null
    /// @param namespace base scopes (env, metadata, builtin), not null
    /// @param warnings receives non-fatal resolution problems, not null
    /// @return resolved parameters in declaration order, never null
    /// @throws CircularReferenceException if parameters reference each other in a cycle
    /// @throws ExpressionSyntaxException if a marker is malformed
    Map<String, Object> resolveParameters(
            Map<String, ?> rawParameters, Namespace namespace, List<ResolutionWarning> warnings)
            throws CircularReferenceException, ExpressionSyntaxException;
}
