package io.harmonia.client;

/// Alternative source consulted after every retry of a transient failure was used up.
///
/// Fallback answers are returned to the caller but never cached.
@FunctionalInterface
public interface FallbackCall<Q, R> {

    /// @param request the request that failed, not null
    /// @param lastFailure the failure of the final attempt, not null
    /// @return the fallback response, may be null
    /// @throws Exception if the fallback itself fails
    R fallback(Q request, Throwable lastFailure) throws Exception;
}
