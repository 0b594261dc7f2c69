package io.harmonia.client;

/// One outbound request to an external service.
///
/// @param <Q> request type
/// @param <R> response type
@FunctionalInterface
public interface RemoteCall<Q, R> {

    /// Performs the request.
    ///
    /// @param request the request, not null
    /// @return the response; null means the service has no answer for this request
    /// @throws Exception if the call fails; the client's classifier decides whether to retry
    R call(Q request) throws Exception;
}
