package io.harmonia.client;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/// Decides whether a failed call is worth retrying.
@FunctionalInterface
public interface TransientFailureClassifier {

    /// Timeouts, I/O errors and {@link ServiceException}s with a `5xx` or `429` status,
    /// anywhere in the cause chain.
    TransientFailureClassifier DEFAULT =
            failure -> {
                for (Throwable t = failure; t != null; t = t.getCause()) {
                    if (t instanceof TimeoutException
                            || t instanceof IOException
                            || t instanceof UncheckedIOException) {
                        return true;
                    }
                    if (t instanceof ServiceException service) {
                        return service.isServerError() || service.getStatusCode() == 429;
                    }
                }
                return false;
            };

    boolean isTransient(Throwable failure);
}
