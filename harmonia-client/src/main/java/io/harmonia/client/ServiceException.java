package io.harmonia.client;

import java.io.Serial;

/// Error response from an external service, carrying its status code.
///
/// Status codes follow HTTP conventions: `5xx` and `429` are transient for
/// {@link TransientFailureClassifier#DEFAULT}; everything else is permanent.
public class ServiceException extends Exception {
    @Serial private static final long serialVersionUID = 4120958318390227145L;

    private final int statusCode;

    public ServiceException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ServiceException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode <= 599;
    }
}
