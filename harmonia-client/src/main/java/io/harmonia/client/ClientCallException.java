package io.harmonia.client;

import java.io.Serial;

/// Raised when a request fails and no fallback answered it.
public class ClientCallException extends Exception {
    @Serial private static final long serialVersionUID = -2976019735410563221L;

    private final int attempts;

    public ClientCallException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /// @return outbound attempts made before giving up
    public int getAttempts() {
        return attempts;
    }
}
