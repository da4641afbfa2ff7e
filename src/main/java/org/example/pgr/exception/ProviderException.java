package org.example.pgr.exception;

/**
 * Exception thrown when a version provider query fails.
 * Never retried by the resolver; retry policy belongs to the provider.
 */
public class ProviderException extends PgrException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
