package org.example.pgr.exception;

/**
 * Exception thrown when a package manifest is missing or cannot be read.
 */
public class ManifestException extends PgrException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
