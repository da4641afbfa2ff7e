package org.example.pgr.exception;

/**
 * Exception thrown when a lockfile cannot be read or written.
 */
public class LockfileException extends PgrException {

    public LockfileException(String message) {
        super(message);
    }

    public LockfileException(String message, Throwable cause) {
        super(message, cause);
    }
}
