package org.example.pgr.exception;

/**
 * Base exception for all package graph resolver errors.
 */
public class PgrException extends Exception {

    public PgrException(String message) {
        super(message);
    }

    public PgrException(String message, Throwable cause) {
        super(message, cause);
    }
}
