package com.blueprintarchitect.core.connectivity;

/**
 * Thrown when a connectivity matrix cannot be read or is incomplete.
 */
public class MatrixLoadException extends RuntimeException {

    public MatrixLoadException(String message) {
        super(message);
    }

    public MatrixLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
