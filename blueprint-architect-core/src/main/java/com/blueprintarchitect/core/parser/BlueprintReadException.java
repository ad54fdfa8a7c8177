package com.blueprintarchitect.core.parser;

/**
 * Thrown when a blueprint file cannot be read or is not a YAML/JSON object.
 */
public class BlueprintReadException extends RuntimeException {

    public BlueprintReadException(String message) {
        super(message);
    }

    public BlueprintReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
