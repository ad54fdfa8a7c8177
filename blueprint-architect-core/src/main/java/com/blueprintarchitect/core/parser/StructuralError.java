package com.blueprintarchitect.core.parser;

import com.blueprintarchitect.core.model.IssueSeverity;

import java.util.Objects;

/**
 * Problem with the shape of a raw document, found before any graph analysis.
 *
 * @param path location in the document, e.g. {@code system.components[2].type}
 * @param message human-readable description
 * @param severity severity; only {@link IssueSeverity#ERROR} entries fail a parse
 */
public record StructuralError(String path, String message, IssueSeverity severity) {

    public StructuralError {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static StructuralError error(String path, String message) {
        return new StructuralError(path, message, IssueSeverity.ERROR);
    }

    public static StructuralError warning(String path, String message) {
        return new StructuralError(path, message, IssueSeverity.WARNING);
    }

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + path + ": " + message;
    }
}
