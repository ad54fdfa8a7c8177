package com.blueprintarchitect.core.model;

import java.util.Locale;

/**
 * Whether a component keeps state between items.
 */
public enum Statefulness {
    STATELESS,
    STATEFUL;

    /**
     * Parses a document value, defaulting to {@link #STATELESS} for null or unknown input.
     *
     * @param value raw value
     * @return parsed statefulness
     */
    public static Statefulness parse(String value) {
        if (value != null && value.trim().toLowerCase(Locale.ROOT).equals("stateful")) {
            return STATEFUL;
        }
        return STATELESS;
    }
}
