package com.blueprintarchitect.core.validation;

import java.util.Locale;

/**
 * Coarse topology classes recognised by the pattern check.
 */
public enum ArchitecturalPattern {
    /** Edge count close to node count */
    PIPELINE,

    /** Contains an externally facing endpoint */
    REQUEST_RESPONSE,

    /** Some node sends to many peers */
    FAN_OUT,

    /** Some node receives from many peers */
    FAN_IN,

    UNKNOWN;

    public String reportName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
