package com.blueprintarchitect.core.healing;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Healed copy of a raw document plus the record of what changed.
 *
 * @param document healed document; the input document is left untouched
 * @param record operations applied
 */
public record HealingResult(ObjectNode document, HealingRecord record) {

    public HealingResult {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(record, "record must not be null");
    }
}
