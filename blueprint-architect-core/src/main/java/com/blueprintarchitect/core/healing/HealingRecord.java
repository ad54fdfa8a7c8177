package com.blueprintarchitect.core.healing;

import java.util.List;
import java.util.Objects;

/**
 * Operations applied by one healing pass, in application order.
 *
 * <p>Operation strings are deterministic for a given input, so two passes that did the
 * same thing produce equal records. Stagnation detection relies on that.
 *
 * @param phase phase that produced the record
 * @param operations human-readable operation descriptions
 */
public record HealingRecord(HealingPhase phase, List<String> operations) {

    public HealingRecord {
        Objects.requireNonNull(phase, "phase must not be null");
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
