package com.blueprintarchitect.core.connectivity;

import com.blueprintarchitect.core.model.ComponentType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Connectivity rule for one component type.
 *
 * @param type the type this rule describes
 * @param canConnectTo types this type may send to
 * @param canReceiveFrom types this type may receive from
 * @param expectedInputs typical number of input ports
 * @param expectedOutputs typical number of output ports
 * @param terminal whether the type ends a data flow
 * @param source whether the type originates data
 */
public record ConnectivityRule(
    ComponentType type,
    Set<ComponentType> canConnectTo,
    Set<ComponentType> canReceiveFrom,
    int expectedInputs,
    int expectedOutputs,
    boolean terminal,
    boolean source
) {
    /**
     * Compact constructor with validation.
     */
    public ConnectivityRule {
        Objects.requireNonNull(type, "type must not be null");
        canConnectTo = frozen(canConnectTo);
        canReceiveFrom = frozen(canReceiveFrom);
        if (expectedInputs < 0 || expectedOutputs < 0) {
            throw new IllegalArgumentException("expected port counts must not be negative for " + type);
        }
    }

    private static Set<ComponentType> frozen(Set<ComponentType> types) {
        if (types == null || types.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(types));
    }
}
