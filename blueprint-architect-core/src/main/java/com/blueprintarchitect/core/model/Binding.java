package com.blueprintarchitect.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Directed data connection from one output port to one or more input ports.
 *
 * <p>{@code toComponents} and {@code toPorts} are parallel arrays: the i-th target
 * component receives on the i-th port.
 *
 * @param fromComponent source component name
 * @param fromPort source output port name
 * @param toComponents target component names
 * @param toPorts target input port names
 * @param transformation optional transformation label applied on the way
 * @param condition optional routing condition
 */
public record Binding(
    String fromComponent,
    String fromPort,
    List<String> toComponents,
    List<String> toPorts,
    String transformation,
    String condition
) {
    /**
     * Compact constructor with validation.
     */
    public Binding {
        Objects.requireNonNull(fromComponent, "fromComponent must not be null");
        Objects.requireNonNull(fromPort, "fromPort must not be null");
        toComponents = toComponents == null ? List.of() : List.copyOf(toComponents);
        toPorts = toPorts == null ? List.of() : List.copyOf(toPorts);
        if (toComponents.size() != toPorts.size()) {
            throw new IllegalArgumentException(
                "to_components and to_ports must have equal length: "
                    + toComponents.size() + " != " + toPorts.size());
        }
        if (toComponents.isEmpty()) {
            throw new IllegalArgumentException("binding from " + fromComponent + " has no targets");
        }
    }

    /**
     * Creates a single-target binding.
     *
     * @param fromComponent source component
     * @param fromPort source port
     * @param toComponent target component
     * @param toPort target port
     * @return new binding
     */
    public static Binding of(String fromComponent, String fromPort, String toComponent, String toPort) {
        return new Binding(fromComponent, fromPort, List.of(toComponent), List.of(toPort), null, null);
    }

    /**
     * Expands the fan-out into individual targets.
     *
     * @return one entry per target component
     */
    public List<Target> targets() {
        List<Target> targets = new ArrayList<>(toComponents.size());
        for (int i = 0; i < toComponents.size(); i++) {
            targets.add(new Target(toComponents.get(i), toPorts.get(i)));
        }
        return targets;
    }

    public boolean hasTransformation() {
        return transformation != null && !transformation.isBlank();
    }

    /**
     * Human-readable form, e.g. {@code api.response -> store.input, sink.input}.
     *
     * @return description for messages
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(fromComponent).append('.').append(fromPort).append(" -> ");
        List<Target> targets = targets();
        for (int i = 0; i < targets.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(targets.get(i).component()).append('.').append(targets.get(i).port());
        }
        return sb.toString();
    }

    /**
     * One target of a binding.
     *
     * @param component target component name
     * @param port target input port name
     */
    public record Target(String component, String port) {
        public Target {
            Objects.requireNonNull(component, "component must not be null");
            Objects.requireNonNull(port, "port must not be null");
        }
    }
}
