package com.blueprintarchitect.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed processing component of a blueprint.
 *
 * @param name unique name within the blueprint
 * @param type component type
 * @param description optional free-text description
 * @param inputs input ports
 * @param outputs output ports
 * @param durable whether the component persists what it receives
 * @param terminalHint author assertion that nothing flows out of this component
 * @param statefulness statefulness
 */
public record Component(
    String name,
    ComponentType type,
    String description,
    List<Port> inputs,
    List<Port> outputs,
    boolean durable,
    boolean terminalHint,
    Statefulness statefulness
) {
    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        if (statefulness == null) {
            statefulness = Statefulness.STATELESS;
        }
    }

    /**
     * Creates a component with type defaults and no ports.
     *
     * @param name component name
     * @param type component type
     * @return new component
     */
    public static Component of(String name, ComponentType type) {
        return new Component(name, type, null, List.of(), List.of(),
            type.durableByDefault(), false, Statefulness.STATELESS);
    }

    public Optional<Port> input(String portName) {
        return inputs.stream().filter(p -> p.name().equals(portName)).findFirst();
    }

    public Optional<Port> output(String portName) {
        return outputs.stream().filter(p -> p.name().equals(portName)).findFirst();
    }

    /**
     * Whether any port of this component carries boundary flags.
     *
     * @return true if at least one input or output has boundary semantics
     */
    public boolean hasBoundarySemantics() {
        return inputs.stream().anyMatch(Port::hasBoundarySemantics)
            || outputs.stream().anyMatch(Port::hasBoundarySemantics);
    }

    /**
     * Whether this component finalizes data it receives.
     *
     * <p>A commitment point is durable, or exposes an egress or reply-satisfying output.
     *
     * @return true if the component is a commitment point
     */
    public boolean isCommitmentPoint() {
        return durable || outputs.stream().anyMatch(p -> p.boundaryEgress() || p.satisfiesReply());
    }
}
