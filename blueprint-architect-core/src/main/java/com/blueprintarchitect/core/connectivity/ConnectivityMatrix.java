package com.blueprintarchitect.core.connectivity;

import com.blueprintarchitect.core.model.ComponentType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-type table of legal bindings.
 *
 * <p>A binding from type A to type B is legal only if B is in A's
 * {@code can_connect_to} <em>and</em> A is in B's {@code can_receive_from}. A rule
 * stated on one side only is treated as disallowed; {@link #symmetryViolations()}
 * reports such one-sided entries.
 *
 * <p>The matrix holds no run state. Load it once with {@link ConnectivityMatrixLoader}
 * and pass the same instance to every validator and healer.
 */
public final class ConnectivityMatrix {

    private final Map<ComponentType, ConnectivityRule> rules;

    /**
     * Creates a matrix from a complete rule set.
     *
     * @param rules one rule per component type
     * @throws MatrixLoadException if a component type has no rule
     */
    public ConnectivityMatrix(Map<ComponentType, ConnectivityRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        EnumMap<ComponentType, ConnectivityRule> copy = new EnumMap<>(ComponentType.class);
        copy.putAll(rules);
        for (ComponentType type : ComponentType.values()) {
            ConnectivityRule rule = copy.get(type);
            if (rule == null) {
                throw new MatrixLoadException("No connectivity rule for component type " + type.blueprintName());
            }
            if (rule.type() != type) {
                throw new MatrixLoadException("Rule registered under " + type.blueprintName()
                    + " describes " + rule.type().blueprintName());
            }
        }
        this.rules = copy;
    }

    public ConnectivityRule ruleFor(ComponentType type) {
        return rules.get(type);
    }

    /**
     * Whether a binding from {@code from} to {@code to} is legal in both directions.
     *
     * @param from source component type
     * @param to target component type
     * @return true if both rules agree
     */
    public boolean allows(ComponentType from, ComponentType to) {
        return rules.get(from).canConnectTo().contains(to)
            && rules.get(to).canReceiveFrom().contains(from);
    }

    /**
     * Returns the types {@code from} may legally bind to.
     *
     * @param from source component type
     * @return legal targets in declaration order of {@link ComponentType}
     */
    public Set<ComponentType> allowedTargets(ComponentType from) {
        Set<ComponentType> targets = EnumSet.noneOf(ComponentType.class);
        for (ComponentType to : ComponentType.values()) {
            if (allows(from, to)) {
                targets.add(to);
            }
        }
        return targets;
    }

    /**
     * Lists one-sided entries: A sends to B but B does not receive from A, or the reverse.
     *
     * @return human-readable violations, empty when the matrix is symmetric
     */
    public List<String> symmetryViolations() {
        List<String> violations = new ArrayList<>();
        for (ComponentType a : ComponentType.values()) {
            for (ComponentType b : ComponentType.values()) {
                boolean sends = rules.get(a).canConnectTo().contains(b);
                boolean receives = rules.get(b).canReceiveFrom().contains(a);
                if (sends && !receives) {
                    violations.add(a.blueprintName() + " can connect to " + b.blueprintName()
                        + " but " + b.blueprintName() + " cannot receive from " + a.blueprintName());
                } else if (receives && !sends) {
                    violations.add(b.blueprintName() + " can receive from " + a.blueprintName()
                        + " but " + a.blueprintName() + " cannot connect to " + b.blueprintName());
                }
            }
        }
        return violations;
    }

    /**
     * Lists source types that receive input and terminal types that send output.
     *
     * @return human-readable violations, empty when every rule has a consistent shape
     */
    public List<String> shapeViolations() {
        List<String> violations = new ArrayList<>();
        for (ConnectivityRule rule : rules.values()) {
            String name = rule.type().blueprintName();
            if (rule.source() && !rule.canReceiveFrom().isEmpty()) {
                violations.add(name + " is a source but can receive from " + rule.canReceiveFrom().size() + " types");
            }
            if (rule.terminal() && !rule.canConnectTo().isEmpty()) {
                violations.add(name + " is terminal but can connect to " + rule.canConnectTo().size() + " types");
            }
            if (rule.source() && rule.terminal()) {
                violations.add(name + " cannot be both source and terminal");
            }
        }
        return violations;
    }

    public boolean isConsistent() {
        return symmetryViolations().isEmpty() && shapeViolations().isEmpty();
    }
}
