package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.graph.BlueprintGraph;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentRole;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.Port;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Every externally triggered entry point must reach a durable or externally visible
 * commitment point.
 *
 * <p>Ingress points are ports flagged {@code boundary_ingress}. Commitment points are
 * components that are durable or expose a {@code boundary_egress} or
 * {@code satisfies_reply} output. An ingress passes when its own component is a
 * commitment point, otherwise a breadth-first search over the bindings must reach one.
 *
 * <p>When no port in the document carries boundary flags, a coarse fallback applies:
 * an endpoint together with a store or controller passes, anything else is a warning.
 */
public class BoundaryTerminationCheck implements ValidationCheck {

    private static final Logger log = LoggerFactory.getLogger(BoundaryTerminationCheck.class);

    public static final String NO_REACHABLE_COMMITMENT = "no_reachable_commitment";
    public static final String MISSING_REPLY = "missing_reply";
    public static final String NO_BOUNDARY_SEMANTICS = "no_boundary_semantics";

    @Override
    public String getId() {
        return "boundary-termination";
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        SystemBlueprint blueprint = context.blueprint();
        if (blueprint.components().stream().noneMatch(Component::hasBoundarySemantics)) {
            return fallback(blueprint);
        }

        Set<String> commitments = new LinkedHashSet<>();
        for (Component component : blueprint.components()) {
            if (component.isCommitmentPoint()) {
                commitments.add(component.name());
            }
        }

        BlueprintGraph graph = context.graph();
        List<ValidationIssue> issues = new ArrayList<>();

        for (Component component : blueprint.components()) {
            List<Port> ingress = Stream.concat(component.inputs().stream(), component.outputs().stream())
                .filter(Port::boundaryIngress)
                .toList();
            if (ingress.isEmpty()) {
                continue;
            }

            if (!commitments.contains(component.name())) {
                Optional<List<String>> path = graph.shortestPathToAny(component.name(), commitments);
                if (path.isPresent()) {
                    log.debug("Ingress on '{}' reaches commitment via {}", component.name(), path.get());
                } else {
                    issues.add(unreachable(component, ingress, graph, commitments));
                }
            }

            boolean hasEgress = component.outputs().stream().anyMatch(Port::boundaryEgress);
            for (Port port : ingress) {
                if (port.replyRequired() && !hasEgress) {
                    issues.add(ValidationIssue.error(IssueKind.BOUNDARY_TERMINATION, MISSING_REPLY,
                            String.format("Ingress port '%s.%s' requires a reply but '%s' has no boundary_egress output",
                                component.name(), port.name(), component.name()))
                        .withComponent(component.name())
                        .withSuggestion("Add an output with boundary_egress: true to '" + component.name() + "'"));
                }
            }
        }
        return issues;
    }

    private ValidationIssue unreachable(Component component, List<Port> ingress, BlueprintGraph graph,
                                        Set<String> commitments) {
        // the search failed, so nothing reachable is a commitment point
        Set<String> explored = graph.reachableFrom(component.name());
        String ports = String.join(", ", ingress.stream().map(Port::name).toList());
        String message = String.format(
            "Ingress on '%s' (%s) reaches no durable or boundary_egress component; explored: %s",
            component.name(), ports, explored.isEmpty() ? "nothing" : String.join(", ", explored));
        String suggestion = commitments.isEmpty()
            ? "Add a durable Store or an output with boundary_egress: true"
            : "Bind '" + component.name() + "' towards one of: " + String.join(", ", commitments);
        return ValidationIssue.error(IssueKind.BOUNDARY_TERMINATION, NO_REACHABLE_COMMITMENT, message)
            .withComponent(component.name())
            .withSuggestion(suggestion);
    }

    private List<ValidationIssue> fallback(SystemBlueprint blueprint) {
        boolean endpoint = blueprint.hasComponentOfType(ComponentType.API_ENDPOINT);
        boolean commitment = blueprint.hasRole(ComponentRole.STORAGE) || blueprint.hasRole(ComponentRole.ORCHESTRATOR);
        if (endpoint && commitment) {
            log.info("No boundary flags in '{}'; endpoint and persistence/orchestration present, passing",
                blueprint.name());
            return List.of();
        }
        return List.of(ValidationIssue.warning(IssueKind.BOUNDARY_TERMINATION, NO_BOUNDARY_SEMANTICS,
                "No boundary semantics found: no port declares boundary_ingress or boundary_egress")
            .withSuggestion("Mark entry ports with boundary_ingress and externally visible outputs with boundary_egress"));
    }
}
