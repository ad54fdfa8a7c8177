package com.blueprintarchitect.core.ports;

import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.Port;
import com.blueprintarchitect.core.model.SystemBlueprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link PortInference} driven by {@link PortTemplates} and by existing bindings.
 *
 * <p>For each component, adds the template ports of its type that are missing, then
 * any port a binding references but the component does not declare (schema
 * {@value PortTemplates#ITEM_SCHEMA}). Template outputs are skipped for components
 * with {@code terminal_hint}.
 */
public class TemplatePortInference implements PortInference {

    private static final Logger log = LoggerFactory.getLogger(TemplatePortInference.class);

    @Override
    public SystemBlueprint inferPorts(SystemBlueprint blueprint) {
        Map<String, Set<String>> boundInputs = new HashMap<>();
        Map<String, Set<String>> boundOutputs = new HashMap<>();
        for (Binding binding : blueprint.bindings()) {
            boundOutputs.computeIfAbsent(binding.fromComponent(), k -> new LinkedHashSet<>()).add(binding.fromPort());
            for (Binding.Target target : binding.targets()) {
                boundInputs.computeIfAbsent(target.component(), k -> new LinkedHashSet<>()).add(target.port());
            }
        }

        int added = 0;
        List<Component> components = new ArrayList<>(blueprint.components().size());
        for (Component component : blueprint.components()) {
            List<Port> inputs = new ArrayList<>(component.inputs());
            List<Port> outputs = new ArrayList<>(component.outputs());

            added += addMissing(component, inputs, PortTemplates.inputs(component.type()), "input");
            if (!component.terminalHint()) {
                added += addMissing(component, outputs, PortTemplates.outputs(component.type()), "output");
            }
            added += addMissing(component, inputs, implied(boundInputs, component.name()), "input");
            added += addMissing(component, outputs, implied(boundOutputs, component.name()), "output");

            components.add(new Component(component.name(), component.type(), component.description(),
                inputs, outputs, component.durable(), component.terminalHint(), component.statefulness()));
        }

        if (added == 0) {
            return blueprint;
        }
        log.debug("Inferred {} ports for '{}'", added, blueprint.name());
        return new SystemBlueprint(blueprint.name(), blueprint.description(), blueprint.version(),
            blueprint.schemaVersion(), components, blueprint.bindings(), blueprint.policy(), blueprint.schemas());
    }

    private static List<Port> implied(Map<String, Set<String>> bound, String componentName) {
        List<Port> ports = new ArrayList<>();
        for (String portName : bound.getOrDefault(componentName, Set.of())) {
            ports.add(Port.of(portName, PortTemplates.ITEM_SCHEMA));
        }
        return ports;
    }

    private static int addMissing(Component component, List<Port> existing, List<Port> candidates, String direction) {
        int added = 0;
        for (Port candidate : candidates) {
            boolean present = existing.stream().anyMatch(p -> p.name().equals(candidate.name()));
            if (!present) {
                existing.add(candidate);
                added++;
                log.debug("Added {} port {}.{} ({})", direction, component.name(), candidate.name(), candidate.schemaId());
            }
        }
        return added;
    }
}
