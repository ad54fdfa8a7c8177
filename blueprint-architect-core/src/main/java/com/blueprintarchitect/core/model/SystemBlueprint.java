package com.blueprintarchitect.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed blueprint document: components plus the bindings between them.
 *
 * <p>Instances are rebuilt from the raw document on every parse and never mutated;
 * healing edits the raw document and re-parses it.
 *
 * @param name system name (snake_case)
 * @param description optional free-text description
 * @param version optional system version
 * @param schemaVersion blueprint format version marker
 * @param components components, unique by name
 * @param bindings bindings between component ports
 * @param policy optional policy side table
 * @param schemas optional schema side table
 */
public record SystemBlueprint(
    String name,
    String description,
    String version,
    String schemaVersion,
    List<Component> components,
    List<Binding> bindings,
    Map<String, Object> policy,
    Map<String, Object> schemas
) {
    /**
     * Compact constructor with validation.
     */
    public SystemBlueprint {
        Objects.requireNonNull(name, "name must not be null");
        components = components == null ? List.of() : List.copyOf(components);
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
        policy = policy == null ? Map.of() : Map.copyOf(policy);
        schemas = schemas == null ? Map.of() : Map.copyOf(schemas);
        long distinct = components.stream().map(Component::name).distinct().count();
        if (distinct != components.size()) {
            throw new IllegalArgumentException("component names must be unique in " + name);
        }
    }

    public Optional<Component> component(String componentName) {
        return components.stream().filter(c -> c.name().equals(componentName)).findFirst();
    }

    /**
     * Returns components of the given type in document order.
     *
     * @param type component type
     * @return matching components
     */
    public List<Component> componentsOfType(ComponentType type) {
        return components.stream().filter(c -> c.type() == type).toList();
    }

    public boolean hasComponentOfType(ComponentType type) {
        return components.stream().anyMatch(c -> c.type() == type);
    }

    /**
     * Whether any component carries a role.
     *
     * @param role role to look for
     * @return true if present
     */
    public boolean hasRole(ComponentRole role) {
        return components.stream().anyMatch(c -> c.type().role() == role);
    }

    /**
     * Bindings whose source is the given component.
     *
     * @param componentName source component name
     * @return outgoing bindings
     */
    public List<Binding> bindingsFrom(String componentName) {
        return bindings.stream().filter(b -> b.fromComponent().equals(componentName)).toList();
    }
}
