package com.blueprintarchitect.core.graph;

import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.SystemBlueprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed-graph view of a blueprint used by the traversal-based checks.
 *
 * <p>Nodes are component names. There is one edge per distinct
 * {@code (from_component, to_component)} pair; fan-out bindings contribute one edge
 * per target. Degrees therefore count distinct neighbours, not bindings.
 *
 * <p>Instances are immutable once built and safe to share between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BlueprintGraph graph = BlueprintGraph.of(blueprint);
 * if (graph.outDegree("router") > 3) {
 *     // ...
 * }
 * Optional<List<String>> path = graph.shortestPathToAny("api", Set.of("orders_db"));
 * }</pre>
 */
public final class BlueprintGraph {

    private static final Logger log = LoggerFactory.getLogger(BlueprintGraph.class);

    private final Map<String, ComponentType> nodes;
    private final Map<String, Map<String, GraphEdge>> outgoing;
    private final Map<String, Set<String>> incoming;
    private final int edgeCount;

    private BlueprintGraph(Map<String, ComponentType> nodes,
                           Map<String, Map<String, GraphEdge>> outgoing,
                           Map<String, Set<String>> incoming) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.outgoing = outgoing;
        this.incoming = incoming;
        this.edgeCount = outgoing.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Builds the graph for a blueprint.
     *
     * <p>Binding targets naming unknown components are skipped; the typed parser
     * normally rejects those before a graph is built.
     *
     * @param blueprint typed blueprint
     * @return immutable graph
     */
    public static BlueprintGraph of(SystemBlueprint blueprint) {
        Map<String, ComponentType> nodes = new LinkedHashMap<>();
        for (Component component : blueprint.components()) {
            nodes.put(component.name(), component.type());
        }

        Map<String, Map<String, List<GraphEdge.PortLink>>> links = new LinkedHashMap<>();
        for (Binding binding : blueprint.bindings()) {
            if (!nodes.containsKey(binding.fromComponent())) {
                log.debug("Skipping binding from unknown component: {}", binding.fromComponent());
                continue;
            }
            for (Binding.Target target : binding.targets()) {
                if (!nodes.containsKey(target.component())) {
                    log.debug("Skipping binding target on unknown component: {}", target.component());
                    continue;
                }
                links.computeIfAbsent(binding.fromComponent(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(target.component(), k -> new ArrayList<>())
                    .add(new GraphEdge.PortLink(binding.fromPort(), target.port()));
            }
        }

        Map<String, Map<String, GraphEdge>> outgoing = new HashMap<>();
        Map<String, Set<String>> incoming = new HashMap<>();
        for (String node : nodes.keySet()) {
            Map<String, GraphEdge> edges = new LinkedHashMap<>();
            links.getOrDefault(node, Map.of()).forEach((to, ports) -> {
                edges.put(to, new GraphEdge(node, to, ports));
                incoming.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(node);
            });
            outgoing.put(node, Collections.unmodifiableMap(edges));
        }
        return new BlueprintGraph(nodes, outgoing, incoming);
    }

    /**
     * Returns node names mapped to their component type, in document order.
     *
     * @return unmodifiable node map
     */
    public Map<String, ComponentType> nodes() {
        return nodes;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean contains(String node) {
        return nodes.containsKey(node);
    }

    public Optional<ComponentType> typeOf(String node) {
        return Optional.ofNullable(nodes.get(node));
    }

    /**
     * Returns all edges in document order of their source node.
     *
     * @return edges
     */
    public List<GraphEdge> edges() {
        List<GraphEdge> edges = new ArrayList<>(edgeCount);
        for (String node : nodes.keySet()) {
            edges.addAll(outgoing.get(node).values());
        }
        return edges;
    }

    public Set<String> successors(String node) {
        return outgoing.getOrDefault(node, Map.of()).keySet();
    }

    public Set<String> predecessors(String node) {
        return incoming.getOrDefault(node, Set.of());
    }

    public Optional<GraphEdge> edge(String from, String to) {
        return Optional.ofNullable(outgoing.getOrDefault(from, Map.of()).get(to));
    }

    public int outDegree(String node) {
        return successors(node).size();
    }

    public int inDegree(String node) {
        return predecessors(node).size();
    }

    /**
     * Whether a directed path of length zero or more leads from one node to another.
     *
     * @param from start node
     * @param to end node
     * @return true if {@code to} is reachable from {@code from}
     */
    public boolean hasPath(String from, String to) {
        return shortestPathToAny(from, Set.of(to)).isPresent();
    }

    /**
     * Breadth-first search for the nearest node in {@code targets}.
     *
     * <p>The start node itself counts as reached when it is a target, which gives the
     * same-node case its constant-time answer.
     *
     * @param from start node
     * @param targets nodes that end the search
     * @return path from {@code from} to the first target found, or empty if none is reachable
     */
    public Optional<List<String>> shortestPathToAny(String from, Set<String> targets) {
        if (!nodes.containsKey(from)) {
            return Optional.empty();
        }
        if (targets.contains(from)) {
            return Optional.of(List.of(from));
        }

        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        parent.put(from, null);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors(current)) {
                if (parent.containsKey(next)) {
                    continue;
                }
                parent.put(next, current);
                if (targets.contains(next)) {
                    return Optional.of(tracePath(parent, from, next));
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns every node reachable from {@code from}, excluding {@code from} unless it lies on a cycle.
     *
     * @param from start node
     * @return reachable nodes in BFS order
     */
    public Set<String> reachableFrom(String from) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(successors(from));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (seen.add(current)) {
                queue.addAll(successors(current));
            }
        }
        return seen;
    }

    private static List<String> tracePath(Map<String, String> parent, String from, String to) {
        List<String> path = new ArrayList<>();
        String current = to;
        while (current != null) {
            path.add(current);
            current = current.equals(from) ? null : parent.get(current);
        }
        Collections.reverse(path);
        return path;
    }
}
