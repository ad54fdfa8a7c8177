package com.blueprintarchitect.core.graph;

import java.util.List;
import java.util.Objects;

/**
 * Directed edge between two components, aggregating every binding between them.
 *
 * @param from source component name
 * @param to target component name
 * @param ports port pairs of the bindings that produced this edge
 */
public record GraphEdge(String from, String to, List<PortLink> ports) {

    public GraphEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        ports = ports == null ? List.of() : List.copyOf(ports);
    }

    /**
     * Output port to input port link carried by an edge.
     *
     * @param fromPort source output port
     * @param toPort target input port
     */
    public record PortLink(String fromPort, String toPort) {}
}
