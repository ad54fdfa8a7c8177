package com.blueprintarchitect.core.model;

import java.util.Objects;

/**
 * Named input or output of a component.
 *
 * <p>Boundary flags describe where externally triggered data enters
 * ({@code boundaryIngress}) or becomes externally visible ({@code boundaryEgress}).
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Port request = new Port("request", "OrderRequest", true, true, false, true, false, null);
 * }</pre>
 *
 * @param name port name, unique per direction within a component
 * @param schemaId declared type label of the data flowing through the port
 * @param required whether the port must be connected
 * @param boundaryIngress whether externally triggered data enters here
 * @param boundaryEgress whether data leaving here is externally visible
 * @param replyRequired whether the caller expects a reply for data entering here
 * @param satisfiesReply whether data leaving here answers a pending reply
 * @param dataClassification optional classification label (e.g. {@code pii})
 */
public record Port(
    String name,
    String schemaId,
    boolean required,
    boolean boundaryIngress,
    boolean boundaryEgress,
    boolean replyRequired,
    boolean satisfiesReply,
    String dataClassification
) {
    /**
     * Compact constructor with validation.
     */
    public Port {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schemaId, "schemaId must not be null");
    }

    /**
     * Creates a plain required port with no boundary semantics.
     *
     * @param name port name
     * @param schemaId schema label
     * @return new port
     */
    public static Port of(String name, String schemaId) {
        return new Port(name, schemaId, true, false, false, false, false, null);
    }

    /**
     * Whether any boundary flag is set on this port.
     *
     * @return true if the port participates in boundary-termination analysis
     */
    public boolean hasBoundarySemantics() {
        return boundaryIngress || boundaryEgress || replyRequired || satisfiesReply;
    }
}
