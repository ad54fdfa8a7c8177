package com.blueprintarchitect.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BindingShapes}.
 */
class BindingShapesTest {

    @Test
    void canonicalize_dottedLegacyForm_splitsComponentAndPort() {
        ObjectNode canonical = canonicalize("""
            from: ingest.events
            to: enrich.stream
            """);

        assertThat(canonical.get("from_component").asText()).isEqualTo("ingest");
        assertThat(canonical.get("from_port").asText()).isEqualTo("events");
        assertThat(canonical.get("to_components").get(0).asText()).isEqualTo("enrich");
        assertThat(canonical.get("to_ports").get(0).asText()).isEqualTo("stream");
        assertThat(BindingShapes.isCanonical(canonical)).isTrue();
    }

    @Test
    void canonicalize_dottedWithoutPorts_usesDefaultPortNames() {
        ObjectNode canonical = canonicalize("""
            from: ingest
            to: [enrich, archive.in]
            """);

        assertThat(canonical.get("from_port").asText()).isEqualTo("output");
        assertThat(canonical.get("to_components")).extracting(JsonNode::asText).containsExactly("enrich", "archive");
        assertThat(canonical.get("to_ports")).extracting(JsonNode::asText).containsExactly("input", "in");
    }

    @Test
    void canonicalize_singularTarget_becomesOneElementArrays() {
        ObjectNode canonical = canonicalize("""
            from_component: ingest
            from_port: output
            to_component: store
            to_port: input
            condition: "size > 0"
            """);

        assertThat(canonical.get("to_components")).hasSize(1);
        assertThat(canonical.get("to_ports").get(0).asText()).isEqualTo("input");
        assertThat(canonical.get("condition").asText()).isEqualTo("size > 0");
        assertThat(canonical.has("to_component")).isFalse();
    }

    @Test
    void canonicalize_pluralWithoutPorts_defaultsEveryPort() {
        ObjectNode canonical = canonicalize("""
            from_component: router
            to_components: [a, b, c]
            """);

        assertThat(canonical.get("to_ports")).extracting(JsonNode::asText).containsExactly("input", "input", "input");
    }

    @Test
    void canonicalize_mismatchedPluralArrays_keepsLengthsForCaller() {
        ObjectNode canonical = canonicalize("""
            from_component: router
            from_port: output
            to_components: [a, b]
            to_ports: [input]
            """);

        assertThat(canonical.get("to_components")).hasSize(2);
        assertThat(canonical.get("to_ports")).hasSize(1);
        assertThat(BindingShapes.isCanonical(canonical)).isFalse();
    }

    @Test
    void canonicalize_noSourceOrNoTarget_returnsEmpty() {
        assertThat(BindingShapes.canonicalize(BlueprintDocuments.parse("to: store"))).isEmpty();
        assertThat(BindingShapes.canonicalize(BlueprintDocuments.parse("from: ingest"))).isEmpty();
        assertThat(BindingShapes.canonicalize(null)).isEmpty();
    }

    @Test
    void isCanonical_legacyKeysPresent_isFalse() {
        assertThat(BindingShapes.isCanonical(BlueprintDocuments.parse("""
            from_component: a
            from_port: output
            to_components: [b]
            to_ports: [input]
            to: b
            """))).isFalse();
    }

    private static ObjectNode canonicalize(String yaml) {
        return BindingShapes.canonicalize(BlueprintDocuments.parse(yaml)).orElseThrow();
    }
}
