package com.blueprintarchitect.core.healing;

import com.blueprintarchitect.core.parser.BlueprintDocuments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NameNormalizer}.
 */
class NameNormalizerTest {

    private final NameNormalizer normalizer = new NameNormalizer();

    @ParameterizedTest
    @CsvSource({
        "OrderIngest, order_ingest",
        "HTTPServer, http_server",
        "OrderDB, order_db",
        "Broken-System, broken_system",
        "order service, order_service",
        "__edge__, edge",
        "2fast, component_2fast",
        "already_fine, already_fine"
    })
    void toSnakeCase_convertsToPattern(String input, String expected) {
        assertThat(NameNormalizer.toSnakeCase(input)).isEqualTo(expected);
    }

    @Test
    void toSnakeCase_nothingLeft_usesFallback() {
        assertThat(NameNormalizer.toSnakeCase("---")).isEqualTo(NameNormalizer.FALLBACK_NAME);
    }

    @Test
    void normalize_renamedComponentsAndPorts_areFollowedInBindings() {
        ObjectNode system = system("""
            name: OrderSystem
            components:
              - name: OrderIngest
                type: Source
                outputs:
                  - name: RawOut
              - name: OrderDB
                type: Store
                inputs:
                  - name: InPort
            bindings:
              - from_component: OrderIngest
                from_port: RawOut
                to_components: [OrderDB]
                to_ports: [InPort]
            """);

        List<String> operations = normalizer.normalize(system);

        JsonNode binding = system.path("bindings").get(0);
        assertThat(system.path("name").asText()).isEqualTo("order_system");
        assertThat(binding.path("from_component").asText()).isEqualTo("order_ingest");
        assertThat(binding.path("from_port").asText()).isEqualTo("raw_out");
        assertThat(binding.path("to_components").get(0).asText()).isEqualTo("order_db");
        assertThat(binding.path("to_ports").get(0).asText()).isEqualTo("in_port");
        assertThat(operations).containsExactly(
            "Normalized system name OrderSystem -> order_system",
            "Normalized component name OrderIngest -> order_ingest",
            "Normalized port name order_ingest.RawOut -> order_ingest.raw_out",
            "Normalized component name OrderDB -> order_db",
            "Normalized port name order_db.InPort -> order_db.in_port");
    }

    @Test
    void normalize_collidingName_getsNumericSuffix() {
        ObjectNode system = system("""
            name: shop
            components:
              - name: order_db
                type: Store
              - name: OrderDB
                type: Store
              - name: ingest
                type: Source
            bindings:
              - from_component: ingest
                from_port: output
                to_components: [order_db, OrderDB]
                to_ports: [input, input]
            """);

        normalizer.normalize(system);

        assertThat(system.path("components").get(0).path("name").asText()).isEqualTo("order_db");
        assertThat(system.path("components").get(1).path("name").asText()).isEqualTo("order_db_2");
        JsonNode targets = system.path("bindings").get(0).path("to_components");
        assertThat(targets.get(0).asText()).isEqualTo("order_db");
        assertThat(targets.get(1).asText()).isEqualTo("order_db_2");
    }

    @Test
    void normalize_secondRun_changesNothing() {
        ObjectNode system = system("""
            name: ClickCapture
            components:
              - name: ClickStream
                type: Source
            """);

        assertThat(normalizer.normalize(system)).hasSize(2);
        assertThat(normalizer.normalize(system)).isEmpty();
    }

    private static ObjectNode system(String yaml) {
        return BlueprintDocuments.parse(yaml);
    }
}
