package com.blueprintarchitect.core.healing;

import com.blueprintarchitect.core.config.EngineConfig.SchemaSettings;
import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.parser.BlueprintDocuments;
import com.blueprintarchitect.core.parser.DefaultBlueprintParser;
import com.blueprintarchitect.core.parser.ParseResult;
import com.blueprintarchitect.core.schema.SchemaCompatibility;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.blueprintarchitect.core.BlueprintFixtures.MATRIX;
import static com.blueprintarchitect.core.BlueprintFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BlueprintHealer}.
 */
class BlueprintHealerTest {

    private static final String MIXED_SYSTEM = """
        schema_version: "1.0.0"
        system:
          name: mixed
          components:
            - name: events
              type: EventSource
            - name: api
              type: APIEndpoint
            - name: ctrl
              type: Controller
            - name: enrich
              type: Transformer
            - name: db
              type: Store
        """;

    private BlueprintHealer healer;
    private HealingSession session;
    private final DefaultBlueprintParser parser = new DefaultBlueprintParser();

    @BeforeEach
    void setUp() {
        healer = new BlueprintHealer(MATRIX);
        session = HealingSession.start();
    }

    @Test
    void heal_sourceAndStore_insertsSingleBinding() {
        HealingResult result = healer.heal(document("source-and-store.yaml"), HealingPhase.STRUCTURAL, session);

        SystemBlueprint blueprint = parse(result.document());
        assertThat(blueprint.bindings()).containsExactly(Binding.of("clicks", "output", "click_db", "input"));
        assertThat(result.record().operations()).contains("Generated binding clicks.output -> click_db.input");
        assertThat(result.record().phase()).isEqualTo(HealingPhase.STRUCTURAL);
    }

    @Test
    void heal_doesNotModifyInputDocument() {
        ObjectNode original = document("source-and-store.yaml");
        ObjectNode snapshot = original.deepCopy();

        healer.heal(original, HealingPhase.STRUCTURAL, session);

        assertThat(original).isEqualTo(snapshot);
    }

    @Test
    void heal_everyGeneratedBindingIsAllowedByMatrix() {
        HealingResult result = healer.heal(BlueprintDocuments.parse(MIXED_SYSTEM), HealingPhase.STRUCTURAL, session);

        SystemBlueprint blueprint = parse(result.document());
        assertThat(blueprint.bindings()).hasSize(5);
        for (Binding binding : blueprint.bindings()) {
            ComponentType from = blueprint.component(binding.fromComponent()).orElseThrow().type();
            for (Binding.Target target : binding.targets()) {
                ComponentType to = blueprint.component(target.component()).orElseThrow().type();
                assertThat(MATRIX.allows(from, to)).as(binding.describe()).isTrue();
            }
        }
        assertThat(session.rejectedPairs()).contains(
            new HealingSession.ComponentPair("ctrl", "events"),
            new HealingSession.ComponentPair("db", "api"));
    }

    @Test
    void heal_controllerBindsToTwoPeers() {
        HealingResult result = healer.heal(BlueprintDocuments.parse(MIXED_SYSTEM), HealingPhase.STRUCTURAL, session);

        assertThat(parse(result.document()).bindingsFrom("ctrl"))
            .flatExtracting(Binding::toComponents)
            .containsExactly("api", "enrich");
    }

    @Test
    void heal_repeatedPasses_neverDuplicatePairs() {
        ObjectNode working = BlueprintDocuments.parse(MIXED_SYSTEM);
        for (int i = 0; i < 3; i++) {
            working = healer.heal(working, HealingPhase.STRUCTURAL, session).document();
        }

        List<Binding> bindings = parse(working).bindings();
        Set<String> pairs = new HashSet<>();
        for (Binding binding : bindings) {
            for (Binding.Target target : binding.targets()) {
                assertThat(pairs.add(binding.fromComponent() + "->" + target.component()))
                    .as("duplicate pair %s -> %s", binding.fromComponent(), target.component())
                    .isTrue();
            }
        }
        assertThat(healer.heal(working, HealingPhase.STRUCTURAL, session).record().isEmpty()).isTrue();
    }

    @Test
    void heal_noTerminalWithProcessor_addsUniquelyNamedStore() {
        HealingResult result = healer.heal(BlueprintDocuments.parse("""
            schema_version: "1.0.0"
            system:
              name: no_terminal
              components:
                - name: src
                  type: Source
                - name: primary_store
                  type: Transformer
            """), HealingPhase.STRUCTURAL, session);

        SystemBlueprint blueprint = parse(result.document());
        assertThat(blueprint.component("primary_store_2"))
            .hasValueSatisfying(c -> assertThat(c.type()).isEqualTo(ComponentType.STORE));
        assertThat(result.record().operations()).contains("Added terminal component primary_store_2 (Store)");
        assertThat(blueprint.bindingsFrom("src")).hasSize(1);
        assertThat(blueprint.bindingsFrom("primary_store"))
            .singleElement()
            .satisfies(b -> assertThat(b.targets().get(0).component()).isEqualTo("primary_store_2"));
    }

    @Test
    void heal_camelCaseNames_renamesBeforeProposingBindings() {
        HealingResult result = healer.heal(BlueprintDocuments.parse("""
            schema_version: "1.0.0"
            system:
              name: ClickCapture
              components:
                - name: ClickStream
                  type: Source
                - name: ClickDB
                  type: Store
            """), HealingPhase.STRUCTURAL, session);

        SystemBlueprint blueprint = parse(result.document());
        assertThat(blueprint.name()).isEqualTo("click_capture");
        assertThat(blueprint.bindingsFrom("click_stream")).singleElement()
            .satisfies(b -> assertThat(b.toComponents()).containsExactly("click_db"));
    }

    @Test
    void heal_onlyOrigins_addsSinkAndConnectsThem() {
        HealingResult result = healer.heal(BlueprintDocuments.parse("""
            schema_version: "1.0.0"
            system:
              name: lonely
              components:
                - name: ticker
                  type: EventSource
            """), HealingPhase.STRUCTURAL, session);

        SystemBlueprint blueprint = parse(result.document());
        assertThat(blueprint.component("data_sink"))
            .hasValueSatisfying(c -> assertThat(c.type()).isEqualTo(ComponentType.SINK));
        assertThat(blueprint.bindings()).containsExactly(Binding.of("ticker", "events", "data_sink", "input"));
    }

    @Test
    void heal_legacyDocument_isRepairedIntoParsableShape() {
        HealingResult result = healer.heal(document("legacy-shapes.yaml"), HealingPhase.STRUCTURAL, session);
        ObjectNode healed = result.document();

        assertThat(healed.get("schema_version").asText()).isEqualTo("1.0.0");
        assertThat(healed.path("system").path("policy").path("security").path("encryption_at_rest").asBoolean()).isTrue();
        assertThat(result.record().operations()).contains(
            "Wrapped top-level components into system block",
            "Dropped malformed binding [2]",
            "Fixed type casing of reader: source -> Source",
            "Replaced non-list inputs of cleaner with empty list");

        ParseResult parsed = parser.parse(healed);
        assertThat(parsed.isSuccess()).isTrue();
        assertThat(parsed.blueprint().bindings()).extracting(Binding::describe).containsExactly(
            "reader.output -> cleaner.input",
            "cleaner.output -> archive.input");
    }

    @Test
    void heal_misplacedLegacySchemaVersion_isMovedAndUpgraded() {
        HealingResult result = healer.heal(BlueprintDocuments.parse("""
            system:
              name: old
              schema_version: "1.0"
              components:
                - name: src
                  type: Source
                - name: sink
                  type: Sink
            """), HealingPhase.STRUCTURAL, session);

        assertThat(result.document().get("schema_version").asText()).isEqualTo("1.0.0");
        assertThat(result.document().path("system").has("schema_version")).isFalse();
        assertThat(result.record().operations()).contains(
            "Moved schema_version out of system block", "Upgraded schema_version 1.0 to 1.0.0");
    }

    @Test
    void heal_schemaPhase_injectsTransformationForIncompatiblePorts() {
        HealingResult result = healer.heal(document("schema-mismatch.yaml"), HealingPhase.SCHEMA, session);

        JsonNode first = result.document().path("system").path("bindings").get(0);
        assertThat(first.get("transformation").asText()).isEqualTo("convert_orderschema_to_invoiceschema");
        assertThat(result.document().path("system").path("bindings").get(1).has("transformation")).isFalse();
        assertThat(result.record().operations())
            .containsExactly("Injected transformation convert_orderschema_to_invoiceschema on orders -> invoicer");
    }

    @Test
    void heal_schemaPhaseStrictWithoutRegistration_leavesBindingUntouched() {
        BlueprintHealer strict = new BlueprintHealer(MATRIX,
            SchemaCompatibility.from(new SchemaSettings(true, List.of(), List.of())));

        HealingResult result = strict.heal(document("schema-mismatch.yaml"), HealingPhase.SCHEMA, session);

        assertThat(result.record().isEmpty()).isTrue();
    }

    private SystemBlueprint parse(ObjectNode document) {
        ParseResult parsed = parser.parse(document);
        assertThat(parsed.errors()).isEmpty();
        return parsed.blueprint();
    }
}
