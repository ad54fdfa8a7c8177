package com.blueprintarchitect.cli;

import com.blueprintarchitect.cli.CommandTestSupport.Run;
import com.blueprintarchitect.core.parser.BlueprintDocuments;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class HealCommandTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Heal writes the repaired document and a diagram")
    void heal_unboundBlueprint_writesOutputAndDiagram() throws IOException {
        Path input = Files.writeString(tempDir.resolve("clicks.yaml"), CommandTestSupport.UNBOUND_BLUEPRINT);
        Path output = tempDir.resolve("out/healed.yaml");
        Path diagram = tempDir.resolve("out/healed.md");

        Run run = CommandTestSupport.run("heal", input.toString(),
            "-o", output.toString(), "--diagram", diagram.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("✓ Wrote healed blueprint to: " + output)
            .contains("✓ Blueprint 'click_capture' healed in 1 attempt(s)")
            .contains("Generated binding clicks.output -> click_db.input");
        assertThat(Files.readString(output))
            .contains("bindings")
            .contains("from_component: clicks")
            .contains("convert_common_object_schema_to_itemschema");
        assertThat(Files.readString(diagram))
            .startsWith("# click_capture")
            .contains("flowchart LR")
            .contains("clicks -->|convert_common_object_schema_to_itemschema| click_db");
    }

    @Test
    @DisplayName("Without --output, standard output holds only the healed blueprint")
    void heal_withoutOutput_printsParseableYaml() throws IOException {
        Path input = Files.writeString(tempDir.resolve("clicks.yaml"), CommandTestSupport.UNBOUND_BLUEPRINT);

        Run run = CommandTestSupport.run("heal", input.toString());

        assertThat(run.exitCode()).isZero();
        ObjectNode healed = BlueprintDocuments.parse(run.out());
        assertThat(healed.path("system").path("name").asText()).isEqualTo("click_capture");
        assertThat(healed.path("system").path("bindings")).hasSize(1);
        assertThat(run.out()).doesNotContain("✓", "•");
        assertThat(run.err())
            .contains("✓ Blueprint 'click_capture' healed in 1 attempt(s)")
            .contains("Generated binding clicks.output -> click_db.input");
    }

    @Test
    void heal_zeroMaxAttempts_isRejected() throws IOException {
        Path input = Files.writeString(tempDir.resolve("clicks.yaml"), CommandTestSupport.UNBOUND_BLUEPRINT);

        Run run = CommandTestSupport.run("heal", input.toString(), "--max-attempts", "0");

        assertThat(run.exitCode()).isEqualTo(ValidateCommand.EXIT_UNREADABLE);
        assertThat(run.err()).contains("✗ --max-attempts must be at least 1, was 0").doesNotContain("Exception");
        assertThat(run.out()).isEmpty();
    }

    @Test
    void heal_contradictoryBlueprint_exitsOneWithIssues() throws IOException {
        Path input = Files.writeString(tempDir.resolve("flow.yaml"), CommandTestSupport.CONTRADICTORY_BLUEPRINT);
        Path output = tempDir.resolve("healed.yaml");

        Run run = CommandTestSupport.run("heal", input.toString(), "-o", output.toString(), "--max-attempts", "2");

        assertThat(run.exitCode()).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(run.err())
            .contains("✗ Healing failed after 2 attempt(s)")
            .contains("terminal_hint_outputs");
        assertThat(output).doesNotExist();
    }

    @Test
    void heal_missingFile_exitsTwo() {
        Run run = CommandTestSupport.run("heal", tempDir.resolve("absent.yaml").toString());

        assertThat(run.exitCode()).isEqualTo(ValidateCommand.EXIT_UNREADABLE);
    }
}
