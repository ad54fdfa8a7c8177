package com.blueprintarchitect.core.connectivity;

import com.blueprintarchitect.core.model.ComponentType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConnectivityMatrixLoader}.
 */
class ConnectivityMatrixLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadDefault_readsCardinalities() {
        ConnectivityMatrix matrix = ConnectivityMatrixLoader.loadDefault();

        assertThat(matrix.ruleFor(ComponentType.AGGREGATOR).expectedInputs()).isEqualTo(2);
        assertThat(matrix.ruleFor(ComponentType.ROUTER).expectedOutputs()).isEqualTo(2);
        assertThat(matrix.ruleFor(ComponentType.SOURCE).source()).isTrue();
        assertThat(matrix.ruleFor(ComponentType.STORE).terminal()).isTrue();
    }

    @Test
    void load_customFile_acceptsTypeNameVariants() throws IOException {
        Path file = tempDir.resolve("matrix.yaml");
        Files.writeString(file, completeMatrix("""
              source:
                can_connect_to: [sink]
                is_source: true
              sink:
                can_receive_from: [Source]
                is_terminal: true
            """));

        ConnectivityMatrix matrix = ConnectivityMatrixLoader.load(file);

        assertThat(matrix.allows(ComponentType.SOURCE, ComponentType.SINK)).isTrue();
        assertThat(matrix.allows(ComponentType.SOURCE, ComponentType.STORE)).isFalse();
        assertThat(matrix.isConsistent()).isTrue();
    }

    @Test
    void load_unknownTypeName_throws() throws IOException {
        Path file = tempDir.resolve("matrix.yaml");
        Files.writeString(file, """
            rules:
              Database:
                can_connect_to: []
            """);

        assertThatThrownBy(() -> ConnectivityMatrixLoader.load(file))
            .isInstanceOf(MatrixLoadException.class)
            .hasMessageContaining("Database");
    }

    @Test
    void load_incompleteRuleSet_throws() throws IOException {
        Path file = tempDir.resolve("matrix.yaml");
        Files.writeString(file, """
            rules:
              Source:
                is_source: true
            """);

        assertThatThrownBy(() -> ConnectivityMatrixLoader.load(file))
            .isInstanceOf(MatrixLoadException.class)
            .hasMessageContaining("No connectivity rule");
    }

    @Test
    void load_missingFile_throws() {
        assertThatThrownBy(() -> ConnectivityMatrixLoader.load(tempDir.resolve("absent.yaml")))
            .isInstanceOf(MatrixLoadException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void loadOrDefault_nullPath_usesBundledMatrix() {
        assertThat(ConnectivityMatrixLoader.loadOrDefault(null).isConsistent()).isTrue();
    }

    /**
     * Prepends empty rules for every type not named in {@code rules}.
     */
    private static String completeMatrix(String rules) {
        StringBuilder sb = new StringBuilder("rules:\n").append(rules);
        for (ComponentType type : ComponentType.values()) {
            if (type != ComponentType.SOURCE && type != ComponentType.SINK) {
                sb.append("  ").append(type.blueprintName()).append(": {}\n");
            }
        }
        return sb.toString();
    }
}
