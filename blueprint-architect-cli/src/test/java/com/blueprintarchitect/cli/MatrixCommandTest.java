package com.blueprintarchitect.cli;

import com.blueprintarchitect.cli.CommandTestSupport.Run;
import com.blueprintarchitect.core.connectivity.ConnectivityMatrixLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MatrixCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void matrix_bundled_isConsistent() {
        Run run = CommandTestSupport.run("matrix");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("Connectivity Matrix:")
            .contains("• Source (ORIGIN) [source]")
            .contains("• Sink (TERMINAL) [terminal]")
            .contains("✓ Matrix is consistent");
    }

    @Test
    void matrix_asymmetricFile_exitsOne() throws IOException {
        String bundled;
        try (InputStream in = ConnectivityMatrixLoader.class.getResourceAsStream(ConnectivityMatrixLoader.DEFAULT_RESOURCE)) {
            bundled = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        // Source stops connecting to Store while Store still receives from Source
        String asymmetric = bundled.replaceFirst("APIEndpoint, Store, Sink]", "APIEndpoint, Sink]");
        Path file = Files.writeString(tempDir.resolve("matrix.yaml"), asymmetric);

        Run run = CommandTestSupport.run("matrix", "--file", file.toString());

        assertThat(run.exitCode()).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(run.err()).contains("✗ Matrix is inconsistent:").contains("Source");
    }

    @Test
    void matrix_missingFile_exitsTwo() {
        Run run = CommandTestSupport.run("matrix", "-f", tempDir.resolve("absent.yaml").toString());

        assertThat(run.exitCode()).isEqualTo(ValidateCommand.EXIT_UNREADABLE);
        assertThat(run.err()).contains("not found");
    }
}
