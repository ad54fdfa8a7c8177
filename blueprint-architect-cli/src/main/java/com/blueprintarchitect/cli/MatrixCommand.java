package com.blueprintarchitect.cli;

import com.blueprintarchitect.core.config.EngineConfig;
import com.blueprintarchitect.core.connectivity.ConnectivityMatrix;
import com.blueprintarchitect.core.connectivity.ConnectivityMatrixLoader;
import com.blueprintarchitect.core.connectivity.ConnectivityRule;
import com.blueprintarchitect.core.connectivity.MatrixLoadException;
import com.blueprintarchitect.core.model.ComponentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to print the connectivity matrix and check that it is self-consistent.
 *
 * <p>Exits with {@code 1} when a receive rule has no matching connect rule (or the
 * reverse), or a source or terminal type has edges on its closed side.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * blueprint-architect matrix
 * blueprint-architect matrix --file custom-matrix.yaml
 * }</pre>
 */
@Command(
    name = "matrix",
    description = "Print the connectivity matrix and check its consistency",
    mixinStandardHelpOptions = true
)
public class MatrixCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MatrixCommand.class);

    @Option(names = {"-f", "--file"}, description = "Matrix file (default: matrix from config, else bundled)")
    private Path matrixFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: blueprint-architect.yaml if present)"
    )
    private Path configPath;

    @Override
    public Integer call() {
        ConnectivityMatrix matrix;
        try {
            matrix = loadMatrix();
        } catch (MatrixLoadException e) {
            log.error("Cannot load connectivity matrix", e);
            System.err.println("✗ " + e.getMessage());
            return ValidateCommand.EXIT_UNREADABLE;
        }

        System.out.println("Connectivity Matrix:");
        System.out.println();
        for (ComponentType type : ComponentType.values()) {
            ConnectivityRule rule = matrix.ruleFor(type);
            System.out.printf("  • %s (%s)%s%s%n", type.blueprintName(), type.role(),
                rule.source() ? " [source]" : "", rule.terminal() ? " [terminal]" : "");
            System.out.printf("    Connects to:   %s%n", names(rule.canConnectTo()));
            System.out.printf("    Receives from: %s%n", names(rule.canReceiveFrom()));
            System.out.printf("    Expected ports: %d in, %d out%n", rule.expectedInputs(), rule.expectedOutputs());
        }
        System.out.println();

        List<String> violations = new ArrayList<>(matrix.symmetryViolations());
        violations.addAll(matrix.shapeViolations());
        if (!violations.isEmpty()) {
            System.err.println("✗ Matrix is inconsistent:");
            violations.forEach(v -> System.err.println("  " + v));
            return ValidateCommand.EXIT_INVALID;
        }
        System.out.println("✓ Matrix is consistent");
        return 0;
    }

    private ConnectivityMatrix loadMatrix() {
        if (matrixFile != null) {
            return ConnectivityMatrixLoader.load(matrixFile);
        }
        EngineConfig config = EngineConfigs.resolve(configPath);
        String configured = config.matrix().path();
        return ConnectivityMatrixLoader.loadOrDefault(configured == null ? null : Path.of(configured));
    }

    private static String names(Set<ComponentType> types) {
        if (types.isEmpty()) {
            return "-";
        }
        return types.stream().map(ComponentType::blueprintName).collect(Collectors.joining(", "));
    }
}
