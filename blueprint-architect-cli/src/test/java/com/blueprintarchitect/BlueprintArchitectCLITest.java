package com.blueprintarchitect;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class BlueprintArchitectCLITest {

    @Test
    void commandLine_registersSubcommands() {
        CommandLine commandLine = BlueprintArchitectCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsOnlyKeys("validate", "heal", "matrix");
    }

    @Test
    void parse_globalOptions_setFlags() {
        CommandLine commandLine = BlueprintArchitectCLI.commandLine();
        commandLine.parseArgs("-v", "matrix");

        BlueprintArchitectCLI cli = commandLine.getCommand();
        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void version_printsProjectVersion() {
        CommandLine commandLine = BlueprintArchitectCLI.commandLine();

        assertThat(commandLine.getCommandSpec().version()).contains("BlueprintArchitect 1.0.0-SNAPSHOT");
    }
}
