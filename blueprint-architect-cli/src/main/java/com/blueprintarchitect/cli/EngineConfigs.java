package com.blueprintarchitect.cli;

import com.blueprintarchitect.core.config.ConfigLoader;
import com.blueprintarchitect.core.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the engine configuration for a command.
 *
 * <p>An explicit {@code --config} path is always loaded. Without one, a
 * {@code blueprint-architect.yaml} in the working directory is used if present.
 */
final class EngineConfigs {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigs.class);

    private EngineConfigs() {
    }

    static EngineConfig resolve(Path explicitPath) {
        if (explicitPath != null) {
            return ConfigLoader.load(explicitPath);
        }
        Path fallback = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.isRegularFile(fallback)) {
            return ConfigLoader.load(fallback);
        }
        log.debug("No {} in working directory, using defaults", ConfigLoader.DEFAULT_FILE_NAME);
        return EngineConfig.defaults();
    }
}
