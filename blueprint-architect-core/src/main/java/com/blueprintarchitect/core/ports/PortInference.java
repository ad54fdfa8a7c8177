package com.blueprintarchitect.core.ports;

import com.blueprintarchitect.core.model.SystemBlueprint;

/**
 * Fills in ports a blueprint leaves implicit.
 *
 * <p>Implementations only add ports. Existing ports are never removed, renamed or
 * altered.
 */
public interface PortInference {

    /**
     * Returns a blueprint with inferred ports added.
     *
     * @param blueprint parsed blueprint
     * @return blueprint whose components carry at least the ports they had before
     */
    SystemBlueprint inferPorts(SystemBlueprint blueprint);
}
