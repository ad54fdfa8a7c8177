package com.blueprintarchitect.core.healing;

import com.blueprintarchitect.core.config.EngineConfig.HealingSettings;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable state of one heal-and-validate run.
 *
 * <p>Remembers which {@code (from, to)} component pairs were already proposed or
 * rejected, and tracks stagnation across attempts. Create one per run; a session must
 * never be shared between unrelated documents.
 */
public final class HealingSession {

    private final Set<ComponentPair> generated = new HashSet<>();
    private final Set<ComponentPair> rejected = new HashSet<>();
    private final StagnationTracker stagnation;

    private HealingSession(StagnationTracker stagnation) {
        this.stagnation = stagnation;
    }

    /**
     * Starts a new session.
     *
     * @param settings healing settings providing the stagnation thresholds
     * @return fresh session
     */
    public static HealingSession start(HealingSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new HealingSession(
            new StagnationTracker(settings.stagnationWarnThreshold(), settings.stagnationStopThreshold()));
    }

    /**
     * Starts a session with default thresholds.
     *
     * @return fresh session
     */
    public static HealingSession start() {
        return start(HealingSettings.defaults());
    }

    /**
     * Whether a binding between two components may still be proposed.
     *
     * @param from source component name
     * @param to target component name
     * @return false if the pair was generated or rejected earlier in this run
     */
    public boolean isUndecided(String from, String to) {
        ComponentPair pair = new ComponentPair(from, to);
        return !generated.contains(pair) && !rejected.contains(pair);
    }

    void markGenerated(String from, String to) {
        generated.add(new ComponentPair(from, to));
    }

    void markRejected(String from, String to) {
        rejected.add(new ComponentPair(from, to));
    }

    public Set<ComponentPair> generatedPairs() {
        return Set.copyOf(generated);
    }

    public Set<ComponentPair> rejectedPairs() {
        return Set.copyOf(rejected);
    }

    public StagnationTracker stagnation() {
        return stagnation;
    }

    /**
     * Ordered pair of component names.
     *
     * @param from source component
     * @param to target component
     */
    public record ComponentPair(String from, String to) {}
}
