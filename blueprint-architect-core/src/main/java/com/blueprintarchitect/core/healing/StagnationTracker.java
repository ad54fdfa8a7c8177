package com.blueprintarchitect.core.healing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Detects healing attempts that make no progress.
 *
 * <p>An attempt whose operation list is empty, or identical to the previous attempt's,
 * is stagnant. Consecutive stagnant attempts are counted; any attempt with new
 * operations resets the count.
 */
public class StagnationTracker {

    private static final Logger log = LoggerFactory.getLogger(StagnationTracker.class);

    /**
     * Outcome of observing one attempt.
     */
    public enum Verdict {
        /** The attempt changed something new */
        PROGRESS,

        /** Stagnant, below the warning threshold */
        STAGNANT,

        /** Stagnant for {@code warnThreshold} or more consecutive attempts */
        WARN,

        /** Stagnant for {@code stopThreshold} consecutive attempts; the loop must end */
        STOP
    }

    private final int warnThreshold;
    private final int stopThreshold;
    private List<String> previous;
    private int stagnantCount;

    public StagnationTracker(int warnThreshold, int stopThreshold) {
        if (warnThreshold < 1 || stopThreshold < warnThreshold) {
            throw new IllegalArgumentException(
                "thresholds must satisfy 1 <= warn <= stop, got " + warnThreshold + "/" + stopThreshold);
        }
        this.warnThreshold = warnThreshold;
        this.stopThreshold = stopThreshold;
    }

    /**
     * Records the operations of one attempt.
     *
     * @param operations all healing operations of the attempt, in order
     * @return verdict for this attempt
     */
    public Verdict observe(List<String> operations) {
        boolean stagnant = operations.isEmpty() || operations.equals(previous);
        previous = List.copyOf(operations);

        if (!stagnant) {
            stagnantCount = 0;
            return Verdict.PROGRESS;
        }

        stagnantCount++;
        if (stagnantCount >= stopThreshold) {
            log.warn("Healing stagnated for {} consecutive attempts, stopping", stagnantCount);
            return Verdict.STOP;
        }
        if (stagnantCount >= warnThreshold) {
            log.warn("Healing is stagnating: {} consecutive attempts without new changes", stagnantCount);
            return Verdict.WARN;
        }
        return Verdict.STAGNANT;
    }

    public int stagnantCount() {
        return stagnantCount;
    }
}
