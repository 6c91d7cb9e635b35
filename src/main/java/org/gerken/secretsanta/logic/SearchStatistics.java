package org.gerken.secretsanta.logic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters for a single search.
 *
 * Tracks assignments tried (nodes), backtracks, branches cut by pruning rules
 * (in total and per rule) and elapsed time. A search runs on one thread, so the
 * counters are plain fields.
 */
public class SearchStatistics {

    private long nodes;
    private long backtracks;
    private long pruned;
    private final Map<String, Long> prunedByRule;
    private final long startTime;
    private long elapsedMs;

    /**
     * Creates statistics with all counters at zero and the clock started.
     */
    public SearchStatistics() {
        this.prunedByRule = new LinkedHashMap<>();
        this.startTime = System.currentTimeMillis();
    }

    // ========== Counter Updates ==========

    public void incrementNodes() {
        nodes++;
    }

    public void incrementBacktracks() {
        backtracks++;
    }

    /**
     * Records a branch cut by the named rule.
     *
     * @param ruleName name of the pruning rule that fired
     */
    public void incrementPruned(String ruleName) {
        pruned++;
        prunedByRule.merge(ruleName, 1L, Long::sum);
    }

    /**
     * Stops the clock. Later calls have no effect on the recorded time.
     */
    public void finish() {
        if (elapsedMs == 0) {
            elapsedMs = Math.max(1, System.currentTimeMillis() - startTime);
        }
    }

    // ========== Queries ==========

    /**
     * Gets the number of assignments tried.
     *
     * @return the node count
     */
    public long getNodes() {
        return nodes;
    }

    public long getBacktracks() {
        return backtracks;
    }

    public long getPruned() {
        return pruned;
    }

    /**
     * Gets the prune count per rule name, in the order rules first fired.
     *
     * @return unmodifiable map of rule name to count
     */
    public Map<String, Long> getPrunedByRule() {
        return Collections.unmodifiableMap(prunedByRule);
    }

    /**
     * Gets the elapsed time, in milliseconds, once the search has finished.
     *
     * @return elapsed milliseconds, or 0 while still running
     */
    public long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public String toString() {
        return "nodes=" + nodes + ", backtracks=" + backtracks + ", pruned=" + pruned
            + (prunedByRule.isEmpty() ? "" : " " + prunedByRule);
    }
}
