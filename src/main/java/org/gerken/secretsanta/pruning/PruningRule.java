package org.gerken.secretsanta.pruning;

import org.gerken.secretsanta.logic.SearchState;

/**
 * Interface for stateless singleton rules that detect partial assignments which can
 * no longer be completed. Every registered rule is used to prune the search.
 */
public interface PruningRule {

    /**
     * Determines if the given state cannot be extended to a full solution.
     * A rule must never report a dead end for a state that still has a completion.
     *
     * @param state the partial assignment to evaluate
     * @return true if the state should be abandoned
     */
    boolean isDeadEnd(SearchState state);

    /**
     * Returns a descriptive name for this rule, used in search statistics.
     *
     * @return the name of this rule
     */
    String getName();
}
