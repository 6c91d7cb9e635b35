package org.gerken.secretsanta.pruning;

import org.gerken.secretsanta.logic.SearchState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Coordinator that runs all registered pruning rules against search states.
 * Stateless singleton; safe to share between concurrent searches.
 *
 * Currently registered rules:
 * 1. StrandedGiverRule - a free giver has no allowed receiver left
 * 2. OrphanedReceiverRule - an uncovered receiver has no allowed giver left
 *
 * Both rules only look one step ahead, so they never cut a branch that still holds
 * a solution; the search stays complete.
 */
public class PruningRuleCoordinator {

    private static final PruningRuleCoordinator INSTANCE = new PruningRuleCoordinator();

    private final List<PruningRule> rules;

    private PruningRuleCoordinator() {
        List<PruningRule> ruleList = new ArrayList<>();

        // Order: cheapest rules first for early exit
        ruleList.add(StrandedGiverRule.getInstance());
        ruleList.add(OrphanedReceiverRule.getInstance());

        this.rules = Collections.unmodifiableList(ruleList);
    }

    public static PruningRuleCoordinator getInstance() {
        return INSTANCE;
    }

    /**
     * Finds the first registered rule that declares the state a dead end.
     *
     * @param state the partial assignment to evaluate
     * @return the rule that fired, or null if the state may still be completed
     */
    public PruningRule findDeadEnd(SearchState state) {
        for (PruningRule rule : rules) {
            if (rule.isDeadEnd(state)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * Checks if the given state is a dead end according to any registered rule.
     *
     * @param state the partial assignment to evaluate
     * @return true if any rule fires
     */
    public boolean isDeadEnd(SearchState state) {
        return findDeadEnd(state) != null;
    }

    /**
     * Returns an unmodifiable list of all registered rules.
     *
     * @return the list of rules
     */
    public List<PruningRule> getRules() {
        return rules;
    }

    public int getRuleCount() {
        return rules.size();
    }
}
