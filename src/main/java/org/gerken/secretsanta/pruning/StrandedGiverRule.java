package org.gerken.secretsanta.pruning;

import org.gerken.secretsanta.logic.ConstraintModel;
import org.gerken.secretsanta.logic.SearchState;

import java.util.ArrayList;
import java.util.List;

/**
 * Pruning rule that detects a giver left without any receiver.
 *
 * If a giver G has no receiver yet, but every remaining receiver is forbidden for G,
 * already taken, or already gives to G, then G can never be assigned and the state
 * is a dead end.
 *
 * Optimization: after the assignment g->r only free givers that could have taken r,
 * plus r itself (who can no longer give back to g), lost a candidate. Only those are
 * checked; a state with no last assignment is checked in full.
 *
 * Stateless singleton implementation.
 */
public class StrandedGiverRule implements PruningRule {

    private static final StrandedGiverRule INSTANCE = new StrandedGiverRule();

    private StrandedGiverRule() {
        // Private constructor for singleton pattern
    }

    public static StrandedGiverRule getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean isDeadEnd(SearchState state) {
        int lastGiver = state.getLastGiver();
        if (lastGiver < 0) {
            return !findStrandedGivers(state).isEmpty();
        }

        ConstraintModel model = state.getModel();
        int taken = state.getReceiverOf(lastGiver);

        if (!state.isGiverAssigned(taken) && state.countCandidates(taken) == 0) {
            return true;
        }
        for (int g = 0; g < state.size(); g++) {
            if (!state.isGiverAssigned(g) && !model.isForbidden(g, taken)
                    && state.countCandidates(g) == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds every free giver that has no allowed receiver.
     *
     * @param state the partial assignment
     * @return giver indices, in roster order
     */
    public List<Integer> findStrandedGivers(SearchState state) {
        List<Integer> stranded = new ArrayList<>();
        for (int g = 0; g < state.size(); g++) {
            if (!state.isGiverAssigned(g) && state.countCandidates(g) == 0) {
                stranded.add(g);
            }
        }
        return stranded;
    }

    @Override
    public String getName() {
        return "StrandedGiverRule";
    }
}
