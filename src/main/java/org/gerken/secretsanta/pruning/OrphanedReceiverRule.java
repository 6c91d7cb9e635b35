package org.gerken.secretsanta.pruning;

import org.gerken.secretsanta.logic.ConstraintModel;
import org.gerken.secretsanta.logic.SearchState;

import java.util.ArrayList;
import java.util.List;

/**
 * Pruning rule that detects a receiver nobody can give to any more.
 *
 * If receiver R has no giver yet and every free giver is forbidden from R or is R's
 * own receiver, R will never be covered and the state is a dead end.
 *
 * Optimization: after the assignment g->r only receivers that g could have covered,
 * plus g itself (whom r can no longer give to), lost a potential giver.
 *
 * Stateless singleton implementation.
 */
public class OrphanedReceiverRule implements PruningRule {

    private static final OrphanedReceiverRule INSTANCE = new OrphanedReceiverRule();

    private OrphanedReceiverRule() {
        // Private constructor for singleton pattern
    }

    public static OrphanedReceiverRule getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean isDeadEnd(SearchState state) {
        int lastGiver = state.getLastGiver();
        if (lastGiver < 0) {
            return !findOrphanedReceivers(state).isEmpty();
        }

        ConstraintModel model = state.getModel();

        if (!state.isReceiverTaken(lastGiver) && state.countPotentialGivers(lastGiver) == 0) {
            return true;
        }
        for (int r = 0; r < state.size(); r++) {
            if (!state.isReceiverTaken(r) && !model.isForbidden(lastGiver, r)
                    && state.countPotentialGivers(r) == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds every uncovered receiver that no free giver may give to.
     *
     * @param state the partial assignment
     * @return receiver indices, in roster order
     */
    public List<Integer> findOrphanedReceivers(SearchState state) {
        List<Integer> orphaned = new ArrayList<>();
        for (int r = 0; r < state.size(); r++) {
            if (!state.isReceiverTaken(r) && state.countPotentialGivers(r) == 0) {
                orphaned.add(r);
            }
        }
        return orphaned;
    }

    @Override
    public String getName() {
        return "OrphanedReceiverRule";
    }
}
