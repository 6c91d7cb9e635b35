package org.gerken.secretsanta.logic;

import org.gerken.secretsanta.InfeasibleException;
import org.gerken.secretsanta.SearchLimitException;
import org.gerken.secretsanta.model.Roster;
import org.gerken.secretsanta.model.Solution;
import org.gerken.secretsanta.pruning.OrphanedReceiverRule;
import org.gerken.secretsanta.pruning.PruningRule;
import org.gerken.secretsanta.pruning.PruningRuleCoordinator;
import org.gerken.secretsanta.pruning.StrandedGiverRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Randomized depth-first backtracking search for a valid assignment.
 *
 * Algorithm:
 * - Forced (whitelist) pairs are placed first
 * - A person with no possible receiver or giver at that point proves infeasibility
 *   before any searching
 * - Remaining givers are visited in a shuffled order; each giver's candidate receivers
 *   are shuffled too, so repeated draws differ while a fixed seed reproduces a draw
 * - Each assignment is checked by the registered pruning rules; a dead end moves on to
 *   the next candidate, and a giver with no candidates left backtracks to the previous one
 * - The backtracking stack is an explicit array of frames, one per free giver
 *
 * Without a bound the search is exhaustive, so running out of candidates at the root is
 * a proof that no solution exists. With a bound, running out of steps is reported
 * separately as {@link SearchLimitException}.
 *
 * The search keeps no state between calls to {@link #run(Random)}; one instance may be
 * reused and may run on several threads at once.
 */
public class AssignmentSearch {

    private static final Logger log = LoggerFactory.getLogger(AssignmentSearch.class);

    private final ConstraintModel model;
    private final long maxSteps;
    private final PruningRuleCoordinator coordinator;

    /**
     * Creates a search over the given model.
     *
     * @param model the validated rules
     * @param maxSteps maximum number of assignments to try, or 0 for no limit
     */
    public AssignmentSearch(ConstraintModel model, long maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be non-negative: " + maxSteps);
        }
        this.model = Objects.requireNonNull(model, "model");
        this.maxSteps = maxSteps;
        this.coordinator = PruningRuleCoordinator.getInstance();
    }

    public ConstraintModel getModel() {
        return model;
    }

    public long getMaxSteps() {
        return maxSteps;
    }

    /**
     * Searches for a solution.
     *
     * @param random source of the giver and candidate ordering
     * @return a solution satisfying every rule of the model
     * @throws InfeasibleException if no solution exists
     * @throws SearchLimitException if the step bound ran out first
     */
    public Solution run(Random random) {
        Objects.requireNonNull(random, "random");
        SearchStatistics stats = new SearchStatistics();
        SearchState state = new SearchState(model);

        for (int g = 0; g < model.size(); g++) {
            if (model.isForced(g)) {
                state.assign(g, model.getForcedReceiver(g));
            }
        }
        checkFeasible(state, stats);

        List<Integer> order = new ArrayList<>();
        for (int g = 0; g < model.size(); g++) {
            if (!state.isGiverAssigned(g)) {
                order.add(g);
            }
        }
        Collections.shuffle(order, random);

        SearchFrame[] frames = new SearchFrame[order.size()];
        int depth = 0;

        while (depth < frames.length) {
            if (depth < 0) {
                stats.finish();
                throw new InfeasibleException(exhaustedDetail(stats), List.of(), stats);
            }

            SearchFrame frame = frames[depth];
            if (frame == null) {
                int giver = order.get(depth);
                frame = new SearchFrame(giver, shuffle(state.candidatesFor(giver), random));
                frames[depth] = frame;
            } else if (frame.hasAssignment()) {
                state.unassign(frame.getGiver());
                frame.clearAssignment();
            }

            if (tryNextCandidate(frame, state, stats)) {
                depth++;
            } else {
                frames[depth] = null;
                depth--;
                stats.incrementBacktracks();
            }
        }

        stats.finish();
        log.debug("Search finished: {}", stats);
        return new Solution(model.getRoster(), state.toReceiverArray(), stats);
    }

    /**
     * Assigns the frame's giver to its next candidate that survives pruning.
     *
     * @return true if an assignment was made, false if the candidates are used up
     */
    private boolean tryNextCandidate(SearchFrame frame, SearchState state, SearchStatistics stats) {
        int giver = frame.getGiver();
        while (frame.hasNextCandidate()) {
            int receiver = frame.nextCandidate();

            if (maxSteps > 0 && stats.getNodes() >= maxSteps) {
                stats.finish();
                log.debug("Search bound of {} steps reached: {}", maxSteps, stats);
                throw new SearchLimitException(maxSteps, stats);
            }

            state.assign(giver, receiver);
            stats.incrementNodes();
            frame.setAssignment(receiver);

            PruningRule rule = coordinator.findDeadEnd(state);
            if (rule == null) {
                return true;
            }
            stats.incrementPruned(rule.getName());
            state.unassign(giver);
            frame.clearAssignment();
        }
        return false;
    }

    /**
     * Fails fast when, after placing forced pairs, somebody has no legal partner at all.
     */
    private void checkFeasible(SearchState state, SearchStatistics stats) {
        Roster roster = model.getRoster();
        List<String> people = new ArrayList<>();
        List<String> reasons = new ArrayList<>();

        for (int g : StrandedGiverRule.getInstance().findStrandedGivers(state)) {
            String name = roster.getPerson(g).getName();
            people.add(name);
            reasons.add(name + " cannot give to anyone (" + describeBlockedReceivers(state, g) + ")");
        }
        for (int r : OrphanedReceiverRule.getInstance().findOrphanedReceivers(state)) {
            String name = roster.getPerson(r).getName();
            if (!people.contains(name)) {
                people.add(name);
            }
            reasons.add("nobody can give to " + name + " (" + describeBlockedGivers(state, r) + ")");
        }

        if (!reasons.isEmpty()) {
            stats.finish();
            throw new InfeasibleException("No valid assignment exists: " + String.join("; ", reasons),
                people, stats);
        }
    }

    private String describeBlockedReceivers(SearchState state, int giver) {
        Roster roster = model.getRoster();
        List<String> blocked = new ArrayList<>();
        for (int r = 0; r < model.size(); r++) {
            if (r == giver) {
                continue;
            }
            String name = roster.getPerson(r).getName();
            if (model.isForbidden(giver, r)) {
                blocked.add(name + ": " + labels(model, giver, r));
            } else if (state.isReceiverTaken(r)) {
                blocked.add(name + ": already receives from " + roster.getPerson(state.getGiverOf(r)).getName() + " (whitelist)");
            } else if (state.getReceiverOf(r) == giver) {
                blocked.add(name + ": 2-cycle with whitelist pair " + name + "->" + roster.getPerson(giver).getName());
            }
        }
        return blocked.isEmpty() ? "nobody else in the roster" : String.join("; ", blocked);
    }

    private String describeBlockedGivers(SearchState state, int receiver) {
        Roster roster = model.getRoster();
        List<String> blocked = new ArrayList<>();
        for (int g = 0; g < model.size(); g++) {
            if (g == receiver) {
                continue;
            }
            String name = roster.getPerson(g).getName();
            if (model.isForbidden(g, receiver)) {
                blocked.add(name + ": " + labels(model, g, receiver));
            } else if (state.isGiverAssigned(g)) {
                blocked.add(name + ": already gives to " + roster.getPerson(state.getReceiverOf(g)).getName() + " (whitelist)");
            } else if (state.getReceiverOf(receiver) == g) {
                blocked.add(name + ": 2-cycle with whitelist pair " + roster.getPerson(receiver).getName() + "->" + name);
            }
        }
        return blocked.isEmpty() ? "nobody else in the roster" : String.join("; ", blocked);
    }

    private static String labels(ConstraintModel model, int giver, int receiver) {
        List<String> labels = new ArrayList<>();
        for (ExclusionSource source : model.getExclusionSources(giver, receiver)) {
            labels.add(source.getLabel());
        }
        return String.join(", ", labels);
    }

    private String exhaustedDetail(SearchStatistics stats) {
        String detail = "No valid assignment exists: every possibility was ruled out after "
            + stats.getNodes() + " step(s)";
        if (model.size() == 2) {
            detail += "; two people can only give to each other, which is a 2-cycle";
        }
        return detail;
    }

    private static int[] shuffle(int[] values, Random random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
        return values;
    }
}
