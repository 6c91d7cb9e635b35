package org.gerken.secretsanta.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The partial assignment at one point of the search.
 *
 * Unlike the immutable model, the state is changed in place: the search assigns on the
 * way down and unassigns on the way back. All rule checks for a single edge go through
 * {@link #allows(int, int)}.
 */
public class SearchState {

    private static final int NONE = -1;

    private final ConstraintModel model;
    private final int[] receiverOf;
    private final int[] giverOf;
    private int assignedCount;
    private int lastGiver = NONE;

    /**
     * Creates an empty state for the given model.
     *
     * @param model the rules to enforce
     */
    public SearchState(ConstraintModel model) {
        this.model = model;
        this.receiverOf = new int[model.size()];
        this.giverOf = new int[model.size()];
        Arrays.fill(receiverOf, NONE);
        Arrays.fill(giverOf, NONE);
    }

    public ConstraintModel getModel() {
        return model;
    }

    /**
     * Checks whether giver may be assigned to receiver right now.
     *
     * The edge must not be forbidden, the giver must still be free, the receiver must not
     * already have a giver, and the receiver must not already give to this giver (which
     * would close a 2-cycle).
     *
     * @param giver giver index
     * @param receiver receiver index
     * @return true if the assignment keeps every rule
     */
    public boolean allows(int giver, int receiver) {
        return !model.isForbidden(giver, receiver)
            && receiverOf[giver] == NONE
            && giverOf[receiver] == NONE
            && receiverOf[receiver] != giver;
    }

    /**
     * Gets every receiver the giver could take now, in roster order.
     *
     * @param giver giver index
     * @return allowed receiver indices
     */
    public int[] candidatesFor(int giver) {
        List<Integer> candidates = new ArrayList<>();
        for (int r = 0; r < receiverOf.length; r++) {
            if (allows(giver, r)) {
                candidates.add(r);
            }
        }
        int[] result = new int[candidates.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = candidates.get(i);
        }
        return result;
    }

    /**
     * Counts the receivers the giver could take now.
     *
     * @param giver giver index
     * @return number of allowed receivers
     */
    public int countCandidates(int giver) {
        int count = 0;
        for (int r = 0; r < receiverOf.length; r++) {
            if (allows(giver, r)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Counts the free givers that could still give to the receiver.
     *
     * @param receiver receiver index
     * @return number of allowed givers
     */
    public int countPotentialGivers(int receiver) {
        int count = 0;
        for (int g = 0; g < receiverOf.length; g++) {
            if (allows(g, receiver)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Records giver->receiver. The caller has checked {@link #allows(int, int)}.
     *
     * @param giver giver index
     * @param receiver receiver index
     */
    public void assign(int giver, int receiver) {
        receiverOf[giver] = receiver;
        giverOf[receiver] = giver;
        assignedCount++;
        lastGiver = giver;
    }

    /**
     * Removes the giver's current assignment.
     *
     * @param giver giver index
     */
    public void unassign(int giver) {
        int receiver = receiverOf[giver];
        if (receiver == NONE) {
            throw new IllegalStateException("Giver " + giver + " is not assigned");
        }
        receiverOf[giver] = NONE;
        giverOf[receiver] = NONE;
        assignedCount--;
        lastGiver = NONE;
    }

    public boolean isGiverAssigned(int giver) {
        return receiverOf[giver] != NONE;
    }

    public boolean isReceiverTaken(int receiver) {
        return giverOf[receiver] != NONE;
    }

    /**
     * Gets the receiver of a giver.
     *
     * @param giver giver index
     * @return receiver index, or -1 if unassigned
     */
    public int getReceiverOf(int giver) {
        return receiverOf[giver];
    }

    /**
     * Gets the giver of a receiver.
     *
     * @param receiver receiver index
     * @return giver index, or -1 if nobody gives to them yet
     */
    public int getGiverOf(int receiver) {
        return giverOf[receiver];
    }

    /**
     * Gets the giver of the most recent assignment.
     *
     * @return giver index, or -1 if the last operation was an unassign
     */
    public int getLastGiver() {
        return lastGiver;
    }

    public int getAssignedCount() {
        return assignedCount;
    }

    public int size() {
        return receiverOf.length;
    }

    /**
     * Checks whether everyone has a receiver.
     *
     * @return true once the assignment is total
     */
    public boolean isComplete() {
        return assignedCount == receiverOf.length;
    }

    /**
     * Copies the receiver array.
     *
     * @return receiverOf[g] for every giver
     */
    public int[] toReceiverArray() {
        return receiverOf.clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int g = 0; g < receiverOf.length; g++) {
            if (receiverOf[g] != NONE) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(model.getRoster().getPerson(g).getName()).append("->")
                  .append(model.getRoster().getPerson(receiverOf[g]).getName());
            }
        }
        return "[" + sb + "] " + assignedCount + "/" + receiverOf.length;
    }
}
