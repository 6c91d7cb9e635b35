package org.gerken.secretsanta.logic;

/**
 * One level of the backtracking stack: a giver, the receivers still to try for them,
 * and the receiver currently assigned.
 */
class SearchFrame {

    private static final int NONE = -1;

    private final int giver;
    private final int[] candidates;
    private int next;
    private int current = NONE;

    /**
     * Creates a frame.
     *
     * @param giver the giver at this depth
     * @param candidates receivers to try, in the order they should be tried
     */
    SearchFrame(int giver, int[] candidates) {
        this.giver = giver;
        this.candidates = candidates;
    }

    int getGiver() {
        return giver;
    }

    boolean hasNextCandidate() {
        return next < candidates.length;
    }

    int nextCandidate() {
        return candidates[next++];
    }

    boolean hasAssignment() {
        return current != NONE;
    }

    void setAssignment(int receiver) {
        this.current = receiver;
    }

    void clearAssignment() {
        this.current = NONE;
    }
}
