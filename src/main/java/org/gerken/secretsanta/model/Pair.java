package org.gerken.secretsanta.model;

import java.util.Objects;

/**
 * An ordered giver/receiver pair of person names.
 * Used both as an edge of a solution and as a whitelist, blacklist or history entry.
 * Pairs are written "giver->receiver" (e.g., "Sean->Shane").
 */
public class Pair {

    private final String giver;
    private final String receiver;

    /**
     * Creates a pair.
     *
     * @param giver the name of the person giving
     * @param receiver the name of the person receiving
     */
    public Pair(String giver, String receiver) {
        this.giver = Objects.requireNonNull(giver, "giver");
        this.receiver = Objects.requireNonNull(receiver, "receiver");
    }

    public static Pair of(String giver, String receiver) {
        return new Pair(giver, receiver);
    }

    public String getGiver() {
        return giver;
    }

    public String getReceiver() {
        return receiver;
    }

    /**
     * Gets the pair with giver and receiver exchanged.
     *
     * @return the reversed pair
     */
    public Pair reversed() {
        return new Pair(receiver, giver);
    }

    /**
     * Checks whether the giver and receiver are the same person.
     *
     * @return true for a self-pair
     */
    public boolean isSelfPair() {
        return giver.equals(receiver);
    }

    @Override
    public String toString() {
        return giver + "->" + receiver;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Pair pair = (Pair) o;
        return giver.equals(pair.giver) && receiver.equals(pair.receiver);
    }

    @Override
    public int hashCode() {
        return 31 * giver.hashCode() + receiver.hashCode();
    }
}
