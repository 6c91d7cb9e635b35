package org.gerken.secretsanta.model;

import org.gerken.secretsanta.logic.SearchStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A complete assignment: every person gives to exactly one other person and
 * receives from exactly one other person.
 *
 * The constructor rejects anything that is not a derangement of the roster, so a
 * Solution instance is always a total bijection without self-pairs.
 */
public class Solution {

    private final Roster roster;
    private final int[] receiverOf;
    private final int[] giverOf;
    private final SearchStatistics statistics;

    /**
     * Creates a solution from receiver indices.
     *
     * @param roster the roster the indices refer to
     * @param receiverOf receiverOf[g] is the roster index of the person g gives to
     * @param statistics statistics of the search that produced this solution
     * @throws IllegalArgumentException if the mapping is not a derangement of the roster
     */
    public Solution(Roster roster, int[] receiverOf, SearchStatistics statistics) {
        int n = roster.size();
        if (receiverOf.length != n) {
            throw new IllegalArgumentException(
                "Expected " + n + " receivers but got " + receiverOf.length);
        }
        int[] givers = new int[n];
        Arrays.fill(givers, -1);
        for (int g = 0; g < n; g++) {
            int r = receiverOf[g];
            if (r < 0 || r >= n) {
                throw new IllegalArgumentException(
                    roster.getPerson(g).getName() + " has no receiver");
            }
            if (r == g) {
                throw new IllegalArgumentException(
                    roster.getPerson(g).getName() + " is assigned to themselves");
            }
            if (givers[r] != -1) {
                throw new IllegalArgumentException(
                    roster.getPerson(r).getName() + " is assigned more than one giver");
            }
            givers[r] = g;
        }
        this.roster = roster;
        this.receiverOf = receiverOf.clone();
        this.giverOf = givers;
        this.statistics = statistics;
    }

    public Roster getRoster() {
        return roster;
    }

    /**
     * Gets statistics of the search that produced this solution.
     *
     * @return the statistics, or null if the solution was not produced by a search
     */
    public SearchStatistics getStatistics() {
        return statistics;
    }

    /**
     * Gets the person the named giver is assigned to.
     *
     * @param giver the giver's name
     * @return the receiver
     * @throws IllegalArgumentException if the giver is not in the roster
     */
    public Person receiverOf(String giver) {
        return roster.getPerson(receiverOf[requireIndex(giver)]);
    }

    /**
     * Gets the person assigned to give to the named receiver.
     *
     * @param receiver the receiver's name
     * @return the giver
     * @throws IllegalArgumentException if the receiver is not in the roster
     */
    public Person giverOf(String receiver) {
        return roster.getPerson(giverOf[requireIndex(receiver)]);
    }

    /**
     * Gets the receiver index for a giver index.
     *
     * @param giverIndex the giver's roster index
     * @return the receiver's roster index
     */
    public int getReceiverIndex(int giverIndex) {
        return receiverOf[giverIndex];
    }

    /**
     * Copies the receiver indices.
     *
     * @return element g is the roster index of the person g gives to
     */
    public int[] getReceiverIndices() {
        return receiverOf.clone();
    }

    /**
     * Checks whether the solution contains the given pair.
     *
     * @param pair the pair to look up
     * @return true if the pair's giver gives to the pair's receiver
     */
    public boolean contains(Pair pair) {
        int g = roster.indexOf(pair.getGiver());
        int r = roster.indexOf(pair.getReceiver());
        return g >= 0 && r >= 0 && receiverOf[g] == r;
    }

    /**
     * Gets all pairs, sorted by giver name.
     *
     * @return the pairs of this solution
     */
    public List<Pair> getPairs() {
        List<Pair> pairs = new ArrayList<>(receiverOf.length);
        for (int g = 0; g < receiverOf.length; g++) {
            pairs.add(new Pair(roster.getPerson(g).getName(),
                               roster.getPerson(receiverOf[g]).getName()));
        }
        pairs.sort(Comparator.comparing(Pair::getGiver));
        return pairs;
    }

    /**
     * Gets the assignment as a giver-to-receiver map in roster order.
     *
     * @return unmodifiable map from giver to receiver
     */
    public Map<Person, Person> asMap() {
        Map<Person, Person> map = new LinkedHashMap<>();
        for (int g = 0; g < receiverOf.length; g++) {
            map.put(roster.getPerson(g), roster.getPerson(receiverOf[g]));
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Records this solution as a history entry for use in later draws.
     *
     * @param year the year of this draw
     * @param excludePairs whether later draws should avoid these pairs
     * @return the history record
     */
    public HistoryRecord toHistoryRecord(int year, boolean excludePairs) {
        return new HistoryRecord(year, excludePairs, getPairs());
    }

    private int requireIndex(String name) {
        int index = roster.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown person: " + name);
        }
        return index;
    }

    @Override
    public String toString() {
        return getPairs().toString();
    }
}
