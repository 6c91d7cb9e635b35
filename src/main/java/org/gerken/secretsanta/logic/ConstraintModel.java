package org.gerken.secretsanta.logic;

import org.gerken.secretsanta.model.Roster;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Normalized, index-based form of a validated roster and its rules.
 *
 * All exclusions (self, blacklist, household, history) are merged into a single
 * forbidden relation, with a bitmask per edge recording which categories forbid it.
 * The whitelist becomes a forced receiver per giver. Instances are immutable.
 */
public class ConstraintModel {

    private static final int NONE = -1;

    private final Roster roster;
    private final int[][] exclusions;
    private final int[] forcedReceiver;
    private final int[] forcedGiver;

    /**
     * Creates a model. Callers go through {@link ConstraintValidator}, which guarantees
     * that forced pairs are consistent and not forbidden.
     *
     * @param roster the roster indices refer to
     * @param exclusions exclusions[g][r] is a bitmask of {@link ExclusionSource} ordinals
     * @param forcedReceiver forcedReceiver[g] is the forced receiver of g, or -1
     */
    ConstraintModel(Roster roster, int[][] exclusions, int[] forcedReceiver) {
        this.roster = roster;
        this.exclusions = exclusions;
        this.forcedReceiver = forcedReceiver;
        this.forcedGiver = new int[forcedReceiver.length];
        Arrays.fill(forcedGiver, NONE);
        for (int g = 0; g < forcedReceiver.length; g++) {
            if (forcedReceiver[g] != NONE) {
                forcedGiver[forcedReceiver[g]] = g;
            }
        }
    }

    public Roster getRoster() {
        return roster;
    }

    /**
     * Gets the number of people.
     *
     * @return the roster size
     */
    public int size() {
        return forcedReceiver.length;
    }

    /**
     * Checks whether the edge giver->receiver is forbidden by any rule, including the
     * self-pair rule.
     *
     * @param giver giver index
     * @param receiver receiver index
     * @return true if the edge may never appear in a solution
     */
    public boolean isForbidden(int giver, int receiver) {
        return exclusions[giver][receiver] != 0;
    }

    /**
     * Gets every category that forbids the edge giver->receiver.
     *
     * @param giver giver index
     * @param receiver receiver index
     * @return the categories, empty if the edge is allowed
     */
    public Set<ExclusionSource> getExclusionSources(int giver, int receiver) {
        Set<ExclusionSource> sources = EnumSet.noneOf(ExclusionSource.class);
        int mask = exclusions[giver][receiver];
        for (ExclusionSource source : ExclusionSource.values()) {
            if ((mask & source.mask()) != 0) {
                sources.add(source);
            }
        }
        return sources;
    }

    /**
     * Checks whether any edge is forbidden by the given category.
     *
     * @param source the category
     * @return true if the category contributes at least one edge
     */
    public boolean hasSource(ExclusionSource source) {
        for (int[] row : exclusions) {
            for (int mask : row) {
                if ((mask & source.mask()) != 0) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Gets the whitelisted receiver for a giver.
     *
     * @param giver giver index
     * @return the forced receiver index, or -1 if the giver is free
     */
    public int getForcedReceiver(int giver) {
        return forcedReceiver[giver];
    }

    /**
     * Gets the whitelisted giver for a receiver.
     *
     * @param receiver receiver index
     * @return the forced giver index, or -1 if none
     */
    public int getForcedGiver(int receiver) {
        return forcedGiver[receiver];
    }

    public boolean isForced(int giver) {
        return forcedReceiver[giver] != NONE;
    }

    /**
     * Creates a model with one category of exclusions removed.
     *
     * @param source the category to drop; must be relaxable
     * @return the relaxed model
     */
    public ConstraintModel without(ExclusionSource source) {
        if (source == ExclusionSource.SELF) {
            throw new IllegalArgumentException("The self-pair rule cannot be relaxed");
        }
        int[][] relaxed = copyExclusions();
        for (int[] row : relaxed) {
            for (int r = 0; r < row.length; r++) {
                row[r] &= ~source.mask();
            }
        }
        return new ConstraintModel(roster, relaxed, forcedReceiver.clone());
    }

    /**
     * Creates a model that additionally forbids the free edges of an assignment.
     * Forced edges stay allowed.
     *
     * @param receiverOf receiverOf[g] is the receiver of g
     * @param source the category to record the new exclusions under
     * @return the stricter model
     */
    public ConstraintModel excluding(int[] receiverOf, ExclusionSource source) {
        int[][] stricter = copyExclusions();
        for (int g = 0; g < receiverOf.length; g++) {
            if (forcedReceiver[g] != receiverOf[g]) {
                stricter[g][receiverOf[g]] |= source.mask();
            }
        }
        return new ConstraintModel(roster, stricter, forcedReceiver.clone());
    }

    private int[][] copyExclusions() {
        int[][] copy = new int[exclusions.length][];
        for (int i = 0; i < exclusions.length; i++) {
            copy[i] = exclusions[i].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int g = 0; g < size(); g++) {
            sb.append(roster.getPerson(g).getName()).append(':');
            for (int r = 0; r < size(); r++) {
                if (forcedReceiver[g] == r) {
                    sb.append(" +").append(roster.getPerson(r).getName());
                } else if (!isForbidden(g, r)) {
                    sb.append(' ').append(roster.getPerson(r).getName());
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
