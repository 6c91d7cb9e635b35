package org.gerken.secretsanta.logic;

import org.gerken.secretsanta.ConfigurationException;
import org.gerken.secretsanta.model.ConstraintSet;
import org.gerken.secretsanta.model.HistoryRecord;
import org.gerken.secretsanta.model.Pair;
import org.gerken.secretsanta.model.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a roster and its rules for consistency and merges the rules into a
 * {@link ConstraintModel}.
 *
 * Every conflict is collected before failing, so a single {@link ConfigurationException}
 * describes everything that needs fixing. Validation has no side effects: running it
 * twice on the same input gives the same verdict.
 */
public class ConstraintValidator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintValidator.class);

    private final HistoryWindow historyWindow;

    /**
     * Creates a validator that applies every excluding history record.
     */
    public ConstraintValidator() {
        this(HistoryWindow.unbounded());
    }

    /**
     * Creates a validator with the given history policy.
     *
     * @param historyWindow decides which history records forbid their pairs
     */
    public ConstraintValidator(HistoryWindow historyWindow) {
        this.historyWindow = Objects.requireNonNull(historyWindow, "historyWindow");
    }

    public HistoryWindow getHistoryWindow() {
        return historyWindow;
    }

    /**
     * Validates the rules against the roster and builds the normalized model.
     *
     * @param roster the people taking part
     * @param constraints the rules to apply
     * @return the merged forbidden and forced relations
     * @throws ConfigurationException listing every conflict found
     */
    public ConstraintModel validate(Roster roster, ConstraintSet constraints) {
        Objects.requireNonNull(roster, "roster");
        Objects.requireNonNull(constraints, "constraints");

        List<String> conflicts = new ArrayList<>();
        checkNames(roster, constraints.getWhitelist(), "whitelist pair", conflicts);
        checkNames(roster, constraints.getBlacklist(), "blacklist pair", conflicts);
        for (List<String> set : constraints.getBlacklistSets()) {
            checkSet(roster, set, conflicts);
        }
        for (HistoryRecord record : constraints.getHistory()) {
            checkNames(roster, record.getPairs(), "history " + record.getYear() + " pair", conflicts);
        }

        int n = roster.size();
        int[][] exclusions = new int[n][n];
        for (int i = 0; i < n; i++) {
            exclusions[i][i] |= ExclusionSource.SELF.mask();
        }
        forbidPairs(roster, constraints.getBlacklist(), ExclusionSource.BLACKLIST, exclusions);
        for (List<String> set : constraints.getBlacklistSets()) {
            forbidSet(roster, set, exclusions);
        }
        List<HistoryRecord> applicable = historyWindow.select(constraints.getHistory());
        for (HistoryRecord record : applicable) {
            forbidPairs(roster, record.getPairs(), ExclusionSource.HISTORY, exclusions);
        }

        int[] forcedReceiver = checkWhitelist(roster, constraints.getWhitelist(), exclusions, conflicts);

        if (!conflicts.isEmpty()) {
            log.debug("Rejected configuration with {} conflict(s): {}", conflicts.size(), conflicts);
            throw new ConfigurationException(conflicts);
        }

        log.debug("Validated {} people with {} history record(s) applied ({})",
            n, applicable.size(), historyWindow);
        return new ConstraintModel(roster, exclusions, forcedReceiver);
    }

    private void checkNames(Roster roster, List<Pair> pairs, String label, List<String> conflicts) {
        for (Pair pair : pairs) {
            if (!roster.contains(pair.getGiver())) {
                conflicts.add(label + " " + pair + " references unknown giver '" + pair.getGiver() + "'");
            }
            if (!roster.contains(pair.getReceiver())) {
                conflicts.add(label + " " + pair + " references unknown receiver '" + pair.getReceiver() + "'");
            }
        }
    }

    private void checkSet(Roster roster, List<String> set, List<String> conflicts) {
        Set<String> distinct = new LinkedHashSet<>(set);
        if (distinct.size() < 2) {
            conflicts.add("blacklist set " + set + " needs at least 2 distinct people");
        }
        for (String name : distinct) {
            if (!roster.contains(name)) {
                conflicts.add("blacklist set " + set + " references unknown person '" + name + "'");
            }
        }
    }

    private void forbidPairs(Roster roster, List<Pair> pairs, ExclusionSource source, int[][] exclusions) {
        for (Pair pair : pairs) {
            int g = roster.indexOf(pair.getGiver());
            int r = roster.indexOf(pair.getReceiver());
            if (g >= 0 && r >= 0) {
                exclusions[g][r] |= source.mask();
            }
        }
    }

    private void forbidSet(Roster roster, List<String> set, int[][] exclusions) {
        for (String a : set) {
            for (String b : set) {
                int x = roster.indexOf(a);
                int y = roster.indexOf(b);
                if (x >= 0 && y >= 0 && x != y) {
                    exclusions[x][y] |= ExclusionSource.HOUSEHOLD.mask();
                }
            }
        }
    }

    /**
     * Resolves whitelist pairs into forced receivers, reporting pairs that can never
     * hold together: self-pairs, a person forced twice in the same role, forced
     * 2-cycles, and forced pairs that another rule forbids.
     */
    private int[] checkWhitelist(Roster roster, List<Pair> whitelist, int[][] exclusions,
                                 List<String> conflicts) {
        int n = roster.size();
        int[] forcedReceiver = new int[n];
        int[] forcedGiver = new int[n];
        Arrays.fill(forcedReceiver, -1);
        Arrays.fill(forcedGiver, -1);

        for (Pair pair : whitelist) {
            int g = roster.indexOf(pair.getGiver());
            int r = roster.indexOf(pair.getReceiver());
            if (g < 0 || r < 0) {
                continue;
            }
            if (g == r) {
                conflicts.add("whitelist pair " + pair + " is a self-pair");
                continue;
            }
            if (forcedReceiver[g] == r) {
                continue; // repeated entry
            }
            if (forcedReceiver[g] != -1) {
                conflicts.add(pair.getGiver() + " is whitelisted to give to both "
                    + roster.getPerson(forcedReceiver[g]).getName() + " and " + pair.getReceiver());
                continue;
            }
            if (forcedGiver[r] != -1) {
                conflicts.add(pair.getReceiver() + " is whitelisted to receive from both "
                    + roster.getPerson(forcedGiver[r]).getName() + " and " + pair.getGiver());
                continue;
            }
            if (forcedReceiver[r] == g) {
                conflicts.add("whitelist pairs " + pair.reversed() + " and " + pair + " form a 2-cycle");
                continue;
            }
            int mask = exclusions[g][r] & ~ExclusionSource.SELF.mask();
            if (mask != 0) {
                conflicts.add("whitelist pair " + pair + " is also forbidden by " + describe(mask));
                continue;
            }
            forcedReceiver[g] = r;
            forcedGiver[r] = g;
        }
        return forcedReceiver;
    }

    private String describe(int mask) {
        List<String> labels = new ArrayList<>();
        for (ExclusionSource source : ExclusionSource.values()) {
            if ((mask & source.mask()) != 0) {
                labels.add(source.getLabel());
            }
        }
        return String.join(" and ", labels);
    }
}
