package org.gerken.secretsanta.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The raw exclusion and inclusion rules for a draw, exactly as supplied by the caller.
 * Nothing is checked here; {@code ConstraintValidator} resolves names against a roster
 * and reports conflicts.
 *
 * Example:
 * <pre>
 * ConstraintSet constraints = ConstraintSet.builder()
 *     .blacklistSet("John", "Sean")
 *     .history(new HistoryRecord(2024, true, List.of(Pair.of("John", "Shane"))))
 *     .build();
 * </pre>
 */
public class ConstraintSet {

    private static final Comparator<HistoryRecord> NEWEST_FIRST =
        Comparator.comparingInt(HistoryRecord::getYear).reversed();

    private final List<Pair> whitelist;
    private final List<Pair> blacklist;
    private final List<List<String>> blacklistSets;
    private final List<HistoryRecord> history;

    private ConstraintSet(Builder builder) {
        this.whitelist = Collections.unmodifiableList(new ArrayList<>(builder.whitelist));
        this.blacklist = Collections.unmodifiableList(new ArrayList<>(builder.blacklist));
        List<List<String>> sets = new ArrayList<>();
        for (List<String> set : builder.blacklistSets) {
            sets.add(Collections.unmodifiableList(new ArrayList<>(set)));
        }
        this.blacklistSets = Collections.unmodifiableList(sets);
        List<HistoryRecord> sorted = new ArrayList<>(builder.history);
        sorted.sort(NEWEST_FIRST);
        this.history = Collections.unmodifiableList(sorted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConstraintSet empty() {
        return new Builder().build();
    }

    /**
     * Gets the pairs that must appear in the solution.
     *
     * @return the forced pairs
     */
    public List<Pair> getWhitelist() {
        return whitelist;
    }

    /**
     * Gets the pairs that must not appear in the solution.
     *
     * @return the forbidden pairs
     */
    public List<Pair> getBlacklist() {
        return blacklist;
    }

    /**
     * Gets the groups (households) whose members may not be paired with each other
     * in either direction.
     *
     * @return the blacklist sets
     */
    public List<List<String>> getBlacklistSets() {
        return blacklistSets;
    }

    /**
     * Gets all history records, newest year first.
     *
     * @return the history
     */
    public List<HistoryRecord> getHistory() {
        return history;
    }

    /**
     * Creates a copy of this constraint set with its history replaced.
     *
     * @param records the history records to use instead
     * @return a new constraint set
     */
    public ConstraintSet withHistory(List<HistoryRecord> records) {
        return toBuilder().clearHistory().history(records).build();
    }

    /**
     * Creates a builder pre-populated with this set's rules.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.whitelist.addAll(whitelist);
        builder.blacklist.addAll(blacklist);
        builder.blacklistSets.addAll(blacklistSets);
        builder.history.addAll(history);
        return builder;
    }

    /**
     * Gets whom the named person gave to in past years, newest year first.
     * Every record counts, whether or not it excludes its pairs.
     *
     * @param giver the person's name
     * @return map of year to receiver name
     */
    public Map<Integer, String> pastReceiversOf(String giver) {
        Map<Integer, String> result = new LinkedHashMap<>();
        for (HistoryRecord record : history) {
            for (Pair pair : record.getPairs()) {
                if (pair.getGiver().equals(giver)) {
                    result.putIfAbsent(record.getYear(), pair.getReceiver());
                }
            }
        }
        return result;
    }

    /**
     * Gets who gave to the named person in past years, newest year first.
     *
     * @param receiver the person's name
     * @return map of year to giver name
     */
    public Map<Integer, String> pastGiversOf(String receiver) {
        Map<Integer, String> result = new LinkedHashMap<>();
        for (HistoryRecord record : history) {
            for (Pair pair : record.getPairs()) {
                if (pair.getReceiver().equals(receiver)) {
                    result.putIfAbsent(record.getYear(), pair.getGiver());
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "whitelist=" + whitelist + ", blacklist=" + blacklist
            + ", blacklistSets=" + blacklistSets + ", history=" + history;
    }

    /**
     * Accumulates rules for a {@link ConstraintSet}.
     */
    public static class Builder {

        private final List<Pair> whitelist = new ArrayList<>();
        private final List<Pair> blacklist = new ArrayList<>();
        private final List<List<String>> blacklistSets = new ArrayList<>();
        private final List<HistoryRecord> history = new ArrayList<>();

        private Builder() {
        }

        public Builder whitelist(String giver, String receiver) {
            whitelist.add(new Pair(giver, receiver));
            return this;
        }

        public Builder whitelist(List<Pair> pairs) {
            whitelist.addAll(pairs);
            return this;
        }

        public Builder blacklist(String giver, String receiver) {
            blacklist.add(new Pair(giver, receiver));
            return this;
        }

        public Builder blacklist(List<Pair> pairs) {
            blacklist.addAll(pairs);
            return this;
        }

        public Builder blacklistSet(String... names) {
            blacklistSets.add(List.of(names));
            return this;
        }

        public Builder blacklistSet(List<String> names) {
            blacklistSets.add(new ArrayList<>(names));
            return this;
        }

        public Builder history(HistoryRecord record) {
            history.add(record);
            return this;
        }

        public Builder history(List<HistoryRecord> records) {
            history.addAll(records);
            return this;
        }

        Builder clearHistory() {
            history.clear();
            return this;
        }

        public ConstraintSet build() {
            return new ConstraintSet(this);
        }
    }
}
