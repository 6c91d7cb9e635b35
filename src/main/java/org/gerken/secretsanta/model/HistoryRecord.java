package org.gerken.secretsanta.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The pairs drawn in a prior year.
 * When {@code excludePairs} is set, every pair becomes a forbidden edge for the
 * current draw; otherwise the record is kept for reference only.
 */
public class HistoryRecord {

    private final int year;
    private final boolean excludePairs;
    private final List<Pair> pairs;

    /**
     * Creates a history record.
     *
     * @param year the year the pairs were drawn
     * @param excludePairs whether these pairs are forbidden in the current draw
     * @param pairs the pairs in the order they were recorded
     */
    public HistoryRecord(int year, boolean excludePairs, List<Pair> pairs) {
        this.year = year;
        this.excludePairs = excludePairs;
        this.pairs = Collections.unmodifiableList(new ArrayList<>(pairs));
    }

    public int getYear() {
        return year;
    }

    public boolean isExcludePairs() {
        return excludePairs;
    }

    public List<Pair> getPairs() {
        return pairs;
    }

    @Override
    public String toString() {
        return year + (excludePairs ? " (excluded) " : " ") + pairs;
    }
}
