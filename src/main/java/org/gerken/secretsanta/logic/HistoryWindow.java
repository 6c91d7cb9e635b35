package org.gerken.secretsanta.logic;

import org.gerken.secretsanta.model.HistoryRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides which history records turn into forbidden pairs.
 *
 * Only records flagged {@code excludePairs} ever count. On top of that the window
 * limits how far back to look, since excluding every past year eventually leaves a
 * small group without a solution.
 */
public class HistoryWindow {

    private enum Kind { UNBOUNDED, TRAILING_YEARS, SINCE_YEAR }

    private static final HistoryWindow UNBOUNDED = new HistoryWindow(Kind.UNBOUNDED, 0);

    private final Kind kind;
    private final int value;

    private HistoryWindow(Kind kind, int value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Every excluding record counts, however old.
     *
     * @return the unbounded window
     */
    public static HistoryWindow unbounded() {
        return UNBOUNDED;
    }

    /**
     * Only the most recent {@code years} years count, measured back from the newest
     * record in the history. {@code trailingYears(1)} keeps only the latest year.
     *
     * @param years number of years to look back, at least 1
     * @return the window
     */
    public static HistoryWindow trailingYears(int years) {
        if (years < 1) {
            throw new IllegalArgumentException("years must be at least 1: " + years);
        }
        return new HistoryWindow(Kind.TRAILING_YEARS, years);
    }

    /**
     * Only records from {@code year} onward count.
     *
     * @param year the first year to include
     * @return the window
     */
    public static HistoryWindow sinceYear(int year) {
        return new HistoryWindow(Kind.SINCE_YEAR, year);
    }

    /**
     * Selects the records whose pairs are forbidden for the current draw.
     *
     * @param history all history records, in any order
     * @return the applicable records, newest first
     */
    public List<HistoryRecord> select(List<HistoryRecord> history) {
        int firstYear = firstIncludedYear(history);
        List<HistoryRecord> selected = new ArrayList<>();
        for (HistoryRecord record : history) {
            if (record.isExcludePairs() && record.getYear() >= firstYear) {
                selected.add(record);
            }
        }
        selected.sort(Comparator.comparingInt(HistoryRecord::getYear).reversed());
        return selected;
    }

    private int firstIncludedYear(List<HistoryRecord> history) {
        switch (kind) {
            case TRAILING_YEARS:
                int newest = Integer.MIN_VALUE;
                for (HistoryRecord record : history) {
                    newest = Math.max(newest, record.getYear());
                }
                return newest == Integer.MIN_VALUE ? newest : newest - value + 1;
            case SINCE_YEAR:
                return value;
            default:
                return Integer.MIN_VALUE;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case TRAILING_YEARS:
                return "last " + value + " year(s)";
            case SINCE_YEAR:
                return "since " + value;
            default:
                return "all years";
        }
    }
}
