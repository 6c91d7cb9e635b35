package org.gerken.secretsanta;

import org.gerken.secretsanta.logic.SearchStatistics;

/**
 * The search used up its step bound before finding an assignment or proving that
 * none exists. The caller may retry with a larger bound.
 */
public class SearchLimitException extends AssignmentException {

    private final long bound;
    private final SearchStatistics statistics;

    public SearchLimitException(long bound, SearchStatistics statistics) {
        super("Search stopped after " + bound + " steps without a result; "
            + "retry with a larger bound or fewer rules (" + statistics + ")");
        this.bound = bound;
        this.statistics = statistics;
    }

    public long getBound() {
        return bound;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }
}
