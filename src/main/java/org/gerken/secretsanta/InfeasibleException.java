package org.gerken.secretsanta;

import org.gerken.secretsanta.logic.ExclusionSource;
import org.gerken.secretsanta.logic.SearchStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * No assignment satisfies every rule. This is a proof, not a timeout: either a person
 * has no legal partner at all, or the search visited every possibility.
 */
public class InfeasibleException extends AssignmentException {

    private final List<String> overConstrainedPeople;
    private final Set<ExclusionSource> relaxableSources;
    private final SearchStatistics statistics;

    /**
     * Creates an infeasibility report.
     *
     * @param detail what made the draw impossible
     * @param overConstrainedPeople names of people left without any legal partner, may be empty
     * @param statistics statistics of the search, may be null if no search ran
     */
    public InfeasibleException(String detail, List<String> overConstrainedPeople,
                               SearchStatistics statistics) {
        this(detail, overConstrainedPeople, EnumSet.noneOf(ExclusionSource.class), statistics, null);
    }

    private InfeasibleException(String detail, List<String> overConstrainedPeople,
                                Set<ExclusionSource> relaxableSources, SearchStatistics statistics,
                                Throwable cause) {
        super(detail, cause);
        this.overConstrainedPeople = Collections.unmodifiableList(new ArrayList<>(overConstrainedPeople));
        this.relaxableSources = Collections.unmodifiableSet(
            relaxableSources.isEmpty() ? EnumSet.noneOf(ExclusionSource.class) : EnumSet.copyOf(relaxableSources));
        this.statistics = statistics;
    }

    /**
     * Creates a copy of this report that also names the rule categories whose removal
     * alone would make the draw solvable.
     *
     * @param sources the categories found to be relaxable
     * @return the enriched exception, caused by this one
     */
    public InfeasibleException withRelaxableSources(Set<ExclusionSource> sources) {
        String message = getMessage();
        if (!sources.isEmpty()) {
            List<String> labels = new ArrayList<>();
            for (ExclusionSource source : sources) {
                labels.add(source.getLabel());
            }
            message = message + " (relaxing " + String.join(" or ", labels) + " rules would allow a solution)";
        }
        return new InfeasibleException(message, overConstrainedPeople, sources, statistics, this);
    }

    /**
     * Gets the people left without any legal receiver or giver.
     *
     * @return the names, empty when infeasibility was only found by exhausting the search
     */
    public List<String> getOverConstrainedPeople() {
        return overConstrainedPeople;
    }

    /**
     * Gets the rule categories that, dropped on their own, make the draw solvable.
     *
     * @return the relaxable categories, empty if none was found
     */
    public Set<ExclusionSource> getRelaxableSources() {
        return relaxableSources;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }
}
