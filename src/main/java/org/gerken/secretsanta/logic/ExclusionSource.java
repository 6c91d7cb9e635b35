package org.gerken.secretsanta.logic;

/**
 * Why a giver/receiver edge is forbidden.
 * An edge may be forbidden for several reasons at once; {@link ConstraintModel}
 * keeps all of them so failures can say which rule to relax.
 */
public enum ExclusionSource {

    /** Nobody gives to themselves. */
    SELF("self"),
    /** An explicit blacklist pair. */
    BLACKLIST("blacklist"),
    /** Both people belong to the same blacklist set. */
    HOUSEHOLD("household"),
    /** The pair was drawn in an excluded history year. */
    HISTORY("history"),
    /** The pair belongs to a solution already drawn in this run. */
    DRAWN("earlier draw");

    private final String label;

    ExclusionSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Checks whether a caller could reasonably drop this category to find a solution.
     *
     * @return true for rules that come from configuration
     */
    public boolean isRelaxable() {
        return this == BLACKLIST || this == HOUSEHOLD || this == HISTORY;
    }

    int mask() {
        return 1 << ordinal();
    }
}
