package org.gerken.secretsanta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The roster or rules are inconsistent: an unknown person is referenced, a rule is
 * malformed, or a forced pair is also forbidden. Raised before any search is attempted.
 */
public class ConfigurationException extends AssignmentException {

    private final List<String> conflicts;

    /**
     * Creates an exception listing every conflict found.
     *
     * @param conflicts human readable descriptions, in detection order
     */
    public ConfigurationException(List<String> conflicts) {
        super("Invalid secret santa configuration: " + String.join("; ", conflicts));
        this.conflicts = Collections.unmodifiableList(new ArrayList<>(conflicts));
    }

    public ConfigurationException(String conflict) {
        this(List.of(conflict));
    }

    public List<String> getConflicts() {
        return conflicts;
    }
}
