package org.gerken.secretsanta.pruning;

import org.gerken.secretsanta.logic.ConstraintValidator;
import org.gerken.secretsanta.logic.SearchState;
import org.gerken.secretsanta.model.ConstraintSet;
import org.gerken.secretsanta.model.Person;
import org.gerken.secretsanta.model.Roster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrphanedReceiverRuleTest {

    private final Roster roster = Roster.of(
        new Person("A", "a@email.com"),
        new Person("B", "b@email.com"),
        new Person("C", "c@email.com"));

    private SearchState state(ConstraintSet constraints) {
        return new SearchState(new ConstraintValidator().validate(roster, constraints));
    }

    @Test
    @DisplayName("a receiver whose last possible giver is used up is orphaned")
    void detectsOrphanedReceiver() {
        SearchState state = state(ConstraintSet.builder().blacklist("A", "C").build());
        OrphanedReceiverRule rule = OrphanedReceiverRule.getInstance();

        assertThat(rule.isDeadEnd(state)).isFalse();

        state.assign(1, 0); // B->A

        assertThat(rule.isDeadEnd(state)).isTrue();
        assertThat(rule.findOrphanedReceivers(state)).containsExactly(2);
    }

    @Test
    void openStateIsNotADeadEnd() {
        SearchState state = state(ConstraintSet.empty());
        state.assign(0, 1);

        assertThat(OrphanedReceiverRule.getInstance().isDeadEnd(state)).isFalse();
    }

    @Test
    @DisplayName("a state without a last assignment is checked in full")
    void fullCheck() {
        SearchState state = state(ConstraintSet.builder().blacklist("A", "C").blacklist("B", "C").build());

        assertThat(OrphanedReceiverRule.getInstance().isDeadEnd(state)).isTrue();
        assertThat(OrphanedReceiverRule.getInstance().findOrphanedReceivers(state)).containsExactly(2);
    }

    @Test
    void singletonAndName() {
        assertThat(OrphanedReceiverRule.getInstance()).isSameAs(OrphanedReceiverRule.getInstance());
        assertThat(OrphanedReceiverRule.getInstance().getName()).isEqualTo("OrphanedReceiverRule");
    }
}
