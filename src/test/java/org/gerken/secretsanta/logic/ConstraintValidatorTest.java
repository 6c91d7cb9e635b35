package org.gerken.secretsanta.logic;

import org.gerken.secretsanta.ConfigurationException;
import org.gerken.secretsanta.model.ConstraintSet;
import org.gerken.secretsanta.model.HistoryRecord;
import org.gerken.secretsanta.model.Pair;
import org.gerken.secretsanta.model.Person;
import org.gerken.secretsanta.model.Roster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintValidatorTest {

    private final Roster roster = Roster.of(
        new Person("John", "john@email.com"),
        new Person("Sean", "sean@email.com"),
        new Person("Shane", "shane@email.com"),
        new Person("Mary", "mary@email.com"));

    private final ConstraintValidator validator = new ConstraintValidator();

    private List<String> conflictsOf(ConstraintSet constraints) {
        try {
            validator.validate(roster, constraints);
        } catch (ConfigurationException e) {
            return e.getConflicts();
        }
        throw new AssertionError("expected a configuration error");
    }

    private int index(String name) {
        return roster.indexOf(name);
    }

    // =========================================================================
    //  Names
    // =========================================================================

    @Nested
    @DisplayName("Unknown names")
    class UnknownNames {

        @Test
        void inPairs() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("Bob", "John")
                .blacklist("John", "Bob")
                .history(new HistoryRecord(2023, false, List.of(Pair.of("Sean", "Ann"))))
                .build();

            assertThat(conflictsOf(constraints)).containsExactly(
                "whitelist pair Bob->John references unknown giver 'Bob'",
                "blacklist pair John->Bob references unknown receiver 'Bob'",
                "history 2023 pair Sean->Ann references unknown receiver 'Ann'");
        }

        @Test
        void inBlacklistSets() {
            ConstraintSet constraints = ConstraintSet.builder()
                .blacklistSet("John", "John")
                .blacklistSet("Sean", "Bob")
                .build();

            assertThat(conflictsOf(constraints)).containsExactly(
                "blacklist set [John, John] needs at least 2 distinct people",
                "blacklist set [Sean, Bob] references unknown person 'Bob'");
        }
    }

    // =========================================================================
    //  Whitelist
    // =========================================================================

    @Nested
    @DisplayName("Whitelist conflicts")
    class WhitelistConflicts {

        @Test
        void selfPair() {
            assertThat(conflictsOf(ConstraintSet.builder().whitelist("John", "John").build()))
                .containsExactly("whitelist pair John->John is a self-pair");
        }

        @Test
        void giverForcedTwice() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("John", "Sean")
                .whitelist("John", "Shane")
                .build();

            assertThat(conflictsOf(constraints))
                .containsExactly("John is whitelisted to give to both Sean and Shane");
        }

        @Test
        void receiverForcedTwice() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("Sean", "John")
                .whitelist("Shane", "John")
                .build();

            assertThat(conflictsOf(constraints))
                .containsExactly("John is whitelisted to receive from both Sean and Shane");
        }

        @Test
        void forcedTwoCycle() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("John", "Sean")
                .whitelist("Sean", "John")
                .build();

            assertThat(conflictsOf(constraints))
                .containsExactly("whitelist pairs John->Sean and Sean->John form a 2-cycle");
        }

        @Test
        @DisplayName("every rule forbidding a whitelist pair is named")
        void forbiddenByOtherRules() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("John", "Sean")
                .blacklist("John", "Sean")
                .blacklistSet("John", "Sean")
                .history(new HistoryRecord(2024, true, List.of(Pair.of("John", "Sean"))))
                .build();

            assertThat(conflictsOf(constraints)).containsExactly(
                "whitelist pair John->Sean is also forbidden by blacklist and household and history");
        }

        @Test
        @DisplayName("a repeated whitelist pair is not a conflict")
        void repeatedPair() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("John", "Sean")
                .whitelist("John", "Sean")
                .build();

            ConstraintModel model = validator.validate(roster, constraints);

            assertThat(model.getForcedReceiver(index("John"))).isEqualTo(index("Sean"));
            assertThat(model.getForcedGiver(index("Sean"))).isEqualTo(index("John"));
        }

        @Test
        @DisplayName("all conflicts are reported at once")
        void collectsEverything() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("John", "John")
                .whitelist("Sean", "Shane")
                .blacklist("Sean", "Shane")
                .blacklist("Mary", "Bob")
                .build();

            assertThatThrownBy(() -> validator.validate(roster, constraints))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Invalid secret santa configuration: ")
                .satisfies(e -> assertThat(((ConfigurationException) e).getConflicts()).hasSize(3));
        }
    }

    // =========================================================================
    //  Model
    // =========================================================================

    @Nested
    @DisplayName("Resulting model")
    class ResultingModel {

        @Test
        void recordsWhyEachEdgeIsForbidden() {
            ConstraintSet constraints = ConstraintSet.builder()
                .blacklist("John", "Sean")
                .blacklistSet("John", "Sean")
                .history(new HistoryRecord(2024, true, List.of(Pair.of("Shane", "Mary"))))
                .history(new HistoryRecord(2023, false, List.of(Pair.of("Mary", "John"))))
                .build();

            ConstraintModel model = validator.validate(roster, constraints);

            assertThat(model.getExclusionSources(index("John"), index("Sean")))
                .containsExactly(ExclusionSource.BLACKLIST, ExclusionSource.HOUSEHOLD);
            assertThat(model.getExclusionSources(index("Sean"), index("John")))
                .containsExactly(ExclusionSource.HOUSEHOLD);
            assertThat(model.getExclusionSources(index("Shane"), index("Mary")))
                .containsExactly(ExclusionSource.HISTORY);
            assertThat(model.getExclusionSources(index("Mary"), index("Mary")))
                .containsExactly(ExclusionSource.SELF);
            assertThat(model.isForbidden(index("Mary"), index("John"))).isFalse();
            assertThat(model.hasSource(ExclusionSource.DRAWN)).isFalse();
        }

        @Test
        @DisplayName("the history window limits which years are forbidden")
        void appliesHistoryWindow() {
            ConstraintSet constraints = ConstraintSet.builder()
                .history(new HistoryRecord(2023, true, List.of(Pair.of("John", "Sean"))))
                .history(new HistoryRecord(2024, true, List.of(Pair.of("John", "Shane"))))
                .build();

            ConstraintModel model = new ConstraintValidator(HistoryWindow.trailingYears(1))
                .validate(roster, constraints);

            assertThat(model.isForbidden(index("John"), index("Shane"))).isTrue();
            assertThat(model.isForbidden(index("John"), index("Sean"))).isFalse();
        }

        @Test
        @DisplayName("validating twice gives the same model")
        void idempotent() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("Mary", "John")
                .blacklistSet("John", "Sean", "Shane")
                .build();

            ConstraintModel first = validator.validate(roster, constraints);
            ConstraintModel second = validator.validate(roster, constraints);

            assertThat(second.toString()).isEqualTo(first.toString());
        }

        @Test
        void relaxingAndExcluding() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("Mary", "John")
                .blacklistSet("John", "Sean")
                .build();
            ConstraintModel model = validator.validate(roster, constraints);

            ConstraintModel relaxed = model.without(ExclusionSource.HOUSEHOLD);
            assertThat(relaxed.isForbidden(index("John"), index("Sean"))).isFalse();
            assertThat(model.isForbidden(index("John"), index("Sean"))).isTrue();
            assertThatThrownBy(() -> model.without(ExclusionSource.SELF))
                .isInstanceOf(IllegalArgumentException.class);

            // John->Shane, Sean->Mary, Shane->Sean, Mary->John (forced)
            int[] drawn = {index("Shane"), index("Mary"), index("Sean"), index("John")};
            ConstraintModel stricter = model.excluding(drawn, ExclusionSource.DRAWN);
            assertThat(stricter.getExclusionSources(index("John"), index("Shane")))
                .containsExactly(ExclusionSource.DRAWN);
            assertThat(stricter.isForbidden(index("Mary"), index("John"))).isFalse();
            assertThat(stricter.isForced(index("Mary"))).isTrue();
        }
    }
}
