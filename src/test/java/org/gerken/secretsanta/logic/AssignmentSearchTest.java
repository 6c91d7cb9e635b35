package org.gerken.secretsanta.logic;

import org.gerken.secretsanta.ConfigurationException;
import org.gerken.secretsanta.InfeasibleException;
import org.gerken.secretsanta.SolutionChecks;
import org.gerken.secretsanta.model.ConstraintSet;
import org.gerken.secretsanta.model.HistoryRecord;
import org.gerken.secretsanta.model.Pair;
import org.gerken.secretsanta.model.Person;
import org.gerken.secretsanta.model.Roster;
import org.gerken.secretsanta.model.Solution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssignmentSearchTest {

    private static Roster people(String... names) {
        List<Person> persons = new ArrayList<>();
        for (String name : names) {
            persons.add(new Person(name, name.toLowerCase() + "@email.com"));
        }
        return new Roster(persons);
    }

    private static AssignmentSearch search(Roster roster, ConstraintSet constraints) {
        return new AssignmentSearch(new ConstraintValidator().validate(roster, constraints), 0);
    }

    @Nested
    @DisplayName("Small rosters")
    class SmallRosters {

        @Test
        void emptyRosterHasEmptySolution() {
            Solution solution = search(people(), ConstraintSet.empty()).run(new Random(1));

            assertThat(solution.getPairs()).isEmpty();
        }

        @Test
        @DisplayName("a single person is named as over-constrained")
        void singlePerson() {
            assertThatThrownBy(() -> search(people("A"), ConstraintSet.empty()).run(new Random(1)))
                .isInstanceOf(InfeasibleException.class)
                .hasMessage("No valid assignment exists: A cannot give to anyone (nobody else in the roster); "
                    + "nobody can give to A (nobody else in the roster)")
                .satisfies(e -> assertThat(((InfeasibleException) e).getOverConstrainedPeople())
                    .containsExactly("A"));
        }

        @Test
        @DisplayName("two people exhaust the search and record the pruning")
        void twoPeople() {
            assertThatThrownBy(() -> search(people("A", "B"), ConstraintSet.empty()).run(new Random(1)))
                .isInstanceOf(InfeasibleException.class)
                .hasMessage("No valid assignment exists: every possibility was ruled out after 1 step(s); "
                    + "two people can only give to each other, which is a 2-cycle")
                .satisfies(e -> {
                    SearchStatistics stats = ((InfeasibleException) e).getStatistics();
                    assertThat(stats.getNodes()).isEqualTo(1);
                    assertThat(stats.getBacktracks()).isEqualTo(1);
                    assertThat(stats.getPrunedByRule()).containsEntry("StrandedGiverRule", 1L);
                    assertThat(stats.getElapsedMs()).isPositive();
                });
        }
    }

    @Nested
    @DisplayName("Forced pairs")
    class ForcedPairs {

        @Test
        void alwaysPresent() {
            Roster roster = people("A", "B", "C", "D", "E");
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("A", "B")
                .whitelist("C", "D")
                .build();
            AssignmentSearch search = search(roster, constraints);

            for (long seed = 0; seed < 25; seed++) {
                Solution solution = search.run(new Random(seed));
                assertThat(solution.contains(Pair.of("A", "B"))).isTrue();
                assertThat(solution.contains(Pair.of("C", "D"))).isTrue();
            }
        }

        @Test
        @DisplayName("people left without a partner are explained before searching")
        void explainsBlockedPartners() {
            ConstraintSet constraints = ConstraintSet.builder()
                .whitelist("A", "B")
                .blacklist("C", "A")
                .build();

            assertThatThrownBy(() -> search(people("A", "B", "C"), constraints).run(new Random(1)))
                .isInstanceOf(InfeasibleException.class)
                .hasMessage("No valid assignment exists: "
                    + "C cannot give to anyone (A: blacklist; B: already receives from A (whitelist)); "
                    + "nobody can give to A (B: 2-cycle with whitelist pair A->B; C: blacklist)")
                .satisfies(e -> {
                    InfeasibleException ex = (InfeasibleException) e;
                    assertThat(ex.getOverConstrainedPeople()).containsExactly("C", "A");
                    assertThat(ex.getStatistics().getNodes()).isZero();
                });
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        void rejectsNegativeBound() {
            ConstraintModel model = new ConstraintValidator().validate(people("A", "B", "C"), ConstraintSet.empty());

            assertThatThrownBy(() -> new AssignmentSearch(model, -1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("the same seed reproduces the same solution")
        void reproducible() {
            AssignmentSearch search = search(people("A", "B", "C", "D", "E", "F", "G"), ConstraintSet.empty());

            Solution first = search.run(new Random(42));
            Solution second = search.run(new Random(42));

            assertThat(second.getPairs()).isEqualTo(first.getPairs());
            assertThat(search.getMaxSteps()).isZero();
        }
    }

    // =========================================================================
    //  Completeness
    // =========================================================================

    @Nested
    @DisplayName("Completeness")
    class Completeness {

        private final String[] names = {"A", "B", "C", "D", "E", "F", "G"};

        @Test
        @DisplayName("the search agrees with full enumeration on random small rosters")
        void agreesWithEnumeration() {
            Random random = new Random(2024);
            int feasible = 0;
            int infeasible = 0;

            for (int round = 0; round < 600; round++) {
                int size = 1 + random.nextInt(names.length);
                String[] group = new String[size];
                System.arraycopy(names, 0, group, 0, size);
                Roster roster = people(group);
                ConstraintSet constraints = randomConstraints(group, random);

                ConstraintModel model;
                try {
                    model = new ConstraintValidator().validate(roster, constraints);
                } catch (ConfigurationException e) {
                    continue;
                }
                AssignmentSearch search = new AssignmentSearch(model, 0);
                boolean exists = hasAssignment(search.getModel(), new int[size], new boolean[size], 0);

                if (exists) {
                    feasible++;
                    Solution solution = search.run(new Random(round));
                    SolutionChecks.assertValid(solution, constraints);
                } else {
                    infeasible++;
                    long seed = round;
                    assertThatThrownBy(() -> search.run(new Random(seed)))
                        .as("round %d: %s", round, constraints)
                        .isInstanceOf(InfeasibleException.class);
                }
            }

            assertThat(feasible).isPositive();
            assertThat(infeasible).isPositive();
        }

        private ConstraintSet randomConstraints(String[] group, Random random) {
            ConstraintSet.Builder builder = ConstraintSet.builder();
            if (group.length < 2) {
                return builder.build();
            }
            int blacklist = random.nextInt(group.length + 1);
            for (int i = 0; i < blacklist; i++) {
                Pair pair = randomPair(group, random);
                builder.blacklist(pair.getGiver(), pair.getReceiver());
            }
            if (random.nextInt(3) == 0) {
                Pair pair = randomPair(group, random);
                builder.blacklistSet(pair.getGiver(), pair.getReceiver());
            }
            List<Pair> history = new ArrayList<>();
            int historyPairs = random.nextInt(group.length + 1);
            for (int i = 0; i < historyPairs; i++) {
                history.add(randomPair(group, random));
            }
            builder.history(new HistoryRecord(2024, random.nextBoolean(), history));
            if (random.nextInt(3) == 0) {
                Pair pair = randomPair(group, random);
                builder.whitelist(pair.getGiver(), pair.getReceiver());
            }
            return builder.build();
        }

        private Pair randomPair(String[] group, Random random) {
            int giver = random.nextInt(group.length);
            int receiver = (giver + 1 + random.nextInt(group.length - 1)) % group.length;
            return Pair.of(group[giver], group[receiver]);
        }

        /**
         * Tries every permutation, giver by giver, checking the rules only on complete
         * assignments.
         */
        private boolean hasAssignment(ConstraintModel model, int[] receiverOf, boolean[] taken, int giver) {
            int n = model.size();
            if (giver == n) {
                for (int g = 0; g < n; g++) {
                    int r = receiverOf[g];
                    if (model.isForbidden(g, r) || receiverOf[r] == g) {
                        return false;
                    }
                    if (model.isForced(g) && model.getForcedReceiver(g) != r) {
                        return false;
                    }
                }
                return true;
            }
            for (int r = 0; r < n; r++) {
                if (!taken[r]) {
                    taken[r] = true;
                    receiverOf[giver] = r;
                    boolean found = hasAssignment(model, receiverOf, taken, giver + 1);
                    taken[r] = false;
                    if (found) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
