package org.gerken.secretsanta;

import org.gerken.secretsanta.logic.AssignmentSearch;
import org.gerken.secretsanta.logic.ConstraintModel;
import org.gerken.secretsanta.logic.ConstraintValidator;
import org.gerken.secretsanta.logic.ExclusionSource;
import org.gerken.secretsanta.model.ConstraintSet;
import org.gerken.secretsanta.model.Roster;
import org.gerken.secretsanta.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Entry point of the secret santa assignment engine.
 *
 * Architecture:
 * - {@link ConstraintValidator} checks the roster and rules and merges them into a
 *   {@link ConstraintModel}; configuration errors surface before any search
 * - {@link AssignmentSearch} runs a randomized backtracking search over the model,
 *   pruned by the rules in {@code org.gerken.secretsanta.pruning}
 * - When the search proves infeasibility, the engine probes which rule category,
 *   dropped alone, would allow a solution and reports it with the failure
 *
 * Usage:
 * <pre>
 * SecretSantaEngine engine = new SecretSantaEngine(new SolverConfig().setSeed(2025L));
 * Solution solution = engine.solve(roster, constraints);
 * </pre>
 *
 * The engine keeps no state between calls. Every call gets its own search state and,
 * unless one is passed in, its own {@link Random} (seeded from the configuration when
 * a seed is set), so identical input and seed give identical results.
 */
public class SecretSantaEngine {

    private static final Logger log = LoggerFactory.getLogger(SecretSantaEngine.class);

    private final SolverConfig config;
    private final ConstraintValidator validator;

    /**
     * Creates an engine with default configuration.
     */
    public SecretSantaEngine() {
        this(new SolverConfig());
    }

    /**
     * Creates an engine with the given configuration.
     *
     * @param config the solver configuration
     */
    public SecretSantaEngine(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.validator = new ConstraintValidator(config.getHistoryWindow());
    }

    public SolverConfig getConfig() {
        return config;
    }

    /**
     * Validates the roster and rules without searching.
     *
     * @param roster the people taking part
     * @param constraints the rules to apply
     * @return the normalized model
     * @throws ConfigurationException if the rules are inconsistent
     */
    public ConstraintModel validate(Roster roster, ConstraintSet constraints) {
        return validator.validate(roster, constraints);
    }

    /**
     * Finds one assignment using the configured randomness.
     *
     * @param roster the people taking part
     * @param constraints the rules to apply
     * @return a valid solution
     * @throws ConfigurationException if the rules are inconsistent
     * @throws InfeasibleException if no valid assignment exists
     * @throws SearchLimitException if the step bound ran out first
     */
    public Solution solve(Roster roster, ConstraintSet constraints) {
        return solve(roster, constraints, newRandom());
    }

    /**
     * Finds one assignment using the given source of randomness.
     *
     * @param roster the people taking part
     * @param constraints the rules to apply
     * @param random orders givers and candidates
     * @return a valid solution
     */
    public Solution solve(Roster roster, ConstraintSet constraints, Random random) {
        ConstraintModel model = validate(roster, constraints);
        Solution solution = search(model, random);
        log.info("Assigned {} people in {} step(s) with {} backtrack(s)",
            roster.size(), solution.getStatistics().getNodes(), solution.getStatistics().getBacktracks());
        return solution;
    }

    /**
     * Collects up to {@code limit} solutions that share no free pair: each new solution
     * avoids every non-forced pair of the ones before it. Forced pairs appear in all.
     *
     * @param roster the people taking part
     * @param constraints the rules to apply
     * @param limit maximum number of solutions to collect
     * @return at least one solution
     * @throws InfeasibleException if not even one solution exists
     */
    public List<Solution> findIndependentSolutions(Roster roster, ConstraintSet constraints, int limit) {
        return findIndependentSolutions(roster, constraints, limit, newRandom());
    }

    /**
     * Collects independent solutions using the given source of randomness.
     *
     * @see #findIndependentSolutions(Roster, ConstraintSet, int)
     */
    public List<Solution> findIndependentSolutions(Roster roster, ConstraintSet constraints, int limit,
                                                   Random random) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        ConstraintModel model = validate(roster, constraints);
        List<Solution> solutions = new ArrayList<>();

        Solution solution = search(model, random);
        solutions.add(solution);
        model = model.excluding(solution.getReceiverIndices(), ExclusionSource.DRAWN);

        while (solutions.size() < limit) {
            try {
                solution = new AssignmentSearch(model, config.getMaxSteps()).run(random);
            } catch (InfeasibleException | SearchLimitException e) {
                log.debug("Stopped collecting after {} independent solution(s): {}",
                    solutions.size(), e.getMessage());
                break;
            }
            solutions.add(solution);
            model = model.excluding(solution.getReceiverIndices(), ExclusionSource.DRAWN);
        }
        return solutions;
    }

    /**
     * Collects independent solutions (up to the configured count) and picks one at
     * random, so no particular solution is favored.
     *
     * @param roster the people taking part
     * @param constraints the rules to apply
     * @return the chosen solution
     */
    public Solution draw(Roster roster, ConstraintSet constraints) {
        return draw(roster, constraints, newRandom());
    }

    /**
     * Draws a solution using the given source of randomness.
     *
     * @see #draw(Roster, ConstraintSet)
     */
    public Solution draw(Roster roster, ConstraintSet constraints, Random random) {
        List<Solution> solutions = findIndependentSolutions(roster, constraints,
            config.getIndependentSolutions(), random);
        log.info("Found {} independent solution(s). Choosing one.", solutions.size());
        return solutions.get(random.nextInt(solutions.size()));
    }

    /**
     * Finds the rule categories that, removed on their own, make the model solvable.
     * Each probe is bounded like a normal search; a probe that runs out of steps does
     * not count as relaxable.
     *
     * @param model the infeasible model
     * @param random source of ordering for the probes
     * @return the relaxable categories
     */
    public Set<ExclusionSource> findRelaxableSources(ConstraintModel model, Random random) {
        Set<ExclusionSource> relaxable = EnumSet.noneOf(ExclusionSource.class);
        for (ExclusionSource source : ExclusionSource.values()) {
            if (!source.isRelaxable() || !model.hasSource(source)) {
                continue;
            }
            try {
                new AssignmentSearch(model.without(source), config.getMaxSteps()).run(random);
                relaxable.add(source);
            } catch (InfeasibleException | SearchLimitException e) {
                log.debug("Relaxing {} rules does not help: {}", source.getLabel(), e.getMessage());
            }
        }
        return relaxable;
    }

    private Solution search(ConstraintModel model, Random random) {
        try {
            return new AssignmentSearch(model, config.getMaxSteps()).run(random);
        } catch (InfeasibleException e) {
            InfeasibleException diagnosed = e.withRelaxableSources(findRelaxableSources(model, random));
            log.warn("{}", diagnosed.getMessage());
            throw diagnosed;
        } catch (SearchLimitException e) {
            log.warn("{}", e.getMessage());
            throw e;
        }
    }

    private Random newRandom() {
        Long seed = config.getSeed();
        return seed == null ? new Random() : new Random(seed);
    }
}
