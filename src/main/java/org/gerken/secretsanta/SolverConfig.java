package org.gerken.secretsanta;

import org.gerken.secretsanta.logic.HistoryWindow;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Configuration for {@link SecretSantaEngine}.
 *
 * Properties (all optional):
 *   secretsanta.maxSteps              Assignments to try before giving up, 0 = no limit (default: 1000000)
 *   secretsanta.seed                  Random seed for reproducible draws (default: none)
 *   secretsanta.historyYears          Years of history to exclude, 0 = all years (default: 0)
 *   secretsanta.independentSolutions  Solutions to collect before drawing one (default: 100)
 */
public class SolverConfig {

    public static final String RESOURCE_NAME = "secret-santa.properties";

    public static final long DEFAULT_MAX_STEPS = 1_000_000L;
    public static final int DEFAULT_HISTORY_YEARS = 0; // all years
    public static final int DEFAULT_INDEPENDENT_SOLUTIONS = 100;

    static final String KEY_MAX_STEPS = "secretsanta.maxSteps";
    static final String KEY_SEED = "secretsanta.seed";
    static final String KEY_HISTORY_YEARS = "secretsanta.historyYears";
    static final String KEY_INDEPENDENT_SOLUTIONS = "secretsanta.independentSolutions";

    private long maxSteps = DEFAULT_MAX_STEPS;
    private Long seed;
    private int historyYears = DEFAULT_HISTORY_YEARS;
    private int independentSolutions = DEFAULT_INDEPENDENT_SOLUTIONS;

    /**
     * Creates a configuration with default values.
     */
    public SolverConfig() {
    }

    /**
     * Loads configuration from {@value #RESOURCE_NAME} on the classpath, falling back to
     * defaults for anything it does not set, or entirely when it is absent.
     *
     * @return the loaded configuration
     */
    public static SolverConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SolverConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + RESOURCE_NAME, e);
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from properties. Missing keys keep their defaults.
     *
     * @param properties the properties to read
     * @return the configuration
     * @throws IllegalArgumentException naming the key of any invalid value
     */
    public static SolverConfig fromProperties(Properties properties) {
        SolverConfig config = new SolverConfig();

        String value = trimmed(properties, KEY_MAX_STEPS);
        if (value != null) {
            config.setMaxSteps(parseLong(KEY_MAX_STEPS, value));
        }
        value = trimmed(properties, KEY_SEED);
        if (value != null) {
            config.setSeed(parseLong(KEY_SEED, value));
        }
        value = trimmed(properties, KEY_HISTORY_YEARS);
        if (value != null) {
            config.setHistoryYears(parseInt(KEY_HISTORY_YEARS, value));
        }
        value = trimmed(properties, KEY_INDEPENDENT_SOLUTIONS);
        if (value != null) {
            config.setIndependentSolutions(parseInt(KEY_INDEPENDENT_SOLUTIONS, value));
        }
        return config;
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Error: invalid value for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Error: invalid value for " + key + ": " + value, e);
        }
    }

    /**
     * Gets the maximum number of assignments one search may try.
     *
     * @return the bound, 0 for an exhaustive search
     */
    public long getMaxSteps() {
        return maxSteps;
    }

    public SolverConfig setMaxSteps(long maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("Error: " + KEY_MAX_STEPS + " must be non-negative (0 for no limit)");
        }
        this.maxSteps = maxSteps;
        return this;
    }

    /**
     * Gets the random seed.
     *
     * @return the seed, or null for a different draw on every solve
     */
    public Long getSeed() {
        return seed;
    }

    public SolverConfig setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    public int getHistoryYears() {
        return historyYears;
    }

    public SolverConfig setHistoryYears(int historyYears) {
        if (historyYears < 0) {
            throw new IllegalArgumentException("Error: " + KEY_HISTORY_YEARS + " must be non-negative (0 for all years)");
        }
        this.historyYears = historyYears;
        return this;
    }

    public int getIndependentSolutions() {
        return independentSolutions;
    }

    public SolverConfig setIndependentSolutions(int independentSolutions) {
        if (independentSolutions < 1) {
            throw new IllegalArgumentException("Error: " + KEY_INDEPENDENT_SOLUTIONS + " must be positive");
        }
        this.independentSolutions = independentSolutions;
        return this;
    }

    /**
     * Gets the history policy implied by {@link #getHistoryYears()}.
     *
     * @return the history window
     */
    public HistoryWindow getHistoryWindow() {
        return historyYears == 0 ? HistoryWindow.unbounded() : HistoryWindow.trailingYears(historyYears);
    }

    @Override
    public String toString() {
        return "maxSteps=" + (maxSteps == 0 ? "unlimited" : maxSteps)
            + ", seed=" + (seed == null ? "random" : seed)
            + ", history=" + getHistoryWindow()
            + ", independentSolutions=" + independentSolutions;
    }
}
