package nqueens.ga;

import java.util.Locale;
import java.util.Properties;
import nqueens.core.BoardGenerator;

/**
 * SolverConfig: the tuning constants of both controllers.
 * Immutable; build one with {@link #builder()} or start from a preset.
 */
public final class SolverConfig {

    public enum Crossover {
        MIXED, PMX, OX, RANGE_COPY;

        public CrossoverStrategy create() {
            switch (this) {
                case PMX:
                    return new PmxCrossover();
                case OX:
                    return new OrderCrossover();
                case RANGE_COPY:
                    return new RangeCopyCrossover();
                default:
                    return new CombinedCrossoverStrategy();
            }
        }
    }

    static final String PREFIX = "nqueens.";

    private final int maxGenerations;
    private final int populationSize;
    private final double initialMutationRate;
    private final double maxMutationRate;
    private final int stagnationLowThreshold;
    private final int stagnationHighThreshold;
    private final int fullResetThreshold;
    private final int eveResetThreshold;
    private final int eveScrambleSwaps;
    private final int tournamentResetThreshold;
    private final double fixedMutationProbability;
    private final int greedyMaxAttempts;
    private final int parallelism;
    private final Crossover crossover;
    private final BoardGenerator.Mode initialization;
    private final boolean verbose;
    private final int progressInterval;

    private SolverConfig(Builder b) {
        this.maxGenerations = b.maxGenerations;
        this.populationSize = b.populationSize;
        this.initialMutationRate = b.initialMutationRate;
        this.maxMutationRate = b.maxMutationRate;
        this.stagnationLowThreshold = b.stagnationLowThreshold;
        this.stagnationHighThreshold = b.stagnationHighThreshold;
        this.fullResetThreshold = b.fullResetThreshold;
        this.eveResetThreshold = b.eveResetThreshold;
        this.eveScrambleSwaps = b.eveScrambleSwaps;
        this.tournamentResetThreshold = b.tournamentResetThreshold;
        this.fixedMutationProbability = b.fixedMutationProbability;
        this.greedyMaxAttempts = b.greedyMaxAttempts;
        this.parallelism = b.parallelism;
        this.crossover = b.crossover;
        this.initialization = b.initialization;
        this.verbose = b.verbose;
        this.progressInterval = b.progressInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Preset for the elitist solver: PMX/OX mix, greedy initial boards.
     */
    public static SolverConfig adamEve() {
        return builder().crossover(Crossover.MIXED).initialization(BoardGenerator.Mode.GREEDY).build();
    }

    /**
     * Preset for the tournament solver: PMX, shuffled initial boards.
     */
    public static SolverConfig tournament() {
        return builder().crossover(Crossover.PMX).initialization(BoardGenerator.Mode.RANDOM).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.maxGenerations = maxGenerations;
        b.populationSize = populationSize;
        b.initialMutationRate = initialMutationRate;
        b.maxMutationRate = maxMutationRate;
        b.stagnationLowThreshold = stagnationLowThreshold;
        b.stagnationHighThreshold = stagnationHighThreshold;
        b.fullResetThreshold = fullResetThreshold;
        b.eveResetThreshold = eveResetThreshold;
        b.eveScrambleSwaps = eveScrambleSwaps;
        b.tournamentResetThreshold = tournamentResetThreshold;
        b.fixedMutationProbability = fixedMutationProbability;
        b.greedyMaxAttempts = greedyMaxAttempts;
        b.parallelism = parallelism;
        b.crossover = crossover;
        b.initialization = initialization;
        b.verbose = verbose;
        b.progressInterval = progressInterval;
        return b;
    }

    /**
     * Overlays "nqueens.*" keys on the given defaults. Unknown keys are
     * ignored; malformed values are rejected.
     */
    public static SolverConfig fromProperties(Properties props, SolverConfig defaults) {
        Builder b = defaults.toBuilder();
        String value;
        if ((value = get(props, "maxGenerations")) != null) b.maxGenerations(parseInt("maxGenerations", value));
        if ((value = get(props, "populationSize")) != null) b.populationSize(parseInt("populationSize", value));
        if ((value = get(props, "initialMutationRate")) != null) b.initialMutationRate(parseDouble("initialMutationRate", value));
        if ((value = get(props, "maxMutationRate")) != null) b.maxMutationRate(parseDouble("maxMutationRate", value));
        if ((value = get(props, "stagnationLowThreshold")) != null) b.stagnationLowThreshold(parseInt("stagnationLowThreshold", value));
        if ((value = get(props, "stagnationHighThreshold")) != null) b.stagnationHighThreshold(parseInt("stagnationHighThreshold", value));
        if ((value = get(props, "fullResetThreshold")) != null) b.fullResetThreshold(parseInt("fullResetThreshold", value));
        if ((value = get(props, "eveResetThreshold")) != null) b.eveResetThreshold(parseInt("eveResetThreshold", value));
        if ((value = get(props, "eveScrambleSwaps")) != null) b.eveScrambleSwaps(parseInt("eveScrambleSwaps", value));
        if ((value = get(props, "tournamentResetThreshold")) != null) b.tournamentResetThreshold(parseInt("tournamentResetThreshold", value));
        if ((value = get(props, "fixedMutationProbability")) != null) b.fixedMutationProbability(parseDouble("fixedMutationProbability", value));
        if ((value = get(props, "greedyMaxAttempts")) != null) b.greedyMaxAttempts(parseInt("greedyMaxAttempts", value));
        if ((value = get(props, "parallelism")) != null) b.parallelism(parseInt("parallelism", value));
        if ((value = get(props, "crossover")) != null) b.crossover(parseEnum(Crossover.class, "crossover", value));
        if ((value = get(props, "initialization")) != null) b.initialization(parseEnum(BoardGenerator.Mode.class, "initialization", value));
        if ((value = get(props, "verbose")) != null) b.verbose(Boolean.parseBoolean(value));
        if ((value = get(props, "progressInterval")) != null) b.progressInterval(parseInt("progressInterval", value));
        return b.build();
    }

    private static String get(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    public int getMaxGenerations() { return maxGenerations; }
    public int getPopulationSize() { return populationSize; }
    public double getInitialMutationRate() { return initialMutationRate; }
    public double getMaxMutationRate() { return maxMutationRate; }
    public int getStagnationLowThreshold() { return stagnationLowThreshold; }
    public int getStagnationHighThreshold() { return stagnationHighThreshold; }
    public int getFullResetThreshold() { return fullResetThreshold; }
    public int getEveResetThreshold() { return eveResetThreshold; }
    public int getEveScrambleSwaps() { return eveScrambleSwaps; }
    public int getTournamentResetThreshold() { return tournamentResetThreshold; }
    public double getFixedMutationProbability() { return fixedMutationProbability; }
    public int getGreedyMaxAttempts() { return greedyMaxAttempts; }
    public int getParallelism() { return parallelism; }
    public Crossover getCrossover() { return crossover; }
    public BoardGenerator.Mode getInitialization() { return initialization; }
    public boolean isVerbose() { return verbose; }
    public int getProgressInterval() { return progressInterval; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "SolverConfig{maxGenerations=%d, populationSize=%d, mutation=%.3f..%.3f, stagnation=%d/%d/%d, "
                + "eveReset=%d, tournamentReset=%d, parallelism=%d, crossover=%s, initialization=%s}",
            maxGenerations, populationSize, initialMutationRate, maxMutationRate, stagnationLowThreshold,
            stagnationHighThreshold, fullResetThreshold, eveResetThreshold, tournamentResetThreshold,
            parallelism, crossover, initialization);
    }

    public static final class Builder {
        private int maxGenerations = 10000;
        private int populationSize = 0;
        private double initialMutationRate = 0.2;
        private double maxMutationRate = 0.4;
        private int stagnationLowThreshold = 50;
        private int stagnationHighThreshold = 200;
        private int fullResetThreshold = 5000;
        private int eveResetThreshold = 100;
        private int eveScrambleSwaps = 3;
        private int tournamentResetThreshold = 5000;
        private double fixedMutationProbability = 0.5;
        private int greedyMaxAttempts = BoardGenerator.DEFAULT_MAX_ATTEMPTS;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private Crossover crossover = Crossover.MIXED;
        private BoardGenerator.Mode initialization = BoardGenerator.Mode.GREEDY;
        private boolean verbose = false;
        private int progressInterval = 50;

        private Builder() {
        }

        public Builder maxGenerations(int value) { this.maxGenerations = value; return this; }
        /** 0 derives the size from N. */
        public Builder populationSize(int value) { this.populationSize = value; return this; }
        public Builder initialMutationRate(double value) { this.initialMutationRate = value; return this; }
        public Builder maxMutationRate(double value) { this.maxMutationRate = value; return this; }
        public Builder stagnationLowThreshold(int value) { this.stagnationLowThreshold = value; return this; }
        public Builder stagnationHighThreshold(int value) { this.stagnationHighThreshold = value; return this; }
        public Builder fullResetThreshold(int value) { this.fullResetThreshold = value; return this; }
        public Builder eveResetThreshold(int value) { this.eveResetThreshold = value; return this; }
        public Builder eveScrambleSwaps(int value) { this.eveScrambleSwaps = value; return this; }
        public Builder tournamentResetThreshold(int value) { this.tournamentResetThreshold = value; return this; }
        public Builder fixedMutationProbability(double value) { this.fixedMutationProbability = value; return this; }
        public Builder greedyMaxAttempts(int value) { this.greedyMaxAttempts = value; return this; }
        public Builder parallelism(int value) { this.parallelism = value; return this; }
        public Builder crossover(Crossover value) { this.crossover = value; return this; }
        public Builder initialization(BoardGenerator.Mode value) { this.initialization = value; return this; }
        public Builder verbose(boolean value) { this.verbose = value; return this; }
        public Builder progressInterval(int value) { this.progressInterval = value; return this; }

        public SolverConfig build() {
            require(maxGenerations >= 1, "maxGenerations must be at least 1");
            require(populationSize >= 0, "populationSize must not be negative");
            require(inUnitRange(initialMutationRate), "initialMutationRate must be in [0, 1]");
            require(inUnitRange(maxMutationRate), "maxMutationRate must be in [0, 1]");
            require(initialMutationRate <= maxMutationRate, "initialMutationRate must not exceed maxMutationRate");
            require(stagnationLowThreshold >= 0 && stagnationHighThreshold >= 0
                && fullResetThreshold >= 0 && eveResetThreshold >= 0 && tournamentResetThreshold >= 0,
                "stagnation thresholds must not be negative");
            require(stagnationLowThreshold <= stagnationHighThreshold,
                "stagnationLowThreshold must not exceed stagnationHighThreshold");
            require(eveScrambleSwaps >= 1, "eveScrambleSwaps must be at least 1");
            require(inUnitRange(fixedMutationProbability), "fixedMutationProbability must be in [0, 1]");
            require(greedyMaxAttempts >= 1, "greedyMaxAttempts must be at least 1");
            require(parallelism >= 1, "parallelism must be at least 1");
            require(progressInterval >= 1, "progressInterval must be at least 1");
            require(crossover != null && initialization != null, "crossover and initialization are required");
            return new SolverConfig(this);
        }

        private static boolean inUnitRange(double value) {
            return value >= 0.0 && value <= 1.0;
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
