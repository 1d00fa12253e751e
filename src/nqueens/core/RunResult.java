package nqueens.core;

import java.time.Duration;
import java.util.Locale;

/**
 * RunResult: everything one solver run exposes to its caller.
 * Reporting code (console printer, CSV export, statistics) reads only this.
 */
public final class RunResult {
    private final String algorithm;
    private final int n;
    private final long seed;
    private final Board best;
    private final int generations;
    private final Duration elapsed;
    private final int populationSize;
    private final double initialMutationRate;
    private final double finalMutationRate;
    private final int stagnationCount;
    private final int stagnationThresholdLow;
    private final int stagnationThresholdHigh;
    private final int reinitializationCount;
    private final int parallelism;
    private final boolean complexityPerCore;
    private final int tournamentSize;
    private final int[] convergence;

    private RunResult(Builder b) {
        this.algorithm = b.algorithm;
        this.n = b.n;
        this.seed = b.seed;
        this.best = b.best;
        this.generations = b.generations;
        this.elapsed = b.elapsed;
        this.populationSize = b.populationSize;
        this.initialMutationRate = b.initialMutationRate;
        this.finalMutationRate = b.finalMutationRate;
        this.stagnationCount = b.stagnationCount;
        this.stagnationThresholdLow = b.stagnationThresholdLow;
        this.stagnationThresholdHigh = b.stagnationThresholdHigh;
        this.reinitializationCount = b.reinitializationCount;
        this.parallelism = b.parallelism;
        this.complexityPerCore = b.complexityPerCore;
        this.tournamentSize = b.tournamentSize;
        this.convergence = b.convergence;
    }

    public static Builder builder(String algorithm, int n, long seed) {
        return new Builder(algorithm, n, seed);
    }

    public String getAlgorithm() { return algorithm; }
    public int getN() { return n; }
    public long getSeed() { return seed; }
    public Board getBestBoard() { return best; }
    public int[] getBestState() { return best.getState(); }
    public int getConflicts() { return best.getConflicts(); }
    public double getFitness() { return best.getFitness(); }
    public boolean isPermutation() { return best.isPermutation(); }
    public int getGenerations() { return generations; }
    public Duration getElapsed() { return elapsed; }
    public double getElapsedMillis() { return elapsed.toNanos() / 1_000_000.0; }
    public int getPopulationSize() { return populationSize; }
    public double getInitialMutationRate() { return initialMutationRate; }
    public double getFinalMutationRate() { return finalMutationRate; }
    public int getStagnationCount() { return stagnationCount; }
    public int getStagnationThresholdLow() { return stagnationThresholdLow; }
    public int getStagnationThresholdHigh() { return stagnationThresholdHigh; }
    public int getReinitializationCount() { return reinitializationCount; }
    public int getParallelism() { return parallelism; }
    public int getTournamentSize() { return tournamentSize; }

    /**
     * Best-so-far conflict count per generation; index 0 is generation 1.
     */
    public int[] getConvergence() {
        return convergence.clone();
    }

    /**
     * Solved means zero conflicts on a valid permutation, nothing less.
     */
    public boolean isSolved() {
        return best.isSolved();
    }

    /**
     * Estimated work: G x P x N, divided by the parallelism degree when the
     * reproduction step ran on a worker pool.
     */
    public double getComplexity() {
        double work = (double) generations * populationSize * n;
        return complexityPerCore ? work / parallelism : work;
    }

    public String formatElapsed() {
        return formatDuration(elapsed);
    }

    /**
     * Formats as ss.SSS, mm:ss.SSS or hh:mm:ss.SSS depending on length.
     */
    public static String formatDuration(Duration d) {
        long hours = d.toHours();
        int minutes = d.toMinutesPart();
        int seconds = d.toSecondsPart();
        int millis = d.toMillisPart();
        if (hours >= 1) {
            return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, seconds, millis);
        }
        if (minutes >= 1) {
            return String.format(Locale.ROOT, "%02d:%02d.%03d", minutes, seconds, millis);
        }
        return String.format(Locale.ROOT, "%02d.%03d", seconds, millis);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "=== %s Summary ===\n", algorithm));
        sb.append(String.format(Locale.ROOT, "Algorithm: %s\n", algorithm));
        sb.append(String.format(Locale.ROOT, "N (Queens): %d\n", n));
        sb.append(String.format(Locale.ROOT, "Seed: %d\n", seed));
        sb.append(String.format(Locale.ROOT, "Generations (G): %d\n", generations));
        sb.append(String.format(Locale.ROOT, "Population Size (P): %d\n", populationSize));
        if (tournamentSize > 0) {
            sb.append(String.format(Locale.ROOT, "Tournament Size (T): %d\n", tournamentSize));
        } else {
            sb.append(String.format(Locale.ROOT, "Mutation Rate: %.3f -> %.3f\n", initialMutationRate, finalMutationRate));
        }
        sb.append(String.format(Locale.ROOT, "Cores (C): %d\n", parallelism));
        sb.append(String.format(Locale.ROOT, "Elapsed Time: %s\n", formatElapsed()));
        sb.append(String.format(Locale.ROOT, "Stagnation: %d, Reinitializations: %d\n", stagnationCount, reinitializationCount));
        sb.append(String.format(Locale.ROOT, "Fitness: %.4f\n", getFitness()));
        sb.append(String.format(Locale.ROOT, "Intersections: %d\n", getConflicts()));
        sb.append(String.format(Locale.ROOT, "Solved: %s%s\n", isSolved() ? "yes" : "no",
            isPermutation() ? "" : " (best state is not a permutation)"));
        sb.append("\nAlgorithm Analysis:\n");
        if (complexityPerCore) {
            sb.append(String.format(Locale.ROOT, "Time Complexity: O(G x P x N / C) = (%d x %d x %d) / %d = %.2f\n",
                generations, populationSize, n, parallelism, getComplexity()));
        } else {
            sb.append(String.format(Locale.ROOT, "Time Complexity: O(G x P x N) = %d x %d x %d = %.2f\n",
                generations, populationSize, n, getComplexity()));
        }
        sb.append(String.format(Locale.ROOT, "Space Complexity: O(P x N) = %d\n", (long) populationSize * n));
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RunResult{" + algorithm + ", n=" + n + ", seed=" + seed + ", conflicts=" + getConflicts()
            + ", generations=" + generations + ", best=" + best + "}";
    }

    public static final class Builder {
        private final String algorithm;
        private final int n;
        private final long seed;
        private Board best;
        private int generations;
        private Duration elapsed = Duration.ZERO;
        private int populationSize;
        private double initialMutationRate;
        private double finalMutationRate;
        private int stagnationCount;
        private int stagnationThresholdLow;
        private int stagnationThresholdHigh;
        private int reinitializationCount;
        private int parallelism = 1;
        private boolean complexityPerCore;
        private int tournamentSize;
        private int[] convergence = new int[0];

        private Builder(String algorithm, int n, long seed) {
            this.algorithm = algorithm;
            this.n = n;
            this.seed = seed;
        }

        public Builder best(Board best) { this.best = best; return this; }
        public Builder generations(int generations) { this.generations = generations; return this; }
        public Builder elapsed(Duration elapsed) { this.elapsed = elapsed; return this; }
        public Builder populationSize(int populationSize) { this.populationSize = populationSize; return this; }
        public Builder initialMutationRate(double rate) { this.initialMutationRate = rate; return this; }
        public Builder finalMutationRate(double rate) { this.finalMutationRate = rate; return this; }
        public Builder stagnationCount(int count) { this.stagnationCount = count; return this; }
        public Builder stagnationThresholds(int low, int high) {
            this.stagnationThresholdLow = low;
            this.stagnationThresholdHigh = high;
            return this;
        }
        public Builder reinitializationCount(int count) { this.reinitializationCount = count; return this; }
        public Builder parallelism(int parallelism, boolean complexityPerCore) {
            this.parallelism = parallelism;
            this.complexityPerCore = complexityPerCore;
            return this;
        }
        public Builder tournamentSize(int tournamentSize) { this.tournamentSize = tournamentSize; return this; }
        public Builder convergence(int[] convergence) { this.convergence = convergence.clone(); return this; }

        public RunResult build() {
            if (best == null) {
                throw new IllegalStateException("A run result needs a best board");
            }
            if (best.size() != n) {
                throw new IllegalStateException("Best board has " + best.size() + " rows, expected " + n);
            }
            return new RunResult(this);
        }
    }
}
