package nqueens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import nqueens.core.RunResult;

/**
 * StatisticsAnalyzer: aggregates a batch of solver runs.
 * Generations are the measured quantity; failures (runs that ended
 * unsolved) are counted separately.
 */
public class StatisticsAnalyzer {
    private final List<Integer> generationHistory;
    private final List<Long> executionTimes;  // milliseconds
    private int failures;

    public StatisticsAnalyzer() {
        this.generationHistory = new ArrayList<>();
        this.executionTimes = new ArrayList<>();
    }

    /**
     * Records one run.
     */
    public void recordExecution(int generations, long executionTimeMs, boolean solved) {
        generationHistory.add(generations);
        executionTimes.add(executionTimeMs);
        if (!solved) {
            failures++;
        }
    }

    public void recordExecution(RunResult result) {
        recordExecution(result.getGenerations(), result.getElapsed().toMillis(), result.isSolved());
    }

    public void clear() {
        generationHistory.clear();
        executionTimes.clear();
        failures = 0;
    }

    public int getBest() {
        if (generationHistory.isEmpty()) return 0;
        return Collections.min(generationHistory);
    }

    public int getWorst() {
        if (generationHistory.isEmpty()) return 0;
        return Collections.max(generationHistory);
    }

    public double getAverage() {
        if (generationHistory.isEmpty()) return 0.0;
        double sum = 0.0;
        for (int generations : generationHistory) {
            sum += generations;
        }
        return sum / generationHistory.size();
    }

    /**
     * Sample standard deviation (n - 1).
     */
    public double getStandardDeviation() {
        if (generationHistory.size() <= 1) return 0.0;

        double mean = getAverage();
        double sumSquaredDiff = 0.0;
        for (int generations : generationHistory) {
            double diff = generations - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (generationHistory.size() - 1));
    }

    /**
     * Average running time in seconds.
     */
    public double getAverageRunningTime() {
        if (executionTimes.isEmpty()) return 0.0;
        long sum = 0;
        for (long time : executionTimes) {
            sum += time;
        }
        return (sum / (double) executionTimes.size()) / 1000.0;
    }

    public int getExecutionCount() {
        return generationHistory.size();
    }

    public int getFailureCount() {
        return failures;
    }

    public double getSuccessRate() {
        if (generationHistory.isEmpty()) return 0.0;
        return (generationHistory.size() - failures) / (double) generationHistory.size();
    }

    public StatisticsReport generateReport() {
        return new StatisticsReport(getBest(), getWorst(), getAverage(), getStandardDeviation(),
            getAverageRunningTime(), getExecutionCount(), getSuccessRate());
    }

    /**
     * Immutable summary of a batch.
     */
    public static class StatisticsReport {
        private final int best;
        private final int worst;
        private final double average;
        private final double standardDeviation;
        private final double averageRunningTime;
        private final int executionCount;
        private final double successRate;

        public StatisticsReport(int best, int worst, double average, double standardDeviation,
                                double averageRunningTime, int executionCount, double successRate) {
            this.best = best;
            this.worst = worst;
            this.average = average;
            this.standardDeviation = standardDeviation;
            this.averageRunningTime = averageRunningTime;
            this.executionCount = executionCount;
            this.successRate = successRate;
        }

        public int getBest() { return best; }
        public int getWorst() { return worst; }
        public double getAverage() { return average; }
        public double getStandardDeviation() { return standardDeviation; }
        public double getAverageRunningTime() { return averageRunningTime; }
        public int getExecutionCount() { return executionCount; }
        public double getSuccessRate() { return successRate; }

        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                "Statistics (%d runs):\n" +
                "  Best Generations:   %d\n" +
                "  Worst Generations:  %d\n" +
                "  Average Generations: %.1f\n" +
                "  Standard Deviation: %.2f\n" +
                "  Avg. Running Time:  %.4f s\n" +
                "  Success Rate:       %.1f %%",
                executionCount, best, worst, average, standardDeviation, averageRunningTime, successRate * 100.0);
        }

        /**
         * One tab-separated row, prefixed by the board size.
         */
        public String toTableRow(int n) {
            return String.format(Locale.ROOT, "%d\t%d\t%d\t%.1f\t%.2f\t%.4f\t%.2f",
                n, best, worst, average, standardDeviation, averageRunningTime, successRate);
        }
    }
}
