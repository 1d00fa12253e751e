package nqueens.ga;

import nqueens.core.RunResult;

/**
 * Solver: searches for a placement of N non-attacking queens.
 */
public interface Solver {

    String getName();

    /**
     * Runs with a fixed seed. Same n, seed and configuration give the same
     * result regardless of the number of worker threads.
     */
    RunResult solve(int n, long seed);

    /**
     * Runs with a freshly drawn seed, reported in the result.
     */
    RunResult solve(int n);
}
