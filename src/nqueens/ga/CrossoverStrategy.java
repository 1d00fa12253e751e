package nqueens.ga;

import java.util.Random;

/**
 * CrossoverStrategy: recombines two parent states into two children.
 */
public interface CrossoverStrategy {
    /**
     * Produces two children from two parents of equal length.
     * @param parent1 first parent state (not modified)
     * @param parent2 second parent state (not modified)
     * @param random random source owned by the calling task
     * @return exactly two child states, each of the parents' length
     */
    int[][] crossover(int[] parent1, int[] parent2, Random random);

    /**
     * Whether two permutations always yield two permutations.
     */
    boolean preservesPermutation();

    String getName();
}
