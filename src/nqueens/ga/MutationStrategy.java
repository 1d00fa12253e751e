package nqueens.ga;

import java.util.Random;

/**
 * MutationStrategy: perturbs a child state before it becomes a Board.
 */
public interface MutationStrategy {
    /**
     * @param state the state to mutate (not modified)
     * @param random random source owned by the calling task
     * @return the mutated state, or the same array when no mutation happened
     */
    int[] mutate(int[] state, Random random);
}
