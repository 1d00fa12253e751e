package nqueens.ga;

import java.util.Random;

/**
 * SwapMutation: with some probability, swaps the queens of two distinct rows.
 * The probability is either fixed or derived from the current mutation rate
 * and how long the search has stagnated.
 */
public class SwapMutation implements MutationStrategy {
    static final double STAGNATION_WEIGHT = 0.05;
    static final double MAX_PROBABILITY = 0.9;

    private final double probability;

    private SwapMutation(double probability) {
        this.probability = probability;
    }

    /**
     * A coin with a fixed bias gates every swap.
     */
    public static SwapMutation fixed(double probability) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Mutation probability out of range: " + probability);
        }
        return new SwapMutation(probability);
    }

    /**
     * Probability = min(rate + ln(stagnation + 1) * 0.05, 0.9).
     */
    public static SwapMutation adaptive(double mutationRate, int stagnationCount) {
        return new SwapMutation(adaptiveProbability(mutationRate, stagnationCount));
    }

    public static double adaptiveProbability(double mutationRate, int stagnationCount) {
        double p = mutationRate + Math.log(Math.max(0, stagnationCount) + 1) * STAGNATION_WEIGHT;
        return Math.min(p, MAX_PROBABILITY);
    }

    public double getProbability() {
        return probability;
    }

    @Override
    public int[] mutate(int[] state, Random random) {
        if (state.length < 2 || random.nextDouble() >= probability) {
            return state;
        }
        int[] mutated = state.clone();
        swapRandomPair(mutated, random);
        return mutated;
    }

    /**
     * Applies the given number of unconditional swaps to a copy of the state.
     */
    public static int[] scramble(int[] state, int swaps, Random random) {
        int[] mutated = state.clone();
        if (mutated.length < 2) {
            return mutated;
        }
        for (int i = 0; i < swaps; i++) {
            swapRandomPair(mutated, random);
        }
        return mutated;
    }

    static void swapRandomPair(int[] state, Random random) {
        int n = state.length;
        int idx1 = random.nextInt(n);
        int idx2;
        do {
            idx2 = random.nextInt(n);
        } while (idx2 == idx1);
        int tmp = state[idx1];
        state[idx1] = state[idx2];
        state[idx2] = tmp;
    }
}
