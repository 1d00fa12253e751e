package nqueens.ga;

import java.util.Random;

/**
 * CombinedCrossoverStrategy: flips a fair coin per child pair and applies
 * either PMX or OX.
 */
public class CombinedCrossoverStrategy implements CrossoverStrategy {
    private final CrossoverStrategy pmx = new PmxCrossover();
    private final CrossoverStrategy ox = new OrderCrossover();

    @Override
    public int[][] crossover(int[] parent1, int[] parent2, Random random) {
        return random.nextDouble() < 0.5
            ? pmx.crossover(parent1, parent2, random)
            : ox.crossover(parent1, parent2, random);
    }

    @Override
    public boolean preservesPermutation() {
        return true;
    }

    @Override
    public String getName() {
        return "PMX/OX";
    }
}
