package nqueens.ga;

import java.util.Objects;
import java.util.Random;
import nqueens.core.Board;
import nqueens.core.BoardGenerator;
import nqueens.core.Population;

/**
 * ElitistSelection: Adam is the best board, Eve the second best.
 * Built once per generation with that generation's stagnation count.
 */
public class ElitistSelection implements SelectionStrategy {
    private final int stagnationCount;
    private final int eveResetThreshold;
    private final int eveScrambleSwaps;
    private final BoardGenerator generator;

    public ElitistSelection(int stagnationCount, int eveResetThreshold, int eveScrambleSwaps, BoardGenerator generator) {
        this.stagnationCount = stagnationCount;
        this.eveResetThreshold = eveResetThreshold;
        this.eveScrambleSwaps = eveScrambleSwaps;
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    @Override
    public Parents select(Population population, Random random) {
        Board adam;
        Board eve;
        if (population == null || population.size() < 2) {
            // not enough members: one random board and a swapped copy of it
            adam = generator.generateBoard(random);
            eve = new Board(SwapMutation.scramble(adam.getState(), 1, random));
        } else {
            adam = population.best();
            eve = population.secondBest();
        }

        if (isEveReset()) {
            eve = new Board(SwapMutation.scramble(adam.getState(), eveScrambleSwaps, random));
        }
        return new Parents(adam, eve);
    }

    /**
     * True when stagnation has lasted long enough that Eve is replaced by a
     * heavily mutated copy of Adam.
     */
    public boolean isEveReset() {
        return stagnationCount > eveResetThreshold;
    }
}
