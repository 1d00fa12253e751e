package nqueens.ga;

import java.util.Random;
import nqueens.core.Population;

/**
 * SelectionStrategy: picks the two parents for one reproduction step.
 */
public interface SelectionStrategy {
    Parents select(Population population, Random random);
}
