package nqueens.ga;

import nqueens.core.Board;
import nqueens.core.Population;

/**
 * State of a run right after one generation was materialized.
 */
public final class GenerationSnapshot {
    private final int generation;
    private final Population population;
    private final Board bestSoFar;
    private final int stagnationCount;
    private final double mutationRate;
    private final int tournamentSize;
    private final boolean reinitialized;

    public GenerationSnapshot(int generation, Population population, Board bestSoFar, int stagnationCount,
                              double mutationRate, int tournamentSize, boolean reinitialized) {
        this.generation = generation;
        this.population = population;
        this.bestSoFar = bestSoFar;
        this.stagnationCount = stagnationCount;
        this.mutationRate = mutationRate;
        this.tournamentSize = tournamentSize;
        this.reinitialized = reinitialized;
    }

    public int getGeneration() { return generation; }
    public Population getPopulation() { return population; }
    public Board getBestSoFar() { return bestSoFar; }
    public int getStagnationCount() { return stagnationCount; }
    /** 0 for the tournament solver. */
    public double getMutationRate() { return mutationRate; }
    /** 0 for the Adam & Eve solver. */
    public int getTournamentSize() { return tournamentSize; }
    /** True when the population was fully or partially regenerated in this generation. */
    public boolean isReinitialized() { return reinitialized; }
}
