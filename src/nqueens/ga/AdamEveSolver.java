package nqueens.ga;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import nqueens.core.Board;
import nqueens.core.BoardGenerator;
import nqueens.core.Population;
import nqueens.core.RunResult;
import nqueens.core.SeedSequence;

/**
 * AdamEveSolver: elitist genetic algorithm.
 * Every generation the best two boards (Adam and Eve) survive unchanged and
 * all other slots are filled by their children, bred in parallel. The
 * mutation rate climbs while the search stagnates and the population is
 * rebuilt from scratch when stagnation becomes severe.
 */
public class AdamEveSolver extends AbstractSolver {
    public static final String NAME = "GA (Adam & Eve)";

    static final double MILD_MUTATION_BOOST = 1.05;
    static final double STRONG_MUTATION_BOOST = 1.10;

    public AdamEveSolver() {
        this(SolverConfig.adamEve());
    }

    public AdamEveSolver(SolverConfig config) {
        super(config);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int defaultPopulationSize(int n) {
        return Math.max(50, Math.min(n * 10, 2000));
    }

    @Override
    protected RunResult.Builder run(int n, SeedSequence seeds, BreedingPool pool, RunResult.Builder result) {
        return new Run(n, seeds, pool).execute(result);
    }

    /**
     * Mutation rate after one generation's stagnation check.
     */
    static double adaptMutationRate(double mutationRate, int stagnationCount, SolverConfig config) {
        if (stagnationCount > config.getStagnationHighThreshold()) {
            return Math.min(mutationRate * STRONG_MUTATION_BOOST, config.getMaxMutationRate());
        }
        if (stagnationCount > config.getStagnationLowThreshold()) {
            return Math.min(mutationRate * MILD_MUTATION_BOOST, config.getMaxMutationRate());
        }
        return mutationRate;
    }

    // Per-run state; only the controller thread touches it.
    private final class Run {
        private final int n;
        private final SeedSequence seeds;
        private final BreedingPool pool;
        private final int populationSize;
        private final BoardGenerator generator;
        private final CrossoverStrategy crossover;
        private final Random random;

        private Population population;
        private Board bestSolution;
        private int generation;
        private int stagnationCount;
        private double mutationRate;
        private int reinitializationCount;
        private final List<Integer> convergence = new ArrayList<>();

        Run(int n, SeedSequence seeds, BreedingPool pool) {
            this.n = n;
            this.seeds = seeds;
            this.pool = pool;
            this.populationSize = populationSize(n);
            this.generator = boardGenerator(n);
            this.crossover = config.getCrossover().create();
            this.random = seeds.nextRandom();
            this.mutationRate = config.getInitialMutationRate();
        }

        RunResult.Builder execute(RunResult.Builder result) {
            log("Starting %s: N=%d, population=%d, workers=%d, crossover=%s\n",
                NAME, n, populationSize, pool.getParallelism(), crossover.getName());

            population = initializePopulation(populationSize, generator, seeds, pool);
            generation = 1;
            bestSolution = candidate(population);
            recordGeneration(false);

            while (!bestSolution.isSolved() && generation < config.getMaxGenerations()) {
                boolean reinitialized = false;
                if (population.isEmpty()) {
                    log("WARNING: Evolution failed, population is empty. Reinitializing...\n");
                    population = initializePopulation(populationSize, generator, seeds, pool);
                    reinitializationCount++;
                    reinitialized = true;
                } else {
                    population = evolveOnce();
                }
                generation++;
                updateBestSolution();

                if (stagnationCount > config.getFullResetThreshold()) {
                    log("  - Stagnated for %d generations. Best conflicts: %d. Reinitializing population.\n",
                        stagnationCount, bestSolution.getConflicts());
                    population = initializePopulation(populationSize, generator, seeds, pool);
                    stagnationCount = 0;
                    reinitializationCount++;
                    reinitialized = true;
                    Board fresh = candidate(population);
                    if (improves(fresh, bestSolution)) {
                        bestSolution = fresh;
                    }
                } else {
                    mutationRate = adaptMutationRate(mutationRate, stagnationCount, config);
                }
                recordGeneration(reinitialized);
            }

            log("Finished %s run. Generations: %d, Best Conflicts: %d\n", NAME, generation, bestSolution.getConflicts());
            return result.best(bestSolution)
                .generations(generation)
                .populationSize(populationSize)
                .initialMutationRate(config.getInitialMutationRate())
                .finalMutationRate(mutationRate)
                .stagnationCount(stagnationCount)
                .stagnationThresholds(config.getStagnationLowThreshold(), config.getStagnationHighThreshold())
                .reinitializationCount(reinitializationCount)
                .parallelism(pool.getParallelism(), true)
                .convergence(toArray(convergence));
        }

        /**
         * Builds the next generation: Adam and Eve in slots 0 and 1, then
         * child pairs bred independently from those two parents.
         */
        private Population evolveOnce() {
            ElitistSelection selection = new ElitistSelection(stagnationCount, config.getEveResetThreshold(),
                config.getEveScrambleSwaps(), generator);
            Parents parents = selection.select(population, random);
            if (stagnationCount == config.getEveResetThreshold() + 1) {
                log("  - Adam & Eve seem stuck after %d generations. Resetting Eve...\n", stagnationCount);
            }

            MutationStrategy mutation = SwapMutation.adaptive(mutationRate, stagnationCount);
            int[] adam = parents.getFirst().getState();
            int[] eve = parents.getSecond().getState();

            List<Board> next = new ArrayList<>(populationSize);
            next.add(parents.getFirst());
            if (populationSize > 1) {
                next.add(parents.getSecond());
            }

            int pairs = (populationSize - next.size() + 1) / 2;
            List<Board[]> children = pool.map(seeds.nextSeeds(pairs), (index, taskRandom) -> {
                int[][] offspring = crossover.crossover(adam, eve, taskRandom);
                return new Board[] {
                    new Board(mutation.mutate(offspring[0], taskRandom), n),
                    new Board(mutation.mutate(offspring[1], taskRandom), n)
                };
            });
            for (Board[] pair : children) {
                for (Board child : pair) {
                    if (next.size() < populationSize) {
                        next.add(child);
                    }
                }
            }
            return Population.of(next);
        }

        private void updateBestSolution() {
            Board generationBest = candidate(population);
            if (improves(generationBest, bestSolution)) {
                bestSolution = generationBest;
                stagnationCount = 0;
                mutationRate = config.getInitialMutationRate();
            } else {
                stagnationCount++;
            }
        }

        private void recordGeneration(boolean reinitialized) {
            convergence.add(bestSolution.getConflicts());
            if (generation % config.getProgressInterval() == 0) {
                log("Generation %d: Best Conflicts=%d, Stagnation=%d, Mutation Rate=%.3f\n",
                    generation, bestSolution.getConflicts(), stagnationCount, mutationRate);
            }
            listener().onGeneration(new GenerationSnapshot(generation, population, bestSolution,
                stagnationCount, mutationRate, 0, reinitialized));
        }
    }
}
