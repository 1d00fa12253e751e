package nqueens.ga;

import java.util.ArrayList;
import java.util.List;
import nqueens.core.Board;
import nqueens.core.BoardGenerator;
import nqueens.core.Population;
import nqueens.core.RunResult;
import nqueens.core.SeedSequence;

/**
 * TournamentSolver: generational genetic algorithm with tournament selection.
 * The whole population is replaced every generation. The tournament size
 * shrinks as stagnation grows, and after long stagnation the worst half of
 * the population is swapped for fresh random boards.
 */
public class TournamentSolver extends AbstractSolver {
    public static final String NAME = "GA (Tournament)";

    public TournamentSolver() {
        this(SolverConfig.tournament());
    }

    public TournamentSolver(SolverConfig config) {
        super(config);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected int defaultPopulationSize(int n) {
        return Math.max(2, Math.min(n * 5, 5000));
    }

    @Override
    protected RunResult.Builder run(int n, SeedSequence seeds, BreedingPool pool, RunResult.Builder result) {
        int populationSize = populationSize(n);
        BoardGenerator generator = boardGenerator(n);
        CrossoverStrategy crossover = config.getCrossover().create();
        MutationStrategy mutation = SwapMutation.fixed(config.getFixedMutationProbability());
        if (!crossover.preservesPermutation()) {
            log("WARNING: %s crossover does not preserve permutations; duplicate columns are not repaired.\n",
                crossover.getName());
        }
        log("Starting %s: N=%d, population=%d, workers=%d, crossover=%s\n",
            NAME, n, populationSize, pool.getParallelism(), crossover.getName());

        Population population = initializePopulation(populationSize, generator, seeds, pool);
        int generation = 1;
        int stagnationCount = 0;
        int reinitializationCount = 0;
        int tournamentSize = TournamentSelection.tournamentSize(populationSize, stagnationCount);
        Board bestSolution = candidate(population);
        List<Integer> convergence = new ArrayList<>();
        convergence.add(bestSolution.getConflicts());
        listener().onGeneration(new GenerationSnapshot(generation, population, bestSolution, stagnationCount,
            0.0, tournamentSize, false));

        while (!bestSolution.isSolved() && generation < config.getMaxGenerations()) {
            boolean reinitialized = false;

            if (stagnationCount > config.getTournamentResetThreshold()) {
                int replaceCount = populationSize / 2;
                log("  - Stagnation detected after %d generations. Replacing bottom %d boards...\n",
                    stagnationCount, replaceCount);
                population = population.replaceWorst(generateBoards(replaceCount, generator, seeds, pool));
                stagnationCount = 0;
                reinitialized = true;
            }

            tournamentSize = TournamentSelection.tournamentSize(populationSize, stagnationCount);
            population = evolveOnce(population, new TournamentSelection(tournamentSize), crossover, mutation,
                n, populationSize, seeds, pool);
            generation++;

            if (population.isEmpty()) {
                log("WARNING: Population was wiped out. Reinitializing...\n");
                population = initializePopulation(populationSize, generator, seeds, pool);
                reinitializationCount++;
                reinitialized = true;
            }

            Board generationBest = candidate(population);
            if (improves(generationBest, bestSolution)) {
                bestSolution = generationBest;
                stagnationCount = 0;
            } else {
                stagnationCount++;
            }

            convergence.add(bestSolution.getConflicts());
            if (generation % config.getProgressInterval() == 0) {
                log("Generation %d: Best Conflicts=%d, Stagnation=%d, Tournament Size=%d\n",
                    generation, bestSolution.getConflicts(), stagnationCount, tournamentSize);
            }
            listener().onGeneration(new GenerationSnapshot(generation, population, bestSolution, stagnationCount,
                0.0, tournamentSize, reinitialized));
        }

        log("Finished %s run. Generations: %d, Best Conflicts: %d\n", NAME, generation, bestSolution.getConflicts());
        return result.best(bestSolution)
            .generations(generation)
            .populationSize(populationSize)
            .initialMutationRate(config.getFixedMutationProbability())
            .finalMutationRate(config.getFixedMutationProbability())
            .stagnationCount(stagnationCount)
            .stagnationThresholds(0, 0)
            .reinitializationCount(reinitializationCount)
            .parallelism(pool.getParallelism(), false)
            .tournamentSize(tournamentSize)
            .convergence(toArray(convergence));
    }

    /**
     * Fills a new population with child pairs. Each pair runs its own
     * tournament against the read-only current population.
     */
    private static Population evolveOnce(Population population, SelectionStrategy selection,
                                         CrossoverStrategy crossover, MutationStrategy mutation,
                                         int n, int populationSize, SeedSequence seeds, BreedingPool pool) {
        int pairs = (populationSize + 1) / 2;
        List<Board[]> children = pool.map(seeds.nextSeeds(pairs), (index, random) -> {
            Parents parents = selection.select(population, random);
            int[][] offspring = crossover.crossover(parents.getFirst().getState(), parents.getSecond().getState(), random);
            return new Board[] {
                new Board(mutation.mutate(offspring[0], random), n),
                new Board(mutation.mutate(offspring[1], random), n)
            };
        });

        List<Board> next = new ArrayList<>(populationSize);
        for (Board[] pair : children) {
            for (Board child : pair) {
                if (next.size() < populationSize) {
                    next.add(child);
                }
            }
        }
        return Population.of(next);
    }
}
