package nqueens.ga;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import nqueens.core.Board;
import nqueens.core.BoardGenerator;
import nqueens.core.Population;
import nqueens.core.RunResult;
import nqueens.core.SeedSequence;

/**
 * Shared plumbing of the two controllers: argument checks, timing, the
 * worker pool lifecycle, population seeding and best-so-far bookkeeping.
 */
public abstract class AbstractSolver implements Solver {
    protected final SolverConfig config;
    private GenerationListener listener = GenerationListener.NONE;

    protected AbstractSolver(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SolverConfig getConfig() {
        return config;
    }

    public void setGenerationListener(GenerationListener listener) {
        this.listener = listener == null ? GenerationListener.NONE : listener;
    }

    protected GenerationListener listener() {
        return listener;
    }

    @Override
    public RunResult solve(int n) {
        return solve(n, new SplittableRandom().nextInt(Integer.MAX_VALUE));
    }

    @Override
    public RunResult solve(int n, long seed) {
        if (n < 1) {
            throw new IllegalArgumentException("Number of queens must be positive: " + n);
        }
        long startTime = System.nanoTime();
        try (BreedingPool pool = new BreedingPool(config.getParallelism())) {
            RunResult.Builder result = run(n, new SeedSequence(seed), pool, RunResult.builder(getName(), n, seed));
            return result.elapsed(Duration.ofNanos(System.nanoTime() - startTime)).build();
        }
    }

    /**
     * Executes one run and fills in everything but the elapsed time.
     */
    protected abstract RunResult.Builder run(int n, SeedSequence seeds, BreedingPool pool, RunResult.Builder result);

    protected abstract int defaultPopulationSize(int n);

    protected int populationSize(int n) {
        return config.getPopulationSize() > 0 ? config.getPopulationSize() : defaultPopulationSize(n);
    }

    protected BoardGenerator boardGenerator(int n) {
        return new BoardGenerator(n, config.getInitialization(), config.getGreedyMaxAttempts());
    }

    /**
     * One board per slot, generated in parallel with one seed per slot.
     */
    protected List<Board> generateBoards(int count, BoardGenerator generator, SeedSequence seeds, BreedingPool pool) {
        return pool.map(seeds.nextSeeds(count), (index, random) -> generator.generateBoard(random));
    }

    protected Population initializePopulation(int size, BoardGenerator generator, SeedSequence seeds, BreedingPool pool) {
        return Population.of(generateBoards(size, generator, seeds, pool));
    }

    /**
     * The board of a population that competes for best-so-far: a solved
     * board if one exists, else the top-ranked one.
     */
    protected static Board candidate(Population population) {
        Board solved = population.bestSolved();
        return solved != null ? solved : population.best();
    }

    /**
     * A solved board beats an unsolved one; otherwise fewer conflicts wins.
     */
    protected static boolean improves(Board candidate, Board best) {
        if (candidate == null) {
            return false;
        }
        if (best == null) {
            return true;
        }
        if (candidate.isSolved() != best.isSolved()) {
            return candidate.isSolved();
        }
        return candidate.getConflicts() < best.getConflicts();
    }

    protected static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }

    protected void log(String format, Object... args) {
        if (config.isVerbose()) {
            System.out.printf(format, args);
        }
    }
}
