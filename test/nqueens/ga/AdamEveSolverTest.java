package nqueens.ga;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import nqueens.core.Board;
import nqueens.core.BoardGenerator;
import nqueens.core.RunResult;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class AdamEveSolverTest {

    private static SolverConfig.Builder randomStart() {
        return SolverConfig.adamEve().toBuilder()
            .initialization(BoardGenerator.Mode.RANDOM)
            .parallelism(2);
    }

    private static void assertNonIncreasing(int[] convergence) {
        for (int i = 1; i < convergence.length; i++) {
            assertTrue(convergence[i] <= convergence[i - 1], "generation " + (i + 1));
        }
    }

    @Test
    void testSolveFourQueens() {
        RunResult result = new AdamEveSolver().solve(4, 1);
        assertTrue(result.isSolved());
        int[] state = result.getBestState();
        assertTrue(Arrays.equals(state, new int[] {1, 3, 0, 2})
            || Arrays.equals(state, new int[] {2, 0, 3, 1}));
        assertEquals(AdamEveSolver.NAME, result.getAlgorithm());
        assertEquals(50, result.getPopulationSize());
    }

    @Test
    void testSolveEightQueensFromRandomBoards() {
        SolverConfig config = randomStart().maxGenerations(3000).fullResetThreshold(500).build();
        AdamEveSolver solver = new AdamEveSolver(config);
        RunResult solved = null;
        for (long seed = 0; seed < 5 && solved == null; seed++) {
            RunResult result = solver.solve(8, seed);
            assertTrue(result.isPermutation());
            assertEquals(result.getGenerations(), result.getConvergence().length);
            assertNonIncreasing(result.getConvergence());
            if (result.isSolved()) {
                solved = result;
            }
        }
        assertNotNull(solved);
        assertEquals(0, solved.getConflicts());
        assertEquals(80, solved.getPopulationSize());
    }

    @Test
    void testSameSeedSameResultForAnyWorkerCount() {
        SolverConfig base = randomStart().maxGenerations(150).build();
        RunResult single = new AdamEveSolver(base.toBuilder().parallelism(1).build()).solve(14, 42);
        RunResult multi = new AdamEveSolver(base.toBuilder().parallelism(3).build()).solve(14, 42);
        assertArrayEquals(single.getBestState(), multi.getBestState());
        assertEquals(single.getGenerations(), multi.getGenerations());
        assertArrayEquals(single.getConvergence(), multi.getConvergence());
        assertEquals(single.getFinalMutationRate(), multi.getFinalMutationRate(), 0.0);
    }

    @Test
    void testTinyPopulationsDoNotBreakTheLoop() {
        for (int size = 1; size <= 3; size++) {
            SolverConfig config = randomStart().populationSize(size).maxGenerations(30).build();
            RunResult result = new AdamEveSolver(config).solve(9, 7);
            assertEquals(9, result.getBestState().length);
            assertTrue(result.getGenerations() <= 30);
            assertEquals(size, result.getPopulationSize());
        }
    }

    @Test
    void testFullResetRebuildsThePopulation() {
        // two boards and no children: nothing can improve, so every check resets
        SolverConfig config = randomStart().populationSize(2).fullResetThreshold(0).maxGenerations(10).build();
        AdamEveSolver solver = new AdamEveSolver(config);
        List<GenerationSnapshot> snapshots = new ArrayList<>();
        solver.setGenerationListener(snapshots::add);

        RunResult result = solver.solve(12, 3);

        assertEquals(1, snapshots.get(0).getGeneration());
        assertFalse(snapshots.get(0).isReinitialized());
        GenerationSnapshot second = snapshots.get(1);
        assertEquals(2, second.getGeneration());
        assertTrue(second.isReinitialized());
        assertEquals(0, second.getStagnationCount());
        assertNotEquals(snapshots.get(0).getPopulation().getBoards(), second.getPopulation().getBoards());
        assertTrue(result.getReinitializationCount() >= 1);
    }

    @Test
    void testListenerSeesEveryGeneration() {
        SolverConfig config = randomStart().maxGenerations(40).build();
        AdamEveSolver solver = new AdamEveSolver(config);
        List<Integer> generations = new ArrayList<>();
        solver.setGenerationListener(snapshot -> {
            generations.add(snapshot.getGeneration());
            assertEquals(0, snapshot.getTournamentSize());
            assertTrue(snapshot.getMutationRate() <= config.getMaxMutationRate());
        });
        RunResult result = solver.solve(16, 11);
        assertEquals(result.getGenerations(), generations.size());
        for (int i = 0; i < generations.size(); i++) {
            assertEquals(i + 1, generations.get(i).intValue());
        }
    }

    @Test
    void testAdaptMutationRate() {
        SolverConfig config = SolverConfig.adamEve();
        assertEquals(0.2, AdamEveSolver.adaptMutationRate(0.2, 50, config), 1e-12);
        assertEquals(0.21, AdamEveSolver.adaptMutationRate(0.2, 51, config), 1e-12);
        assertEquals(0.21, AdamEveSolver.adaptMutationRate(0.2, 200, config), 1e-12);
        assertEquals(0.22, AdamEveSolver.adaptMutationRate(0.2, 201, config), 1e-12);
        assertEquals(0.4, AdamEveSolver.adaptMutationRate(0.39, 201, config), 1e-12);
    }

    @Test
    void testDefaultPopulationSize() {
        AdamEveSolver solver = new AdamEveSolver();
        assertEquals(50, solver.defaultPopulationSize(4));
        assertEquals(100, solver.defaultPopulationSize(10));
        assertEquals(2000, solver.defaultPopulationSize(512));
    }

    @Test
    void testRejectsNonPositiveN() {
        assertThrows(IllegalArgumentException.class, () -> new AdamEveSolver().solve(0, 1));
    }

    @Test
    void testGreedyStartSolvesEightQueens() {
        RunResult result = new AdamEveSolver(SolverConfig.adamEve().toBuilder().parallelism(2).build()).solve(8, 5);
        assertTrue(result.isSolved());
        assertEquals(0, Board.countConflicts(result.getBestState()));
    }
}
