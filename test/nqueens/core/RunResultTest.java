package nqueens.core;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class RunResultTest {

    private static RunResult.Builder solvedRun() {
        return RunResult.builder("GA (Adam & Eve)", 4, 5L)
            .best(new Board(new int[] {2, 0, 3, 1}))
            .generations(10)
            .populationSize(50)
            .initialMutationRate(0.2)
            .finalMutationRate(0.25)
            .stagnationThresholds(50, 200)
            .elapsed(Duration.ofMillis(1500))
            .convergence(new int[] {2, 1, 0});
    }

    @Test
    void testFormatDuration() {
        assertEquals("01.500", RunResult.formatDuration(Duration.ofMillis(1500)));
        assertEquals("02:03.004", RunResult.formatDuration(Duration.ofMillis(123_004)));
        assertEquals("01:00:00.000", RunResult.formatDuration(Duration.ofHours(1)));
    }

    @Test
    void testComplexity_PerCoreOnlyWhenRequested() {
        RunResult perCore = solvedRun().parallelism(4, true).build();
        assertEquals(10.0 * 50 * 4 / 4, perCore.getComplexity(), 1e-9);

        RunResult plain = solvedRun().parallelism(4, false).build();
        assertEquals(10.0 * 50 * 4, plain.getComplexity(), 1e-9);
    }

    @Test
    void testSummary() {
        String summary = solvedRun().parallelism(2, true).build().summary();
        assertTrue(summary.contains("=== GA (Adam & Eve) Summary ==="));
        assertTrue(summary.contains("N (Queens): 4"));
        assertTrue(summary.contains("Mutation Rate: 0.200 -> 0.250"));
        assertTrue(summary.contains("Solved: yes"));
        assertTrue(summary.contains("O(G x P x N / C)"));
        assertTrue(summary.contains("Space Complexity: O(P x N) = 200"));

        String tournament = solvedRun().tournamentSize(5).build().summary();
        assertTrue(tournament.contains("Tournament Size (T): 5"));
        assertTrue(tournament.contains("O(G x P x N) ="));
    }

    @Test
    void testAccessors() {
        RunResult result = solvedRun().build();
        assertTrue(result.isSolved());
        assertEquals(0, result.getConflicts());
        assertArrayEquals(new int[] {2, 0, 3, 1}, result.getBestState());
        assertArrayEquals(new int[] {2, 1, 0}, result.getConvergence());
        assertEquals(1500.0, result.getElapsedMillis(), 1e-9);
        assertEquals("01.500", result.formatElapsed());
    }

    @Test
    void testBuild_RequiresMatchingBestBoard() {
        assertThrows(IllegalStateException.class, () -> RunResult.builder("x", 4, 0).build());
        assertThrows(IllegalStateException.class,
            () -> RunResult.builder("x", 5, 0).best(new Board(new int[] {2, 0, 3, 1})).build());
    }
}
