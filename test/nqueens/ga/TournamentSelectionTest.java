package nqueens.ga;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import nqueens.core.Board;
import nqueens.core.Population;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TournamentSelectionTest {
    private static final Board SOLVED_A = new Board(new int[] {1, 3, 0, 2});
    private static final Board SOLVED_B = new Board(new int[] {2, 0, 3, 1});
    private static final Board ONE_CONFLICT = new Board(new int[] {1, 3, 2, 0});
    private static final Board IDENTITY = new Board(new int[] {0, 1, 2, 3});

    @Test
    void testTournamentSize() {
        assertEquals(10, TournamentSelection.tournamentSize(100, 0));
        assertEquals(6, TournamentSelection.tournamentSize(100, 5));
        assertEquals(3, TournamentSelection.tournamentSize(20, 0));
        assertEquals(3, TournamentSelection.tournamentSize(5000, 5000));
        assertEquals(500, TournamentSelection.tournamentSize(5000, 0));
    }

    @Test
    void testPick_TwoSolvedBoardsWinInSampleOrder() {
        Parents parents = TournamentSelection.pick(Arrays.asList(SOLVED_A, IDENTITY, SOLVED_B));
        assertSame(SOLVED_A, parents.getFirst());
        assertSame(SOLVED_B, parents.getSecond());
    }

    @Test
    void testPick_SingleSolvedBoardPairsWithBestOfTheRest() {
        Parents parents = TournamentSelection.pick(Arrays.asList(IDENTITY, SOLVED_B, ONE_CONFLICT));
        assertSame(SOLVED_B, parents.getFirst());
        assertSame(ONE_CONFLICT, parents.getSecond());

        Parents alone = TournamentSelection.pick(List.of(SOLVED_B));
        assertSame(SOLVED_B, alone.getFirst());
        assertSame(SOLVED_B, alone.getSecond());
    }

    @Test
    void testPick_NoSolvedBoardsTakesTheTwoFewestConflicts() {
        Board twoConflicts = new Board(new int[] {0, 2, 1, 3});
        Parents parents = TournamentSelection.pick(Arrays.asList(IDENTITY, twoConflicts, ONE_CONFLICT));
        assertSame(ONE_CONFLICT, parents.getFirst());
        assertSame(twoConflicts, parents.getSecond());

        Parents alone = TournamentSelection.pick(List.of(IDENTITY));
        assertSame(IDENTITY, alone.getFirst());
        assertSame(IDENTITY, alone.getSecond());
    }

    @Test
    void testSelect_DrawsFromThePopulation() {
        Population population = Population.of(IDENTITY, ONE_CONFLICT, SOLVED_A);
        Parents parents = new TournamentSelection(5).select(population, new Random(4));
        assertTrue(population.getBoards().contains(parents.getFirst()));
        assertTrue(population.getBoards().contains(parents.getSecond()));
    }

    @Test
    void testSelect_RejectsEmptyPopulation() {
        TournamentSelection selection = new TournamentSelection(3);
        assertThrows(IllegalArgumentException.class, () -> selection.select(Population.empty(), new Random(0)));
        assertThrows(IllegalArgumentException.class, () -> new TournamentSelection(0));
    }
}
