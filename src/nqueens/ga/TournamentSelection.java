package nqueens.ga;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import nqueens.core.Board;
import nqueens.core.Population;

/**
 * TournamentSelection: samples boards with replacement and returns the two
 * strongest, giving precedence to boards without conflicts.
 */
public class TournamentSelection implements SelectionStrategy {
    static final int MIN_TOURNAMENT_SIZE = 3;

    // fewest conflicts first, ties go to the higher fitness
    private static final Comparator<Board> LEAST_CONFLICTS = Comparator
        .comparingInt(Board::getConflicts)
        .thenComparing(Comparator.comparingDouble(Board::getFitness).reversed());

    private static final Comparator<Board> HIGHEST_FITNESS =
        Comparator.comparingDouble(Board::getFitness).reversed();

    private final int tournamentSize;

    public TournamentSelection(int tournamentSize) {
        if (tournamentSize < 1) {
            throw new IllegalArgumentException("Tournament size must be positive: " + tournamentSize);
        }
        this.tournamentSize = tournamentSize;
    }

    /**
     * max(3, populationSize / (10 + stagnation)): longer stagnation means a
     * smaller sample and weaker selection pressure.
     */
    public static int tournamentSize(int populationSize, int stagnationCount) {
        return Math.max(MIN_TOURNAMENT_SIZE, populationSize / (10 + Math.max(0, stagnationCount)));
    }

    public int getTournamentSize() {
        return tournamentSize;
    }

    @Override
    public Parents select(Population population, Random random) {
        if (population == null || population.isEmpty()) {
            throw new IllegalArgumentException("Tournament selection needs a non-empty population");
        }
        List<Board> tournament = new ArrayList<>(tournamentSize);
        for (int i = 0; i < tournamentSize; i++) {
            tournament.add(population.get(random.nextInt(population.size())));
        }
        return pick(tournament);
    }

    /**
     * Chooses two parents from an already drawn sample.
     */
    static Parents pick(List<Board> tournament) {
        List<Board> valid = new ArrayList<>();
        List<Board> others = new ArrayList<>();
        for (Board board : tournament) {
            if (board.getConflicts() == 0) {
                valid.add(board);
            } else {
                others.add(board);
            }
        }

        if (valid.size() >= 2) {
            valid.sort(HIGHEST_FITNESS);
            return new Parents(valid.get(0), valid.get(1));
        }
        if (valid.size() == 1) {
            Board partner = others.isEmpty() ? valid.get(0) : others.stream().min(LEAST_CONFLICTS).get();
            return new Parents(valid.get(0), partner);
        }

        List<Board> ranked = new ArrayList<>(tournament);
        ranked.sort(LEAST_CONFLICTS);
        Board first = ranked.get(0);
        Board second = ranked.size() > 1 ? ranked.get(1) : first;
        return new Parents(first, second);
    }
}
