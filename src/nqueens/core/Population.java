package nqueens.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Population: a ranked, immutable snapshot of one generation.
 * Boards are kept in an array sorted once by the Board ordering, so
 * duplicate boards are retained rather than collapsed.
 */
public final class Population {
    private static final Population EMPTY = new Population(new Board[0]);

    private final Board[] ranked;

    private Population(Board[] ranked) {
        this.ranked = ranked;
    }

    public static Population of(Collection<Board> boards) {
        Board[] copy = boards.toArray(new Board[0]);
        for (Board board : copy) {
            if (board == null) {
                throw new IllegalArgumentException("Population must not contain null boards");
            }
        }
        Arrays.sort(copy);
        return new Population(copy);
    }

    public static Population of(Board... boards) {
        return of(Arrays.asList(boards));
    }

    public static Population empty() {
        return EMPTY;
    }

    public int size() {
        return ranked.length;
    }

    public boolean isEmpty() {
        return ranked.length == 0;
    }

    /**
     * @return the lowest-conflict board, or null when empty
     */
    public Board best() {
        return ranked.length > 0 ? ranked[0] : null;
    }

    /**
     * @return the runner-up board, or null when fewer than two boards exist
     */
    public Board secondBest() {
        return ranked.length > 1 ? ranked[1] : null;
    }

    public Board worst() {
        return ranked.length > 0 ? ranked[ranked.length - 1] : null;
    }

    public Board get(int rank) {
        return ranked[rank];
    }

    public int bestConflicts() {
        return ranked.length > 0 ? ranked[0].getConflicts() : Integer.MAX_VALUE;
    }

    public boolean containsSolution() {
        return bestSolved() != null;
    }

    /**
     * @return the highest-ranked solved board, or null if there is none
     */
    public Board bestSolved() {
        for (Board board : ranked) {
            if (board.isSolved()) {
                return board;
            }
        }
        return null;
    }

    public List<Board> getBoards() {
        return Collections.unmodifiableList(Arrays.asList(ranked));
    }

    /**
     * Gets the top boards of this generation.
     * @param count number of boards wanted
     */
    public List<Board> top(int count) {
        int limit = Math.min(Math.max(count, 0), ranked.length);
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOf(ranked, limit)));
    }

    /**
     * Replaces the worst-ranked boards with the given ones.
     * @param replacements fresh boards; at most size() of them are used
     * @return a new ranked population of the same size
     */
    public Population replaceWorst(List<Board> replacements) {
        int replace = Math.min(replacements.size(), ranked.length);
        List<Board> next = new ArrayList<>(ranked.length);
        next.addAll(Arrays.asList(ranked).subList(0, ranked.length - replace));
        next.addAll(replacements.subList(0, replace));
        return of(next);
    }

    @Override
    public String toString() {
        return "Population{size=" + ranked.length + ", bestConflicts="
            + (ranked.length > 0 ? String.valueOf(ranked[0].getConflicts()) : "n/a") + "}";
    }
}
