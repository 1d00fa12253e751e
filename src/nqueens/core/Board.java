package nqueens.core;

import java.util.Arrays;

/**
 * Board: one candidate placement of N queens.
 * state[row] = column of the queen in that row. The conflict count is
 * computed once at construction; a Board never changes afterwards.
 */
public final class Board implements Comparable<Board> {
    /** Fitness reserved for a board without diagonal conflicts. */
    public static final double SOLVED_FITNESS = 1000.0;

    private final int[] state;
    private final int conflicts;    // diagonal attacks, O(n^2) once
    private final boolean permutation;

    public Board(int[] state) {
        if (state == null) {
            throw new IllegalArgumentException("Board state must not be null");
        }
        this.state = state.clone();
        this.conflicts = countConflicts(this.state);
        this.permutation = isPermutation(this.state);
    }

    /**
     * Builds a board and checks it against the expected board size.
     * @param state queen columns by row
     * @param n expected number of queens
     */
    public Board(int[] state, int n) {
        this(checkLength(state, n));
    }

    private static int[] checkLength(int[] state, int n) {
        if (state == null || state.length != n) {
            throw new IllegalArgumentException("Board state must have length " + n + " but was "
                + (state == null ? "null" : String.valueOf(state.length)));
        }
        return state;
    }

    /**
     * Counts pairs (i, j), i < j, with |state[i] - state[j]| == |i - j|.
     */
    public static int countConflicts(int[] state) {
        int count = 0;
        int n = state.length;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Math.abs(state[i] - state[j]) == j - i) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * True when the array holds every value of [0, n) exactly once.
     */
    public static boolean isPermutation(int[] state) {
        int n = state.length;
        boolean[] seen = new boolean[n];
        for (int value : state) {
            if (value < 0 || value >= n || seen[value]) {
                return false;
            }
            seen[value] = true;
        }
        return true;
    }

    public int getConflicts() {
        return conflicts;
    }

    public double getFitness() {
        return conflicts == 0 ? SOLVED_FITNESS : 1.0 / (1.0 + conflicts);
    }

    public int[] getState() {
        return state.clone();
    }

    public int size() {
        return state.length;
    }

    public int get(int row) {
        return state[row];
    }

    public boolean isPermutation() {
        return permutation;
    }

    /**
     * A board is solved only when no two queens share a diagonal and every
     * column is used exactly once.
     */
    public boolean isSolved() {
        return conflicts == 0 && permutation;
    }

    // Orders by conflicts, then lexicographically by state
    @Override
    public int compareTo(Board other) {
        int cmp = Integer.compare(this.conflicts, other.conflicts);
        if (cmp != 0) {
            return cmp;
        }
        return Arrays.compare(this.state, other.state);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Board)) {
            return false;
        }
        return Arrays.equals(state, ((Board) obj).state);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(state);
    }

    /**
     * Draws the board as rows of 'Q' and '-' separated by the given spacing.
     */
    public String render(int spaces) {
        String cellSpacing = " ".repeat(Math.max(0, spaces));
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < state.length; row++) {
            StringBuilder line = new StringBuilder();
            for (int col = 0; col < state.length; col++) {
                line.append(state[row] == col ? 'Q' : '-').append(cellSpacing);
            }
            sb.append(line.toString().stripTrailing()).append('\n');
        }
        return sb.toString();
    }

    public String render() {
        return render(0);
    }

    @Override
    public String toString() {
        return Arrays.toString(state);
    }
}
