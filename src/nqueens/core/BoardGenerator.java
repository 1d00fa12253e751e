package nqueens.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * BoardGenerator: produces initial candidate states.
 * RANDOM is a uniform shuffle; GREEDY places row by row on a column that
 * does not clash with earlier rows, restarting on a dead end.
 */
public class BoardGenerator {

    public enum Mode { RANDOM, GREEDY }

    public static final int DEFAULT_MAX_ATTEMPTS = 1000;

    private final int n;
    private final Mode mode;
    private final int maxAttempts;

    public BoardGenerator(int n, Mode mode, int maxAttempts) {
        if (n < 1) {
            throw new IllegalArgumentException("Board size must be positive: " + n);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Greedy attempts must be positive: " + maxAttempts);
        }
        this.n = n;
        this.mode = mode;
        this.maxAttempts = maxAttempts;
    }

    public BoardGenerator(int n, Mode mode) {
        this(n, mode, DEFAULT_MAX_ATTEMPTS);
    }

    public int getSize() {
        return n;
    }

    public Mode getMode() {
        return mode;
    }

    public int[] generate(Random random) {
        return mode == Mode.GREEDY ? greedyPermutation(n, maxAttempts, random) : randomPermutation(n, random);
    }

    public Board generateBoard(Random random) {
        return new Board(generate(random));
    }

    /**
     * Fisher-Yates shuffle of the identity permutation.
     */
    public static int[] randomPermutation(int n, Random random) {
        int[] state = new int[n];
        for (int i = 0; i < n; i++) {
            state[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = state[i];
            state[i] = state[j];
            state[j] = tmp;
        }
        return state;
    }

    /**
     * Greedy constructive placement. Each row tries the unused columns in a
     * shuffled order and takes the first one without a diagonal clash.
     * After maxAttempts failed attempts the identity permutation is returned.
     */
    public static int[] greedyPermutation(int n, int maxAttempts, Random random) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int[] board = new int[n];
            boolean[] used = new boolean[n];
            boolean valid = true;

            for (int row = 0; row < n; row++) {
                List<Integer> available = new ArrayList<>(n - row);
                for (int col = 0; col < n; col++) {
                    if (!used[col]) {
                        available.add(col);
                    }
                }
                Collections.shuffle(available, random);

                boolean placed = false;
                for (int col : available) {
                    board[row] = col;
                    if (isValidPartialSolution(board, row)) {
                        used[col] = true;
                        placed = true;
                        break;
                    }
                }
                if (!placed) {
                    valid = false;
                    break;
                }
            }

            if (valid) {
                return board;
            }
        }

        int[] identity = new int[n];
        for (int i = 0; i < n; i++) {
            identity[i] = i;
        }
        return identity;
    }

    // rows [0, row) are already placed
    static boolean isValidPartialSolution(int[] board, int row) {
        for (int i = 0; i < row; i++) {
            if (board[i] == board[row]) {
                return false;
            }
            if (Math.abs(board[i] - board[row]) == row - i) {
                return false;
            }
        }
        return true;
    }
}
