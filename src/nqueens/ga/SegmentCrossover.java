package nqueens.ga;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * Base for the segment-copying operators. A contiguous segment
 * [start, end) is copied from one parent; what the subclass does with the
 * rest of the child decides whether permutations survive.
 */
public abstract class SegmentCrossover implements CrossoverStrategy {
    private final int segmentDivisor;

    protected SegmentCrossover(int segmentDivisor) {
        this.segmentDivisor = segmentDivisor;
    }

    @Override
    public int[][] crossover(int[] parent1, int[] parent2, Random random) {
        checkParents(parent1, parent2);
        int n = parent1.length;
        int[] segment = pickSegment(n, segmentDivisor, random);
        int start = segment[0];
        int end = segment[1];

        int[] child1 = new int[n];
        int[] child2 = new int[n];
        System.arraycopy(parent1, start, child1, start, end - start);
        System.arraycopy(parent2, start, child2, start, end - start);

        fillOutsideSegment(child1, parent2, start, end);
        fillOutsideSegment(child2, parent1, start, end);
        return new int[][] {child1, child2};
    }

    /**
     * Completes the child outside [start, end) using the donor parent.
     */
    protected abstract void fillOutsideSegment(int[] child, int[] donor, int start, int end);

    /**
     * start in [0, n/d), end = start + a length drawn from [n/d, n - start).
     * @return {start, end}
     */
    static int[] pickSegment(int n, int divisor, Random random) {
        int minLength = n / divisor;
        int start = minLength > 0 ? random.nextInt(minLength) : 0;
        int end = start + minLength + random.nextInt(n - start - minLength);
        return new int[] {start, end};
    }

    static void checkParents(int[] parent1, int[] parent2) {
        if (parent1 == null || parent2 == null) {
            throw new IllegalArgumentException("Crossover needs two parents");
        }
        if (parent1.length == 0) {
            throw new IllegalArgumentException("Crossover parents must not be empty");
        }
        if (parent1.length != parent2.length) {
            throw new IllegalArgumentException("Parents differ in length: " + parent1.length + " vs " + parent2.length);
        }
    }

    /**
     * Fills the open slots left to right with the donor's values in donor
     * order, skipping values already present in the copied segment.
     */
    static void fillFromDonor(int[] child, int[] donor, int start, int end) {
        int n = child.length;
        Set<Integer> used = new HashSet<>();
        for (int i = start; i < end; i++) {
            used.add(child[i]);
        }

        int index = 0;
        for (int i = 0; i < n; i++) {
            if (i >= start && i < end) {
                continue;
            }
            while (index < n && used.contains(donor[index])) {
                index++;
            }
            if (index < n) {
                child[i] = donor[index++];
            }
        }
    }
}
