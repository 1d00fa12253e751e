package nqueens.ga;

/**
 * Order crossover (OX). Same fill rule as PMX over a segment that starts in
 * [0, n/4) and spans at least n/4 rows.
 */
public class OrderCrossover extends SegmentCrossover {

    public OrderCrossover() {
        super(4);
    }

    @Override
    protected void fillOutsideSegment(int[] child, int[] donor, int start, int end) {
        fillFromDonor(child, donor, start, end);
    }

    @Override
    public boolean preservesPermutation() {
        return true;
    }

    @Override
    public String getName() {
        return "OX";
    }
}
