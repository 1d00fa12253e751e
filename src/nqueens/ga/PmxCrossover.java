package nqueens.ga;

/**
 * Partially-mapped crossover. Segment start lies in [0, n/3) and the
 * segment spans at least n/3 rows; every other slot is taken from the
 * other parent in its order, skipping values the segment already holds.
 * Two permutations in, two permutations out.
 */
public class PmxCrossover extends SegmentCrossover {

    public PmxCrossover() {
        super(3);
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
        return "PMX";
    }
}
