package nqueens.ga;

/**
 * Range-copy crossover: only the segment is copied, every other slot stays 0.
 * Children are generally not permutations; nothing repairs them here.
 */
public class RangeCopyCrossover extends SegmentCrossover {

    public RangeCopyCrossover() {
        super(3);
    }

    @Override
    protected void fillOutsideSegment(int[] child, int[] donor, int start, int end) {
        // left as zero
    }

    @Override
    public boolean preservesPermutation() {
        return false;
    }

    @Override
    public String getName() {
        return "RANGE_COPY";
    }
}
