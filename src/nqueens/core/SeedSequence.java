package nqueens.core;

import java.util.Random;
import java.util.SplittableRandom;

/**
 * Derives per-task seeds from one master seed.
 * Only the controller thread draws from a SeedSequence; each parallel task
 * receives a plain long and builds its own Random from it, so no random
 * generator is ever shared between threads.
 */
public final class SeedSequence {
    private final long masterSeed;
    private final SplittableRandom source;

    public SeedSequence(long masterSeed) {
        this.masterSeed = masterSeed;
        this.source = new SplittableRandom(masterSeed);
    }

    public long getMasterSeed() {
        return masterSeed;
    }

    public long nextSeed() {
        return source.nextLong();
    }

    public long[] nextSeeds(int count) {
        long[] seeds = new long[count];
        for (int i = 0; i < count; i++) {
            seeds[i] = source.nextLong();
        }
        return seeds;
    }

    /**
     * A fresh generator for work done on the controller thread itself.
     */
    public Random nextRandom() {
        return new Random(source.nextLong());
    }
}
