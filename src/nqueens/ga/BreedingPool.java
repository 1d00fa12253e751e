package nqueens.ga;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BreedingPool: fans independent units of work out over a fixed worker pool
 * and waits for all of them (one barrier per call).
 * <p>
 * Unit i always runs with {@code new Random(seeds[i])} and its result always
 * lands at index i, so results do not depend on thread scheduling or on the
 * number of workers. Units must only read shared data.
 * </p>
 */
public class BreedingPool implements AutoCloseable {

    /**
     * One unit of work, given its index and its own random source.
     */
    @FunctionalInterface
    public interface SeededTask<T> {
        T apply(int index, Random random);
    }

    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private final int parallelism;
    private final ExecutorService pool;

    public BreedingPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        this.parallelism = parallelism;
        this.pool = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, workerFactory()) : null;
    }

    private static ThreadFactory workerFactory() {
        int poolId = POOL_IDS.incrementAndGet();
        AtomicInteger threadIds = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "nqueens-breeder-" + poolId + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Runs task for every index in [0, seeds.length) and returns the results
     * in index order.
     */
    public <T> List<T> map(long[] seeds, SeededTask<T> task) {
        int count = seeds.length;
        if (count == 0) {
            return new ArrayList<>();
        }
        Object[] results = new Object[count];
        if (pool == null || count == 1) {
            runRange(seeds, task, results, 0, count);
            return toList(results);
        }

        // contiguous chunks, one per worker
        int chunks = Math.min(parallelism, count);
        int chunkSize = (count + chunks - 1) / chunks;
        List<Callable<Void>> jobs = new ArrayList<>(chunks);
        for (int from = 0; from < count; from += chunkSize) {
            final int start = from;
            final int end = Math.min(count, from + chunkSize);
            jobs.add(() -> {
                runRange(seeds, task, results, start, end);
                return null;
            });
        }

        try {
            List<Future<Void>> futures = pool.invokeAll(jobs);
            for (Future<Void> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("Interrupted while waiting for the breeding workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SolverException("Breeding worker failed", cause);
        }
        return toList(results);
    }

    private static <T> void runRange(long[] seeds, SeededTask<T> task, Object[] results, int start, int end) {
        for (int i = start; i < end; i++) {
            results[i] = task.apply(i, new Random(seeds[i]));
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> toList(Object[] results) {
        return new ArrayList<>((List<T>) Arrays.asList(results));
    }

    @Override
    public void close() {
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
