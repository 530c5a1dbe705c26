package org.metalineage.pipeline.consensus;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * Fixed-size pool that splits an index range into contiguous shards and processes them
 * in parallel, blocking the caller until every shard is done.
 * <p>
 * The calling thread takes shard 0; {@code parallelism - 1} parked daemon threads take
 * the others. With a parallelism of 1 no thread is started and everything runs on the
 * caller. Shards are disjoint, so tasks that only write to their own index range need
 * no further synchronization.
 * <p>
 * {@link #dispatch(int, ShardTask)} must be called from one thread at a time.
 * {@link #close()} is idempotent.
 */
public class ShardWorkerPool implements AutoCloseable {

    /**
     * Work on the index range [{@code fromInclusive}, {@code toExclusive}).
     */
    @FunctionalInterface
    public interface ShardTask {
        void run(int fromInclusive, int toExclusive);
    }

    private final Thread[] workers;
    private final int totalThreads;

    private volatile int phase;
    private volatile int workSize;
    private volatile ShardTask task;
    private volatile boolean stopped;
    private final AtomicInteger workersCompleted = new AtomicInteger();
    private final AtomicInteger readyWorkers = new AtomicInteger();
    private final AtomicReference<Throwable> workerException = new AtomicReference<>();

    /**
     * @param parallelism total threads including the caller, at least 1
     * @throws IllegalArgumentException if parallelism &lt; 1
     */
    public ShardWorkerPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        this.totalThreads = parallelism;
        this.workers = new Thread[parallelism - 1];
        for (int i = 0; i < workers.length; i++) {
            int shard = i + 1;
            workers[i] = new Thread(() -> workerLoop(shard), "consensus-worker-" + shard);
            workers[i].setDaemon(true);
            workers[i].start();
        }
        // Workers must snapshot the initial phase before the first dispatch bumps it
        while (readyWorkers.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    public int getParallelism() {
        return totalThreads;
    }

    /**
     * Processes [0, {@code totalSize}) and waits for completion. The first failure of any
     * shard is rethrown once all shards have stopped.
     *
     * @throws IllegalStateException if the pool has been closed
     */
    public void dispatch(int totalSize, ShardTask task) {
        if (stopped) {
            throw new IllegalStateException("Pool is closed");
        }
        if (totalSize <= 0) {
            return;
        }
        if (workers.length == 0) {
            task.run(0, totalSize);
            return;
        }

        this.workSize = totalSize;
        this.task = task;
        workerException.set(null);
        workersCompleted.set(0);
        phase++;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }

        Throwable callerException = null;
        try {
            task.run(0, Math.min(shardSize(totalSize), totalSize));
        } catch (Throwable t) {
            callerException = t;
        }

        while (workersCompleted.get() < workers.length) {
            Thread.onSpinWait();
        }

        Throwable failure = workerException.get();
        if (failure == null) {
            failure = callerException;
        } else if (callerException != null) {
            failure.addSuppressed(callerException);
        }
        if (failure instanceof RuntimeException re) {
            throw re;
        }
        if (failure instanceof Error err) {
            throw err;
        }
        if (failure != null) {
            throw new IllegalStateException("Shard task failed", failure);
        }
    }

    /**
     * Stops and joins the worker threads.
     */
    @Override
    public void close() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private int shardSize(int totalSize) {
        return (totalSize + totalThreads - 1) / totalThreads;
    }

    private void workerLoop(int shard) {
        int lastPhase = phase;
        readyWorkers.incrementAndGet();

        while (!stopped) {
            LockSupport.park();
            if (stopped) {
                break;
            }
            int currentPhase = phase;
            if (currentPhase == lastPhase) {
                continue;
            }
            lastPhase = currentPhase;

            try {
                int size = workSize;
                int chunk = shardSize(size);
                int from = shard * chunk;
                if (from < size) {
                    task.run(from, Math.min(from + chunk, size));
                }
            } catch (Throwable t) {
                workerException.compareAndSet(null, t);
            }
            workersCompleted.incrementAndGet();
        }
    }
}
