package org.ecosocial.runtime;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * A small pool of parked daemon threads for the read-only encoding pass at the end of a step.
 * <p>
 * The pool keeps {@code P-1} workers alive between steps and wakes them with
 * {@link LockSupport#unpark(Thread)}. The stepping thread takes part as slot 0, so one dispatch
 * uses P threads in total. Each slot processes one contiguous range of agent indices.
 * <p>
 * <b>Dispatch protocol:</b>
 * <ol>
 *   <li>The stepping thread publishes the range size and task, then bumps the volatile {@code generation}</li>
 *   <li>It unparks every worker and runs slot 0 itself</li>
 *   <li>Workers that observe a new generation run their slot and count themselves done</li>
 *   <li>The stepping thread spins until all workers are done, then rethrows the first failure</li>
 * </ol>
 * <p>
 * Only the mutation-free encoding pass may be dispatched here; the movement and social phases
 * depend on strict id order and always run on the stepping thread.
 */
public class StepWorkerPool {

    /**
     * Work over a contiguous range of agent indices.
     */
    @FunctionalInterface
    public interface RangeTask {
        /**
         * Processes indices in [{@code fromInclusive}, {@code toExclusive}).
         *
         * @param fromInclusive first index
         * @param toExclusive   index after the last one
         */
        void run(int fromInclusive, int toExclusive);
    }

    private final Thread[] workers;
    private final int slots;

    private volatile int generation;
    private volatile int size;
    private volatile RangeTask task;
    private volatile boolean stopped;
    private final AtomicInteger finished = new AtomicInteger();
    private final AtomicInteger parked = new AtomicInteger();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    /**
     * Starts {@code parallelism - 1} workers and waits until each has captured the initial
     * generation, so the first dispatch cannot be mistaken for a spurious wakeup.
     *
     * @param parallelism total number of threads including the stepping thread, must be &gt;= 2
     * @throws IllegalArgumentException if parallelism &lt; 2
     */
    public StepWorkerPool(int parallelism) {
        if (parallelism < 2) {
            throw new IllegalArgumentException("Parallelism must be >= 2, got " + parallelism);
        }
        this.slots = parallelism;
        this.workers = new Thread[parallelism - 1];
        for (int i = 0; i < workers.length; i++) {
            int slot = i + 1;
            workers[i] = new Thread(() -> workerLoop(slot), "encode-worker-" + slot);
            workers[i].setDaemon(true);
            workers[i].start();
        }
        while (parked.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    /**
     * Returns the total number of threads taking part in a dispatch.
     * @return the parallelism
     */
    public int getParallelism() {
        return slots;
    }

    /**
     * Splits [0, {@code totalSize}) into one range per slot and blocks until all ranges are done.
     * <p>
     * The first exception thrown by any slot is rethrown here, with later ones suppressed.
     * Must be called from the stepping thread only; not reentrant.
     *
     * @param totalSize number of indices, nothing happens if &lt;= 0
     * @param task      work for each range
     */
    public void dispatch(int totalSize, RangeTask task) {
        if (totalSize <= 0) return;

        this.size = totalSize;
        this.task = task;
        failure.set(null);
        finished.set(0);
        generation++;

        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }

        Throwable local = null;
        try {
            runSlot(0, totalSize, task);
        } catch (Throwable t) {
            local = t;
        }

        while (finished.get() < workers.length) {
            Thread.onSpinWait();
        }

        Throwable remote = failure.get();
        if (remote != null && local != null) {
            remote.addSuppressed(local);
        }
        Throwable first = remote != null ? remote : local;
        if (first instanceof RuntimeException re) {
            throw re;
        }
        if (first instanceof Error e) {
            throw e;
        }
        if (first != null) {
            throw new IllegalStateException("Encoding dispatch failed", first);
        }
    }

    /**
     * Stops and joins all workers. Idempotent; waits at most five seconds per worker.
     */
    public void shutdown() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runSlot(int slot, int totalSize, RangeTask rangeTask) {
        int chunk = (totalSize + slots - 1) / slots;
        int from = slot * chunk;
        int to = Math.min(from + chunk, totalSize);
        if (from < to) {
            rangeTask.run(from, to);
        }
    }

    private void workerLoop(int slot) {
        int seen = generation;
        parked.incrementAndGet();

        while (!stopped) {
            LockSupport.park();
            if (stopped) break;

            int current = generation;
            if (current == seen) {
                continue; // spurious wakeup
            }
            seen = current;

            try {
                runSlot(slot, size, task);
            } catch (Throwable t) {
                failure.compareAndSet(null, t);
            }
            finished.incrementAndGet();
        }
    }
}
