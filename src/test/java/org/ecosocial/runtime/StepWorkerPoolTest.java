package org.ecosocial.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicIntegerArray;

import org.ecosocial.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StepWorkerPoolTest {

    private StepWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void dispatchCoversEveryIndexExactlyOnce() {
        pool = new StepWorkerPool(4);
        AtomicIntegerArray hits = new AtomicIntegerArray(103);

        pool.dispatch(hits.length(), (from, to) -> {
            for (int i = from; i < to; i++) {
                hits.incrementAndGet(i);
            }
        });

        for (int i = 0; i < hits.length(); i++) {
            assertThat(hits.get(i)).as("index %d", i).isEqualTo(1);
        }
    }

    @Test
    void fewerIndicesThanThreads() {
        pool = new StepWorkerPool(4);
        int[] data = new int[1];

        pool.dispatch(1, (from, to) -> data[from] = 42);

        assertThat(data[0]).isEqualTo(42);
    }

    @Test
    void zeroSizeDoesNotRunTheTask() {
        pool = new StepWorkerPool(2);

        pool.dispatch(0, (from, to) -> {
            throw new AssertionError("must not be called");
        });
    }

    @Test
    void workerFailurePropagatesToCaller() {
        pool = new StepWorkerPool(4);

        assertThatThrownBy(() -> pool.dispatch(100, (from, to) -> {
            if (from > 0) {
                throw new IllegalStateException("worker failure");
            }
        })).isInstanceOf(IllegalStateException.class).hasMessageContaining("worker failure");

        // The pool stays usable after a failed dispatch
        int[] data = new int[8];
        pool.dispatch(data.length, (from, to) -> {
            for (int i = from; i < to; i++) {
                data[i] = 1;
            }
        });
        assertThat(data).containsOnly(1);
    }

    @Test
    void workersRunOnNamedDaemonThreads() {
        pool = new StepWorkerPool(3);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        String caller = Thread.currentThread().getName();

        pool.dispatch(30, (from, to) -> threads.add(Thread.currentThread().getName()));

        assertThat(threads).contains(caller, "encode-worker-1", "encode-worker-2");
    }

    @Test
    void repeatedDispatchesDoNotDeadlock() {
        pool = new StepWorkerPool(4);
        AtomicIntegerArray counters = new AtomicIntegerArray(50);

        for (int round = 0; round < 1000; round++) {
            pool.dispatch(counters.length(), (from, to) -> {
                for (int i = from; i < to; i++) {
                    counters.incrementAndGet(i);
                }
            });
        }

        for (int i = 0; i < counters.length(); i++) {
            assertThat(counters.get(i)).isEqualTo(1000);
        }
    }

    @Test
    void shutdownIsIdempotentAndParallelismIsValidated() {
        pool = new StepWorkerPool(2);
        assertThat(pool.getParallelism()).isEqualTo(2);
        pool.shutdown();
        pool.shutdown();

        assertThatThrownBy(() -> new StepWorkerPool(1)).isInstanceOf(IllegalArgumentException.class);
    }
}
