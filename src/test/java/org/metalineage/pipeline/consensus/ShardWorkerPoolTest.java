package org.metalineage.pipeline.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicIntegerArray;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ShardWorkerPoolTest {

    private ShardWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    @Test
    void dispatchWritesAllElements() {
        pool = new ShardWorkerPool(4);
        int[] data = new int[100];

        pool.dispatch(data.length, (from, to) -> {
            for (int i = from; i < to; i++) {
                data[i] = i * 2;
            }
        });

        for (int i = 0; i < data.length; i++) {
            assertThat(data[i]).isEqualTo(i * 2);
        }
    }

    @Test
    void singleThreadRunsOnCaller() {
        pool = new ShardWorkerPool(1);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        pool.dispatch(10, (from, to) -> threads.add(Thread.currentThread().getName()));

        assertThat(threads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    void fewerElementsThanThreads() {
        pool = new ShardWorkerPool(4);
        int[] data = new int[1];

        pool.dispatch(1, (from, to) -> {
            for (int i = from; i < to; i++) {
                data[i] = 42;
            }
        });

        assertThat(data[0]).isEqualTo(42);
    }

    @Test
    void dispatchWithZeroSize() {
        pool = new ShardWorkerPool(2);

        pool.dispatch(0, (from, to) -> {
            throw new AssertionError("Should not be called");
        });
    }

    @Test
    void workerExceptionPropagates() {
        pool = new ShardWorkerPool(4);

        assertThatThrownBy(() ->
                pool.dispatch(100, (from, to) -> {
                    if (from > 0) {
                        throw new IllegalStateException("Worker failure");
                    }
                })
        ).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Worker failure");
    }

    @Test
    void repeatedDispatchesDoNotDeadlock() {
        pool = new ShardWorkerPool(4);
        AtomicIntegerArray counters = new AtomicIntegerArray(100);

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
    void closeIsIdempotentAndRejectsFurtherWork() {
        pool = new ShardWorkerPool(3);
        pool.close();
        pool.close();

        assertThatThrownBy(() -> pool.dispatch(5, (from, to) -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constructorRejectsParallelismBelowOne() {
        assertThatThrownBy(() -> new ShardWorkerPool(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
