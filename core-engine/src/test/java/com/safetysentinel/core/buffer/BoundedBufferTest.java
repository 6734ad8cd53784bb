package com.safetysentinel.core.buffer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BoundedBuffer}.
 */
class BoundedBufferTest {

    @Test
    @DisplayName("Should evict oldest element once capacity is reached")
    void shouldEvictOldest() {
        BoundedBuffer<Integer> buffer = new BoundedBuffer<>(3);

        assertThat(buffer.push(1)).isNull();
        assertThat(buffer.push(2)).isNull();
        assertThat(buffer.push(3)).isNull();
        assertThat(buffer.push(4)).isEqualTo(1);

        assertThat(buffer.snapshot()).containsExactly(2, 3, 4);
        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.evictedCount()).isEqualTo(1);
        assertThat(buffer.peekLast()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should return a snapshot that is not affected by later pushes")
    void shouldReturnDetachedSnapshot() {
        BoundedBuffer<String> buffer = new BoundedBuffer<>(5);
        buffer.push("a");
        List<String> snapshot = buffer.snapshot();

        buffer.push("b");

        assertThat(snapshot).containsExactly("a");
        assertThatThrownBy(() -> snapshot.add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject capacity below one")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new BoundedBuffer<>(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }

    @Test
    @DisplayName("Should reject null elements")
    void shouldRejectNull() {
        BoundedBuffer<String> buffer = new BoundedBuffer<>(1);
        assertThatThrownBy(() -> buffer.push(null)).isInstanceOf(NullPointerException.class);
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should never exceed capacity under concurrent pushes")
    void shouldStayBoundedUnderConcurrency() throws InterruptedException {
        BoundedBuffer<Integer> buffer = new BoundedBuffer<>(100);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            tasks.add(() -> {
                awaitQuietly(start);
                for (int i = 0; i < 1_000; i++) {
                    buffer.push(i);
                }
            });
        }
        tasks.forEach(pool::submit);
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(buffer.size()).isEqualTo(100);
        assertThat(buffer.evictedCount()).isEqualTo(7_900);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
