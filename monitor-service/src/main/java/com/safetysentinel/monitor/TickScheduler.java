package com.safetysentinel.monitor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Waits between {@link HealthLoop} ticks and carries the stop signal.
 *
 * <p>
 * The default implementation parks on a latch, so {@link #stop()} wakes a
 * sleeping loop immediately instead of after the remaining interval.
 * </p>
 */
interface TickScheduler {

    /**
     * Wait for up to {@code delay}.
     *
     * @param delay how long to wait
     * @return {@code true} if {@link #stop()} was called and the loop must exit
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean await(Duration delay) throws InterruptedException;

    /**
     * Signal the loop to exit; a pending {@link #await} returns at once.
     */
    void stop();

    static TickScheduler latch() {
        CountDownLatch stopped = new CountDownLatch(1);
        return new TickScheduler() {
            @Override
            public boolean await(Duration delay) throws InterruptedException {
                return stopped.await(delay.toMillis(), TimeUnit.MILLISECONDS);
            }

            @Override
            public void stop() {
                stopped.countDown();
            }
        };
    }
}
