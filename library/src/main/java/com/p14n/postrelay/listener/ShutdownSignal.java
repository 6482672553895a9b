package com.p14n.postrelay.listener;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot flag that sleeping listener code waits on, so that shutdown ends
 * a poll interval or backoff wait immediately.
 */
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void fire() {
        latch.countDown();
    }

    /**
     * Sleeps for {@code duration} or until the signal fires.
     *
     * @return true if the signal fired
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration duration) throws InterruptedException {
        return latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }
}
