package com.rms.taskqueue.consumer;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cooperative stop request shared between the supervisor and the consumer loop.
 */
public class StopSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void raise() {
        latch.countDown();
    }

    public boolean isRaised() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps for up to {@code timeout}, returning early once the signal is raised.
     *
     * @return {@code true} if the signal was raised
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
