package com.testops.publisher.retry;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * {@link Sleeper} whose waits can be cut short from another thread.
 *
 * Waiting happens on a latch rather than {@code Thread.sleep}, so
 * {@link #cancel()} releases a wait in progress immediately. Once cancelled,
 * every current and future wait throws {@link CancellationException}.
 */
public class CancellableSleeper implements Sleeper {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            if (isCancelled()) {
                throw new CancellationException("Wait cancelled");
            }
            return;
        }
        if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new CancellationException("Wait cancelled");
        }
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
}
