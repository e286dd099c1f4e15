package in.spreadarb.service.engine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock tick timer backed by a latch, so cancel() wakes the sleeper at once.
 */
public final class SleepingTickTimer implements TickTimer {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    @Override
    public boolean await(Duration interval) throws InterruptedException {
        return !cancelled.await(interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void cancel() {
        cancelled.countDown();
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
}
