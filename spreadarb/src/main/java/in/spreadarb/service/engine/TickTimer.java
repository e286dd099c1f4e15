package in.spreadarb.service.engine;

import java.time.Duration;

/**
 * Cancellable wait between scheduler ticks.
 */
public interface TickTimer {

    /**
     * Block for {@code interval} or until cancelled.
     *
     * @return true if the full interval elapsed, false if the timer was cancelled
     */
    boolean await(Duration interval) throws InterruptedException;

    /**
     * Cancel the timer. Wakes a waiting thread; every later {@link #await} returns false immediately.
     */
    void cancel();

    boolean isCancelled();
}
