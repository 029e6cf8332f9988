package com.kiisha.ai.gateway;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-side cancellation for a gateway call: a manual {@link #cancel()}, an optional
 * deadline, or both. The gateway checks it before every attempt, wakes from backoff
 * sleeps when it fires, and hands the remaining time to the provider as its timeout.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(null, Clock.systemUTC(), false);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;
    private final boolean cancellable;

    private CancellationSignal(Instant deadline, Clock clock, boolean cancellable) {
        this.deadline = deadline;
        this.clock = clock;
        this.cancellable = cancellable;
    }

    /**
     * A signal that never fires.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null, Clock.systemUTC(), true);
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationSignal withTimeout(Duration timeout, Clock clock) {
        return new CancellationSignal(clock.instant().plus(timeout), clock, true);
    }

    public static CancellationSignal withDeadline(Instant deadline, Clock clock) {
        return new CancellationSignal(deadline, clock, true);
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("The shared no-op signal cannot be cancelled");
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || deadlinePassed();
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left before the deadline; empty when there is none. Never negative.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Sleeps up to {@code millis}, waking early on cancellation or at the deadline.
     *
     * @return true if the signal has fired
     */
    public boolean await(long millis) throws InterruptedException {
        long wait = millis;
        Optional<Duration> left = remaining();
        if (left.isPresent()) {
            wait = Math.min(wait, left.get().toMillis());
        }
        if (wait > 0) {
            cancelled.await(wait, TimeUnit.MILLISECONDS);
        }
        return isCancelled();
    }

    private boolean deadlinePassed() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + isCancelled() +
                (deadline != null ? ", deadline=" + deadline : "") + '}';
    }
}
