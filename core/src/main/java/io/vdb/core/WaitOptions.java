// file: core/src/main/java/io/vdb/core/WaitOptions.java
package io.vdb.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied bounds for a synchronous convergence wait.
 *
 * Semantics:
 *  - interval:               fixed pause between poll cycles (no backoff).
 *  - timeout:                optional deadline for the whole wait; absent
 *                            means wait until converged.
 *  - cancellation:           signal that aborts the wait from another thread.
 *  - maxConsecutiveFailures: stop after this many failed polls in a row;
 *                            0 means failed polls never end the wait.
 *
 * Defaults keep the unbounded wait: 100ms interval, no timeout, no limit.
 */
public final class WaitOptions {

    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);

    private final Duration interval;
    private final Duration timeout;                // null => no deadline
    private final CancellationSignal cancellation;
    private final int maxConsecutiveFailures;

    public WaitOptions(Duration interval,
                       Duration timeout,
                       CancellationSignal cancellation,
                       int maxConsecutiveFailures) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0, got " + interval);
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0, got " + timeout);
        }
        if (maxConsecutiveFailures < 0) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be >= 0, got " + maxConsecutiveFailures);
        }
        this.interval = interval;
        this.timeout = timeout;
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    public static WaitOptions defaults() {
        return new WaitOptions(DEFAULT_INTERVAL, null, CancellationSignal.none(), 0);
    }

    public WaitOptions withInterval(Duration interval) {
        return new WaitOptions(interval, this.timeout, this.cancellation, this.maxConsecutiveFailures);
    }

    public WaitOptions withTimeout(Duration timeout) {
        return new WaitOptions(this.interval, Objects.requireNonNull(timeout, "timeout"),
                this.cancellation, this.maxConsecutiveFailures);
    }

    /** Same options without a deadline. */
    public WaitOptions withoutTimeout() {
        return new WaitOptions(this.interval, null, this.cancellation, this.maxConsecutiveFailures);
    }

    public WaitOptions withCancellation(CancellationSignal cancellation) {
        return new WaitOptions(this.interval, this.timeout, cancellation, this.maxConsecutiveFailures);
    }

    public WaitOptions withMaxConsecutiveFailures(int maxConsecutiveFailures) {
        return new WaitOptions(this.interval, this.timeout, this.cancellation, maxConsecutiveFailures);
    }

    public Duration interval() {
        return interval;
    }

    public boolean hasTimeout() {
        return timeout != null;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    public int maxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    @Override
    public String toString() {
        return "WaitOptions{" +
                "interval=" + interval +
                ", timeout=" + timeout +
                ", cancelled=" + cancellation.isCancelled() +
                ", maxConsecutiveFailures=" + maxConsecutiveFailures +
                '}';
    }
}
