// file: core/src/main/java/io/vdb/core/ConvergenceWaiter.java
package io.vdb.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Waits until every segment of a {@link TargetSnapshot} is visible on the
 * serving nodes with at least its expected row count.
 * <p>
 * State:
 *  - pending: target segment ids not yet confirmed. Starts as all targets,
 *    only ever shrinks, and never holds an id outside the snapshot.
 * <p>
 * Each poll cycle:
 *  1) ask the {@link RemoteQueryPort} for the current observation,
 *  2) on success, drop every pending id whose visible count >= expected,
 *  3) on failure, leave pending untouched (a missed poll is not a deletion),
 *  4) pause for the configured interval and go again.
 * <p>
 * Not thread-safe. A waiter belongs to exactly one load call; only the
 * {@link CancellationSignal} is meant to be touched from other threads.
 */
public final class ConvergenceWaiter {

    private static final Logger log = Logger.getLogger(ConvergenceWaiter.class.getName());

    private final TargetSnapshot target;
    private final Set<Long> pending;
    private final Sleeper sleeper;
    private final Clock clock;
    private final PollMetrics metrics;

    private long pollCount;
    private int consecutiveFailures;

    public ConvergenceWaiter(TargetSnapshot target) {
        this(target, Sleeper.system(), Clock.systemUTC(), new PollMetrics());
    }

    /**
     * @param target  segments that must converge
     * @param sleeper pause between cycles
     * @param clock   time source for the optional deadline
     * @param metrics counters to update; may be shared with other waiters
     */
    public ConvergenceWaiter(TargetSnapshot target, Sleeper sleeper, Clock clock, PollMetrics metrics) {
        this.target = Objects.requireNonNull(target, "target");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.pending = new LinkedHashSet<>(target.segmentIds());
    }

    /**
     * Drop every pending segment that the observation shows at or above its
     * expected row count. Segments missing from the observation stay pending.
     * Applying the same observation twice has the same effect as once.
     *
     * @return number of segments removed by this call
     */
    public int reconcile(ObservedState observed) {
        Objects.requireNonNull(observed, "observed");
        int removed = 0;
        Iterator<Long> it = pending.iterator();
        while (it.hasNext()) {
            long segmentId = it.next();
            OptionalLong rows = observed.rows(segmentId);
            if (rows.isPresent() && rows.getAsLong() >= target.expectedRows(segmentId)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public boolean isConverged() {
        return pending.isEmpty();
    }

    /** Copy of the ids still pending. */
    public Set<Long> pending() {
        return Set.copyOf(pending);
    }

    public TargetSnapshot target() {
        return target;
    }

    /** Poll cycles run by this waiter, failed ones included. */
    public long pollCount() {
        return pollCount;
    }

    /** Failed polls in a row for this wait; 0 after any successful poll. */
    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public PollMetrics metrics() {
        return metrics;
    }

    /**
     * Block until converged, with no deadline.
     * <p>
     * Returns early only if the calling thread is interrupted; the interrupt
     * flag is left set and {@link #isConverged()} reports false.
     */
    public void run(RemoteQueryPort port, Duration interval) {
        run(port, WaitOptions.defaults().withInterval(interval));
    }

    /**
     * Block until converged or until one of the bounds in {@code options}
     * ends the wait. An empty snapshot converges with zero polls.
     */
    public WaitOutcome run(RemoteQueryPort port, WaitOptions options) {
        Objects.requireNonNull(port, "port");
        Objects.requireNonNull(options, "options");

        Instant deadline = options.timeout()
                .map(t -> clock.instant().plus(t))
                .orElse(null);

        while (!isConverged()) {
            if (options.cancellation().isCancelled() || Thread.currentThread().isInterrupted()) {
                return stop(WaitOutcome.CANCELLED);
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                return stop(WaitOutcome.TIMED_OUT);
            }

            pollOnce(port);
            if (isConverged()) {
                break;
            }

            int limit = options.maxConsecutiveFailures();
            if (limit > 0 && consecutiveFailures >= limit) {
                return stop(WaitOutcome.POLL_FAILURES_EXHAUSTED);
            }

            try {
                sleeper.sleep(options.interval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return stop(WaitOutcome.CANCELLED);
            }
        }

        log.log(Level.FINE, "converged {0} segment(s) after {1} poll(s)",
                new Object[]{target.size(), pollCount});
        return WaitOutcome.CONVERGED;
    }

    private void pollOnce(RemoteQueryPort port) {
        pollCount++;
        ObservedState observed;
        try {
            observed = port.fetchObserved();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            consecutiveFailures++;
            metrics.recordFailure(consecutiveFailures);
            if (consecutiveFailures == 1) {
                log.log(Level.WARNING,
                        "segment poll failed, keeping " + pending.size() + " segment(s) pending", e);
            } else {
                log.log(Level.FINE, "segment poll failed again ({0} in a row): {1}",
                        new Object[]{consecutiveFailures, e.getMessage()});
            }
            return;
        }

        consecutiveFailures = 0;
        int removed = reconcile(observed == null ? ObservedState.empty() : observed);
        metrics.recordSuccess(removed);
        log.log(Level.FINE, "poll {0}: {1} converged, {2} pending",
                new Object[]{pollCount, removed, pending.size()});
    }

    private WaitOutcome stop(WaitOutcome outcome) {
        log.log(Level.INFO, "convergence wait ended with {0}: {1} of {2} segment(s) pending after {3} poll(s)",
                new Object[]{outcome, pending.size(), target.size(), pollCount});
        return outcome;
    }
}
