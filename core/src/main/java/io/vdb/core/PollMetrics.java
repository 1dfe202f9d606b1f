// file: core/src/main/java/io/vdb/core/PollMetrics.java
package io.vdb.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for convergence polling.
 *
 * Tracked:
 *  - polls:                     poll cycles attempted.
 *  - failures:                  poll cycles whose fetch failed.
 *  - longestFailureStreak:      longest run of failed polls within one wait.
 *  - convergedSegments:         targets confirmed visible.
 *
 * May be shared across concurrent load calls; all updates are atomic.
 * The current streak belongs to each waiter
 * ({@link ConvergenceWaiter#consecutiveFailures()}), so a success in one
 * wait never resets the streak of another.
 */
public final class PollMetrics {

    private final AtomicLong polls = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong longestFailureStreak = new AtomicLong();
    private final AtomicLong convergedSegments = new AtomicLong();

    public void recordSuccess(int newlyConverged) {
        polls.incrementAndGet();
        if (newlyConverged > 0) {
            convergedSegments.addAndGet(newlyConverged);
        }
    }

    /**
     * @param streak the calling waiter's failure streak, this failure included
     */
    public void recordFailure(long streak) {
        if (streak <= 0) {
            throw new IllegalArgumentException("streak must be > 0, got " + streak);
        }
        polls.incrementAndGet();
        failures.incrementAndGet();
        longestFailureStreak.accumulateAndGet(streak, Math::max);
    }

    public long polls()                 { return polls.get(); }
    public long failures()              { return failures.get(); }
    public long longestFailureStreak()  { return longestFailureStreak.get(); }
    public long convergedSegments()     { return convergedSegments.get(); }

    @Override
    public String toString() {
        return "PollMetrics{" +
                "polls=" + polls.get() +
                ", failures=" + failures.get() +
                ", longestFailureStreak=" + longestFailureStreak.get() +
                ", convergedSegments=" + convergedSegments.get() +
                '}';
    }
}
