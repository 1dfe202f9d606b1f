// file: core/src/test/java/io/vdb/core/ConvergenceWaiterTest.java
package io.vdb.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for ConvergenceWaiter: reconciliation rules, poll-failure tolerance
 * and the optional wait bounds.
 */
class ConvergenceWaiterTest {

    private static final Duration INTERVAL = Duration.ofMillis(100);

    private final FakeClock clock = new FakeClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();
    // each sleep moves the fake clock forward, so deadlines behave like real time
    private final Sleeper sleeper = d -> {
        sleeps.add(d);
        clock.advance(d);
    };

    private ConvergenceWaiter waiter(Map<Long, Long> targets) {
        return new ConvergenceWaiter(TargetSnapshot.of(targets), sleeper, clock, new PollMetrics());
    }

    private static ObservedState observed(long... idAndRows) {
        ObservedState.Builder b = ObservedState.builder();
        for (int i = 0; i < idAndRows.length; i += 2) {
            b.add(idAndRows[i], idAndRows[i + 1]);
        }
        return b.build();
    }

    @Test
    void segments_converge_once_their_expected_rows_are_visible() {
        ConvergenceWaiter w = waiter(Map.of(1L, 100L, 2L, 50L));

        w.reconcile(observed(1L, 100L));
        assertEquals(Set.of(2L), w.pending());

        w.reconcile(observed(2L, 49L));
        assertEquals(Set.of(2L), w.pending(), "49 < 50 must stay pending");
        assertFalse(w.isConverged());

        w.reconcile(observed(2L, 50L));
        assertEquals(Set.of(), w.pending());
        assertTrue(w.isConverged());
    }

    @Test
    void reconcile_twice_with_same_observation_equals_once() {
        ConvergenceWaiter once = waiter(Map.of(1L, 10L, 2L, 20L, 3L, 30L));
        ConvergenceWaiter twice = waiter(Map.of(1L, 10L, 2L, 20L, 3L, 30L));
        ObservedState obs = observed(1L, 10L, 2L, 5L, 3L, 31L);

        once.reconcile(obs);
        twice.reconcile(obs);
        int secondRemoval = twice.reconcile(obs);

        assertEquals(once.pending(), twice.pending());
        assertEquals(0, secondRemoval);
    }

    @Test
    void pending_never_grows_and_stays_within_targets() {
        Map<Long, Long> targets = new HashMap<>();
        for (long id = 1; id <= 20; id++) {
            targets.put(id, id * 10);
        }
        ConvergenceWaiter w = waiter(targets);
        Random random = new Random(42);

        int previous = w.pending().size();
        for (int round = 0; round < 200; round++) {
            ObservedState.Builder b = ObservedState.builder();
            for (long id = 1; id <= 25; id++) {      // ids 21..25 are not targets
                if (random.nextBoolean()) {
                    b.add(id, random.nextInt(250));
                }
            }
            w.reconcile(b.build());

            Set<Long> pending = w.pending();
            assertTrue(pending.size() <= previous, "pending set grew in round " + round);
            assertTrue(targets.keySet().containsAll(pending));
            previous = pending.size();
        }
    }

    @Test
    void converged_segment_is_not_re_added_by_a_lower_later_observation() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L, 2L, 10L));

        w.reconcile(observed(1L, 10L));
        w.reconcile(observed(1L, 3L));

        assertEquals(Set.of(2L), w.pending());
    }

    @Test
    void missing_segment_in_observation_stays_pending() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));

        w.reconcile(ObservedState.empty());
        w.reconcile(observed(99L, 1000L));

        assertEquals(Set.of(1L), w.pending());
    }

    @Test
    void empty_snapshot_converges_without_polling() {
        ConvergenceWaiter w = new ConvergenceWaiter(TargetSnapshot.empty(), sleeper, clock, new PollMetrics());

        assertTrue(w.isConverged());
        WaitOutcome outcome = w.run(() -> fail("must not poll"), WaitOptions.defaults());

        assertEquals(WaitOutcome.CONVERGED, outcome);
        assertEquals(0, w.pollCount());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void failed_poll_then_success_converges_after_two_polls() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));
        ScriptedPort port = new ScriptedPort(w)
                .fail("statistics endpoint unavailable")
                .then(observed(1L, 10L));

        WaitOutcome outcome = w.run(port, WaitOptions.defaults());

        assertEquals(WaitOutcome.CONVERGED, outcome);
        assertEquals(2, w.pollCount());
        assertEquals(List.of(Set.of(1L), Set.of(1L)), port.pendingAtEachPoll);
        assertEquals(List.of(INTERVAL), sleeps);
    }

    @Test
    void failed_polls_leave_pending_untouched_and_are_not_raised() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L, 2L, 20L));
        ScriptedPort port = new ScriptedPort(w)
                .then(observed(1L, 10L))
                .fail("boom")
                .fail("boom")
                .fail("boom")
                .then(observed(2L, 20L));

        WaitOutcome outcome = assertDoesNotThrow(() -> w.run(port, WaitOptions.defaults()));

        assertEquals(WaitOutcome.CONVERGED, outcome);
        assertEquals(
                List.of(Set.of(1L, 2L), Set.of(2L), Set.of(2L), Set.of(2L), Set.of(2L)),
                port.pendingAtEachPoll
        );
        PollMetrics m = w.metrics();
        assertEquals(5, m.polls());
        assertEquals(3, m.failures());
        assertEquals(3, m.longestFailureStreak());
        assertEquals(0, w.consecutiveFailures(), "success resets the streak");
        assertEquals(2, m.convergedSegments());
    }

    @Test
    void null_observation_counts_as_no_information() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));
        ScriptedPort port = new ScriptedPort(w).then(null).then(observed(1L, 11L));

        assertEquals(WaitOutcome.CONVERGED, w.run(port, WaitOptions.defaults()));
        assertEquals(2, w.pollCount());
    }

    @Test
    void wait_times_out_when_deadline_passes() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));
        RemoteQueryPort neverVisible = ObservedState::empty;

        WaitOutcome outcome = w.run(neverVisible, WaitOptions.defaults().withTimeout(Duration.ofMillis(250)));

        // polls at t=0, 100, 200; deadline checked at t=300
        assertEquals(WaitOutcome.TIMED_OUT, outcome);
        assertEquals(3, w.pollCount());
        assertEquals(Set.of(1L), w.pending());
    }

    @Test
    void zero_timeout_gives_up_before_the_first_poll() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));

        WaitOutcome outcome = w.run(() -> fail("must not poll"), WaitOptions.defaults().withTimeout(Duration.ZERO));

        assertEquals(WaitOutcome.TIMED_OUT, outcome);
        assertEquals(0, w.pollCount());
    }

    @Test
    void cancellation_stops_the_wait_before_the_next_poll() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));
        CancellationSignal signal = new CancellationSignal();
        int[] calls = {0};
        RemoteQueryPort port = () -> {
            if (++calls[0] == 2) {
                signal.cancel();
            }
            return ObservedState.empty();
        };

        WaitOutcome outcome = w.run(port, WaitOptions.defaults().withCancellation(signal));

        assertEquals(WaitOutcome.CANCELLED, outcome);
        assertEquals(2, w.pollCount());
    }

    @Test
    void interrupt_during_sleep_cancels_and_keeps_interrupt_flag() {
        Sleeper interrupted = d -> {
            throw new InterruptedException("shutdown");
        };
        ConvergenceWaiter w = new ConvergenceWaiter(
                TargetSnapshot.of(Map.of(1L, 10L)), interrupted, clock, new PollMetrics());

        try {
            WaitOutcome outcome = w.run(ObservedState::empty, WaitOptions.defaults());
            assertEquals(WaitOutcome.CANCELLED, outcome);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted(); // clear for other tests
        }
    }

    @Test
    void consecutive_failure_limit_ends_the_wait() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));
        RemoteQueryPort down = () -> {
            throw new IllegalStateException("connection refused");
        };

        WaitOutcome outcome = w.run(down, WaitOptions.defaults().withMaxConsecutiveFailures(3));

        assertEquals(WaitOutcome.POLL_FAILURES_EXHAUSTED, outcome);
        assertEquals(3, w.pollCount());
        assertEquals(3, w.consecutiveFailures());
    }

    @Test
    void successful_poll_resets_the_failure_streak() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L, 2L, 10L));
        ScriptedPort port = new ScriptedPort(w)
                .fail("x").fail("x")
                .then(observed(1L, 10L))
                .fail("x").fail("x")
                .then(observed(2L, 10L));

        WaitOutcome outcome = w.run(port, WaitOptions.defaults().withMaxConsecutiveFailures(3));

        assertEquals(WaitOutcome.CONVERGED, outcome);
        assertEquals(6, w.pollCount());
        assertEquals(2, w.metrics().longestFailureStreak());
    }

    @Test
    void shared_metrics_keep_failure_streaks_per_wait() {
        PollMetrics shared = new PollMetrics();
        ConvergenceWaiter failing = new ConvergenceWaiter(
                TargetSnapshot.of(Map.of(1L, 10L)), sleeper, clock, shared);
        ConvergenceWaiter healthy = new ConvergenceWaiter(
                TargetSnapshot.of(Map.of(2L, 10L)), sleeper, clock, shared);
        RemoteQueryPort down = () -> {
            throw new IllegalStateException("connection refused");
        };
        WaitOptions twoPolls = WaitOptions.defaults().withMaxConsecutiveFailures(2);

        assertEquals(WaitOutcome.POLL_FAILURES_EXHAUSTED, failing.run(down, twoPolls));
        assertEquals(WaitOutcome.CONVERGED, healthy.run(() -> observed(2L, 10L), WaitOptions.defaults()));

        // the other wait's success leaves this streak alone
        assertEquals(2, failing.consecutiveFailures());
        assertEquals(WaitOutcome.POLL_FAILURES_EXHAUSTED,
                failing.run(down, WaitOptions.defaults().withMaxConsecutiveFailures(3)));
        assertEquals(3, failing.consecutiveFailures());

        assertEquals(0, healthy.consecutiveFailures());
        assertEquals(4, shared.polls());
        assertEquals(3, shared.failures());
        assertEquals(3, shared.longestFailureStreak());
        assertEquals(1, shared.convergedSegments());
    }

    @Test
    void unbounded_run_returns_once_converged() {
        ConvergenceWaiter w = waiter(Map.of(1L, 10L));
        ScriptedPort port = new ScriptedPort(w)
                .then(observed(1L, 2L))
                .then(observed(1L, 7L))
                .then(observed(1L, 10L));

        w.run(port, Duration.ofMillis(5));

        assertTrue(w.isConverged());
        assertEquals(3, w.pollCount());
        assertEquals(List.of(Duration.ofMillis(5), Duration.ofMillis(5)), sleeps);
    }

    /**
     * Port that replays a fixed script of observations and failures and
     * records the waiter's pending set at every call.
     */
    private static final class ScriptedPort implements RemoteQueryPort {
        private final ConvergenceWaiter waiter;
        private final Deque<Object> script = new ArrayDeque<>();
        private final List<Set<Long>> pendingAtEachPoll = new ArrayList<>();

        ScriptedPort(ConvergenceWaiter waiter) {
            this.waiter = waiter;
        }

        ScriptedPort then(ObservedState state) {
            script.add(state == null ? NULL_MARKER : state);
            return this;
        }

        ScriptedPort fail(String message) {
            script.add(new IllegalStateException(message));
            return this;
        }

        @Override
        public ObservedState fetchObserved() {
            pendingAtEachPoll.add(waiter.pending());
            Object next = script.poll();
            if (next == null) {
                throw new AssertionError("script exhausted");
            }
            if (next instanceof RuntimeException e) {
                throw e;
            }
            return next == NULL_MARKER ? null : (ObservedState) next;
        }

        private static final Object NULL_MARKER = new Object();
    }
}
