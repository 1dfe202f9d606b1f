// file: core/src/main/java/io/vdb/core/WaitOutcome.java
package io.vdb.core;

/**
 * Terminal state of a {@link ConvergenceWaiter} run.
 */
public enum WaitOutcome {
    /** Every target segment reached its expected row count. */
    CONVERGED,
    /** The wait deadline passed before convergence. */
    TIMED_OUT,
    /** The cancellation signal fired or the waiting thread was interrupted. */
    CANCELLED,
    /** The configured number of consecutive poll failures was reached. */
    POLL_FAILURES_EXHAUSTED
}
