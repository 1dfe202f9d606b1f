// file: core/src/main/java/io/vdb/core/RemoteQueryPort.java
package io.vdb.core;

/**
 * Source of the per-segment row counts currently visible to the serving
 * (query) nodes of one collection.
 * <p>
 * Implementations typically issue one remote statistics call per invocation.
 * Failures are expected and tolerated: ConvergenceWaiter treats a thrown
 * exception as "no information this round" and keeps polling.
 */
@FunctionalInterface
public interface RemoteQueryPort {

    /**
     * Fetch the current observation.
     *
     * @throws Exception on any transport or service failure
     */
    ObservedState fetchObserved() throws Exception;
}
