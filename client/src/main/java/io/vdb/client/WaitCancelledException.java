// file: client/src/main/java/io/vdb/client/WaitCancelledException.java
package io.vdb.client;

/**
 * The caller cancelled (or interrupted) a synchronous load wait.
 * The load itself keeps running remotely.
 */
public final class WaitCancelledException extends VdbException {

    private final int pendingSegments;

    public WaitCancelledException(String collection, int pendingSegments) {
        super("wait for load of collection %s cancelled, %d segment(s) pending"
                .formatted(collection, pendingSegments));
        this.pendingSegments = pendingSegments;
    }

    public int pendingSegments() {
        return pendingSegments;
    }
}
