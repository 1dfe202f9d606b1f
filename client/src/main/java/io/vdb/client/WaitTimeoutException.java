// file: client/src/main/java/io/vdb/client/WaitTimeoutException.java
package io.vdb.client;

import java.time.Duration;

/**
 * A synchronous load was acknowledged but did not become fully visible
 * within the caller's timeout. The load itself keeps running remotely.
 */
public final class WaitTimeoutException extends VdbException {

    private final int pendingSegments;

    public WaitTimeoutException(String collection, int pendingSegments, Duration timeout) {
        super("load of collection %s not visible after %dms, %d segment(s) pending"
                .formatted(collection, timeout.toMillis(), pendingSegments));
        this.pendingSegments = pendingSegments;
    }

    public int pendingSegments() {
        return pendingSegments;
    }
}
