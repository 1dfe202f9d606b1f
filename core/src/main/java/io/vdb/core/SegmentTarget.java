// file: core/src/main/java/io/vdb/core/SegmentTarget.java
package io.vdb.core;

/**
 * A segment that must become visible on the serving nodes with at least
 * {@code expectedRows} rows before a synchronous load may return.
 */
public record SegmentTarget(
        long segmentId,
        long expectedRows
) {
    public SegmentTarget {
        if (expectedRows <= 0) {
            throw new IllegalArgumentException("expectedRows must be > 0, got " + expectedRows);
        }
    }
}
