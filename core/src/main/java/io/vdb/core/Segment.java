// file: core/src/main/java/io/vdb/core/Segment.java
package io.vdb.core;

/**
 * One entry of the persistent segment listing for a collection.
 *
 * Fields:
 *  - segmentId:   opaque segment identity assigned by the service.
 *  - partitionId: partition the segment belongs to.
 *  - rowCount:    rows flushed into the segment at listing time (>= 0).
 */
public record Segment(
        long segmentId,
        long partitionId,
        long rowCount
) {
    public Segment {
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must be >= 0, got " + rowCount);
        }
    }
}
