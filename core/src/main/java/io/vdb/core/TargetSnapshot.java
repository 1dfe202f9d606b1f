// file: core/src/main/java/io/vdb/core/TargetSnapshot.java
package io.vdb.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping segmentId -> expectedRows captured right after a load
 * request has been acknowledged.
 * <p>
 * Only segments that belong to the partitions under load and that carry at
 * least one row are kept: a zero-row segment has nothing to observe, so it
 * never blocks convergence.
 * <p>
 * Design:
 *  - Built once per load call, read-only afterwards.
 *  - Iteration order follows the input listing, so two captures over the
 *    same inputs are equal and iterate identically.
 */
public final class TargetSnapshot {

    private static final TargetSnapshot EMPTY = new TargetSnapshot(Map.of());

    private final Map<Long, Long> expectedRows;

    private TargetSnapshot(Map<Long, Long> expectedRows) {
        this.expectedRows = expectedRows;
    }

    /**
     * Capture the targets for a load of {@code partitionIds}.
     * <p>
     * Neither argument is modified. If the same segment id appears more than
     * once in the listing, the larger row count wins.
     *
     * @param partitionIds partition ids resolved for the load call
     * @param allSegments  full persistent segment listing of the collection
     */
    public static TargetSnapshot capture(Set<Long> partitionIds, List<Segment> allSegments) {
        Objects.requireNonNull(partitionIds, "partitionIds");
        Objects.requireNonNull(allSegments, "allSegments");
        if (partitionIds.isEmpty() || allSegments.isEmpty()) {
            return EMPTY;
        }

        Map<Long, Long> targets = new LinkedHashMap<>();
        for (Segment s : allSegments) {
            if (s.rowCount() == 0) {
                continue;
            }
            if (!partitionIds.contains(s.partitionId())) {
                // segment belongs to a partition we are not loading
                continue;
            }
            targets.merge(s.segmentId(), s.rowCount(), Math::max);
        }
        return targets.isEmpty() ? EMPTY : new TargetSnapshot(Collections.unmodifiableMap(targets));
    }

    /**
     * Build a snapshot from explicit targets.
     */
    public static TargetSnapshot of(Map<Long, Long> expectedRows) {
        Objects.requireNonNull(expectedRows, "expectedRows");
        Map<Long, Long> copy = new LinkedHashMap<>();
        for (Map.Entry<Long, Long> e : expectedRows.entrySet()) {
            SegmentTarget t = new SegmentTarget(e.getKey(), e.getValue());
            copy.put(t.segmentId(), t.expectedRows());
        }
        return copy.isEmpty() ? EMPTY : new TargetSnapshot(Collections.unmodifiableMap(copy));
    }

    public static TargetSnapshot empty() { return EMPTY; }

    public boolean isEmpty() { return expectedRows.isEmpty(); }

    public int size() { return expectedRows.size(); }

    public Set<Long> segmentIds() { return expectedRows.keySet(); }

    public boolean contains(long segmentId) { return expectedRows.containsKey(segmentId); }

    /**
     * Expected row count for a captured segment.
     *
     * @throws IllegalArgumentException if the segment is not part of this snapshot
     */
    public long expectedRows(long segmentId) {
        Long rows = expectedRows.get(segmentId);
        if (rows == null) {
            throw new IllegalArgumentException("segment " + segmentId + " is not a load target");
        }
        return rows;
    }

    /** Read-only view of segmentId -> expectedRows. */
    public Map<Long, Long> entries() { return expectedRows; }

    public List<SegmentTarget> targets() {
        List<SegmentTarget> out = new ArrayList<>(expectedRows.size());
        expectedRows.forEach((id, rows) -> out.add(new SegmentTarget(id, rows)));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetSnapshot that)) return false;
        return expectedRows.equals(that.expectedRows);
    }

    @Override
    public int hashCode() {
        return expectedRows.hashCode();
    }

    @Override
    public String toString() {
        return "TargetSnapshot" + expectedRows;
    }
}
