// file: core/src/main/java/io/vdb/core/ObservedState.java
package io.vdb.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * One poll cycle's view of segment row counts visible on the serving nodes.
 * <p>
 * Transient: built fresh on every poll and dropped after reconciliation.
 * A segment reported by several serving nodes keeps its largest count.
 */
public final class ObservedState {

    private static final ObservedState EMPTY = new ObservedState(Map.of());

    private final Map<Long, Long> visibleRows;

    private ObservedState(Map<Long, Long> visibleRows) {
        this.visibleRows = visibleRows;
    }

    public static ObservedState empty() { return EMPTY; }

    public static ObservedState of(Map<Long, Long> visibleRows) {
        Builder b = builder();
        Objects.requireNonNull(visibleRows, "visibleRows").forEach(b::add);
        return b.build();
    }

    public static Builder builder() { return new Builder(); }

    /** Visible row count for a segment, empty if the segment was not reported. */
    public OptionalLong rows(long segmentId) {
        Long rows = visibleRows.get(segmentId);
        return rows == null ? OptionalLong.empty() : OptionalLong.of(rows);
    }

    public int size() { return visibleRows.size(); }

    @Override
    public String toString() {
        return "ObservedState" + visibleRows;
    }

    public static final class Builder {
        private final Map<Long, Long> rows = new HashMap<>();

        private Builder() {
        }

        public Builder add(long segmentId, long visibleRows) {
            if (visibleRows < 0) {
                throw new IllegalArgumentException("visibleRows must be >= 0, got " + visibleRows);
            }
            rows.merge(segmentId, visibleRows, Math::max);
            return this;
        }

        public ObservedState build() {
            return rows.isEmpty() ? EMPTY : new ObservedState(Map.copyOf(rows));
        }
    }
}
