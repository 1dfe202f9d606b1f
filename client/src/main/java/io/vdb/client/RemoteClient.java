// file: client/src/main/java/io/vdb/client/RemoteClient.java
package io.vdb.client;

import io.vdb.core.Segment;

import java.util.List;
import java.util.Objects;

/**
 * Thin client for the remote vector-database service.
 *
 * This abstracts over the transport:
 *  - GrpcRemoteClient talks to a live service over gRPC.
 *  - Tests plug in in-memory fakes.
 *
 * Every call is a single blocking round trip with no retry and no local
 * caching. Transport failures and non-success response statuses surface
 * as {@link ServiceException}.
 */
public interface RemoteClient extends AutoCloseable {

    boolean hasCollection(String collection);

    boolean hasPartition(String collection, String partition);

    /** All partitions of a collection with their ids. */
    List<Partition> listPartitions(String collection);

    void createPartition(String collection, String partition);

    void dropPartition(String collection, String partition);

    /**
     * Ask the service to load partitions onto its serving nodes.
     * <br>
     * The acknowledgment only means the request was accepted; the data is
     * not necessarily queryable yet.
     */
    void loadPartitions(String collection, List<String> partitionNames);

    void releasePartitions(String collection, List<String> partitionNames);

    /** Segments persisted for the collection, with their flushed row counts. */
    List<Segment> persistentSegments(String collection);

    /** Segments currently served by the query nodes, with visible row counts. */
    List<QuerySegment> querySegments(String collection);

    /** Release transport resources. Calls after close fail. */
    @Override
    default void close() {
    }

    // ----- DTOs returned by the client -----

    record Partition(
            String name,
            long id
    ) {
        public Partition {
            Objects.requireNonNull(name, "name");
        }
    }

    record QuerySegment(
            long segmentId,
            long rowCount
    ) {}
}
