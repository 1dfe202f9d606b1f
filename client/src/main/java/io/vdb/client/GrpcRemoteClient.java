// file: client/src/main/java/io/vdb/client/GrpcRemoteClient.java
package io.vdb.client;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import io.vdb.client.rpc.VdbServiceGrpc;
import io.vdb.client.rpc.VdbServiceProto;
import io.vdb.core.Segment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * gRPC-based RemoteClient implementation.
 *
 * One GrpcRemoteClient instance owns a single channel to one service
 * endpoint (host:port). Every call:
 *  - carries a per-call deadline of {@code rpcTimeout},
 *  - maps {@link StatusRuntimeException} to {@link ServiceException}
 *    with the gRPC status code name,
 *  - maps a non-SUCCESS response status to {@link ServiceException}
 *    with the service error code name and reason.
 */
public final class GrpcRemoteClient implements RemoteClient {

    private static final String DB_NAME = ""; // reserved by the service

    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final VdbServiceGrpc.VdbServiceBlockingStub stub;
    private final Duration rpcTimeout;

    /**
     * Production constructor using host and port.
     */
    public GrpcRemoteClient(String host, int port, Duration rpcTimeout) {
        this(host + ":" + port,
                ManagedChannelBuilder
                        .forAddress(host, port)
                        .usePlaintext() // terminate TLS at a proxy if needed
                        .build(),
                rpcTimeout);
    }

    /**
     * Constructor allowing a pre-built channel (e.g., in-process for tests).
     */
    public GrpcRemoteClient(String target, ManagedChannel channel, Duration rpcTimeout) {
        this.target = Objects.requireNonNull(target, "target");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.rpcTimeout = Objects.requireNonNull(rpcTimeout, "rpcTimeout");
        if (rpcTimeout.isNegative() || rpcTimeout.isZero()) {
            throw new IllegalArgumentException("rpcTimeout must be > 0, got " + rpcTimeout);
        }
        this.stub = VdbServiceGrpc.newBlockingStub(channel);
    }

    public static GrpcRemoteClient fromConfig(ClientConfig cfg) {
        return new GrpcRemoteClient(cfg.host(), cfg.port(), cfg.rpcTimeout());
    }

    public String target() {
        return target;
    }

    @Override
    public boolean hasCollection(String collection) {
        try {
            VdbServiceProto.BoolResponse resp = stub().hasCollection(
                    VdbServiceProto.HasCollectionRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .build());
            checkStatus("HasCollection", resp.getStatus());
            return resp.getValue();
        } catch (StatusRuntimeException sre) {
            throw transportFailure("HasCollection", sre);
        }
    }

    @Override
    public boolean hasPartition(String collection, String partition) {
        try {
            VdbServiceProto.BoolResponse resp = stub().hasPartition(
                    VdbServiceProto.HasPartitionRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .setPartitionName(partition)
                            .build());
            checkStatus("HasPartition", resp.getStatus());
            return resp.getValue();
        } catch (StatusRuntimeException sre) {
            throw transportFailure("HasPartition", sre);
        }
    }

    @Override
    public List<Partition> listPartitions(String collection) {
        try {
            VdbServiceProto.ShowPartitionsResponse resp = stub().showPartitions(
                    VdbServiceProto.ShowPartitionsRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .build());
            checkStatus("ShowPartitions", resp.getStatus());

            if (resp.getPartitionNamesCount() != resp.getPartitionIdsCount()) {
                throw new ServiceException(
                        "MALFORMED_RESPONSE",
                        "ShowPartitions returned %d names but %d ids for collection %s"
                                .formatted(resp.getPartitionNamesCount(), resp.getPartitionIdsCount(), collection));
            }
            List<Partition> out = new ArrayList<>(resp.getPartitionIdsCount());
            for (int i = 0; i < resp.getPartitionIdsCount(); i++) {
                out.add(new Partition(resp.getPartitionNames(i), resp.getPartitionIds(i)));
            }
            return out;
        } catch (StatusRuntimeException sre) {
            throw transportFailure("ShowPartitions", sre);
        }
    }

    @Override
    public void createPartition(String collection, String partition) {
        try {
            VdbServiceProto.Status status = stub().createPartition(
                    VdbServiceProto.CreatePartitionRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .setPartitionName(partition)
                            .build());
            checkStatus("CreatePartition", status);
        } catch (StatusRuntimeException sre) {
            throw transportFailure("CreatePartition", sre);
        }
    }

    @Override
    public void dropPartition(String collection, String partition) {
        try {
            VdbServiceProto.Status status = stub().dropPartition(
                    VdbServiceProto.DropPartitionRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .setPartitionName(partition)
                            .build());
            checkStatus("DropPartition", status);
        } catch (StatusRuntimeException sre) {
            throw transportFailure("DropPartition", sre);
        }
    }

    @Override
    public void loadPartitions(String collection, List<String> partitionNames) {
        try {
            VdbServiceProto.Status status = stub().loadPartitions(
                    VdbServiceProto.LoadPartitionsRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .addAllPartitionNames(partitionNames)
                            .build());
            checkStatus("LoadPartitions", status);
        } catch (StatusRuntimeException sre) {
            throw transportFailure("LoadPartitions", sre);
        }
    }

    @Override
    public void releasePartitions(String collection, List<String> partitionNames) {
        try {
            VdbServiceProto.Status status = stub().releasePartitions(
                    VdbServiceProto.ReleasePartitionsRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .addAllPartitionNames(partitionNames)
                            .build());
            checkStatus("ReleasePartitions", status);
        } catch (StatusRuntimeException sre) {
            throw transportFailure("ReleasePartitions", sre);
        }
    }

    @Override
    public List<Segment> persistentSegments(String collection) {
        try {
            VdbServiceProto.GetPersistentSegmentInfoResponse resp = stub().getPersistentSegmentInfo(
                    VdbServiceProto.GetPersistentSegmentInfoRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .build());
            checkStatus("GetPersistentSegmentInfo", resp.getStatus());

            List<Segment> out = new ArrayList<>(resp.getInfosCount());
            for (VdbServiceProto.PersistentSegmentInfo info : resp.getInfosList()) {
                checkRowCount("GetPersistentSegmentInfo", collection, info.getSegmentId(), info.getNumRows());
                out.add(new Segment(info.getSegmentId(), info.getPartitionId(), info.getNumRows()));
            }
            return out;
        } catch (StatusRuntimeException sre) {
            throw transportFailure("GetPersistentSegmentInfo", sre);
        }
    }

    @Override
    public List<QuerySegment> querySegments(String collection) {
        try {
            VdbServiceProto.GetQuerySegmentInfoResponse resp = stub().getQuerySegmentInfo(
                    VdbServiceProto.GetQuerySegmentInfoRequest.newBuilder()
                            .setDbName(DB_NAME)
                            .setCollectionName(collection)
                            .build());
            checkStatus("GetQuerySegmentInfo", resp.getStatus());

            List<QuerySegment> out = new ArrayList<>(resp.getInfosCount());
            for (VdbServiceProto.QuerySegmentInfo info : resp.getInfosList()) {
                checkRowCount("GetQuerySegmentInfo", collection, info.getSegmentId(), info.getNumRows());
                out.add(new QuerySegment(info.getSegmentId(), info.getNumRows()));
            }
            return out;
        } catch (StatusRuntimeException sre) {
            throw transportFailure("GetQuerySegmentInfo", sre);
        }
    }

    /**
     * Graceful shutdown of the channel.
     */
    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private VdbServiceGrpc.VdbServiceBlockingStub stub() {
        return stub.withDeadlineAfter(rpcTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static void checkStatus(String rpc, VdbServiceProto.Status status) {
        if (status.getErrorCode() != VdbServiceProto.ErrorCode.SUCCESS) {
            throw new ServiceException(
                    status.getErrorCode().name(),
                    rpc + " failed: " + status.getErrorCode() + " " + status.getReason()
            );
        }
    }

    private static void checkRowCount(String rpc, String collection, long segmentId, long numRows) {
        if (numRows < 0) {
            throw new ServiceException(
                    "MALFORMED_RESPONSE",
                    "%s returned num_rows=%d for segment %d of collection %s"
                            .formatted(rpc, numRows, segmentId, collection));
        }
    }

    private ServiceException transportFailure(String rpc, StatusRuntimeException sre) {
        return new ServiceException(
                sre.getStatus().getCode().name(),
                "gRPC " + rpc + " to " + target + " failed",
                sre
        );
    }
}
