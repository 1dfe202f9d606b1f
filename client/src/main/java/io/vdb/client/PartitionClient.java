// file: client/src/main/java/io/vdb/client/PartitionClient.java
package io.vdb.client;

import io.vdb.core.ConvergenceWaiter;
import io.vdb.core.ObservedState;
import io.vdb.core.PollMetrics;
import io.vdb.core.Segment;
import io.vdb.core.Sleeper;
import io.vdb.core.TargetSnapshot;
import io.vdb.core.WaitOptions;
import io.vdb.core.WaitOutcome;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Partition management on top of a {@link RemoteClient}.
 *
 * Responsibilities:
 *  - Validate collection and partition names against the service before
 *    any mutating call.
 *  - Create / drop / list / release partitions.
 *  - Load partitions and, unless the caller asks for async, block until
 *    the loaded data is visible on the serving nodes.
 *
 * Synchronous load:
 *  1) resolve partition names to ids,
 *  2) issue the load and wait for the acknowledgment,
 *  3) capture the persisted segments of those partitions (TargetSnapshot),
 *  4) poll query-node segment statistics with a ConvergenceWaiter until
 *     every captured segment shows at least its persisted row count.
 * Errors from steps 1-2 reach the caller. Poll errors in step 4 are only
 * logged and counted, unless WaitOptions sets a failure limit.
 *
 * Thread-safe: all per-load state lives in the call.
 */
public final class PartitionClient implements AutoCloseable {

    private static final Logger log = Logger.getLogger(PartitionClient.class.getName());

    private final RemoteClient remote;
    private final WaitOptions defaultWait;
    private final Sleeper sleeper;
    private final Clock clock;
    private final PollMetrics pollMetrics = new PollMetrics();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PartitionClient(RemoteClient remote) {
        this(remote, WaitOptions.defaults());
    }

    public PartitionClient(RemoteClient remote, WaitOptions defaultWait) {
        this(remote, defaultWait, Sleeper.system(), Clock.systemUTC());
    }

    /**
     * Full constructor; tests pass a fake sleeper and clock.
     */
    public PartitionClient(RemoteClient remote, WaitOptions defaultWait, Sleeper sleeper, Clock clock) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.defaultWait = Objects.requireNonNull(defaultWait, "defaultWait");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Connect over gRPC using {@code cfg} for the endpoint and wait bounds.
     */
    public static PartitionClient connect(ClientConfig cfg) {
        return new PartitionClient(GrpcRemoteClient.fromConfig(cfg), cfg.waitOptions());
    }

    // ---------- partitions ----------

    public void createPartition(String collection, String partition) {
        ensureReady();
        requireName(collection, "collection");
        requireName(partition, "partition");
        checkCollectionExists(collection);
        if (remote.hasPartition(collection, partition)) {
            throw new PartitionAlreadyExistsException(collection, partition);
        }
        remote.createPartition(collection, partition);
        log.log(Level.INFO, "created partition {0} in {1}", new Object[]{partition, collection});
    }

    public void dropPartition(String collection, String partition) {
        ensureReady();
        requireName(collection, "collection");
        requireName(partition, "partition");
        checkCollectionExists(collection);
        checkPartitionExists(collection, partition);
        remote.dropPartition(collection, partition);
        log.log(Level.INFO, "dropped partition {0} from {1}", new Object[]{partition, collection});
    }

    public boolean hasPartition(String collection, String partition) {
        ensureReady();
        requireName(collection, "collection");
        requireName(partition, "partition");
        return remote.hasPartition(collection, partition);
    }

    public List<RemoteClient.Partition> showPartitions(String collection) {
        ensureReady();
        requireName(collection, "collection");
        return List.copyOf(remote.listPartitions(collection));
    }

    /**
     * Release partitions from the serving nodes. Returns once the service
     * acknowledges; there is no wait for the release to finish.
     */
    public void releasePartitions(String collection, List<String> partitionNames) {
        ensureReady();
        requireName(collection, "collection");
        requireNames(partitionNames);
        checkCollectionExists(collection);
        for (String name : partitionNames) {
            checkPartitionExists(collection, name);
        }
        remote.releasePartitions(collection, List.copyOf(partitionNames));
        log.log(Level.INFO, "released partitions {0} of {1}", new Object[]{partitionNames, collection});
    }

    // ---------- load ----------

    /**
     * Load partitions with this client's default wait bounds.
     *
     * @param async if true, return as soon as the service accepts the load
     */
    public void loadPartitions(String collection, List<String> partitionNames, boolean async) {
        loadPartitions(collection, partitionNames, async, defaultWait);
    }

    /**
     * Load partitions; when {@code async} is false, block until every
     * segment persisted in those partitions is visible on the serving nodes.
     *
     * @throws PartitionNotFoundException  a name does not exist (nothing was loaded)
     * @throws CollectionNotFoundException the collection does not exist
     * @throws ServiceException            the service rejected a call, or the
     *                                     wait hit its poll-failure limit
     * @throws WaitTimeoutException        {@code wait} timed out before convergence
     * @throws WaitCancelledException      {@code wait} was cancelled or the thread interrupted
     */
    public void loadPartitions(String collection, List<String> partitionNames, boolean async, WaitOptions wait) {
        ensureReady();
        requireName(collection, "collection");
        requireNames(partitionNames);
        Objects.requireNonNull(wait, "wait");

        checkCollectionExists(collection);
        for (String name : partitionNames) {
            checkPartitionExists(collection, name);
        }
        Set<Long> partitionIds = resolvePartitionIds(collection, partitionNames);

        remote.loadPartitions(collection, List.copyOf(partitionNames));
        log.log(Level.INFO, "load of {0} partitions {1} accepted (async={2})",
                new Object[]{collection, partitionNames, async});
        if (async) {
            return;
        }

        TargetSnapshot target = captureTarget(collection, partitionIds);
        if (target.isEmpty()) {
            log.log(Level.FINE, "nothing persisted in {0} {1}, load is complete",
                    new Object[]{collection, partitionNames});
            return;
        }

        ConvergenceWaiter waiter = new ConvergenceWaiter(target, sleeper, clock, pollMetrics);
        long startNanos = System.nanoTime();
        WaitOutcome outcome = waiter.run(() -> observe(collection), wait);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();

        switch (outcome) {
            case CONVERGED -> log.log(Level.INFO,
                    "load of {0} partitions {1} visible: {2} segment(s), {3} poll(s), {4}ms",
                    new Object[]{collection, partitionNames, target.size(), waiter.pollCount(), elapsedMs});
            case TIMED_OUT -> throw new WaitTimeoutException(
                    collection, waiter.pending().size(), wait.timeout().orElse(Duration.ZERO));
            case CANCELLED -> throw new WaitCancelledException(collection, waiter.pending().size());
            case POLL_FAILURES_EXHAUSTED -> throw new ServiceException(
                    "POLL_FAILURES_EXHAUSTED",
                    "segment statistics for %s failed %d times in a row, %d segment(s) still pending"
                            .formatted(collection, wait.maxConsecutiveFailures(), waiter.pending().size()));
        }
    }

    /** Poll counters shared by every synchronous load of this client. */
    public PollMetrics pollMetrics() {
        return pollMetrics;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            remote.close();
        }
    }

    // ---------- internals ----------

    private Set<Long> resolvePartitionIds(String collection, List<String> partitionNames) {
        Map<String, Long> idsByName = new HashMap<>();
        for (RemoteClient.Partition p : remote.listPartitions(collection)) {
            idsByName.put(p.name(), p.id());
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (String name : partitionNames) {
            Long id = idsByName.get(name);
            if (id == null) {
                // existed a moment ago but is missing from the listing
                throw new PartitionNotFoundException(collection, name);
            }
            ids.add(id);
        }
        return ids;
    }

    private TargetSnapshot captureTarget(String collection, Set<Long> partitionIds) {
        List<Segment> persisted;
        try {
            persisted = remote.persistentSegments(collection);
        } catch (VdbException e) {
            // Without a listing there is nothing to wait for; the load itself was accepted.
            log.log(Level.WARNING, "persistent segment listing for " + collection
                    + " failed, returning without waiting for the load", e);
            return TargetSnapshot.empty();
        }
        return TargetSnapshot.capture(partitionIds, persisted);
    }

    private ObservedState observe(String collection) {
        ObservedState.Builder b = ObservedState.builder();
        for (RemoteClient.QuerySegment s : remote.querySegments(collection)) {
            b.add(s.segmentId(), s.rowCount());
        }
        return b.build();
    }

    private void checkCollectionExists(String collection) {
        if (!remote.hasCollection(collection)) {
            throw new CollectionNotFoundException(collection);
        }
    }

    private void checkPartitionExists(String collection, String partition) {
        if (!remote.hasPartition(collection, partition)) {
            throw new PartitionNotFoundException(collection, partition);
        }
    }

    private void ensureReady() {
        if (closed.get()) {
            throw new ClientNotReadyException();
        }
    }

    private static void requireName(String name, String what) {
        Objects.requireNonNull(name, what);
        if (name.isBlank()) {
            throw new IllegalArgumentException(what + " name must not be blank");
        }
    }

    private static void requireNames(List<String> partitionNames) {
        Objects.requireNonNull(partitionNames, "partitionNames");
        if (partitionNames.isEmpty()) {
            throw new IllegalArgumentException("partitionNames must not be empty");
        }
        for (String name : partitionNames) {
            requireName(name, "partition");
        }
    }
}
