// file: client/src/main/java/io/vdb/client/PartitionNotFoundException.java
package io.vdb.client;

/**
 * A named partition does not exist. Raised before any remote mutation,
 * so the caller can fix the name and retry.
 */
public final class PartitionNotFoundException extends VdbException {

    private final String collection;
    private final String partition;

    public PartitionNotFoundException(String collection, String partition) {
        super("partition %s of collection %s does not exist".formatted(partition, collection));
        this.collection = collection;
        this.partition = partition;
    }

    public String collection() {
        return collection;
    }

    public String partition() {
        return partition;
    }
}
