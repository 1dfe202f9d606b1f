// file: client/src/main/java/io/vdb/client/PartitionAlreadyExistsException.java
package io.vdb.client;

public final class PartitionAlreadyExistsException extends VdbException {

    public PartitionAlreadyExistsException(String collection, String partition) {
        super("partition %s of collection %s already exists".formatted(partition, collection));
    }
}
