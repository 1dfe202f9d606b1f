// file: client/src/main/java/io/vdb/client/CollectionNotFoundException.java
package io.vdb.client;

public final class CollectionNotFoundException extends VdbException {

    private final String collection;

    public CollectionNotFoundException(String collection) {
        super("collection %s does not exist".formatted(collection));
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }
}
