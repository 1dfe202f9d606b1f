// file: client/src/main/java/io/vdb/client/ClientNotReadyException.java
package io.vdb.client;

/**
 * The client has been closed and can no longer reach the service.
 */
public final class ClientNotReadyException extends VdbException {

    public ClientNotReadyException() {
        super("client is not ready (already closed)");
    }
}
