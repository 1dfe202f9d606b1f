// file: client/src/main/java/io/vdb/client/VdbException.java
package io.vdb.client;

/**
 * Base class for failures reported by the vdb client.
 * Unchecked, like the transport failures it usually wraps.
 */
public class VdbException extends RuntimeException {

    public VdbException(String message) {
        super(message);
    }

    public VdbException(String message, Throwable cause) {
        super(message, cause);
    }
}
