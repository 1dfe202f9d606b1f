// file: client/src/main/java/io/vdb/client/ServiceException.java
package io.vdb.client;

/**
 * Transport or service-level failure of a remote call.
 * <br>
 * errorCode is the service's error code name (e.g. "UNEXPECTED_ERROR"),
 * or the gRPC status code name when the call failed in transport.
 * Never retried by the client.
 */
public final class ServiceException extends VdbException {

    private final String errorCode;

    public ServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ServiceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
