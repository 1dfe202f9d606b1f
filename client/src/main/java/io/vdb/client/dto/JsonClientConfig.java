// file: client/src/main/java/io/vdb/client/dto/JsonClientConfig.java
package io.vdb.client.dto;

/**
 * JSON shape of a client config file. Absent fields keep their defaults.
 */
public class JsonClientConfig {
    public String host;
    public Integer port;
    public Long rpcTimeoutMillis;
    public Long pollIntervalMillis;
    public Long loadTimeoutMillis;          // 0 => wait until loaded
    public Integer maxConsecutivePollFailures;
}
