// file: client/src/main/java/io/vdb/client/ClientConfig.java
package io.vdb.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vdb.client.dto.JsonClientConfig;
import io.vdb.core.WaitOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Client configuration parsed from CLI args or a JSON file.
 *
 * Supports:
 *  - host, port:                 service endpoint
 *  - rpcTimeout:                 deadline for every single RPC
 *  - pollInterval:               pause between load-progress polls
 *  - loadTimeout:                bound on a synchronous load wait;
 *                                ZERO means wait until loaded
 *  - maxConsecutivePollFailures: give up a load wait after this many failed
 *                                polls in a row; 0 means never give up
 */
public record ClientConfig(
        String host,
        int port,
        Duration rpcTimeout,
        Duration pollInterval,
        Duration loadTimeout,
        int maxConsecutivePollFailures
) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 19530;
    public static final Duration DEFAULT_RPC_TIMEOUT = Duration.ofSeconds(10);

    public ClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(rpcTimeout, "rpcTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(loadTimeout, "loadTimeout");
        if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (rpcTimeout.isNegative() || rpcTimeout.isZero()) throw new IllegalArgumentException("rpcTimeout must be > 0");
        if (pollInterval.isNegative()) throw new IllegalArgumentException("pollInterval must be >= 0");
        if (loadTimeout.isNegative()) throw new IllegalArgumentException("loadTimeout must be >= 0");
        if (maxConsecutivePollFailures < 0) throw new IllegalArgumentException("maxConsecutivePollFailures must be >= 0");
    }

    public static ClientConfig defaults() {
        return new ClientConfig(
                DEFAULT_HOST,
                DEFAULT_PORT,
                DEFAULT_RPC_TIMEOUT,
                WaitOptions.DEFAULT_INTERVAL,
                Duration.ZERO,
                0
        );
    }

    /**
     * Default wait bounds for synchronous loads made with this config.
     */
    public WaitOptions waitOptions() {
        WaitOptions w = WaitOptions.defaults()
                .withInterval(pollInterval)
                .withMaxConsecutiveFailures(maxConsecutivePollFailures);
        return loadTimeout.isZero() ? w : w.withTimeout(loadTimeout);
    }

    /**
     * Load a config from JSON. Fields missing from the file keep their defaults.
     */
    public static ClientConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonClientConfig json = mapper.readValue(path.toFile(), JsonClientConfig.class);
            return merge(defaults(), json);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load ClientConfig from " + path, e);
        }
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --config <path>             JSON file applied first, other flags override it
     *   --host <host>
     *   --port <port>
     *   --rpc-timeout-ms <millis>
     *   --poll-interval-ms <millis>
     *   --load-timeout-ms <millis>  (0 = wait until loaded)
     *   --max-poll-failures <n>     (0 = unlimited)
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values
     */
    public static ClientConfig fromArgs(String[] args) {
        ClientConfig base = defaults();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                base = fromJsonFile(Path.of(valueOf(args, i)));
            }
        }

        String host = base.host;
        int port = base.port;
        Duration rpcTimeout = base.rpcTimeout;
        Duration pollInterval = base.pollInterval;
        Duration loadTimeout = base.loadTimeout;
        int maxFailures = base.maxConsecutivePollFailures;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> i++; // already applied
                case "--host" -> host = valueOf(args, i++);
                case "--port" -> port = parseInt(args, i++);
                case "--rpc-timeout-ms" -> rpcTimeout = Duration.ofMillis(parseLong(args, i++));
                case "--poll-interval-ms" -> pollInterval = Duration.ofMillis(parseLong(args, i++));
                case "--load-timeout-ms" -> loadTimeout = Duration.ofMillis(parseLong(args, i++));
                case "--max-poll-failures" -> maxFailures = parseInt(args, i++);
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ClientConfig(host, port, rpcTimeout, pollInterval, loadTimeout, maxFailures);
    }

    private static ClientConfig merge(ClientConfig base, JsonClientConfig json) {
        return new ClientConfig(
                json.host != null ? json.host : base.host,
                json.port != null ? json.port : base.port,
                json.rpcTimeoutMillis != null ? Duration.ofMillis(json.rpcTimeoutMillis) : base.rpcTimeout,
                json.pollIntervalMillis != null ? Duration.ofMillis(json.pollIntervalMillis) : base.pollInterval,
                json.loadTimeoutMillis != null ? Duration.ofMillis(json.loadTimeoutMillis) : base.loadTimeout,
                json.maxConsecutivePollFailures != null ? json.maxConsecutivePollFailures : base.maxConsecutivePollFailures
        );
    }

    private static String valueOf(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String[] args, int i) {
        String v = valueOf(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + args[i] + ": " + v, e);
        }
    }

    private static long parseLong(String[] args, int i) {
        String v = valueOf(args, i);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + args[i] + ": " + v, e);
        }
    }
}
