// file: client/src/main/java/io/vdb/client/Cli.java
package io.vdb.client;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for managing partitions of a running vector-database service.
 *
 * Usage:
 *   vdb-cli [options] partitions <collection>
 *   vdb-cli [options] has-partition <collection> <partition>
 *   vdb-cli [options] create-partition <collection> <partition>
 *   vdb-cli [options] drop-partition <collection> <partition>
 *   vdb-cli [options] load <collection> <partition>... [--async]
 *   vdb-cli [options] release <collection> <partition>...
 *
 * Options (see ClientConfig.fromArgs):
 *   --config <json> --host <host> --port <port> --rpc-timeout-ms <ms>
 *   --poll-interval-ms <ms> --load-timeout-ms <ms> --max-poll-failures <n>
 *
 * Examples:
 *   vdb-cli --port 19530 load books fiction poetry
 *   vdb-cli load books fiction --async
 */
public final class Cli {

    private final PartitionClient client;
    private final PrintStream out;

    Cli(PartitionClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }
            if ("--help".equals(args[0]) || "-h".equals(args[0])) {
                usageAndExit(null);
            }

            Map.Entry<ClientConfig, String[]> parsed = parseOptions(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            try (PartitionClient client = PartitionClient.connect(parsed.getKey())) {
                new Cli(client, System.out).execute(rest);
            }
        } catch (CliException | VdbException | IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Leading "--flag value" pairs configure the client; the rest is the command.
     */
    static Map.Entry<ClientConfig, String[]> parseOptions(String[] args) {
        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            i += 2;
        }
        i = Math.min(i, args.length);
        ClientConfig cfg = ClientConfig.fromArgs(Arrays.copyOfRange(args, 0, i));
        return Map.entry(cfg, Arrays.copyOfRange(args, i, args.length));
    }

    void execute(String[] rest) {
        String cmd = rest[0];
        switch (cmd) {
            case "partitions" -> {
                requireArgs(rest, 2, "partitions requires <collection>");
                for (RemoteClient.Partition p : client.showPartitions(rest[1])) {
                    out.println(p.name() + "\t" + p.id());
                }
            }
            case "has-partition" -> {
                requireArgs(rest, 3, "has-partition requires <collection> <partition>");
                out.println(client.hasPartition(rest[1], rest[2]));
            }
            case "create-partition" -> {
                requireArgs(rest, 3, "create-partition requires <collection> <partition>");
                client.createPartition(rest[1], rest[2]);
                out.println("OK");
            }
            case "drop-partition" -> {
                requireArgs(rest, 3, "drop-partition requires <collection> <partition>");
                client.dropPartition(rest[1], rest[2]);
                out.println("OK");
            }
            case "load" -> {
                List<String> names = new ArrayList<>();
                boolean async = false;
                for (int i = 2; i < rest.length; i++) {
                    if ("--async".equals(rest[i])) {
                        async = true;
                    } else {
                        names.add(rest[i]);
                    }
                }
                if (rest.length < 2 || names.isEmpty()) {
                    throw new CliException("load requires <collection> <partition>...");
                }
                client.loadPartitions(rest[1], names, async);
                out.println(async ? "OK (load accepted)" : "OK (loaded)");
            }
            case "release" -> {
                if (rest.length < 3) {
                    throw new CliException("release requires <collection> <partition>...");
                }
                client.releasePartitions(rest[1], List.of(Arrays.copyOfRange(rest, 2, rest.length)));
                out.println("OK");
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private static void requireArgs(String[] rest, int expected, String message) {
        if (rest.length != expected) {
            throw new CliException(message);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  vdb-cli [options] partitions <collection>
                  vdb-cli [options] has-partition <collection> <partition>
                  vdb-cli [options] create-partition <collection> <partition>
                  vdb-cli [options] drop-partition <collection> <partition>
                  vdb-cli [options] load <collection> <partition>... [--async]
                  vdb-cli [options] release <collection> <partition>...

                Options:
                  --config <json>          JSON client config
                  --host <host>            service host (default: localhost)
                  --port <port>            service port (default: 19530)
                  --rpc-timeout-ms <ms>    per-call deadline (default: 10000)
                  --poll-interval-ms <ms>  load progress poll interval (default: 100)
                  --load-timeout-ms <ms>   bound on a synchronous load, 0 = none (default: 0)
                  --max-poll-failures <n>  failed polls in a row before giving up, 0 = never
                """);
        System.exit(msg == null ? 0 : 1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
