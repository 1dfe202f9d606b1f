// file: core/src/main/java/io/vdb/core/Sleeper.java
package io.vdb.core;

import java.time.Duration;

/**
 * Pause between poll cycles. Swapped for a fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}
