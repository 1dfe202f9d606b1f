// file: core/src/main/java/io/vdb/core/CancellationSignal.java
package io.vdb.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot abort flag shared between a waiting thread and whoever may want
 * to stop it. Once cancelled it stays cancelled.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** A fresh signal; nobody else holds a reference, so it never fires. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
