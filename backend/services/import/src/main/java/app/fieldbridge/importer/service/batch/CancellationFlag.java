package app.fieldbridge.importer.service.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for one import run. Checked between batches only.
 */
public class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
