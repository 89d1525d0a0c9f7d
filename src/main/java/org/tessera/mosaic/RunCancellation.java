package org.tessera.mosaic;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared cancellation flag of one run. Checked by the dispatcher between enqueues.
 */
public final class RunCancellation {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call changed the state.
     */
    public boolean cancel() {
        return requested.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return requested.get();
    }
}
