package com.xksgroup.catalogsync.service.helper;

import com.xksgroup.catalogsync.exception.SyncAbortedException;

public final class Throttle {

    private Throttle() {
    }

    /**
     * Sleeps for {@code millis}; zero or less returns immediately.
     *
     * @throws SyncAbortedException the thread was interrupted
     */
    public static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncAbortedException("Interrupted while throttling", e);
        }
    }
}
