package com.xksgroup.catalogsync.exception;

/**
 * The ingestion loop stopped early. Progress up to the last checkpoint is kept.
 */
public class SyncAbortedException extends CatalogSyncException {

    public SyncAbortedException(String message) {
        super(message);
    }

    public SyncAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
