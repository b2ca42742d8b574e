package com.xksgroup.catalogsync.exception;

/**
 * The checkpoint file could not be read, parsed or written. Always fatal.
 */
public class CheckpointException extends CatalogSyncException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
