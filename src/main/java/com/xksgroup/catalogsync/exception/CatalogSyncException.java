package com.xksgroup.catalogsync.exception;

/**
 * Base type for every failure the sync pipeline surfaces to its caller.
 */
public class CatalogSyncException extends RuntimeException {

    public CatalogSyncException(String message) {
        super(message);
    }

    public CatalogSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
