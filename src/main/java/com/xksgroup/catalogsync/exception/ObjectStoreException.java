package com.xksgroup.catalogsync.exception;

/**
 * A put or head against object storage failed after the upload retry ceiling.
 */
public class ObjectStoreException extends CatalogSyncException {

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
