package com.xksgroup.catalogsync.exception;

/**
 * Network or protocol failure that outlived the adapter's own retry policy.
 */
public class TransportException extends CatalogSyncException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
