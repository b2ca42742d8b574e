package com.xksgroup.catalogsync.exception;

public class AuthException extends CatalogSyncException {

    public AuthException(String message) {
        super(message);
    }
}
