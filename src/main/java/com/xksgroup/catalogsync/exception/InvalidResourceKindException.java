package com.xksgroup.catalogsync.exception;

public class InvalidResourceKindException extends CatalogSyncException {

    public InvalidResourceKindException(String message) {
        super(message);
    }
}
