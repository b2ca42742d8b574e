package com.xksgroup.catalogsync.exception;

public class MissingEpisodeIndexException extends CatalogSyncException {

    public MissingEpisodeIndexException(String message) {
        super(message);
    }
}
