package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.ObjectStoreException;
import com.xksgroup.catalogsync.exception.TransportException;

/**
 * What the mirror needs from a blob store.
 */
public interface ObjectStore {

    /** Short name used in logs and on the command line, e.g. {@code oss} or {@code s3}. */
    String name();

    boolean exists(String key);

    void putBlob(String key, byte[] bytes, String contentType) throws ObjectStoreException;

    /**
     * Downloads a playlist from {@code sourceUrl}, makes its segment references absolute and stores it under {@code key}.
     *
     * @throws TransportException   the origin could not be read or returned an empty playlist
     * @throws ObjectStoreException the upload failed
     */
    void putStream(String key, String sourceUrl) throws TransportException, ObjectStoreException;
}
