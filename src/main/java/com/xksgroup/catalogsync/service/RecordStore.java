package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.model.VideoRecord;

import java.util.Collection;
import java.util.List;

/**
 * Durable record storage as the pipeline sees it.
 */
public interface RecordStore {

    boolean exists(String externalId);

    /**
     * @return false when the write did not happen; the caller must not assume it partially succeeded
     */
    boolean insert(VideoRecord record);

    List<VideoRecord> fetchMany(Collection<String> externalIds);
}
