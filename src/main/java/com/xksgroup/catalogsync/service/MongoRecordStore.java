package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.model.VideoRecord;
import com.xksgroup.catalogsync.repo.VideoRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MongoRecordStore implements RecordStore {

    private final VideoRecordRepository videoRepo;

    @Override
    public boolean exists(String externalId) {
        boolean exists = videoRepo.existsByExternalId(externalId);
        if (exists) {
            log.debug("Record already stored (id: {})", externalId);
        }
        return exists;
    }

    @Override
    public boolean insert(VideoRecord record) {
        log.info("Inserting '{}' (id: {})", record.getTitle(), record.getExternalId());
        try {
            if (record.getCreatedAt() == null) {
                record.setCreatedAt(Instant.now());
            }
            videoRepo.insert(record);
            log.info("Inserted '{}' (id: {})", record.getTitle(), record.getExternalId());
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to insert '{}' (id: {}): {}", record.getTitle(), record.getExternalId(), e.getMessage());
            return false;
        }
    }

    @Override
    public List<VideoRecord> fetchMany(Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            log.warn("fetchMany called with no ids");
            return List.of();
        }
        List<VideoRecord> records = videoRepo.findByExternalIdIn(externalIds);
        log.info("Fetched {} of {} requested records", records.size(), externalIds.size());
        return records;
    }
}
