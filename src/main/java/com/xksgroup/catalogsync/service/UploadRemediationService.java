package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.AuthException;
import com.xksgroup.catalogsync.exception.SyncAbortedException;
import com.xksgroup.catalogsync.model.SyncCheckpoint;
import com.xksgroup.catalogsync.model.VideoRecord;
import com.xksgroup.catalogsync.model.dto.CatalogResult;
import com.xksgroup.catalogsync.model.dto.VideoDetail;
import com.xksgroup.catalogsync.service.helper.Throttle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Re-drives every id in {@code failedUploadIds} against one object store.
 * <p>
 * The failure set written back is exactly what failed in this pass. It replaces the previous set instead of
 * being merged into it, so ids that now succeed (or whose detail vanished) leave the set for good.
 * <p>
 * Keys are derived from the persisted record's title, the same one ingestion mirrored under. The detail is
 * only re-fetched for fresh media locators.
 */
@Slf4j
@Service
public class UploadRemediationService {

    static final int MAX_ATTEMPTS = 2;

    private final CatalogClient catalog;
    private final RecordStore recordStore;
    private final ObjectStoreRegistry objectStores;
    private final MediaMirrorService mirror;
    private final CheckpointStore checkpointStore;
    private final long delayMs;

    public UploadRemediationService(CatalogClient catalog,
                                    RecordStore recordStore,
                                    ObjectStoreRegistry objectStores,
                                    MediaMirrorService mirror,
                                    CheckpointStore checkpointStore,
                                    @Value("${sync.remediation-delay-ms:1000}") long delayMs) {
        this.catalog = catalog;
        this.recordStore = recordStore;
        this.objectStores = objectStores;
        this.mirror = mirror;
        this.checkpointStore = checkpointStore;
        this.delayMs = delayMs;
    }

    /**
     * @param storeName {@code oss} or {@code s3}
     * @return the ids still failing after this pass
     */
    public Set<String> remediate(String storeName) {
        SyncCheckpoint checkpoint = checkpointStore.load();
        List<String> ids = new ArrayList<>(checkpoint.getFailedUploadIds());
        if (ids.isEmpty()) {
            log.info("No failed uploads to remediate");
            return Set.of();
        }

        ObjectStore store = objectStores.get(storeName);
        CatalogSession session = new CatalogSession(catalog, checkpointStore, checkpoint);
        log.info("[{}] Remediating {} failed upload(s)", store.name(), ids.size());

        Set<String> stillFailing = new LinkedHashSet<>();
        for (String externalId : ids) {
            log.info("[{}] Remediating id {}", store.name(), externalId);
            if (remediateOne(session, store, externalId)) {
                log.info("[{}] Remediated id {}", store.name(), externalId);
            } else {
                stillFailing.add(externalId);
            }
            Throttle.pause(delayMs);
        }

        checkpoint.replaceFailedUploads(stillFailing);
        checkpointStore.save(checkpoint);
        log.info("[{}] Upload remediation done: {} of {} still failing", store.name(), stillFailing.size(), ids.size());
        return stillFailing;
    }

    /**
     * @return true when the id no longer needs remediation
     */
    private boolean remediateOne(CatalogSession session, ObjectStore store, String externalId) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            CatalogResult<VideoDetail> result = session.fetchDetail(externalId);
            switch (result.kind()) {
                case OK -> {
                    if (result.isEmpty()) {
                        log.warn("Detail is empty, dropping id {} from remediation", externalId);
                        return true;
                    }
                    return mirrorAsIngested(store, externalId, result.value());
                }
                case RETRYABLE -> {
                    if (attempt == MAX_ATTEMPTS) {
                        log.error("Session still rejected for id {} after {} attempts", externalId, attempt);
                        return false;
                    }
                    try {
                        session.refresh();
                    } catch (AuthException e) {
                        throw new SyncAbortedException("Credential refresh failed during upload remediation", e);
                    }
                }
                case FATAL -> {
                    log.error("Detail fetch failed for id {}: {}", externalId, result.reason());
                    return false;
                }
                default -> throw new IllegalStateException("Unexpected result kind " + result.kind());
            }
        }
        return false;
    }

    private boolean mirrorAsIngested(ObjectStore store, String externalId, VideoDetail detail) {
        VideoRecord record;
        try {
            List<VideoRecord> found = recordStore.fetchMany(List.of(externalId));
            record = found.isEmpty() ? null : found.get(0);
        } catch (DataAccessException e) {
            log.error("Reading the stored record failed for id {}: {}", externalId, e.getMessage());
            return false;
        }

        String title = record != null ? record.getTitle() : detail.getTitle();
        if (title == null || title.isBlank()) {
            log.error("No title to derive keys from for id {}", externalId);
            return false;
        }
        String cover = record != null && record.getCoverUrl() != null && !record.getCoverUrl().isBlank()
                ? record.getCoverUrl() : detail.getCover();
        return mirror.mirror(store, externalId, title, detail.safeVideoList(), cover);
    }
}
