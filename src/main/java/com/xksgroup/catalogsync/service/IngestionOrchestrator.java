package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.AuthException;
import com.xksgroup.catalogsync.exception.SyncAbortedException;
import com.xksgroup.catalogsync.exception.TransportException;
import com.xksgroup.catalogsync.model.SyncCheckpoint;
import com.xksgroup.catalogsync.model.VideoRecord;
import com.xksgroup.catalogsync.model.dto.CatalogItem;
import com.xksgroup.catalogsync.model.dto.CatalogResult;
import com.xksgroup.catalogsync.model.dto.VideoDetail;
import com.xksgroup.catalogsync.service.helper.Throttle;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks the catalog page by page: dedup, enrich, persist, mirror, distribute, checkpoint.
 * <p>
 * The checkpoint only moves at page boundaries. A crash mid-page replays that page on the next run, and the
 * existence check in front of every detail fetch keeps the replay from persisting anything twice.
 * Failures found while ingesting are added to the checkpoint's failure sets, never removed from them.
 */
@Slf4j
@Service
public class IngestionOrchestrator {

    private final CatalogClient catalog;
    private final RecordStore recordStore;
    private final ObjectStoreRegistry objectStores;
    private final MediaMirrorService mirror;
    private final DistributionClient distribution;
    private final CheckpointStore checkpointStore;

    private final String mirrorTarget;
    private final long itemDelayMs;
    private final long pageDelayMs;
    private final int maxRefreshAttempts;

    public IngestionOrchestrator(CatalogClient catalog,
                                 RecordStore recordStore,
                                 ObjectStoreRegistry objectStores,
                                 MediaMirrorService mirror,
                                 DistributionClient distribution,
                                 CheckpointStore checkpointStore,
                                 @Value("${mirror.target:oss}") String mirrorTarget,
                                 @Value("${sync.item-delay-ms:500}") long itemDelayMs,
                                 @Value("${sync.page-delay-ms:1000}") long pageDelayMs,
                                 @Value("${sync.max-refresh-attempts:3}") int maxRefreshAttempts) {
        this.catalog = catalog;
        this.recordStore = recordStore;
        this.objectStores = objectStores;
        this.mirror = mirror;
        this.distribution = distribution;
        this.checkpointStore = checkpointStore;
        this.mirrorTarget = mirrorTarget;
        this.itemDelayMs = itemDelayMs;
        this.pageDelayMs = pageDelayMs;
        this.maxRefreshAttempts = maxRefreshAttempts;
    }

    /**
     * Runs until the catalog returns an empty page.
     *
     * @throws SyncAbortedException the run stopped early; completed pages are checkpointed and records already
     *                              persisted on the aborted page are queued for remediation
     */
    public Summary run() {
        SyncCheckpoint checkpoint = checkpointStore.load();
        ObjectStore store = objectStores.get(mirrorTarget);
        CatalogSession session = new CatalogSession(catalog, checkpointStore, checkpoint);

        int page = checkpoint.getLastPage() + 1;
        log.info("Starting ingestion at page {} (mirror target: {})", page, store.name());

        Summary summary = new Summary();
        while (true) {
            List<CatalogItem> items = fetchPage(session, page);
            if (items.isEmpty()) {
                log.info("Page {} is empty, catalog exhausted", page);
                break;
            }

            log.info("Processing page {} ({} items)", page, items.size());
            PageOutcome outcome = new PageOutcome();
            try {
                processItems(session, store, items, outcome, summary);
            } catch (SyncAbortedException e) {
                saveAbortedPage(checkpoint, page, outcome);
                throw e;
            }
            Map<String, Set<String>> distributionFailures = distribute(outcome.persisted);

            checkpoint.addFailedUploads(outcome.failedUploads);
            distributionFailures.forEach(checkpoint::mergeDistributionFailures);
            checkpoint.advanceTo(page);
            checkpointStore.save(checkpoint);
            summary.pages++;
            log.info("Page {} checkpointed (persisted: {}, mirror failures: {})",
                    page, outcome.persisted.size(), outcome.failedUploads.size());

            page++;
            Throttle.pause(pageDelayMs);
        }

        log.info("Ingestion finished: {}", summary);
        return summary;
    }

    private List<CatalogItem> fetchPage(CatalogSession session, int page) {
        int refreshes = 0;
        while (true) {
            CatalogResult<List<CatalogItem>> result = session.listPage(page);
            switch (result.kind()) {
                case OK -> {
                    return result.isEmpty() ? List.of() : result.value();
                }
                case RETRYABLE -> refreshes = refresh(session, refreshes, "page " + page);
                case FATAL -> throw new SyncAbortedException("Listing page " + page + " failed: " + result.reason());
                default -> throw new IllegalStateException("Unexpected result kind " + result.kind());
            }
        }
    }

    private void processItems(CatalogSession session, ObjectStore store, List<CatalogItem> items,
                              PageOutcome outcome, Summary summary) {
        for (CatalogItem item : items) {
            String externalId = item.getExternalId();
            if (externalId == null || externalId.isBlank()) {
                log.warn("Skipping list entry without id: '{}'", item.getTitle());
                summary.dropped++;
                continue;
            }

            if (alreadyStored(externalId)) {
                log.info("Already stored, skipping: '{}' (id: {})", item.getTitle(), externalId);
                summary.skipped++;
                continue;
            }

            VideoDetail detail = fetchDetail(session, externalId);
            if (detail == null) {
                summary.dropped++;
                continue;
            }

            VideoRecord record = toRecord(item, detail);
            if (!recordStore.insert(record)) {
                log.error("Persisting failed, dropping item (id: {})", externalId);
                summary.dropped++;
                continue;
            }
            outcome.persisted.add(externalId);
            summary.persisted++;

            boolean mirrored = mirror.mirror(store, externalId, record.getTitle(), record.getMediaList(), record.getCoverUrl());
            if (!mirrored) {
                log.error("Mirroring failed, queued for remediation (id: {})", externalId);
                outcome.failedUploads.add(externalId);
                summary.mirrorFailures++;
            }

            Throttle.pause(itemDelayMs);
        }
    }

    /**
     * Records what the aborted page already persisted, without advancing {@code lastPage}. A replay skips those
     * ids as already stored, so their mirror failures are kept and every one of them is queued for
     * distribution remediation on every domain.
     */
    private void saveAbortedPage(SyncCheckpoint checkpoint, int page, PageOutcome outcome) {
        if (outcome.persisted.isEmpty()) {
            return;
        }
        log.error("Page {} aborted after persisting {} record(s), queueing them for remediation",
                page, outcome.persisted.size());
        checkpoint.addFailedUploads(outcome.failedUploads);
        distribution.domains().forEach(domain -> checkpoint.mergeDistributionFailures(domain, outcome.persisted));
        checkpointStore.save(checkpoint);
    }

    private boolean alreadyStored(String externalId) {
        try {
            return recordStore.exists(externalId);
        } catch (DataAccessException e) {
            throw new SyncAbortedException("Existence check failed for " + externalId + ", cannot guarantee dedup", e);
        }
    }

    /**
     * @return the detail, or null when the item is dropped
     */
    private VideoDetail fetchDetail(CatalogSession session, String externalId) {
        int refreshes = 0;
        while (true) {
            CatalogResult<VideoDetail> result = session.fetchDetail(externalId);
            switch (result.kind()) {
                case OK -> {
                    if (result.isEmpty()) {
                        log.warn("Detail is empty, dropping item (id: {})", externalId);
                    }
                    return result.value();
                }
                case RETRYABLE -> refreshes = refresh(session, refreshes, "detail " + externalId);
                case FATAL -> {
                    log.error("Detail fetch failed, dropping item (id: {}): {}", externalId, result.reason());
                    return null;
                }
                default -> throw new IllegalStateException("Unexpected result kind " + result.kind());
            }
        }
    }

    private int refresh(CatalogSession session, int refreshes, String what) {
        if (refreshes >= maxRefreshAttempts) {
            throw new SyncAbortedException("Session still rejected after " + refreshes + " refreshes (" + what + ")");
        }
        try {
            session.refresh();
        } catch (AuthException e) {
            throw new SyncAbortedException("Credential refresh failed while fetching " + what, e);
        }
        return refreshes + 1;
    }

    private Map<String, Set<String>> distribute(Set<String> persisted) {
        Map<String, Set<String>> failures = new LinkedHashMap<>();
        if (persisted.isEmpty()) {
            log.info("No new records on this page, nothing to distribute");
            return failures;
        }

        List<VideoRecord> batch;
        try {
            batch = recordStore.fetchMany(persisted);
        } catch (DataAccessException e) {
            log.error("Re-reading {} records for distribution failed: {}", persisted.size(), e.getMessage());
            batch = List.of();
        }

        if (batch.isEmpty()) {
            log.error("No records to distribute, marking all {} ids failed on every domain", persisted.size());
            distribution.domains().forEach(domain -> failures.put(domain, new LinkedHashSet<>(persisted)));
            return failures;
        }

        Set<String> missing = new LinkedHashSet<>(persisted);
        batch.forEach(record -> missing.remove(record.getExternalId()));
        if (!missing.isEmpty()) {
            log.error("Re-read is missing {} of {} records, marking them failed on every domain: {}",
                    missing.size(), persisted.size(), missing);
        }

        for (String domain : distribution.domains()) {
            Set<String> rejected = new LinkedHashSet<>(missing);
            try {
                rejected.addAll(distribution.push(batch, domain));
            } catch (TransportException e) {
                log.error("Push to {} failed, marking the whole batch failed: {}", domain, e.getMessage());
                rejected.addAll(persisted);
            }
            failures.put(domain, rejected);
        }
        return failures;
    }

    private static VideoRecord toRecord(CatalogItem item, VideoDetail detail) {
        String title = detail.getTitle() != null && !detail.getTitle().isBlank() ? detail.getTitle() : item.getTitle();
        String cover = detail.getCover() != null && !detail.getCover().isBlank() ? detail.getCover() : item.getCover();
        return VideoRecord.builder()
                .externalId(item.getExternalId())
                .title(title)
                .coverUrl(cover)
                .mediaList(new ArrayList<>(detail.safeVideoList()))
                .tags(item.getTags() != null ? new ArrayList<>(item.getTags()) : new ArrayList<>())
                .downloadUrl(detail.getDownloadUrl())
                .description(detail.resolvedDescription())
                .totalEpisodes(item.getTotalEpisodes())
                .freeEpisodes(detail.getFreeWatchEpisodes())
                .build();
    }

    private static final class PageOutcome {
        private final Set<String> persisted = new LinkedHashSet<>();
        private final Set<String> failedUploads = new LinkedHashSet<>();
    }

    /**
     * Counters for one ingestion run.
     */
    @Getter
    @ToString
    public static final class Summary {
        private int pages;
        private int persisted;
        private int skipped;
        private int dropped;
        private int mirrorFailures;
    }
}
