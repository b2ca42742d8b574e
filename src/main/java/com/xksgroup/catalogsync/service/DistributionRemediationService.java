package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.TransportException;
import com.xksgroup.catalogsync.model.SyncCheckpoint;
import com.xksgroup.catalogsync.model.VideoRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-pushes each domain's failed ids to that domain only, reading the records back from the record store.
 * <p>
 * Each domain's result replaces its entry in the checkpoint. Ingestion merges by union; remediation does not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributionRemediationService {

    private final RecordStore recordStore;
    private final DistributionClient distribution;
    private final CheckpointStore checkpointStore;

    /**
     * @return the per-domain failure sets written back to the checkpoint
     */
    public Map<String, Set<String>> remediate() {
        SyncCheckpoint checkpoint = checkpointStore.load();
        Map<String, Set<String>> pending = new LinkedHashMap<>(checkpoint.getFailedDistribution());
        if (pending.values().stream().allMatch(Set::isEmpty)) {
            log.info("No failed distributions to remediate");
            return Map.of();
        }

        Map<String, Set<String>> remaining = new LinkedHashMap<>();
        pending.forEach((domain, ids) -> {
            if (ids.isEmpty()) {
                return;
            }
            log.info("Re-pushing {} record(s) to {}", ids.size(), domain);
            remaining.put(domain, retryDomain(domain, ids));
        });

        checkpoint.replaceFailedDistribution(remaining);
        checkpointStore.save(checkpoint);
        log.info("Distribution remediation done, {} domain(s) still failing", checkpoint.getFailedDistribution().size());
        return checkpoint.getFailedDistribution();
    }

    private Set<String> retryDomain(String domain, Set<String> ids) {
        List<VideoRecord> records;
        try {
            records = recordStore.fetchMany(ids);
        } catch (DataAccessException e) {
            log.error("Reading records for {} failed: {}", domain, e.getMessage());
            return new LinkedHashSet<>(ids);
        }

        if (records.isEmpty()) {
            log.warn("None of the {} failed id(s) for {} were found in the record store", ids.size(), domain);
            return new LinkedHashSet<>(ids);
        }

        try {
            return distribution.push(records, domain);
        } catch (TransportException e) {
            log.error("Re-push to {} failed: {}", domain, e.getMessage());
            return new LinkedHashSet<>(ids);
        }
    }

    /**
     * Asks every configured domain to clean its site data.
     *
     * @return per-domain outcome, in configuration order
     */
    public Map<String, Boolean> cleanSites() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        List<String> domains = distribution.domains();
        if (domains.isEmpty()) {
            log.warn("No site domains configured, nothing to clean");
            return results;
        }
        for (String domain : domains) {
            boolean ok = distribution.cleanup(domain);
            log.info("{}: cleanup {}", domain, ok ? "succeeded" : "failed");
            results.put(domain, ok);
        }
        return results;
    }
}
