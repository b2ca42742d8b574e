package com.xksgroup.catalogsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Durable pipeline state. One JSON document, rewritten after every unit of progress.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"lastPage", "credentialToken", "failedUploadIds", "failedDistribution"})
public class SyncCheckpoint {

    /** Last page whose persistence and distribution attempts completed. 0 means never started. */
    private int lastPage;

    private String credentialToken;

    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> failedUploadIds = new LinkedHashSet<>();

    @JsonDeserialize(as = LinkedHashMap.class, contentAs = LinkedHashSet.class)
    private Map<String, Set<String>> failedDistribution = new LinkedHashMap<>();

    public void setFailedUploadIds(Set<String> failedUploadIds) {
        this.failedUploadIds = failedUploadIds != null ? failedUploadIds : new LinkedHashSet<>();
    }

    /**
     * Domains mapped to null are dropped.
     */
    public void setFailedDistribution(Map<String, Set<String>> failedDistribution) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (failedDistribution != null) {
            failedDistribution.forEach((domain, ids) -> {
                if (domain != null && ids != null) {
                    copy.put(domain, new LinkedHashSet<>(ids));
                }
            });
        }
        this.failedDistribution = copy;
    }

    /**
     * Advances the page marker. Never moves it backwards.
     */
    public void advanceTo(int page) {
        if (page > lastPage) {
            lastPage = page;
        }
    }

    public void addFailedUploads(Collection<String> externalIds) {
        failedUploadIds.addAll(externalIds);
    }

    /**
     * Ingestion-side merge: the domain's existing failures are kept and the new ones added.
     */
    public void mergeDistributionFailures(String domain, Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            return;
        }
        failedDistribution.computeIfAbsent(domain, d -> new LinkedHashSet<>()).addAll(externalIds);
    }

    public void replaceFailedUploads(Collection<String> externalIds) {
        failedUploadIds = new LinkedHashSet<>(externalIds);
    }

    public void replaceFailedDistribution(Map<String, Set<String>> remaining) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        remaining.forEach((domain, ids) -> {
            if (!ids.isEmpty()) {
                copy.put(domain, new LinkedHashSet<>(ids));
            }
        });
        failedDistribution = copy;
    }
}
