package com.xksgroup.catalogsync.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Checkpoint bookkeeping")
class SyncCheckpointTest {

    @DisplayName("lastPage never moves backwards")
    @Test
    void advanceTo_isMonotonic() {
        SyncCheckpoint checkpoint = new SyncCheckpoint();

        checkpoint.advanceTo(3);
        checkpoint.advanceTo(2);
        assertEquals(3, checkpoint.getLastPage());

        checkpoint.advanceTo(4);
        assertEquals(4, checkpoint.getLastPage());
    }

    @DisplayName("ingestion merge is a union: existing failures for a domain are kept")
    @Test
    void mergeDistributionFailures_union() {
        // given
        SyncCheckpoint checkpoint = new SyncCheckpoint();
        checkpoint.mergeDistributionFailures("example.com", List.of("OLD"));

        // when
        checkpoint.mergeDistributionFailures("example.com", List.of("D", "OLD"));
        checkpoint.mergeDistributionFailures("other.com", List.of());

        // then
        assertEquals(Map.of("example.com", Set.of("OLD", "D")), checkpoint.getFailedDistribution());
    }

    @DisplayName("remediation replace discards what was there before")
    @Test
    void replace_isAuthoritative() {
        // given
        SyncCheckpoint checkpoint = new SyncCheckpoint();
        checkpoint.addFailedUploads(List.of("A", "B"));
        checkpoint.mergeDistributionFailures("example.com", List.of("X", "Y"));
        checkpoint.mergeDistributionFailures("other.com", List.of("Z"));

        // when
        checkpoint.replaceFailedUploads(List.of("B"));
        checkpoint.replaceFailedDistribution(Map.of("example.com", Set.of("Y"), "other.com", Set.of()));

        // then
        assertEquals(Set.of("B"), checkpoint.getFailedUploadIds());
        assertEquals(Map.of("example.com", Set.of("Y")), checkpoint.getFailedDistribution());
    }

    @DisplayName("null collections are stored as empty ones")
    @Test
    void setters_tolerateNull() {
        SyncCheckpoint checkpoint = new SyncCheckpoint();

        checkpoint.setFailedUploadIds(null);
        checkpoint.setFailedDistribution(null);

        assertTrue(checkpoint.getFailedUploadIds().isEmpty());
        assertTrue(checkpoint.getFailedDistribution().isEmpty());
    }
}
