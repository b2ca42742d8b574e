package com.xksgroup.catalogsync.runner;

import com.xksgroup.catalogsync.exception.CheckpointException;
import com.xksgroup.catalogsync.exception.SyncAbortedException;
import com.xksgroup.catalogsync.service.DistributionRemediationService;
import com.xksgroup.catalogsync.service.IngestionOrchestrator;
import com.xksgroup.catalogsync.service.UploadRemediationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Command dispatch and exit codes")
class SyncCommandRunnerTest {

    private IngestionOrchestrator ingestion;
    private UploadRemediationService uploadRemediation;
    private DistributionRemediationService distributionRemediation;
    private SyncCommandRunner runner;

    @BeforeEach
    void setUp() {
        ingestion = mock(IngestionOrchestrator.class);
        uploadRemediation = mock(UploadRemediationService.class);
        distributionRemediation = mock(DistributionRemediationService.class);
        runner = new SyncCommandRunner(ingestion, uploadRemediation, distributionRemediation);
    }

    @DisplayName("scraper runs ingestion and exits 0")
    @Test
    void scraper() {
        runner.run("scraper");

        verify(ingestion).run();
        assertEquals(SyncCommandRunner.EXIT_OK, runner.getExitCode());
    }

    @DisplayName("oss_fix and s3_fix remediate against their own store")
    @Test
    void uploadFixes() {
        when(uploadRemediation.remediate("oss")).thenReturn(Set.of("C"));

        runner.run("oss_fix");
        runner.run("s3_fix");

        verify(uploadRemediation).remediate("oss");
        verify(uploadRemediation).remediate("s3");
        assertEquals(SyncCommandRunner.EXIT_OK, runner.getExitCode());
    }

    @DisplayName("site_fix runs distribution remediation")
    @Test
    void siteFix() {
        runner.run("site_fix");

        verify(distributionRemediation).remediate();
        verifyNoInteractions(ingestion, uploadRemediation);
    }

    @DisplayName("site_clean exits 1 when any domain fails")
    @Test
    void siteClean() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        results.put("example.com", true);
        results.put("other.com", false);
        when(distributionRemediation.cleanSites()).thenReturn(results);

        runner.run("site_clean");

        assertEquals(SyncCommandRunner.EXIT_FAILED, runner.getExitCode());
    }

    @DisplayName("site_clean with every domain succeeding exits 0")
    @Test
    void siteCleanOk() {
        when(distributionRemediation.cleanSites()).thenReturn(Map.of("example.com", true));

        runner.run("site_clean");

        assertEquals(SyncCommandRunner.EXIT_OK, runner.getExitCode());
    }

    @DisplayName("an aborted run exits 1")
    @Test
    void abortExitsNonZero() {
        when(ingestion.run()).thenThrow(new SyncAbortedException("refresh failed"));

        runner.run("scraper");

        assertEquals(SyncCommandRunner.EXIT_FAILED, runner.getExitCode());
    }

    @DisplayName("a corrupt checkpoint exits 1")
    @Test
    void corruptCheckpointExitsNonZero() {
        when(distributionRemediation.remediate()).thenThrow(new CheckpointException("corrupt", null));

        runner.run("site_fix");

        assertEquals(SyncCommandRunner.EXIT_FAILED, runner.getExitCode());
    }

    @DisplayName("a missing or unknown command prints usage and exits 2")
    @Test
    void usage() {
        runner.run();
        assertEquals(SyncCommandRunner.EXIT_USAGE, runner.getExitCode());

        runner.run("deploy");
        assertEquals(SyncCommandRunner.EXIT_USAGE, runner.getExitCode());
        verifyNoInteractions(ingestion, uploadRemediation, distributionRemediation);
    }
}
