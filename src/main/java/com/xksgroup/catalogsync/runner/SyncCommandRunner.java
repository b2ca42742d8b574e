package com.xksgroup.catalogsync.runner;

import com.xksgroup.catalogsync.exception.CatalogSyncException;
import com.xksgroup.catalogsync.service.DistributionRemediationService;
import com.xksgroup.catalogsync.service.IngestionOrchestrator;
import com.xksgroup.catalogsync.service.UploadRemediationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Dispatches the first program argument to one command and records its exit code.
 * <ul>
 *   <li>{@code scraper}: ingest the catalog from the last checkpointed page</li>
 *   <li>{@code oss_fix} / {@code s3_fix}: retry failed uploads against that store</li>
 *   <li>{@code site_fix}: retry failed site pushes</li>
 *   <li>{@code site_clean}: clean site data on every domain</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "usage: catalog-sync <scraper|oss_fix|s3_fix|site_fix|site_clean>";
    private static final String BANNER = "=".repeat(80);

    private final IngestionOrchestrator ingestion;
    private final UploadRemediationService uploadRemediation;
    private final DistributionRemediationService distributionRemediation;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) {
        if (args.length == 0 || args[0].isBlank()) {
            log.error(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        String command = args[0].trim();
        log.info(BANNER);
        log.info("Starting command '{}'", command);
        log.info(BANNER);
        try {
            exitCode = dispatch(command);
        } catch (CatalogSyncException e) {
            log.error("Command '{}' aborted: {}", command, e.getMessage(), e);
            exitCode = EXIT_FAILED;
        } finally {
            log.info(BANNER);
            log.info("Command '{}' finished with exit code {}", command, exitCode);
            log.info(BANNER);
        }
    }

    private int dispatch(String command) {
        switch (command) {
            case "scraper" -> ingestion.run();
            case "oss_fix" -> uploadRemediation.remediate("oss");
            case "s3_fix" -> uploadRemediation.remediate("s3");
            case "site_fix" -> distributionRemediation.remediate();
            case "site_clean" -> {
                Map<String, Boolean> results = distributionRemediation.cleanSites();
                return results.containsValue(Boolean.FALSE) ? EXIT_FAILED : EXIT_OK;
            }
            default -> {
                log.error("Unknown command '{}'. {}", command, USAGE);
                return EXIT_USAGE;
            }
        }
        return EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
