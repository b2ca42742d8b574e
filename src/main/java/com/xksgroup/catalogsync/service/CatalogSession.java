package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.AuthException;
import com.xksgroup.catalogsync.model.SyncCheckpoint;
import com.xksgroup.catalogsync.model.dto.CatalogItem;
import com.xksgroup.catalogsync.model.dto.CatalogResult;
import com.xksgroup.catalogsync.model.dto.VideoDetail;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Per-run session context around a {@link CatalogClient}: owns the current credential and the
 * single place it gets refreshed. A refreshed token is written to the checkpoint right away so the
 * next run can reuse it.
 */
@Slf4j
public class CatalogSession {

    private final CatalogClient client;
    private final CheckpointStore checkpointStore;
    private final SyncCheckpoint checkpoint;
    private String token;

    public CatalogSession(CatalogClient client, CheckpointStore checkpointStore, SyncCheckpoint checkpoint) {
        this.client = client;
        this.checkpointStore = checkpointStore;
        this.checkpoint = checkpoint;
        this.token = checkpoint.getCredentialToken();
        if (token != null) {
            log.info("Using cached catalog token");
        }
    }

    public String getToken() {
        return token;
    }

    public CatalogResult<List<CatalogItem>> listPage(int pageNumber) {
        return client.listPage(token, pageNumber, client.defaultPageSize());
    }

    public CatalogResult<VideoDetail> fetchDetail(String externalId) {
        return client.fetchDetail(token, externalId);
    }

    /**
     * Obtains a fresh token and persists it.
     *
     * @throws AuthException the catalog refused or could not be reached
     */
    public void refresh() {
        log.warn("Catalog token expired or missing, logging in again");
        CatalogResult<String> result = client.authenticate();
        if (result.kind() != CatalogResult.Kind.OK || result.isEmpty()) {
            throw new AuthException("Credential refresh failed: " + result.reason());
        }
        token = result.value();
        checkpoint.setCredentialToken(token);
        checkpointStore.save(checkpoint);
        log.info("Catalog login succeeded, token cached");
    }
}
