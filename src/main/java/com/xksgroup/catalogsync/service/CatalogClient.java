package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.model.dto.CatalogItem;
import com.xksgroup.catalogsync.model.dto.CatalogResult;
import com.xksgroup.catalogsync.model.dto.VideoDetail;

import java.util.List;

/**
 * Remote catalog API. Implementations never throw for expected outcomes: an expired session is
 * {@code RETRYABLE}, anything the caller cannot recover from is {@code FATAL}.
 */
public interface CatalogClient {

    /** Logs in with the configured credentials; OK carries the new session token. */
    CatalogResult<String> authenticate();

    CatalogResult<List<CatalogItem>> listPage(String token, int pageNumber, int pageSize);

    /** OK with no value means the catalog knows the id but returned no detail for it. */
    CatalogResult<VideoDetail> fetchDetail(String token, String externalId);

    int defaultPageSize();
}
