package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.TransportException;
import com.xksgroup.catalogsync.model.VideoRecord;

import java.util.List;
import java.util.Set;

/**
 * Downstream site endpoints that receive persisted records.
 */
public interface DistributionClient {

    /** Configured target domains, in configuration order. */
    List<String> domains();

    /**
     * Pushes a batch to one domain.
     *
     * @return the external ids the domain rejected; empty means every record was accepted
     * @throws TransportException the push could not be completed; callers treat it as every id rejected
     */
    Set<String> push(List<VideoRecord> batch, String domain);

    boolean cleanup(String domain);
}
