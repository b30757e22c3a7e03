package com.sentinelids.pipeline.persistence;

import com.sentinelids.pipeline.alert.EnrichedAlert;

import java.util.List;

/**
 * Durable storage for enriched alerts. Shared by all workers; implementations
 * must be safe for concurrent use.
 *
 * @author Naveed Gung
 */
public interface AlertStore {

    /**
     * Persist an enriched alert. Saving an alert whose source message was
     * already stored returns the existing id instead of inserting a duplicate.
     *
     * @return the persisted id
     * @throws DurabilityException if the alert could not be stored
     */
    long save(EnrichedAlert alert);

    /** Most recently processed alerts, newest first. */
    List<EnrichedAlert> findRecent(int limit);
}
