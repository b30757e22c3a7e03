package com.sentinelids.pipeline.processor;

import com.sentinelids.pipeline.alert.EnrichedAlert;
import com.sentinelids.pipeline.persistence.AlertStore;
import com.sentinelids.pipeline.persistence.DurabilityException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link AlertStore} keeping alerts in memory, keyed by source message id.
 */
class RecordingAlertStore implements AlertStore {

    private final Map<String, Long> ids = new LinkedHashMap<>();
    private final List<EnrichedAlert> saved = new ArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private long nextId = 1;

    /** Fail the next {@code count} saves. */
    void failNext(int count) {
        failuresLeft.set(count);
    }

    @Override
    public synchronized long save(EnrichedAlert alert) {
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new DurabilityException("database unavailable");
        }
        Long existing = ids.get(alert.sourceMessageId());
        if (existing != null) {
            return existing;
        }
        long id = nextId++;
        ids.put(alert.sourceMessageId(), id);
        saved.add(alert);
        return id;
    }

    @Override
    public synchronized List<EnrichedAlert> findRecent(int limit) {
        return saved.stream()
                .sorted(Comparator.comparing(EnrichedAlert::processedAt).reversed())
                .limit(limit)
                .toList();
    }

    synchronized List<EnrichedAlert> saved() {
        return List.copyOf(saved);
    }
}
