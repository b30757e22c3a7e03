package com.sentinelids.pipeline.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived lookup cache for recently processed alerts.
 *
 * <p>
 * Best-effort: implementations log and swallow their own failures, so a
 * cache outage never fails the processing unit that writes to it.
 * </p>
 *
 * @author Naveed Gung
 */
public interface AlertCache {

    /** Key under which a persisted alert is cached. */
    static String recentAlertKey(long persistedId) {
        return "recent_alert_" + persistedId;
    }

    /**
     * Store a value with a time-to-live.
     *
     * @return true if the value was stored
     */
    boolean put(String key, Object value, Duration ttl);

    /** The cached JSON document, empty when absent, expired or unreachable. */
    Optional<String> get(String key);
}
