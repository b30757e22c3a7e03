package com.sentinelids.pipeline.stream;

/**
 * Best-effort stream introspection result.
 *
 * @param length     number of entries in the stream
 * @param firstId    id of the oldest entry, null when empty or unknown
 * @param lastId     id of the newest entry, null when empty or unknown
 * @param groupCount number of consumer groups attached to the stream
 *
 * @author Naveed Gung
 */
public record StreamSummary(long length, String firstId, String lastId, long groupCount) {

    /** Zeroed summary returned when introspection fails. */
    public static StreamSummary empty() {
        return new StreamSummary(0L, null, null, 0L);
    }
}
