package com.sentinelids.pipeline.ingest;

/**
 * Outcome of an ingestion call.
 *
 * @param success   whether the record was appended to the raw stream
 * @param messageId id of the appended entry, null on failure
 * @param error     failure reason, null on success
 *
 * @author Naveed Gung
 */
public record IngestResult(boolean success, String messageId, String error) {

    public static IngestResult accepted(String messageId) {
        return new IngestResult(true, messageId, null);
    }

    public static IngestResult rejected(String error) {
        return new IngestResult(false, null, error);
    }
}
