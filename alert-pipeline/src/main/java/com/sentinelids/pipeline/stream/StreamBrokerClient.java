package com.sentinelids.pipeline.stream;

import java.util.List;
import java.util.Map;

/**
 * Durable append-only log with consumer-group semantics.
 *
 * <p>
 * Implementations must be safe for concurrent use: the processor's driver
 * thread reads while every worker appends and acknowledges through the same
 * instance.
 * </p>
 *
 * @author Naveed Gung
 */
public interface StreamBrokerClient extends AutoCloseable {

    /**
     * Append a record to a stream.
     *
     * @return the broker-assigned message id
     * @throws BrokerUnavailableException if the broker cannot be reached
     * @throws InvalidRecordException     if the record cannot be encoded
     */
    String append(String stream, Map<String, ?> record);

    /**
     * Create the consumer group at the start of the stream, creating the stream
     * if needed. An existing group is not an error.
     *
     * @throws BrokerUnavailableException if the broker cannot be reached
     */
    void ensureGroup(String stream, String group);

    /**
     * Read up to {@code maxCount} messages for a consumer, blocking up to
     * {@code blockMillis} when none are available. Returned messages stay
     * pending for the group until acknowledged or reclaimed.
     *
     * @return the messages read, empty on timeout
     * @throws BrokerUnavailableException if the broker cannot be reached
     */
    List<StreamMessage> readBatch(String stream, String group, String consumer, int maxCount, long blockMillis);

    /**
     * Acknowledge a message. Acknowledging twice has no further effect.
     *
     * @throws BrokerUnavailableException if the broker cannot be reached
     */
    void ack(String stream, String group, String messageId);

    /**
     * Introspect a stream. Never throws; returns {@link StreamSummary#empty()}
     * on failure.
     */
    StreamSummary streamInfo(String stream);

    /** Release the client. Later calls fail with {@link BrokerUnavailableException}. */
    @Override
    void close();
}
