package com.sentinelids.pipeline.stream;

import com.sentinelids.pipeline.config.StreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamInfo;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link StreamBrokerClient} backed by Redis Streams.
 *
 * <p>
 * Command mapping:
 * </p>
 * <ul>
 * <li>{@code append} - {@code XADD stream * field value ...}</li>
 * <li>{@code ensureGroup} - {@code XGROUP CREATE stream group 0 MKSTREAM},
 * a {@code BUSYGROUP} reply counts as success</li>
 * <li>{@code readBatch} - {@code XPENDING} + {@code XCLAIM} of entries idle
 * longer than the pending timeout, otherwise
 * {@code XREADGROUP GROUP g c COUNT n BLOCK ms STREAMS stream >}</li>
 * <li>{@code ack} - {@code XACK}</li>
 * <li>{@code streamInfo} - {@code XINFO STREAM}</li>
 * </ul>
 *
 * <p>
 * The template's Lettuce connection is thread-safe and shared by the driver
 * loop and all workers. Several clients may share one template; closing a
 * client only retires that handle, the connection factory belongs to the
 * Spring context.
 * </p>
 *
 * @author Naveed Gung
 */
public class RedisStreamBrokerClient implements StreamBrokerClient {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamBrokerClient.class);

    private static final String BUSYGROUP = "BUSYGROUP";

    private final StringRedisTemplate redisTemplate;
    private final FieldCodec codec;
    private final Duration pendingIdle;
    private final long reclaimScanLimit;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RedisStreamBrokerClient(StringRedisTemplate redisTemplate, FieldCodec codec, StreamConfig config) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.pendingIdle = Duration.ofMillis(config.getPendingIdleMs());
        this.reclaimScanLimit = config.getReclaimScanLimit();
    }

    @Override
    public String append(String stream, Map<String, ?> record) {
        checkOpen();
        Map<String, String> fields = codec.encodeFields(record);
        try {
            RecordId id = ops().add(stream, fields);
            if (id == null) {
                throw new BrokerUnavailableException("XADD to " + stream + " returned no id");
            }
            log.debug("Appended {} to {} ({} fields)", id.getValue(), stream, fields.size());
            return id.getValue();
        } catch (DataAccessException e) {
            throw translate("append to " + stream, e);
        }
    }

    @Override
    public void ensureGroup(String stream, String group) {
        checkOpen();
        try {
            ops().createGroup(stream, ReadOffset.from("0"), group);
            log.info("Created consumer group {} on {}", group, stream);
        } catch (DataAccessException e) {
            if (isBusyGroup(e)) {
                log.debug("Consumer group {} already exists on {}", group, stream);
                return;
            }
            throw translate("create group " + group + " on " + stream, e);
        }
    }

    @Override
    public List<StreamMessage> readBatch(String stream, String group, String consumer, int maxCount,
            long blockMillis) {
        checkOpen();
        try {
            List<StreamMessage> reclaimed = reclaimStale(stream, group, consumer, maxCount);
            if (!reclaimed.isEmpty()) {
                log.info("Reclaimed {} stale pending entries from {} for {}", reclaimed.size(), stream, consumer);
                return reclaimed;
            }

            StreamReadOptions options = StreamReadOptions.empty().count(maxCount);
            if (blockMillis > 0) {
                options = options.block(Duration.ofMillis(blockMillis));
            }
            List<MapRecord<String, String, String>> records = ops().read(
                    Consumer.from(group, consumer),
                    options,
                    StreamOffset.create(stream, ReadOffset.lastConsumed()));
            return toMessages(records);
        } catch (DataAccessException e) {
            throw translate("read from " + stream, e);
        }
    }

    /**
     * Claim entries of the group that were delivered but not acknowledged
     * within the pending timeout, typically left behind by a crashed or
     * stopped consumer or by a failed processing attempt.
     */
    private List<StreamMessage> reclaimStale(String stream, String group, String consumer, int maxCount) {
        PendingMessages pending = ops().pending(stream, group, Range.unbounded(), reclaimScanLimit);
        if (pending == null || pending.isEmpty()) {
            return List.of();
        }

        List<RecordId> stale = new ArrayList<>();
        for (PendingMessage message : pending) {
            if (message.getElapsedTimeSinceLastDelivery().compareTo(pendingIdle) >= 0) {
                stale.add(message.getId());
                if (stale.size() >= maxCount) {
                    break;
                }
            }
        }
        if (stale.isEmpty()) {
            return List.of();
        }

        // XCLAIM re-checks the idle time, so two processors racing for the same entry cannot both win
        List<MapRecord<String, String, String>> claimed = ops().claim(
                stream, group, consumer, pendingIdle, stale.toArray(new RecordId[0]));
        return toMessages(claimed);
    }

    @Override
    public void ack(String stream, String group, String messageId) {
        checkOpen();
        try {
            Long acknowledged = ops().acknowledge(stream, group, messageId);
            if (acknowledged == null || acknowledged == 0L) {
                log.debug("XACK {} on {} was a no-op (already acknowledged or unknown)", messageId, stream);
            }
        } catch (DataAccessException e) {
            throw translate("ack " + messageId + " on " + stream, e);
        }
    }

    @Override
    public StreamSummary streamInfo(String stream) {
        if (closed.get()) {
            return StreamSummary.empty();
        }
        try {
            StreamInfo.XInfoStream info = ops().info(stream);
            if (info == null) {
                return StreamSummary.empty();
            }
            Long length = info.streamLength();
            Long groups = info.groupCount();
            return new StreamSummary(
                    length != null ? length : 0L,
                    info.firstEntryId(),
                    info.lastEntryId(),
                    groups != null ? groups : 0L);
        } catch (Exception e) {
            log.warn("Failed to get stream info for {}: {}", stream, e.getMessage());
            return StreamSummary.empty();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Redis stream broker client closed");
        }
    }

    private StreamOperations<String, String, String> ops() {
        return redisTemplate.opsForStream();
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new BrokerUnavailableException("Stream broker client is closed");
        }
    }

    private static List<StreamMessage> toMessages(List<MapRecord<String, String, String>> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<StreamMessage> messages = new ArrayList<>(records.size());
        for (MapRecord<String, String, String> record : records) {
            if (record == null || record.getId() == null) {
                continue;
            }
            messages.add(new StreamMessage(record.getId().getValue(), record.getStream(), record.getValue()));
        }
        return messages;
    }

    private static boolean isBusyGroup(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(BUSYGROUP)) {
                return true;
            }
        }
        return false;
    }

    private static BrokerUnavailableException translate(String operation, DataAccessException e) {
        return new BrokerUnavailableException("Redis failed to " + operation + ": " + e.getMostSpecificCause().getMessage(), e);
    }
}
