package com.sentinelids.pipeline.ingest;

import com.sentinelids.pipeline.PipelineException;
import com.sentinelids.pipeline.alert.AlertSource;
import com.sentinelids.pipeline.alert.AlertWireFormat;
import com.sentinelids.pipeline.config.StreamConfig;
import com.sentinelids.pipeline.stream.StreamBrokerClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for raw alerts from the sensor tailer or manual submission.
 *
 * <p>
 * Stamps the {@code source} discriminator and {@code ingestion_timestamp}
 * (plus {@code timestamp} when the producer sent none) and appends the record
 * to the raw stream. Failures are reported to the caller and never retried
 * here; retry policy belongs to the caller.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class AlertIngestionService {

    private static final Logger log = LoggerFactory.getLogger(AlertIngestionService.class);

    private final StreamBrokerClient broker;
    private final String rawStream;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public AlertIngestionService(StreamBrokerClient broker, StreamConfig streamConfig, Clock clock,
            MeterRegistry meterRegistry) {
        this.broker = broker;
        this.rawStream = streamConfig.getRawStream();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Append one alert to the raw stream.
     *
     * @param record arbitrary alert fields; not modified
     * @param source ingestion origin
     * @return the outcome; on success the entry is in the stream
     */
    public IngestResult ingest(Map<String, ?> record, AlertSource source) {
        if (source == null) {
            return reject(null, "No alert source given");
        }
        if (record == null || record.isEmpty()) {
            return reject(source, "Alert record is empty");
        }

        Map<String, Object> stamped = new LinkedHashMap<>(record);
        String now = clock.instant().toString();
        stamped.put(AlertWireFormat.SOURCE, source.getWireValue());
        stamped.put(AlertWireFormat.INGESTION_TIMESTAMP, now);
        stamped.putIfAbsent(AlertWireFormat.TIMESTAMP, now);

        try {
            String messageId = broker.append(rawStream, stamped);
            counter("sentinel.ingest.accepted", source).increment();
            log.info("Ingested {} alert {} (src={}, dst={})", source.getWireValue(), messageId,
                    stamped.get(AlertWireFormat.SOURCE_IP), stamped.get(AlertWireFormat.DESTINATION_IP));
            return IngestResult.accepted(messageId);
        } catch (PipelineException e) {
            return reject(source, e.getMessage());
        }
    }

    /** Ingest a record parsed from the sensor's alert log. */
    public IngestResult ingestSnortAlert(Map<String, ?> record) {
        return ingest(record, AlertSource.SNORT);
    }

    /** Ingest a manually submitted record. */
    public IngestResult ingestCustomAlert(Map<String, ?> record) {
        return ingest(record, AlertSource.CUSTOM);
    }

    private IngestResult reject(AlertSource source, String reason) {
        counter("sentinel.ingest.rejected", source).increment();
        log.error("Failed to ingest {} alert: {}", source != null ? source.getWireValue() : "unknown", reason);
        return IngestResult.rejected(reason);
    }

    private Counter counter(String name, AlertSource source) {
        return Counter.builder(name)
                .description("Raw alerts submitted for ingestion")
                .tag("source", source != null ? source.getWireValue() : "unknown")
                .register(meterRegistry);
    }
}
