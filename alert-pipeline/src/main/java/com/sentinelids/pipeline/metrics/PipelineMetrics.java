package com.sentinelids.pipeline.metrics;

import com.sentinelids.pipeline.config.StreamConfig;
import com.sentinelids.pipeline.processor.AlertProcessor;
import com.sentinelids.pipeline.stream.StreamBrokerClient;
import com.sentinelids.pipeline.stream.StreamSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pipeline gauges and the periodic backlog report.
 *
 * <p>
 * Registered gauges (counters and timers live with the components that
 * update them):
 * </p>
 * <ul>
 * <li>{@code sentinel.processor.in_flight} - units currently held by workers</li>
 * <li>{@code sentinel.stream.raw.length} - entries in the raw stream</li>
 * <li>{@code sentinel.stream.processed.length} - entries in the processed stream</li>
 * <li>{@code sentinel.uptime_seconds} - service uptime</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class PipelineMetrics {

    private static final Logger log = LoggerFactory.getLogger(PipelineMetrics.class);

    private final StreamBrokerClient broker;
    private final ObjectProvider<AlertProcessor> processor;
    private final StreamConfig streamConfig;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public PipelineMetrics(
            StreamBrokerClient broker,
            ObjectProvider<AlertProcessor> processor,
            StreamConfig streamConfig,
            MeterRegistry meterRegistry) {
        this.broker = broker;
        this.processor = processor;
        this.streamConfig = streamConfig;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        processor.ifAvailable(p -> Gauge.builder("sentinel.processor.in_flight", p, AlertProcessor::inFlight)
                .description("Alerts currently being processed by workers")
                .register(meterRegistry));

        Gauge.builder("sentinel.stream.raw.length", broker, b -> b.streamInfo(streamConfig.getRawStream()).length())
                .description("Entries in the raw alerts stream")
                .register(meterRegistry);

        Gauge.builder("sentinel.stream.processed.length", broker,
                b -> b.streamInfo(streamConfig.getProcessedStream()).length())
                .description("Entries in the processed alerts stream")
                .register(meterRegistry);

        Gauge.builder("sentinel.uptime_seconds", this, m -> (System.currentTimeMillis() - m.startTime) / 1000.0)
                .description("Pipeline uptime in seconds")
                .register(meterRegistry);

        log.info("Pipeline metrics registered");
    }

    /**
     * Log stream sizes and processor state. Runs every minute.
     */
    @Scheduled(fixedRateString = "${sentinel.metrics.report-interval-ms:60000}", initialDelay = 60_000)
    public void reportBacklog() {
        try {
            StreamSummary raw = broker.streamInfo(streamConfig.getRawStream());
            StreamSummary processed = broker.streamInfo(streamConfig.getProcessedStream());
            AlertProcessor p = processor.getIfAvailable();
            log.info("Backlog: raw={} (last={}, groups={}) processed={} processor={} inFlight={}",
                    raw.length(), raw.lastId(), raw.groupCount(), processed.length(),
                    p != null ? p.state() : "disabled", p != null ? p.inFlight() : 0);
        } catch (Exception e) {
            log.error("Backlog report failed: {}", e.getMessage(), e);
        }
    }
}
