package com.sentinelids.pipeline.processor;

import com.sentinelids.pipeline.PipelineException;
import com.sentinelids.pipeline.alert.AlertWireFormat;
import com.sentinelids.pipeline.alert.EnrichedAlert;
import com.sentinelids.pipeline.alert.RawAlert;
import com.sentinelids.pipeline.cache.AlertCache;
import com.sentinelids.pipeline.config.ProcessorConfig;
import com.sentinelids.pipeline.config.StreamConfig;
import com.sentinelids.pipeline.feature.FeatureExtractor;
import com.sentinelids.pipeline.persistence.AlertStore;
import com.sentinelids.pipeline.scoring.Classification;
import com.sentinelids.pipeline.scoring.ScoringCapability;
import com.sentinelids.pipeline.scoring.ScoringException;
import com.sentinelids.pipeline.stream.StreamBrokerClient;
import com.sentinelids.pipeline.stream.StreamMessage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The per-message unit of work run by a worker.
 *
 * <p>
 * Steps run strictly in order: decode, extract features, classify, assemble
 * the {@link EnrichedAlert}, persist, cache, publish to the processed stream,
 * acknowledge the raw message. The message is acknowledged only when every
 * step up to publishing succeeded; on any failure it stays pending in the
 * consumer group and is reclaimed by a later read. Cache failures do not
 * count as failures.
 * </p>
 *
 * @author Naveed Gung
 */
public class AlertEnricher {

    private static final Logger log = LoggerFactory.getLogger(AlertEnricher.class);

    private final StreamBrokerClient broker;
    private final AlertWireFormat wireFormat;
    private final FeatureExtractor featureExtractor;
    private final ScoringCapability scoringCapability;
    private final AlertStore alertStore;
    private final AlertCache alertCache;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final String rawStream;
    private final String processedStream;
    private final String group;
    private final double defaultConfidence;
    private final Duration cacheTtl;

    private final Counter abandoned;
    private final Timer scoringLatency;
    private final Timer unitLatency;

    public AlertEnricher(
            StreamBrokerClient broker,
            AlertWireFormat wireFormat,
            FeatureExtractor featureExtractor,
            ScoringCapability scoringCapability,
            AlertStore alertStore,
            AlertCache alertCache,
            StreamConfig streamConfig,
            ProcessorConfig processorConfig,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.broker = broker;
        this.wireFormat = wireFormat;
        this.featureExtractor = featureExtractor;
        this.scoringCapability = scoringCapability;
        this.alertStore = alertStore;
        this.alertCache = alertCache;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.rawStream = streamConfig.getRawStream();
        this.processedStream = streamConfig.getProcessedStream();
        this.group = streamConfig.getGroup();
        this.defaultConfidence = processorConfig.getDefaultConfidence();
        this.cacheTtl = processorConfig.getCacheTtl();

        this.abandoned = Counter.builder("sentinel.alerts.abandoned")
                .description("Units interrupted by shutdown before acknowledgement")
                .register(meterRegistry);
        this.scoringLatency = Timer.builder("sentinel.scoring.latency")
                .description("Time spent in the scoring capability per alert")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.unitLatency = Timer.builder("sentinel.alerts.latency")
                .description("Time from worker start to acknowledgement")
                .register(meterRegistry);
    }

    /**
     * Run the unit of work for one message.
     *
     * @return true if the message was fully processed and acknowledged
     */
    public boolean process(WorkerTask task) {
        StreamMessage message = task.message();
        RawAlert alert = wireFormat.decodeRaw(message.fields());
        Stage stage = Stage.SCORE;
        try {
            double[] features = featureExtractor.extract(alert);
            Classification classification = classify(features);
            double confidence = classification.hasConfidence() ? classification.confidence() : defaultConfidence;
            EnrichedAlert enriched = EnrichedAlert.of(alert, classification.label(), confidence, features,
                    clock.instant(), message.id());

            stage = Stage.PERSIST;
            long persistedId = alertStore.save(enriched);

            Map<String, Object> record = wireFormat.encodeEnriched(enriched);
            cache(persistedId, record);

            stage = Stage.PUBLISH;
            if (abandonedByShutdown(message, stage)) {
                return false;
            }
            String processedId = broker.append(processedStream, record);

            stage = Stage.ACK;
            if (abandonedByShutdown(message, stage)) {
                return false;
            }
            broker.ack(rawStream, group, message.id());

            Duration elapsed = Duration.between(task.startedAt(), clock.instant());
            unitLatency.record(elapsed);
            Counter.builder("sentinel.alerts.processed")
                    .description("Alerts enriched, persisted, published and acknowledged")
                    .tag("prediction", enriched.predictionName())
                    .register(meterRegistry)
                    .increment();
            log.info("Processed alert {} -> {} (id={}, prediction={}, confidence={}, src={}, dst={}:{})",
                    message.id(), processedId, persistedId, enriched.predictionName(),
                    String.format("%.3f", enriched.confidence()), alert.sourceIp(), alert.destinationIp(),
                    alert.destinationPort());
            return true;
        } catch (PipelineException e) {
            failed(stage);
            log.error("Failed to {} alert {} (src={}, dst={}), leaving it pending for redelivery: {}",
                    stage.verb, message.id(), alert.sourceIp(), alert.destinationIp(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            failed(stage);
            log.error("Unexpected error during {} of alert {} (src={}, dst={}), leaving it pending for redelivery",
                    stage.verb, message.id(), alert.sourceIp(), alert.destinationIp(), e);
            return false;
        }
    }

    private Classification classify(double[] features) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Classification classification;
        try {
            classification = scoringCapability.classify(features);
        } catch (ScoringException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScoringException("Scoring capability failed: " + e, e);
        } finally {
            sample.stop(scoringLatency);
        }
        if (classification == null || !classification.isValidLabel()) {
            throw new ScoringException("Scoring capability returned an invalid classification: " + classification);
        }
        return classification;
    }

    private void cache(long persistedId, Map<String, Object> record) {
        Map<String, Object> cached = new LinkedHashMap<>(record);
        cached.put("id", persistedId);
        try {
            alertCache.put(AlertCache.recentAlertKey(persistedId), cached, cacheTtl);
        } catch (RuntimeException e) {
            log.warn("Cache write for alert {} failed: {}", persistedId, e.getMessage());
        }
    }

    private boolean abandonedByShutdown(StreamMessage message, Stage stage) {
        if (!Thread.currentThread().isInterrupted()) {
            return false;
        }
        abandoned.increment();
        log.warn("Abandoning alert {} before {}: worker interrupted by shutdown, message stays pending",
                message.id(), stage.verb);
        return true;
    }

    private void failed(Stage stage) {
        Counter.builder("sentinel.alerts.failed")
                .description("Alerts left pending after a failed processing step")
                .tag("stage", stage.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    private enum Stage {
        SCORE("score"),
        PERSIST("persist"),
        PUBLISH("publish"),
        ACK("acknowledge");

        private final String verb;

        Stage(String verb) {
            this.verb = verb;
        }
    }
}
