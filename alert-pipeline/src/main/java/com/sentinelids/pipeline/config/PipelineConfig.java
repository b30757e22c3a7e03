package com.sentinelids.pipeline.config;

import com.sentinelids.pipeline.alert.AlertWireFormat;
import com.sentinelids.pipeline.cache.AlertCache;
import com.sentinelids.pipeline.feature.FeatureExtractor;
import com.sentinelids.pipeline.persistence.AlertStore;
import com.sentinelids.pipeline.processor.AlertEnricher;
import com.sentinelids.pipeline.processor.AlertProcessor;
import com.sentinelids.pipeline.scoring.ScoringCapability;
import com.sentinelids.pipeline.stream.FieldCodec;
import com.sentinelids.pipeline.stream.RedisStreamBrokerClient;
import com.sentinelids.pipeline.stream.StreamBrokerClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Wires the pipeline.
 *
 * <p>
 * The shared {@link StreamBrokerClient} bean serves ingestion and metrics.
 * The processor gets a broker client of its own because stopping the
 * processor closes its client.
 * </p>
 *
 * @author Naveed Gung
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    @Primary
    public StreamBrokerClient streamBrokerClient(StringRedisTemplate redisTemplate, FieldCodec codec,
            StreamConfig streamConfig) {
        return new RedisStreamBrokerClient(redisTemplate, codec, streamConfig);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "sentinel.processor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public AlertProcessor alertProcessor(
            StringRedisTemplate redisTemplate,
            FieldCodec codec,
            AlertWireFormat wireFormat,
            FeatureExtractor featureExtractor,
            ScoringCapability scoringCapability,
            AlertStore alertStore,
            AlertCache alertCache,
            StreamConfig streamConfig,
            ProcessorConfig processorConfig,
            Clock clock,
            MeterRegistry meterRegistry) {
        StreamBrokerClient broker = new RedisStreamBrokerClient(redisTemplate, codec, streamConfig);
        AlertEnricher enricher = new AlertEnricher(broker, wireFormat, featureExtractor, scoringCapability,
                alertStore, alertCache, streamConfig, processorConfig, clock, meterRegistry);
        return new AlertProcessor(broker, enricher, streamConfig, processorConfig, clock);
    }
}
