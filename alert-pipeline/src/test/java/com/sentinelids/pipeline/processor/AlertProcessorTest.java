package com.sentinelids.pipeline.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelids.pipeline.alert.AlertWireFormat;
import com.sentinelids.pipeline.alert.EnrichedAlert;
import com.sentinelids.pipeline.config.ProcessorConfig;
import com.sentinelids.pipeline.config.ScoringConfig;
import com.sentinelids.pipeline.config.StreamConfig;
import com.sentinelids.pipeline.feature.FeatureExtractor;
import com.sentinelids.pipeline.ingest.AlertIngestionService;
import com.sentinelids.pipeline.ingest.IngestResult;
import com.sentinelids.pipeline.scoring.LinearScoringModel;
import com.sentinelids.pipeline.scoring.ScoringCapability;
import com.sentinelids.pipeline.stream.BrokerUnavailableException;
import com.sentinelids.pipeline.stream.FieldCodec;
import com.sentinelids.pipeline.stream.InMemoryStreamBroker;
import com.sentinelids.pipeline.stream.StreamMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class AlertProcessorTest {

    private static final String RAW = "raw_alerts";
    private static final String PROCESSED = "processed_alerts";
    private static final String GROUP = "alert_processors";

    private final FieldCodec codec = new FieldCodec(new ObjectMapper());
    private final AlertWireFormat wireFormat = new AlertWireFormat(codec);
    private final StreamConfig streamConfig = new StreamConfig();

    private InMemoryStreamBroker broker;
    private ControllableScorer scorer;
    private RecordingAlertStore store;
    private ProcessorConfig processorConfig;
    private AlertProcessor processor;

    @BeforeEach
    void setUp() {
        broker = new InMemoryStreamBroker();
        scorer = new ControllableScorer();
        store = new RecordingAlertStore();
        processorConfig = new ProcessorConfig();
        processorConfig.setWorkerPoolSize(4);
        processorConfig.setBatchSize(10);
        processorConfig.setBlockMillis(100);
        processorConfig.setIdlePauseMillis(10);
        processorConfig.setGracePeriodMillis(5000);
        processorConfig.setReadFailureBackoffMillis(10);
        processorConfig.setMaxConsecutiveReadFailures(3);
    }

    @AfterEach
    void tearDown() {
        scorer.release();
        if (processor != null) {
            processor.stop();
        }
    }

    private AlertProcessor newProcessor(ScoringCapability scoring) {
        AlertEnricher enricher = new AlertEnricher(broker, wireFormat, new FeatureExtractor(), scoring, store,
                new RecordingAlertCache(), streamConfig, processorConfig, Clock.systemUTC(), new SimpleMeterRegistry());
        processor = new AlertProcessor(broker, enricher, streamConfig, processorConfig, Clock.systemUTC());
        return processor;
    }

    private void appendAlerts(int count) {
        for (int i = 0; i < count; i++) {
            broker.append(RAW, Map.of(
                    "source_ip", "10.0.0." + (i + 1),
                    "destination_ip", "192.168.1.10",
                    "destination_port", 22,
                    "protocol", "TCP",
                    "alert_message", "alert " + i));
        }
    }

    private static void await(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + timeoutMillis + " ms");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void shouldProcessEveryAlertExactlyOnce() throws Exception {
        newProcessor(scorer).start();
        assertEquals(ProcessorState.RUNNING, processor.state());

        appendAlerts(20);
        await(() -> broker.acks().size() == 20, 10_000);
        processor.stop();

        assertEquals(20, broker.entries(PROCESSED).size());
        assertEquals(20, store.saved().size());
        assertTrue(broker.pending(RAW, GROUP).isEmpty());
        assertEquals(ProcessorState.STOPPED, processor.state());
        assertTrue(broker.isClosed());
    }

    @Test
    void shouldNeverRunMoreScoringCallsThanWorkers() throws Exception {
        scorer.hold();
        newProcessor(scorer).start();

        appendAlerts(12);
        await(() -> scorer.active() == 4, 5000);
        Thread.sleep(200);

        assertEquals(4, scorer.active());
        assertEquals(4, processor.inFlight());
        assertEquals(4, scorer.peak());

        scorer.release();
        await(() -> broker.acks().size() == 12, 10_000);
        assertEquals(4, scorer.peak());
    }

    @Test
    void shouldEnrichSshAlertFromPrivateHost() throws Exception {
        AlertIngestionService ingestion = new AlertIngestionService(broker, streamConfig, Clock.systemUTC(),
                new SimpleMeterRegistry());
        newProcessor(new LinearScoringModel(new ScoringConfig())).start();

        IngestResult ingested = ingestion.ingestSnortAlert(Map.of(
                "source_ip", "10.0.0.5",
                "destination_port", 22,
                "protocol", "TCP"));
        assertTrue(ingested.success());
        await(() -> broker.acks().contains(ingested.messageId()), 5000);

        List<StreamMessage> processed = broker.entries(PROCESSED);
        assertEquals(1, processed.size());
        EnrichedAlert enriched = wireFormat.decodeEnriched(processed.get(0).fields());
        assertTrue(enriched.label() == 0 || enriched.label() == 1);
        assertEquals(FeatureExtractor.FEATURE_LENGTH, enriched.featureVector().size());
        assertEquals(ingested.messageId(), enriched.sourceMessageId());

        assertEquals(1, store.saved().size());
        assertEquals("10.0.0.5", store.saved().get(0).alert().sourceIp());
    }

    @Test
    void shouldWaitForBusyWorkersBeforeStopping() throws Exception {
        scorer.hold();
        newProcessor(scorer).start();
        appendAlerts(3);
        await(() -> scorer.active() == 3, 5000);

        Thread stopper = new Thread(processor::stop, "stopper");
        stopper.start();
        await(() -> processor.state() == ProcessorState.DRAINING, 2000);
        Thread.sleep(200);

        assertTrue(stopper.isAlive());
        assertEquals(ProcessorState.DRAINING, processor.state());
        assertTrue(broker.acks().isEmpty());

        scorer.release();
        stopper.join(5000);

        assertFalse(stopper.isAlive());
        assertEquals(ProcessorState.STOPPED, processor.state());
        assertEquals(3, broker.acks().size());
        assertEquals(3, broker.entries(PROCESSED).size());
    }

    @Test
    void shouldLeaveUnitsUnacknowledgedWhenGracePeriodElapses() throws Exception {
        processorConfig.setGracePeriodMillis(200);
        scorer.hold();
        newProcessor(scorer).start();
        appendAlerts(3);
        await(() -> scorer.active() == 3, 5000);

        long started = System.currentTimeMillis();
        processor.stop();

        assertTrue(System.currentTimeMillis() - started >= 200);
        assertEquals(ProcessorState.STOPPED, processor.state());

        scorer.release();
        await(() -> scorer.active() == 0, 5000);
        assertTrue(broker.acks().isEmpty());
        assertTrue(broker.entries(PROCESSED).isEmpty());
        assertEquals(3, broker.pending(RAW, GROUP).size());
    }

    @Test
    void shouldCountDriverWaitAgainstGracePeriod() throws Exception {
        processorConfig.setBlockMillis(5000);
        processorConfig.setGracePeriodMillis(300);
        scorer.hold();
        newProcessor(scorer).start();
        appendAlerts(1);
        await(() -> scorer.active() == 1, 5000);
        // driver is now parked in a long blocking read with three free workers
        Thread.sleep(100);

        long started = System.currentTimeMillis();
        processor.stop();
        long elapsed = System.currentTimeMillis() - started;

        assertEquals(ProcessorState.STOPPED, processor.state());
        assertTrue(elapsed < 1500, "stop took " + elapsed + " ms");
        assertTrue(broker.acks().isEmpty());
    }

    @Test
    void shouldTolerateConcurrentAndRepeatedStop() throws Exception {
        newProcessor(scorer).start();
        appendAlerts(5);

        Thread first = new Thread(processor::stop);
        Thread second = new Thread(processor::stop);
        first.start();
        second.start();
        first.join(5000);
        second.join(5000);
        processor.stop();

        assertFalse(first.isAlive());
        assertFalse(second.isAlive());
        assertEquals(ProcessorState.STOPPED, processor.state());
        assertEquals(broker.acks().size(), broker.entries(PROCESSED).size());
    }

    @Test
    void shouldIgnoreStopBeforeStart() {
        newProcessor(scorer).stop();

        assertEquals(ProcessorState.STOPPED, processor.state());
        assertFalse(broker.isClosed());
    }

    @Test
    void shouldRefuseToRestart() {
        newProcessor(scorer).start();
        processor.stop();

        assertThrows(IllegalStateException.class, processor::start);
    }

    @Test
    void shouldFailStartWhenGroupCannotBeCreated() {
        broker.failEnsureGroup(true);
        newProcessor(scorer);

        assertThrows(BrokerUnavailableException.class, processor::start);
        assertEquals(ProcessorState.STOPPED, processor.state());
        assertTrue(processor.lastFailure().isPresent());
        assertTrue(broker.isClosed());
    }

    @Test
    void shouldStopItselfAfterRepeatedReadFailures() throws Exception {
        newProcessor(scorer).start();
        broker.failReads(true);

        await(() -> processor.state() == ProcessorState.STOPPED, 5000);

        assertTrue(processor.lastFailure().isPresent());
        assertTrue(processor.lastFailure().get() instanceof BrokerUnavailableException);
        assertTrue(broker.isClosed());
    }

    @Test
    void shouldCreateConsumerGroupAndUseUniqueConsumerName() {
        AlertProcessor one = newProcessor(scorer);
        AlertProcessor two = new AlertProcessor(new InMemoryStreamBroker(), null, streamConfig, processorConfig,
                Clock.systemUTC());

        one.start();

        assertTrue(broker.hasGroup(RAW, GROUP));
        assertTrue(one.consumerName().matches("processor_\\d+_[0-9a-f]{4}"));
        assertNotEquals(one.consumerName(), two.consumerName());
    }
}
