package com.sentinelids.pipeline.processor;

import com.sentinelids.pipeline.config.ProcessorConfig;
import com.sentinelids.pipeline.config.StreamConfig;
import com.sentinelids.pipeline.stream.StreamBrokerClient;
import com.sentinelids.pipeline.stream.StreamMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consume-enrich-persist-republish orchestrator.
 *
 * <p>
 * One driver thread reads batches from the raw stream through the consumer
 * group and hands each message to a fixed pool of workers, which run
 * {@link AlertEnricher#process(WorkerTask)} independently. A semaphore with
 * one permit per worker is taken before each hand-off and returned when the
 * unit ends, so at most {@code workerPoolSize} units run at once whatever the
 * batch size. When every worker is busy the driver stops reading, which is
 * the pipeline's only backpressure.
 * </p>
 *
 * <p>
 * Lifecycle: {@code STOPPED -> RUNNING -> DRAINING -> STOPPED}. {@link #stop()}
 * stops admission immediately, lets in-flight units finish within the grace
 * period, interrupts whatever is still running and closes the broker client.
 * Messages read but not handed off, and units abandoned at the deadline, stay
 * unacknowledged and are reclaimed by a later read.
 * </p>
 *
 * <p>
 * A processor is single-use: once stopped its broker client is closed and it
 * cannot be started again.
 * </p>
 *
 * @author Naveed Gung
 */
public class AlertProcessor {

    private static final Logger log = LoggerFactory.getLogger(AlertProcessor.class);

    /** Poll interval while waiting for a free worker. */
    private static final long SLOT_POLL_MS = 50;

    private final StreamBrokerClient broker;
    private final AlertEnricher enricher;
    private final Clock clock;

    private final String rawStream;
    private final String group;
    private final String consumerName;
    private final int workerPoolSize;
    private final int batchSize;
    private final long blockMillis;
    private final long idlePauseMillis;
    private final long gracePeriodMillis;
    private final long readFailureBackoffMillis;
    private final int maxConsecutiveReadFailures;

    private final AtomicReference<ProcessorState> state = new AtomicReference<>(ProcessorState.STOPPED);
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Semaphore workerSlots;
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile boolean admitting;
    private volatile boolean used;
    private volatile ExecutorService workers;
    private volatile Thread driver;
    private volatile Throwable lastFailure;

    public AlertProcessor(
            StreamBrokerClient broker,
            AlertEnricher enricher,
            StreamConfig streamConfig,
            ProcessorConfig processorConfig,
            Clock clock) {
        this.broker = broker;
        this.enricher = enricher;
        this.clock = clock;
        this.rawStream = streamConfig.getRawStream();
        this.group = streamConfig.getGroup();
        this.workerPoolSize = processorConfig.getWorkerPoolSize();
        this.batchSize = processorConfig.getBatchSize();
        this.blockMillis = processorConfig.getBlockMillis();
        this.idlePauseMillis = processorConfig.getIdlePauseMillis();
        this.gracePeriodMillis = processorConfig.getGracePeriodMillis();
        this.readFailureBackoffMillis = processorConfig.getReadFailureBackoffMillis();
        this.maxConsecutiveReadFailures = processorConfig.getMaxConsecutiveReadFailures();
        this.workerSlots = new Semaphore(workerPoolSize);
        // unique per instance so two processors never share pending entries
        this.consumerName = String.format("processor_%d_%04x",
                clock.millis(), ThreadLocalRandom.current().nextInt(0x10000));
    }

    /**
     * Ensure the consumer group exists, start the worker pool and the driver
     * loop.
     *
     * @throws com.sentinelids.pipeline.stream.BrokerUnavailableException if the
     *         group cannot be created; the processor stays stopped
     * @throws IllegalStateException if the processor was already stopped once
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (state.get() != ProcessorState.STOPPED) {
                log.warn("Alert processor {} already {}", consumerName, state.get());
                return;
            }
            if (used) {
                throw new IllegalStateException("Alert processor " + consumerName + " was stopped and cannot restart");
            }
            used = true;

            try {
                broker.ensureGroup(rawStream, group);
            } catch (RuntimeException e) {
                lastFailure = e;
                log.error("Cannot start alert processor {}: consumer group {} on {} unavailable: {}",
                        consumerName, group, rawStream, e.getMessage());
                broker.close();
                throw e;
            }

            AtomicInteger workerIds = new AtomicInteger();
            workers = new ThreadPoolExecutor(
                    workerPoolSize, workerPoolSize, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(),
                    r -> {
                        Thread t = new Thread(r, "alert-worker-" + workerIds.incrementAndGet());
                        t.setDaemon(true);
                        return t;
                    });

            admitting = true;
            state.set(ProcessorState.RUNNING);
            driver = new Thread(this::runLoop, "alert-processor-driver");
            driver.setDaemon(true);
            driver.start();

            log.info("Alert processor started: consumer={} group={} stream={} workers={} batch={} block={}ms",
                    consumerName, group, rawStream, workerPoolSize, batchSize, blockMillis);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Drain and stop. Idempotent, and safe to call from any thread while the
     * loop is running. Returns once the processor is {@link ProcessorState#STOPPED}.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            stopLocked();
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void stopLocked() {
        if (state.get() != ProcessorState.RUNNING) {
            return;
        }
        state.set(ProcessorState.DRAINING);
        admitting = false;
        log.info("Alert processor {} draining: {} units in flight, grace period {} ms",
                consumerName, inFlight.get(), gracePeriodMillis);

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(gracePeriodMillis);
        try {
            awaitDriver(deadline);
            awaitWorkers(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining alert processor {}, abandoning in-flight units", consumerName);
            workers.shutdownNow();
        } finally {
            broker.close();
            state.set(ProcessorState.STOPPED);
            log.info("Alert processor {} stopped", consumerName);
        }
    }

    /**
     * The driver leaves its blocking read within {@code blockMillis}; it is
     * interrupted if that would overrun the grace deadline.
     */
    private void awaitDriver(long deadline) throws InterruptedException {
        Thread loop = driver;
        if (loop == null || loop == Thread.currentThread()) {
            return;
        }
        loop.join(Math.max(1, Math.min(blockMillis + 2000, remainingMillis(deadline))));
        if (loop.isAlive()) {
            log.warn("Driver thread did not leave its read in time, interrupting it");
            loop.interrupt();
            loop.join(Math.max(1, Math.min(1000, remainingMillis(deadline))));
        }
    }

    private void awaitWorkers(long deadline) throws InterruptedException {
        workers.shutdown();
        if (workers.awaitTermination(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
            log.info("All in-flight units of {} completed", consumerName);
            return;
        }
        int running = inFlight.get();
        List<Runnable> neverStarted = workers.shutdownNow();
        inFlight.addAndGet(-neverStarted.size());
        log.warn("Grace period of {} ms elapsed, abandoning {} running units; their messages stay pending",
                gracePeriodMillis, running);
    }

    private static long remainingMillis(long deadline) {
        return TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
    }

    /** Driver loop: runs until admission stops or reads keep failing. */
    private void runLoop() {
        int consecutiveFailures = 0;
        boolean fatal = false;
        try {
            while (admitting) {
                int free = awaitFreeSlots();
                if (!admitting) {
                    break;
                }

                List<StreamMessage> batch;
                try {
                    batch = broker.readBatch(rawStream, group, consumerName, Math.min(batchSize, free), blockMillis);
                    consecutiveFailures = 0;
                } catch (RuntimeException e) {
                    if (!admitting) {
                        break;
                    }
                    lastFailure = e;
                    consecutiveFailures++;
                    if (consecutiveFailures >= maxConsecutiveReadFailures) {
                        log.error("Giving up after {} consecutive read failures on {}: {}",
                                consecutiveFailures, rawStream, e.getMessage(), e);
                        fatal = true;
                        break;
                    }
                    log.warn("Read from {} failed ({} of {}), retrying in {} ms: {}",
                            rawStream, consecutiveFailures, maxConsecutiveReadFailures,
                            readFailureBackoffMillis, e.getMessage());
                    pause(readFailureBackoffMillis);
                    continue;
                }

                if (batch.isEmpty()) {
                    pause(idlePauseMillis);
                    continue;
                }
                log.debug("Read {} alerts from {}", batch.size(), rawStream);
                dispatch(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Driver of {} interrupted", consumerName);
        } catch (RuntimeException e) {
            lastFailure = e;
            fatal = true;
            log.error("Driver loop of {} failed", consumerName, e);
        }

        if (fatal && lifecycleLock.tryLock()) {
            // nobody else is stopping; surface the failure by stopping ourselves
            try {
                stopLocked();
            } finally {
                lifecycleLock.unlock();
            }
        }
    }

    /** Block until at least one worker is free; return how many are. */
    private int awaitFreeSlots() throws InterruptedException {
        while (admitting) {
            if (workerSlots.tryAcquire(SLOT_POLL_MS, TimeUnit.MILLISECONDS)) {
                workerSlots.release();
                return Math.max(1, workerSlots.availablePermits());
            }
        }
        return 0;
    }

    private void dispatch(List<StreamMessage> batch) throws InterruptedException {
        for (int i = 0; i < batch.size(); i++) {
            StreamMessage message = batch.get(i);
            if (!acquireSlot()) {
                log.info("Shutdown during dispatch, leaving {} read messages pending", batch.size() - i);
                return;
            }
            inFlight.incrementAndGet();
            try {
                workers.execute(() -> runUnit(message));
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                workerSlots.release();
                log.info("Worker pool closed, leaving {} read messages pending", batch.size() - i);
                return;
            }
        }
    }

    private boolean acquireSlot() throws InterruptedException {
        while (admitting) {
            if (workerSlots.tryAcquire(SLOT_POLL_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private void runUnit(StreamMessage message) {
        try {
            enricher.process(new WorkerTask(message, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Worker failed on alert {}", message.id(), e);
        } finally {
            inFlight.decrementAndGet();
            workerSlots.release();
        }
    }

    private void pause(long millis) throws InterruptedException {
        if (millis > 0 && admitting) {
            Thread.sleep(millis);
        }
    }

    public ProcessorState state() {
        return state.get();
    }

    /** Units currently being processed by workers. */
    public int inFlight() {
        return Math.max(0, inFlight.get());
    }

    public String consumerName() {
        return consumerName;
    }

    /** The most recent read or startup failure, if any. */
    public Optional<Throwable> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }
}
