package com.sentinelids.pipeline.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Alert processor loop and worker pool settings.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentinel.processor")
public class ProcessorConfig {

    private boolean enabled = true;
    /** Fixed worker count; the only concurrency and backpressure control. */
    @Min(1)
    private int workerPoolSize = 4;
    @Min(1)
    private int batchSize = 10;
    @Min(0)
    private long blockMillis = 1000;
    @Min(0)
    private long idlePauseMillis = 100;
    @Min(0)
    private long gracePeriodMillis = 30_000;
    @Min(0)
    private long readFailureBackoffMillis = 1000;
    @Min(1)
    private int maxConsecutiveReadFailures = 30;
    /** Used when the scoring capability does not report a confidence. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultConfidence = 0.85;
    @Min(1)
    private long cacheTtlSeconds = 3600;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getBlockMillis() {
        return blockMillis;
    }

    public void setBlockMillis(long blockMillis) {
        this.blockMillis = blockMillis;
    }

    public long getIdlePauseMillis() {
        return idlePauseMillis;
    }

    public void setIdlePauseMillis(long idlePauseMillis) {
        this.idlePauseMillis = idlePauseMillis;
    }

    public long getGracePeriodMillis() {
        return gracePeriodMillis;
    }

    public void setGracePeriodMillis(long gracePeriodMillis) {
        this.gracePeriodMillis = gracePeriodMillis;
    }

    public long getReadFailureBackoffMillis() {
        return readFailureBackoffMillis;
    }

    public void setReadFailureBackoffMillis(long readFailureBackoffMillis) {
        this.readFailureBackoffMillis = readFailureBackoffMillis;
    }

    public int getMaxConsecutiveReadFailures() {
        return maxConsecutiveReadFailures;
    }

    public void setMaxConsecutiveReadFailures(int maxConsecutiveReadFailures) {
        this.maxConsecutiveReadFailures = maxConsecutiveReadFailures;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public void setDefaultConfidence(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public Duration getCacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }
}
