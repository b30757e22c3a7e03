package com.sentinelids.pipeline.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Stream names and consumer-group settings.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentinel.stream")
public class StreamConfig {

    @NotBlank
    private String rawStream = "raw_alerts";
    @NotBlank
    private String processedStream = "processed_alerts";
    @NotBlank
    private String group = "alert_processors";
    /** Pending entries idle longer than this are reclaimed by the next read. */
    @Min(1000)
    private long pendingIdleMs = 60_000;
    /** Upper bound on entries inspected per reclaim pass. */
    @Min(1)
    private int reclaimScanLimit = 100;

    public String getRawStream() {
        return rawStream;
    }

    public void setRawStream(String rawStream) {
        this.rawStream = rawStream;
    }

    public String getProcessedStream() {
        return processedStream;
    }

    public void setProcessedStream(String processedStream) {
        this.processedStream = processedStream;
    }

    public String getGroup() {
        return group;
    }

    public void setGroup(String group) {
        this.group = group;
    }

    public long getPendingIdleMs() {
        return pendingIdleMs;
    }

    public void setPendingIdleMs(long pendingIdleMs) {
        this.pendingIdleMs = pendingIdleMs;
    }

    public int getReclaimScanLimit() {
        return reclaimScanLimit;
    }

    public void setReclaimScanLimit(int reclaimScanLimit) {
        this.reclaimScanLimit = reclaimScanLimit;
    }
}
