package com.sentinelids.pipeline.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Row of the {@code alerts} table.
 *
 * @author Naveed Gung
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_source_message_id", columnList = "source_message_id", unique = true),
        @Index(name = "idx_alerts_source_ip", columnList = "source_ip"),
        @Index(name = "idx_alerts_destination_ip", columnList = "destination_ip"),
        @Index(name = "idx_alerts_processed_at", columnList = "processed_at")
})
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_message_id", length = 64, nullable = false, unique = true)
    private String sourceMessageId;

    @Column(name = "source_ip", columnDefinition = "text", nullable = false)
    private String sourceIp;

    @Column(name = "destination_ip", columnDefinition = "text", nullable = false)
    private String destinationIp;

    @Column(name = "source_port")
    private int sourcePort;

    @Column(name = "destination_port")
    private int destinationPort;

    @Column(name = "protocol", columnDefinition = "text")
    private String protocol;

    @Column(name = "alert_message", columnDefinition = "text")
    private String alertMessage;

    @Column(name = "snort_sid")
    private Long sensorRuleId;

    @Column(name = "source", length = 16)
    private String source;

    @Column(name = "event_timestamp")
    private Instant eventTimestamp;

    @Column(name = "ml_prediction", nullable = false)
    private int label;

    @Column(name = "ml_confidence", nullable = false)
    private double confidence;

    /** JSON array of the feature vector. */
    @Column(name = "feature_vector", columnDefinition = "text", nullable = false)
    private String featureVector;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getSourceMessageId() {
        return sourceMessageId;
    }

    public void setSourceMessageId(String sourceMessageId) {
        this.sourceMessageId = sourceMessageId;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public void setSourceIp(String sourceIp) {
        this.sourceIp = sourceIp;
    }

    public String getDestinationIp() {
        return destinationIp;
    }

    public void setDestinationIp(String destinationIp) {
        this.destinationIp = destinationIp;
    }

    public int getSourcePort() {
        return sourcePort;
    }

    public void setSourcePort(int sourcePort) {
        this.sourcePort = sourcePort;
    }

    public int getDestinationPort() {
        return destinationPort;
    }

    public void setDestinationPort(int destinationPort) {
        this.destinationPort = destinationPort;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public String getAlertMessage() {
        return alertMessage;
    }

    public void setAlertMessage(String alertMessage) {
        this.alertMessage = alertMessage;
    }

    public Long getSensorRuleId() {
        return sensorRuleId;
    }

    public void setSensorRuleId(Long sensorRuleId) {
        this.sensorRuleId = sensorRuleId;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Instant getEventTimestamp() {
        return eventTimestamp;
    }

    public void setEventTimestamp(Instant eventTimestamp) {
        this.eventTimestamp = eventTimestamp;
    }

    public int getLabel() {
        return label;
    }

    public void setLabel(int label) {
        this.label = label;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getFeatureVector() {
        return featureVector;
    }

    public void setFeatureVector(String featureVector) {
        this.featureVector = featureVector;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public void setProcessedAt(Instant processedAt) {
        this.processedAt = processedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
