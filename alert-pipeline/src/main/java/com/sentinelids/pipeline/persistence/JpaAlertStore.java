package com.sentinelids.pipeline.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelids.pipeline.alert.AlertSource;
import com.sentinelids.pipeline.alert.EnrichedAlert;
import com.sentinelids.pipeline.alert.RawAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * {@link AlertStore} on Spring Data JPA.
 *
 * <p>
 * Each save runs in its own bounded transaction. Lookup by source message id
 * makes redelivered messages resolve to the row stored on the first attempt.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class JpaAlertStore implements AlertStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAlertStore.class);

    private static final TypeReference<List<Double>> VECTOR = new TypeReference<>() {
    };

    private final AlertRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public JpaAlertStore(
            AlertRepository repository,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper,
            @Value("${sentinel.persistence.transaction-timeout-seconds:5}") int transactionTimeoutSeconds) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(transactionTimeoutSeconds);
    }

    @Override
    public long save(EnrichedAlert alert) {
        if (alert.sourceMessageId() == null) {
            throw new DurabilityException("Enriched alert has no source message id");
        }
        String vector = writeVector(alert);
        try {
            Long id = transactionTemplate.execute(status -> repository.findBySourceMessageId(alert.sourceMessageId())
                    .map(existing -> {
                        log.info("Alert for message {} already stored as {}", alert.sourceMessageId(), existing.getId());
                        return existing.getId();
                    })
                    .orElseGet(() -> repository.save(toEntity(alert, vector)).getId()));
            if (id == null) {
                throw new DurabilityException("No id assigned to alert for message " + alert.sourceMessageId());
            }
            return id;
        } catch (DataAccessException | TransactionException e) {
            throw new DurabilityException("Failed to persist alert for message " + alert.sourceMessageId()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<EnrichedAlert> findRecent(int limit) {
        try {
            return repository.findAllByOrderByProcessedAtDesc(PageRequest.of(0, Math.max(1, limit)))
                    .stream()
                    .map(this::toEnrichedAlert)
                    .toList();
        } catch (DataAccessException e) {
            throw new DurabilityException("Failed to load recent alerts: " + e.getMessage(), e);
        }
    }

    private String writeVector(EnrichedAlert alert) {
        try {
            return objectMapper.writeValueAsString(alert.featureVector());
        } catch (JsonProcessingException e) {
            throw new DurabilityException("Cannot serialize feature vector: " + e.getOriginalMessage(), e);
        }
    }

    private static AlertEntity toEntity(EnrichedAlert enriched, String vector) {
        RawAlert alert = enriched.alert();
        AlertEntity entity = new AlertEntity();
        entity.setSourceMessageId(enriched.sourceMessageId());
        entity.setSourceIp(alert.sourceIp());
        entity.setDestinationIp(alert.destinationIp());
        entity.setSourcePort(alert.sourcePort());
        entity.setDestinationPort(alert.destinationPort());
        entity.setProtocol(alert.protocol());
        entity.setAlertMessage(alert.message());
        entity.setSensorRuleId(alert.sensorRuleId());
        entity.setSource(alert.source() != null ? alert.source().getWireValue() : null);
        entity.setEventTimestamp(alert.timestamp());
        entity.setLabel(enriched.label());
        entity.setConfidence(enriched.confidence());
        entity.setFeatureVector(vector);
        entity.setProcessedAt(enriched.processedAt());
        return entity;
    }

    private EnrichedAlert toEnrichedAlert(AlertEntity entity) {
        List<Double> vector;
        try {
            vector = objectMapper.readValue(entity.getFeatureVector(), VECTOR);
        } catch (JsonProcessingException e) {
            log.warn("Stored feature vector of alert {} is unreadable: {}", entity.getId(), e.getOriginalMessage());
            vector = List.of();
        }
        RawAlert alert = new RawAlert(
                entity.getSourceIp(),
                entity.getDestinationIp(),
                entity.getSourcePort(),
                entity.getDestinationPort(),
                entity.getProtocol(),
                entity.getAlertMessage(),
                entity.getSensorRuleId(),
                entity.getEventTimestamp(),
                entity.getSource() != null ? AlertSource.fromWireValue(entity.getSource()) : null,
                null);
        return new EnrichedAlert(alert, entity.getLabel(), entity.getConfidence(), vector,
                entity.getProcessedAt(), entity.getSourceMessageId());
    }
}
