package com.sentinelids.pipeline.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelids.pipeline.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Scores feature vectors on a remote model server.
 *
 * <p>
 * Request: {@code POST {base-url}{predict-path}} with body
 * {@code {"features": [..28 numbers..]}}. Response: {@code {"prediction": 0|1,
 * "confidence": 0.93}}; {@code label} is accepted in place of
 * {@code prediction} and the confidence is optional.
 * </p>
 *
 * <p>
 * Workers call this synchronously; the reactive call is blocked on with the
 * configured timeout so each scoring call is bounded.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "sentinel.scoring", name = "mode", havingValue = "remote")
public class RemoteScoringClient implements ScoringCapability {

    private static final Logger log = LoggerFactory.getLogger(RemoteScoringClient.class);

    private final WebClient webClient;
    private final ScoringConfig.Remote config;
    private final ObjectMapper objectMapper;

    @Autowired
    public RemoteScoringClient(ScoringConfig scoringConfig, ObjectMapper objectMapper) {
        this(WebClient.builder(), scoringConfig.getRemote(), objectMapper);
    }

    RemoteScoringClient(WebClient.Builder builder, ScoringConfig.Remote config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.webClient = builder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
        log.info("Remote scoring client targeting {}{}", config.getBaseUrl(), config.getPredictPath());
    }

    @Override
    public Classification classify(double[] features) {
        String body;
        try {
            body = webClient.post()
                    .uri(config.getPredictPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("features", features))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(config.getTimeoutMs()))
                    .block();
        } catch (Exception e) {
            throw new ScoringException("Model server call failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new ScoringException("Model server returned an empty body");
        }
        return parseResponse(body);
    }

    Classification parseResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new ScoringException("Unparseable model server response: " + e.getMessage(), e);
        }
        JsonNode label = root.has("prediction") ? root.get("prediction") : root.get("label");
        if (label == null || !label.canConvertToInt()) {
            throw new ScoringException("Model server response has no integer prediction: " + body);
        }
        JsonNode confidence = root.get("confidence");
        if (confidence != null && confidence.isNumber()) {
            return new Classification(label.asInt(), confidence.asDouble());
        }
        return Classification.labelOnly(label.asInt());
    }
}
