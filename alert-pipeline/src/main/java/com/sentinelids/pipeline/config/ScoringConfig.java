package com.sentinelids.pipeline.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the scoring capability.
 *
 * <p>
 * {@code mode=local} scores in-process with a fixed-weight logistic model;
 * {@code mode=remote} calls a model server over HTTP.
 * </p>
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "sentinel.scoring")
public class ScoringConfig {

    @NotBlank
    private String mode = "local";
    private Remote remote = new Remote();
    private Local local = new Local();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Remote getRemote() {
        return remote;
    }

    public void setRemote(Remote remote) {
        this.remote = remote;
    }

    public Local getLocal() {
        return local;
    }

    public void setLocal(Local local) {
        this.local = local;
    }

    public static class Remote {
        @NotBlank
        private String baseUrl = "http://localhost:8501";
        @NotBlank
        private String predictPath = "/predict";
        @Min(50)
        private int timeoutMs = 2000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPredictPath() {
            return predictPath;
        }

        public void setPredictPath(String predictPath) {
            this.predictPath = predictPath;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Local {
        /** One weight per feature; empty means the built-in weights. */
        private List<Double> weights = new ArrayList<>();
        private double bias = -2.0;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold = 0.5;

        public List<Double> getWeights() {
            return weights;
        }

        public void setWeights(List<Double> weights) {
            this.weights = weights;
        }

        public double getBias() {
            return bias;
        }

        public void setBias(double bias) {
            this.bias = bias;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }
    }
}
