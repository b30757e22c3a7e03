package com.sentinelids.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sentinel IDS alert pipeline.
 *
 * <p>
 * Spring Boot application that consumes raw intrusion alerts from the
 * {@code raw_alerts} Redis stream, scores each one through a bounded worker
 * pool, persists the enriched alert and republishes it on
 * {@code processed_alerts}.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineApplication.class, args);
    }
}
