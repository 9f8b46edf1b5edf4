package com.example.entitystore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "entity-store")
@Data
public class AppConfig {
    private QueryConfig query = new QueryConfig();
    private HealthConfig health = new HealthConfig();

    /**
     * Size and depth bounds applied to the list endpoint's query parameters
     * before any of them reaches SQL.
     */
    @Data
    public static class QueryConfig {
        private int maxPathLength = 100;
        private int maxPathDepth = 5; // counted in dots, not segments
        private int maxValueLength = 1000;
        private int maxContainsLength = 5000;
        private int maxSkip = 10000;
        private int maxLimit = 1000;
    }

    @Data
    public static class HealthConfig {
        private Duration timeout = Duration.ofSeconds(2);
    }
}
