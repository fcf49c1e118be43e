package com.quarry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Quarry.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quarry")
public class QuarryProperties {

    private BackendConfig backend = new BackendConfig();
    private QueryConfig query = new QueryConfig();
    private SchemaCacheConfig schemaCache = new SchemaCacheConfig();

    @Data
    public static class BackendConfig {
        private String baseUrl = "http://localhost:5080";
        private Duration responseTimeout = Duration.ofSeconds(60);
        private int maxRetries = 0;

        /**
         * Backend error code to user-facing message overrides.
         */
        private Map<Integer, String> errorMessages = new HashMap<>();
    }

    @Data
    public static class QueryConfig {
        private String timestampColumn = "_timestamp";
        private String histogramTimestampColumn = "zo_sql_key";
        private String logVolumeRefIdPrefix = "log-volume-";
        private int sampleSize = 300;
        private Duration timeout = Duration.ofSeconds(120);
        private Duration histogramTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class SchemaCacheConfig {
        private int maxSize = 500;
        private Duration expireAfterWrite = Duration.ofMinutes(5);
    }
}
