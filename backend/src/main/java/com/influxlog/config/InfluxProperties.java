package com.influxlog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection and target settings for the InfluxDB 2 log store.
 */
@Data
@ConfigurationProperties(prefix = "influx")
public class InfluxProperties {

    private String url = "http://localhost:8086";

    private String token;

    private String org;

    private String bucket;

    private String measurement = "logging";

    private Appender appender = new Appender();

    @Data
    public static class Appender {

        /** Attach the InfluxDB appender to the root logger on startup. */
        private boolean enabled = false;

        /** Write the single-message layout tagged with bot and shard instead of per-field tags. */
        private boolean compact = false;

        private String bot;

        private String shardId;
    }
}
