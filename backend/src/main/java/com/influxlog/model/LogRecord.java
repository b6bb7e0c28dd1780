package com.influxlog.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Log entry read back from InfluxDB. {@code tags} holds every tag of the point other than
 * {@code level}; InfluxDB stores all tag values as strings.
 */
@Value
@Builder
public class LogRecord {

    OffsetDateTime time;

    String level;

    String message;

    @Builder.Default
    Map<String, String> tags = Map.of();

    public String tag(String key) {
        return tags.get(key);
    }
}
