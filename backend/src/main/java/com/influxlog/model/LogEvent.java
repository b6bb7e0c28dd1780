package com.influxlog.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Log line pushed by another service to the collector. Every entry of {@code tags} becomes
 * an extra tag on the stored point.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogEvent {

    @NotNull
    private Instant timestamp;

    @NotBlank
    private String level;

    @NotBlank
    private String service;

    private String host;

    private String logger;

    private String message;

    private Map<String, String> tags;
}
