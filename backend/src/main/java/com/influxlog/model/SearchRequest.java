package com.influxlog.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of {@code POST /api/logs/search}. Either {@code limit} (most recent entries) or
 * {@code start} (time window, ISO-8601 with offset) selects the query kind; sending
 * {@code limit} together with {@code start} or {@code end} is rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @Positive
    private Integer limit;

    private String start;

    private String end;

    private Map<String, String> tags;

    @Valid
    private FilterSpec filter;
}
