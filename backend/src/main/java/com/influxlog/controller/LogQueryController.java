package com.influxlog.controller;

import com.influxlog.filter.FilterExpression;
import com.influxlog.model.LogRecord;
import com.influxlog.model.SearchRequest;
import com.influxlog.service.LogQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read side of the pipeline. Request parameters other than the reserved ones are treated as
 * tag constraints, e.g. {@code GET /api/logs/recent?limit=20&service=payment&level=ERROR}.
 */
@Slf4j
@RestController
@RequestMapping("/api/logs")
@RequiredArgsConstructor
public class LogQueryController {

    private static final Set<String> RESERVED_PARAMS = Set.of("limit", "start", "end");

    private final LogQueryService logQueryService;

    @GetMapping("/recent")
    public ResponseEntity<List<LogRecord>> recent(@RequestParam(defaultValue = "10") int limit,
                                                  @RequestParam Map<String, String> params) {
        Map<String, String> tags = tagParams(params);
        log.debug("Fetching recent logs: limit={}, tags={}", limit, tags);

        try (Stream<LogRecord> records = logQueryService.fetchRecent(limit, tags)) {
            return ResponseEntity.ok(records.toList());
        }
    }

    @GetMapping("/range")
    public ResponseEntity<List<LogRecord>> range(@RequestParam String start,
                                                 @RequestParam(required = false) String end,
                                                 @RequestParam Map<String, String> params) {
        Map<String, String> tags = tagParams(params);
        log.debug("Fetching logs by time: start={}, end={}, tags={}", start, end, tags);

        try (Stream<LogRecord> records = logQueryService.fetchByTime(
                parseTimestamp(start), end == null ? null : parseTimestamp(end), tags)) {
            return ResponseEntity.ok(records.toList());
        }
    }

    @PostMapping("/search")
    public ResponseEntity<List<LogRecord>> search(@Valid @RequestBody SearchRequest request) {
        FilterExpression filter = request.getFilter() == null ? null : request.getFilter().toExpression();
        Map<String, String> tags = request.getTags() == null ? Map.of() : request.getTags();

        if (request.getLimit() != null && (request.getStart() != null || request.getEnd() != null)) {
            throw new IllegalArgumentException("limit cannot be combined with start or end");
        }

        Stream<LogRecord> stream;
        if (request.getLimit() != null) {
            stream = logQueryService.fetchRecent(request.getLimit(), tags, filter);
        } else if (request.getStart() != null) {
            stream = logQueryService.fetchByTime(parseTimestamp(request.getStart()),
                    request.getEnd() == null ? null : parseTimestamp(request.getEnd()), tags, filter);
        } else {
            throw new IllegalArgumentException("either limit or start is required");
        }

        try (Stream<LogRecord> records = stream) {
            return ResponseEntity.ok(records.toList());
        }
    }

    /**
     * Parses ISO-8601 text, keeping values without an offset as {@link LocalDateTime} so the
     * service can reject them.
     */
    static TemporalAccessor parseTimestamp(String text) {
        return DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
    }

    private static Map<String, String> tagParams(Map<String, String> params) {
        Map<String, String> tags = new LinkedHashMap<>(params);
        tags.keySet().removeAll(RESERVED_PARAMS);
        return tags;
    }
}
