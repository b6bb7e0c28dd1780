package com.influxlog.service;

import com.influxdb.client.QueryApi;
import com.influxlog.config.InfluxProperties;
import com.influxlog.exception.TimestampValidationException;
import com.influxlog.filter.FilterExpression;
import com.influxlog.filter.Operator;
import com.influxlog.filter.TagConstraint;
import com.influxlog.model.LogRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads log records back from InfluxDB.
 *
 * <p>Every method returns a lazy stream over the HTTP response. The stream must be closed
 * (try-with-resources) to release the connection when it is not fully consumed. Errors
 * reported by InfluxDB, including those hit in the middle of the response, surface as
 * {@link com.influxdb.exceptions.InfluxException} from the stream.
 *
 * <p>Tag constraints given as a map are ANDed together; when an explicit
 * {@link FilterExpression} is given too, both are ANDed as siblings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogQueryService {

    private final QueryApi queryApi;
    private final InfluxProperties properties;
    private final FluxQueryBuilder queryBuilder;
    private final LogRecordMapper recordMapper;
    private final Clock clock;

    public Stream<LogRecord> fetchRecent(int limit) {
        return fetchRecent(limit, Map.of(), null);
    }

    public Stream<LogRecord> fetchRecent(int limit, Map<String, String> tags) {
        return fetchRecent(limit, tags, null);
    }

    /**
     * The {@code limit} most recent matching records, oldest first.
     *
     * @param filter may be {@code null}
     */
    public Stream<LogRecord> fetchRecent(int limit, Map<String, String> tags, FilterExpression filter) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        String flux = queryBuilder.recent(properties.getBucket(), properties.getMeasurement(), limit,
                combine(tags, filter));
        return execute(flux);
    }

    public Stream<LogRecord> fetchByTime(TemporalAccessor start) {
        return fetchByTime(start, null, Map.of(), null);
    }

    public Stream<LogRecord> fetchByTime(TemporalAccessor start, TemporalAccessor end) {
        return fetchByTime(start, end, Map.of(), null);
    }

    public Stream<LogRecord> fetchByTime(TemporalAccessor start, TemporalAccessor end, Map<String, String> tags) {
        return fetchByTime(start, end, tags, null);
    }

    /**
     * Records with {@code start <= time < end}, oldest first. The upper bound is exclusive,
     * following Flux {@code range()}.
     *
     * @param start an {@link Instant} or a date-time carrying an offset or zone
     * @param end   same as {@code start}, or {@code null} for now
     * @param filter may be {@code null}
     * @throws TimestampValidationException if a bound has no offset or zone
     */
    public Stream<LogRecord> fetchByTime(TemporalAccessor start, TemporalAccessor end,
                                         Map<String, String> tags, FilterExpression filter) {
        if (start == null) {
            throw new TimestampValidationException("start is required");
        }
        Instant from = toInstant(start, "start");
        Instant to = end == null ? clock.instant() : toInstant(end, "end");
        String flux = queryBuilder.range(properties.getBucket(), properties.getMeasurement(), from, to,
                combine(tags, filter));

        // range() rejects empty windows, they simply match nothing
        if (!from.isBefore(to)) {
            log.debug("Empty time window [{}, {}), skipping query", from, to);
            return Stream.empty();
        }
        return execute(flux);
    }

    public Stream<LogRecord> query(String flux) {
        return execute(flux);
    }

    /**
     * Runs a pipeline against the configured bucket; {@code from(bucket: ...)} is prepended
     * unless the text already starts with a source.
     */
    public Stream<LogRecord> queryBucket(String pipeline) {
        return execute(queryBuilder.withSource(properties.getBucket(), pipeline));
    }

    static FilterExpression combine(Map<String, String> tags, FilterExpression filter) {
        boolean hasTags = tags != null && !tags.isEmpty();
        if (!hasTags) {
            return filter;
        }
        if (filter == null) {
            return FilterExpression.of(Operator.AND, TagConstraint.of(tags));
        }
        return FilterExpression.of(Operator.AND, List.of(TagConstraint.of(tags), filter));
    }

    private Stream<LogRecord> execute(String flux) {
        log.debug("Executing Flux query:\n{}", flux);
        return FluxRecordStream.open(queryApi, flux, properties.getOrg())
                .map(recordMapper::toLogRecord);
    }

    private static Instant toInstant(TemporalAccessor value, String name) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value.query(TemporalQueries.zone()) == null) {
            throw new TimestampValidationException(name + " must be timezone aware, got " + value);
        }
        try {
            return Instant.from(value);
        } catch (DateTimeException e) {
            throw new TimestampValidationException(name + " is not a point in time: " + value, e);
        }
    }
}
