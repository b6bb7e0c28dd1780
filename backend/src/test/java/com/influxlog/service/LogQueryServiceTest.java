package com.influxlog.service;

import com.influxdb.Cancellable;
import com.influxdb.client.QueryApi;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;
import com.influxlog.config.InfluxProperties;
import com.influxlog.exception.FilterTypeException;
import com.influxlog.exception.TimestampValidationException;
import com.influxlog.filter.FilterExpression;
import com.influxlog.filter.Operator;
import com.influxlog.model.LogRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static com.influxlog.service.FluxRows.replay;
import static com.influxlog.service.FluxRows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class LogQueryServiceTest {

    private static final String ORG = "testing";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock private QueryApi queryApi;
    @Mock private Cancellable cancellable;

    private LogQueryService service;

    @BeforeEach
    void setUp() {
        InfluxProperties properties = new InfluxProperties();
        properties.setOrg(ORG);
        properties.setBucket("logs");
        properties.setMeasurement("logging");
        service = new LogQueryService(queryApi, properties, new FluxQueryBuilder(), new LogRecordMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private List<FluxRecord> threeLevels() {
        return List.of(
                row(NOW.minusSeconds(3), "DEBUG", "test1."),
                row(NOW.minusSeconds(2), "INFO", "test2."),
                row(NOW.minusSeconds(1), "ERROR", "test3."));
    }

    @SuppressWarnings("unchecked")
    private void respondWith(Answer<Void> answer) {
        doAnswer(answer).when(queryApi)
                .query(anyString(), eq(ORG), any(BiConsumer.class), any(Consumer.class), any(Runnable.class));
    }

    private void respondWith(List<FluxRecord> rows) {
        respondWith(replay(cancellable, rows));
    }

    @SuppressWarnings("unchecked")
    private String executedQuery() {
        ArgumentCaptor<String> flux = ArgumentCaptor.forClass(String.class);
        verify(queryApi).query(flux.capture(), eq(ORG), any(BiConsumer.class), any(Consumer.class), any(Runnable.class));
        return flux.getValue();
    }

    @Test
    void fetchRecent_keepsAscendingOrderOfRows() {
        List<FluxRecord> rows = threeLevels();
        respondWith(rows);

        List<LogRecord> records;
        try (Stream<LogRecord> stream = service.fetchRecent(3)) {
            records = stream.toList();
        }

        assertThat(records).extracting(LogRecord::getLevel).containsExactly("DEBUG", "INFO", "ERROR");
        assertThat(records).extracting(LogRecord::getMessage).containsExactly("test1.", "test2.", "test3.");
        assertThat(executedQuery())
                .contains("|> limit(n: 3)")
                .endsWith("|> sort(columns: [\"_time\"])");
    }

    @Test
    void fetchRecent_rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> service.fetchRecent(0)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(queryApi);
    }

    @Test
    void fetchRecent_andsAdHocTags() {
        respondWith(List.of());
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("building", "b-1");
        tags.put("level", "INFO");

        service.fetchRecent(30, tags).close();

        assertThat(executedQuery())
                .contains("|> filter(fn: (r) => r[\"building\"] == \"b-1\" and r[\"level\"] == \"INFO\")");
    }

    @Test
    void fetchRecent_combinesAdHocTagsWithExplicitFilter() {
        respondWith(List.of());
        FilterExpression filter = FilterExpression.of(Operator.OR, List.of(Map.of("trait", "t-1"), Map.of("trait", "t-2")));

        service.fetchRecent(30, Map.of("building", "b-1"), filter).close();

        assertThat(executedQuery()).contains(
                "|> filter(fn: (r) => r[\"building\"] == \"b-1\" and (r[\"trait\"] == \"t-1\" or r[\"trait\"] == \"t-2\"))");
    }

    @Test
    void fetchRecent_usesExplicitFilterAlone() {
        respondWith(List.of());

        service.fetchRecent(30, Map.of(), FilterExpression.of(Operator.AND, Map.of("building", "b-1"))).close();

        assertThat(executedQuery()).contains("|> filter(fn: (r) => r[\"building\"] == \"b-1\")");
    }

    @Test
    void fetchRecent_badFilterFailsBeforeQuerying() {
        FilterExpression filter = FilterExpression.of(Operator.AND, "not a mapping");

        assertThatThrownBy(() -> service.fetchRecent(5, Map.of(), filter)).isInstanceOf(FilterTypeException.class);
        verifyNoInteractions(queryApi);
    }

    @Test
    void fetchByTime_rejectsNaiveStartBeforeQuerying() {
        LocalDateTime naive = LocalDateTime.of(2024, 6, 1, 11, 0);

        assertThatThrownBy(() -> service.fetchByTime(naive)).isInstanceOf(TimestampValidationException.class);
        verifyNoInteractions(queryApi);
    }

    @Test
    void fetchByTime_rejectsNaiveEndBeforeQuerying() {
        OffsetDateTime start = OffsetDateTime.of(2024, 6, 1, 11, 0, 0, 0, ZoneOffset.UTC);

        assertThatThrownBy(() -> service.fetchByTime(start, LocalDateTime.of(2024, 6, 1, 11, 30)))
                .isInstanceOf(TimestampValidationException.class)
                .hasMessageContaining("end");
        verifyNoInteractions(queryApi);
    }

    @Test
    void fetchByTime_rejectsMissingStart() {
        assertThatThrownBy(() -> service.fetchByTime(null)).isInstanceOf(TimestampValidationException.class);
        verifyNoInteractions(queryApi);
    }

    @Test
    void fetchByTime_defaultsEndToNow() {
        respondWith(List.of());

        service.fetchByTime(NOW.minusSeconds(60)).close();

        assertThat(executedQuery())
                .contains("|> range(start: 2024-06-01T11:59:00Z, stop: 2024-06-01T12:00:00Z)")
                .doesNotContain("limit");
    }

    @Test
    void fetchByTime_convertsZonedBoundsToUtc() {
        respondWith(List.of());
        ZonedDateTime start = ZonedDateTime.of(2024, 6, 1, 13, 0, 0, 0, ZoneId.of("Europe/Helsinki"));
        OffsetDateTime end = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.ofHours(1));

        service.fetchByTime(start, end, Map.of("level", "INFO")).close();

        assertThat(executedQuery())
                .contains("|> range(start: 2024-06-01T10:00:00Z, stop: 2024-06-01T11:00:00Z)")
                .contains("|> filter(fn: (r) => r[\"level\"] == \"INFO\")");
    }

    @Test
    void fetchByTime_emptyWindowYieldsNoRecords() {
        Instant start = NOW.minusSeconds(2);
        Instant end = NOW.minusSeconds(10);

        try (Stream<LogRecord> records = service.fetchByTime(start, end)) {
            assertThat(records).isEmpty();
        }
        verifyNoInteractions(queryApi);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchByTime_returnsSameRecordsWhenRepeated() {
        List<FluxRecord> rows = threeLevels();
        respondWith(rows);
        Instant start = NOW.minusSeconds(10);

        List<LogRecord> first;
        List<LogRecord> second;
        try (Stream<LogRecord> records = service.fetchByTime(start, NOW)) {
            first = records.toList();
        }
        try (Stream<LogRecord> records = service.fetchByTime(start, NOW)) {
            second = records.toList();
        }

        assertThat(second).isEqualTo(first).hasSize(3);
        verify(queryApi, times(2))
                .query(anyString(), eq(ORG), any(BiConsumer.class), any(Consumer.class), any(Runnable.class));
    }

    @Test
    void query_sendsTextVerbatim() {
        String flux = "from(bucket: \"other\")\n|> range(start: -1m)\n|> yield()";
        respondWith(List.of(row(NOW, "INFO", "raw")));

        try (Stream<LogRecord> records = service.query(flux)) {
            assertThat(records).extracting(LogRecord::getMessage).containsExactly("raw");
        }
        assertThat(executedQuery()).isEqualTo(flux);
    }

    @Test
    void queryBucket_prependsConfiguredBucket() {
        respondWith(List.of());

        service.queryBucket("|> range(start: -1m)\n|> yield()").close();

        assertThat(executedQuery()).isEqualTo("from(bucket: \"logs\")\n|> range(start: -1m)\n|> yield()");
    }

    @Test
    void closingTheResultEarlyCancelsTheRequest() {
        respondWith(threeLevels());

        try (Stream<LogRecord> records = service.fetchRecent(3)) {
            assertThat(records.findFirst()).isPresent();
        }

        verify(cancellable).cancel();
    }

    @Test
    void readingEveryRowLeavesTheFinishedRequestAlone() {
        respondWith(threeLevels());

        try (Stream<LogRecord> records = service.fetchRecent(3)) {
            assertThat(records.toList()).hasSize(3);
        }

        verify(cancellable, never()).cancel();
    }

    @Test
    void transportErrorMidStreamPropagates() {
        respondWith(replay(cancellable, List.of(row(NOW, "INFO", "first")), new InfluxException("connection reset")));

        try (Stream<LogRecord> records = service.fetchRecent(10)) {
            assertThatThrownBy(records::toList)
                    .isInstanceOf(InfluxException.class)
                    .hasMessageContaining("connection reset");
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void transportErrorOnExecutionPropagates() {
        doThrow(new InfluxException("unauthorized")).when(queryApi)
                .query(anyString(), eq(ORG), any(BiConsumer.class), any(Consumer.class), any(Runnable.class));

        assertThatThrownBy(() -> service.fetchRecent(10)).isInstanceOf(InfluxException.class);
    }
}
