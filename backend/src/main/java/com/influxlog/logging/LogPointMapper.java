package com.influxlog.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import com.influxdb.client.domain.WritePrecision;
import com.influxdb.client.write.Point;
import com.influxlog.config.InfluxProperties;
import com.influxlog.model.LogEvent;
import lombok.RequiredArgsConstructor;
import org.slf4j.event.KeyValuePair;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Turns log events into InfluxDB points: tags describe where the event came from, the
 * single {@code message} field carries the text. Points are written with microsecond
 * precision.
 */
@Component
@RequiredArgsConstructor
public class LogPointMapper {

    static final String MESSAGE_FIELD = "message";

    private static final DateTimeFormatter COMPACT_TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss,SSS")
            .withZone(ZoneOffset.UTC);

    private final InfluxProperties properties;

    /**
     * Maps a Logback event, using the compact layout when {@code influx.appender.compact}
     * is set. MDC entries and SLF4J key/value pairs become extra tags.
     */
    public Point toPoint(ILoggingEvent event) {
        Point point = properties.getAppender().isCompact() ? compactPoint(event) : standardPoint(event);

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null) {
            mdc.forEach((key, value) -> tag(point, key, value));
        }
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            pairs.forEach(pair -> tag(point, pair.key, pair.value));
        }
        return point.time(event.getInstant(), WritePrecision.US);
    }

    public Point toPoint(LogEvent event) {
        Point point = Point.measurement(properties.getMeasurement());
        tag(point, "level", event.getLevel());
        tag(point, "service", event.getService());
        tag(point, "host", event.getHost());
        tag(point, "logger", event.getLogger());
        if (event.getTags() != null) {
            event.getTags().forEach((key, value) -> tag(point, key, value));
        }
        return point
                .addField(MESSAGE_FIELD, event.getMessage() == null ? "" : event.getMessage())
                .time(event.getTimestamp(), WritePrecision.US);
    }

    private Point standardPoint(ILoggingEvent event) {
        Point point = Point.measurement(properties.getMeasurement())
                .addTag("logger", event.getLoggerName())
                .addTag("level", event.getLevel().toString())
                .addTag("level_number", Integer.toString(levelNumber(event.getLevel())));

        StackTraceElement[] callerData = event.getCallerData();
        if (callerData != null && callerData.length > 0) {
            StackTraceElement caller = callerData[0];
            tag(point, "filename", caller.getFileName());
            tag(point, "line_number", Integer.toString(caller.getLineNumber()));
            tag(point, "function_name", caller.getMethodName());
        }
        return point.addField(MESSAGE_FIELD, event.getFormattedMessage());
    }

    private Point compactPoint(ILoggingEvent event) {
        InfluxProperties.Appender appender = properties.getAppender();
        Point point = Point.measurement(properties.getMeasurement());
        tag(point, "bot", appender.getBot());
        tag(point, "shard_id", appender.getShardId());

        String message = compactMessage(event);
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            tag(point, "exception_type", simpleName(throwable.getClassName()));
            message = (message + "\n" + ThrowableProxyUtil.asString(throwable)).strip();
        }
        return point.addField(MESSAGE_FIELD, message);
    }

    static String compactMessage(ILoggingEvent event) {
        return String.format("[%s] [%-8s] %s: %s",
                COMPACT_TIMESTAMP.format(event.getInstant()),
                event.getLevel(),
                event.getLoggerName(),
                event.getFormattedMessage());
    }

    // conventional 10-step scale shared with other log shippers writing the same measurement
    static int levelNumber(Level level) {
        switch (level.toInt()) {
            case Level.TRACE_INT:
                return 5;
            case Level.DEBUG_INT:
                return 10;
            case Level.INFO_INT:
                return 20;
            case Level.WARN_INT:
                return 30;
            case Level.ERROR_INT:
                return 40;
            default:
                return 0;
        }
    }

    private static String simpleName(String className) {
        return className.substring(className.lastIndexOf('.') + 1);
    }

    private static void tag(Point point, String key, Object value) {
        if (key == null || value == null) {
            return;
        }
        String text = value.toString();
        if (!text.isEmpty()) {
            point.addTag(key, text);
        }
    }
}
