package com.influxlog.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import com.influxdb.client.WriteApiBlocking;
import com.influxdb.exceptions.InfluxException;

/**
 * Logback appender that stores every event as a point through the blocking write API.
 * Failed writes are reported to Logback's status manager.
 */
public class InfluxLogAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    private static final String[] IGNORED_LOGGER_PREFIXES = {"com.influxdb.", "okhttp3."};

    private final WriteApiBlocking writeApi;
    private final LogPointMapper pointMapper;
    private final String bucket;
    private final String org;

    public InfluxLogAppender(WriteApiBlocking writeApi, LogPointMapper pointMapper, String bucket, String org) {
        this.writeApi = writeApi;
        this.pointMapper = pointMapper;
        this.bucket = bucket;
        this.org = org;
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (isClientLogger(event.getLoggerName())) {
            return;
        }
        try {
            writeApi.writePoint(bucket, org, pointMapper.toPoint(event));
        } catch (InfluxException e) {
            addError("Failed to write log event to bucket " + bucket, e);
        }
    }

    // the client's own logging would otherwise feed back into this appender
    static boolean isClientLogger(String loggerName) {
        if (loggerName == null) {
            return false;
        }
        for (String prefix : IGNORED_LOGGER_PREFIXES) {
            if (loggerName.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
