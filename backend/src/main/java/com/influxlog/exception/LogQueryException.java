package com.influxlog.exception;

/**
 * Base of the errors raised while building a log query, before anything is sent to InfluxDB.
 */
public class LogQueryException extends RuntimeException {

    public LogQueryException(String message) {
        super(message);
    }

    public LogQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
