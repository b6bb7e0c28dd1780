package com.influxlog.exception;

/**
 * A time bound carries no offset or zone information.
 */
public class TimestampValidationException extends LogQueryException {

    public TimestampValidationException(String message) {
        super(message);
    }

    public TimestampValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
