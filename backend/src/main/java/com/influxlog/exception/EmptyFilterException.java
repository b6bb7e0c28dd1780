package com.influxlog.exception;

public class EmptyFilterException extends LogQueryException {

    public EmptyFilterException(String message) {
        super(message);
    }
}
