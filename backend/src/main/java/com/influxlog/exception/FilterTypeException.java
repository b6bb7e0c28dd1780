package com.influxlog.exception;

/**
 * A filter child is neither a tag mapping nor a nested filter expression, or an
 * expression has no operator.
 */
public class FilterTypeException extends LogQueryException {

    public FilterTypeException(String message) {
        super(message);
    }
}
