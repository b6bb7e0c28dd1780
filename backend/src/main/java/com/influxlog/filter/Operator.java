package com.influxlog.filter;

import java.util.Locale;

public enum Operator {

    AND("and"),
    OR("or");

    private final String keyword;

    Operator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    String delimiter() {
        return " " + keyword + " ";
    }

    public static Operator parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("operator must not be null");
        }
        return Operator.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
