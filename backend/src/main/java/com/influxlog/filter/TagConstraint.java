package com.influxlog.filter;

import com.influxlog.exception.EmptyFilterException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tag equality tests, e.g. {@code r["level"] == "INFO"}. The pairs are joined with the
 * operator of the enclosing expression, in insertion order.
 */
@ToString
@EqualsAndHashCode
public final class TagConstraint implements FilterNode {

    private final Map<String, String> tags;

    private TagConstraint(Map<String, String> tags) {
        this.tags = Collections.unmodifiableMap(tags);
    }

    public static TagConstraint of(Map<String, String> tags) {
        return new TagConstraint(tags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tags));
    }

    public static TagConstraint of(String key, String value) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(key, value);
        return new TagConstraint(tags);
    }

    static TagConstraint copyOf(Map<?, ?> raw) {
        Map<String, String> tags = new LinkedHashMap<>();
        raw.forEach((key, value) -> tags.put(String.valueOf(key), String.valueOf(value)));
        return new TagConstraint(tags);
    }

    public Map<String, String> tags() {
        return tags;
    }

    @Override
    public String toPredicate(Operator enclosing) {
        if (tags.isEmpty()) {
            throw new EmptyFilterException("tag constraint has no key/value pairs");
        }
        List<String> tests = tags.entrySet().stream()
                .map(tag -> "r[\"" + tag.getKey() + "\"] == \"" + tag.getValue() + "\"")
                .toList();
        return String.join(enclosing.delimiter(), tests);
    }

    @Override
    public int predicateCount() {
        return tags.size();
    }
}
