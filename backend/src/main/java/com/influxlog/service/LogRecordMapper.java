package com.influxlog.service;

import com.influxdb.query.FluxRecord;
import com.influxlog.model.LogRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Component
public class LogRecordMapper {

    static final String LEVEL_TAG = "level";
    static final String MESSAGE_FIELD = "message";

    private static final Set<String> ANNOTATION_COLUMNS = Set.of("result", "table");

    public LogRecord toLogRecord(FluxRecord row) {
        Map<String, String> tags = new LinkedHashMap<>();
        String level = null;

        for (Map.Entry<String, Object> column : row.getValues().entrySet()) {
            String key = column.getKey();
            Object value = column.getValue();
            if (key.startsWith("_") || ANNOTATION_COLUMNS.contains(key) || value == null) {
                continue;
            }
            if (LEVEL_TAG.equals(key)) {
                level = value.toString();
            } else {
                tags.put(key, value.toString());
            }
        }

        String message = null;
        if (MESSAGE_FIELD.equals(row.getField()) && row.getValue() != null) {
            message = row.getValue().toString();
        }

        Instant time = row.getTime();
        return LogRecord.builder()
                .time(time == null ? null : time.atOffset(ZoneOffset.UTC))
                .level(level)
                .message(message)
                .tags(Collections.unmodifiableMap(tags))
                .build();
    }
}
