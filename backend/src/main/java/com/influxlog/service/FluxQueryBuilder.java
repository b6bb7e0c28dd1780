package com.influxlog.service;

import com.influxlog.filter.FilterExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Renders the Flux text for log queries. All rows are merged with {@code group()} before
 * sorting so that ordering and limits span every tag series.
 */
@Component
public class FluxQueryBuilder {

    static final String SOURCE_PREFIX = "from(";

    public String recent(String bucket, String measurement, int limit, FilterExpression filter) {
        StringBuilder flux = new StringBuilder();
        appendSelection(flux, bucket, "range(start: 0)", measurement, filter);
        flux.append("\n|> sort(columns: [\"_time\"], desc: true)");
        flux.append("\n|> limit(n: ").append(limit).append(")");
        flux.append("\n|> sort(columns: [\"_time\"])");
        return flux.toString();
    }

    public String range(String bucket, String measurement, Instant start, Instant stop, FilterExpression filter) {
        StringBuilder flux = new StringBuilder();
        String range = "range(start: " + start + ", stop: " + stop + ")";
        appendSelection(flux, bucket, range, measurement, filter);
        flux.append("\n|> sort(columns: [\"_time\"])");
        return flux.toString();
    }

    /**
     * Prefixes a bare pipeline such as {@code |> range(start: -1m)} with the bucket source.
     * Text that already starts with {@code from(} is returned unchanged.
     */
    public String withSource(String bucket, String pipeline) {
        if (pipeline.stripLeading().startsWith(SOURCE_PREFIX)) {
            return pipeline;
        }
        return source(bucket) + "\n" + pipeline;
    }

    private void appendSelection(StringBuilder flux, String bucket, String range, String measurement,
                                 FilterExpression filter) {
        flux.append(source(bucket));
        flux.append("\n|> ").append(range);
        flux.append("\n|> filter(fn: (r) => r[\"_measurement\"] == \"").append(measurement)
                .append("\" and r[\"_field\"] == \"message\")");
        if (filter != null) {
            flux.append("\n|> ").append(filter.render());
        }
        flux.append("\n|> group()");
    }

    private static String source(String bucket) {
        return "from(bucket: \"" + bucket + "\")";
    }
}
