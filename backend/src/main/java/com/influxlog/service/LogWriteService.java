package com.influxlog.service;

import com.influxdb.client.WriteApiBlocking;
import com.influxdb.client.write.Point;
import com.influxlog.config.InfluxProperties;
import com.influxlog.logging.LogPointMapper;
import com.influxlog.model.LogEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LogWriteService {

    private final WriteApiBlocking writeApi;
    private final InfluxProperties properties;
    private final LogPointMapper pointMapper;

    public void writeLog(LogEvent logEvent) {
        writeApi.writePoint(properties.getBucket(), properties.getOrg(), pointMapper.toPoint(logEvent));
        log.debug("Log written: bucket={}, service={}, level={}",
                properties.getBucket(), logEvent.getService(), logEvent.getLevel());
    }

    public void writeLogs(List<LogEvent> logEvents) {
        List<Point> points = logEvents.stream()
                .map(pointMapper::toPoint)
                .toList();

        writeApi.writePoints(properties.getBucket(), properties.getOrg(), points);
        log.debug("Wrote {} logs to bucket {}", points.size(), properties.getBucket());
    }
}
