package com.influxlog.controller;

import com.influxlog.model.LogEvent;
import com.influxlog.service.LogWriteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/collect")
@RequiredArgsConstructor
public class CollectorController {

    private final LogWriteService logWriteService;

    @PostMapping("/log")
    public ResponseEntity<Map<String, Object>> collectLog(@Valid @RequestBody LogEvent logEvent) {
        log.debug("Received log: service={}, level={}", logEvent.getService(), logEvent.getLevel());

        logWriteService.writeLog(logEvent);

        return ResponseEntity.ok(Map.of(
                "status", "accepted",
                "type", "log"
        ));
    }

    @PostMapping("/logs")
    public ResponseEntity<Map<String, Object>> collectLogs(@Valid @RequestBody List<@Valid LogEvent> logEvents) {
        log.debug("Received {} logs", logEvents.size());

        logWriteService.writeLogs(logEvents);

        return ResponseEntity.ok(Map.of(
                "status", "accepted",
                "type", "logs",
                "count", logEvents.size()
        ));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
