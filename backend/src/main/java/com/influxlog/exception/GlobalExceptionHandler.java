package com.influxlog.exception;

import com.influxdb.exceptions.InfluxException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.format.DateTimeParseException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LogQueryException.class)
    public ResponseEntity<ProblemDetail> handleLogQuery(LogQueryException ex, HttpServletRequest request) {
        log.warn("Rejected log query: path={}, reason={}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid log query", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class})
    public ResponseEntity<ProblemDetail> handleBadArgument(RuntimeException ex, HttpServletRequest request) {
        log.warn("Bad request: path={}, reason={}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad request", ex.getMessage());
    }

    @ExceptionHandler(InfluxException.class)
    public ResponseEntity<ProblemDetail> handleInflux(InfluxException ex, HttpServletRequest request) {
        log.error("InfluxDB request failed: path={}, status={}", request.getRequestURI(), ex.status(), ex);
        return problem(HttpStatus.BAD_GATEWAY, "Log store unavailable", ex.getMessage());
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
        var problem = ProblemDetail.forStatus(status);
        problem.setTitle(title);
        problem.setDetail(detail);
        return ResponseEntity.status(status).body(problem);
    }
}
