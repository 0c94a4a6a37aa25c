package org.jouca.live_arrivals.controller;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jouca.live_arrivals.exceptions.SchemaException;
import org.jouca.live_arrivals.exceptions.TooManyStopsException;
import org.jouca.live_arrivals.exceptions.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps engine failures to HTTP answers.
 *
 * @author Jouca
 * @since 1.0
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TooManyStopsException.class)
    public ResponseEntity<Map<String, Object>> handleTooManyStops(TooManyStopsException e, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<Map<String, Object>> handleTransport(TransportException e, HttpServletRequest request) {
        logger.error("Live data unavailable for {}: {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(), request);
    }

    @ExceptionHandler(SchemaException.class)
    public ResponseEntity<Map<String, Object>> handleSchema(SchemaException e, HttpServletRequest request) {
        logger.error("Undecodable live data for {}", request.getRequestURI(), e);
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(), request);
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", OffsetDateTime.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return new ResponseEntity<>(body, status);
    }
}
