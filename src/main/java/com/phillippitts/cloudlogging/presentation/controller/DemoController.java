package com.phillippitts.cloudlogging.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Endpoints for checking request log aggregation by hand: {@code /} logs at several levels,
 * {@code /error} (alias {@code /fail}) ends in an unexpected error, {@code /health} logs nothing.
 *
 * <p>Spring Boot's own error page is moved to {@code server.error.path} so {@code /error} is free.
 */
@RestController
class DemoController {

    private static final Logger log = LogManager.getLogger(DemoController.class);

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> root() {
        String requestId = UUID.randomUUID().toString();

        log.debug("Debug message for request {}", requestId);
        log.info("Info message for request {}", requestId);
        log.warn("Warning message for request {}", requestId);

        return ResponseEntity.ok(Map.of(
                "message", "Hello, Cloud Logging!",
                "requestId", requestId
        ));
    }

    @GetMapping({"/error", "/fail"})
    ResponseEntity<Map<String, Object>> fail() {
        log.debug("About to trigger an error...");
        int divisor = 0;
        int result = 1 / divisor;
        return ResponseEntity.ok(Map.of("result", result));
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
