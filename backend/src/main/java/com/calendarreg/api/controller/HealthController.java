package com.calendarreg.api.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/** Liveness and build info for load balancers and deploy checks. */
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = "*")
public class HealthController {

    private final Clock clock;
    private final String name;
    private final String version;
    private final String env;

    public HealthController(Clock clock,
                            @Value("${spring.application.name:calendar-reg-api}") String name,
                            @Value("${calendarreg.app.version:0.1.0}") String version,
                            @Value("${calendarreg.app.env:development}") String env) {
        this.clock = clock;
        this.name = name;
        this.version = version;
        this.env = env;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        // UTC, second precision, e.g. 2025-06-01T05:00:00Z
        body.put("timestamp", Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString());
        return body;
    }

    @GetMapping("/version")
    public Map<String, Object> version() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("version", version);
        body.put("env", env);
        return body;
    }
}
