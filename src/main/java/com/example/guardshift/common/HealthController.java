package com.example.guardshift.common;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final Clock clock;
    private final String version;

    public HealthController(Clock clock, @Value("${shift.api.version:1.0.0}") String version) {
        this.clock = clock;
        this.version = version;
    }

    @GetMapping({"/health", "/api/health"})
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "healthy");
        status.put("timestamp", LocalDateTime.now(clock).toString());
        status.put("version", version);
        return ResponseEntity.ok(ApiResponse.success("OK", status));
    }
}
