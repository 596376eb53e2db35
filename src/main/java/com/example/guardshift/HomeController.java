package com.example.guardshift;

import com.example.guardshift.common.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HomeController {

    private final String version;

    public HomeController(@Value("${shift.api.version:1.0.0}") String version) {
        this.version = version;
    }

    @GetMapping("/api")
    public Map<String, Object> home() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Shift Scheduler API is running");
        response.put("version", version);

        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("generate schedule", "POST /schedule");
        endpoints.put("validate time", "GET /validate-time/{HH:MM}");
        endpoints.put("algorithm info", "GET /algorithm-info");
        endpoints.put("health", "GET /health");
        response.put("availableEndpoints", endpoints);
        return response;
    }

    @GetMapping({"/algorithm-info", "/api/algorithm-info"})
    public ApiResponse<Map<String, Object>> algorithmInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("algorithm", "Queue-based Fair Scheduling");
        info.put("description", "Ensures fair distribution of shifts using one rotating guard queue per post");
        info.put("features", List.of(
                "Fair shift distribution",
                "Respects guard unavailability",
                "Limits consecutive night shifts",
                "Optional per-post required hours",
                "Deterministic output for identical input"));
        info.put("constraints", List.of(
                "Guard availability windows",
                "Maximum consecutive night shifts",
                "Post coverage requirements"));
        return ApiResponse.success(info);
    }
}
