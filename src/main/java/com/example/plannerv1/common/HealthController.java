package com.example.plannerv1.common;

import com.example.plannerv1.config.RecurrenceSettings;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final RecurrenceSettings settings;

    public HealthController(RecurrenceSettings settings) {
        this.settings = settings;
    }

    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of(
                "status", "UP",
                "lookaheadDays", settings.getLookaheadDays(),
                "maxBatchSize", settings.getMaxBatchSize())));
    }
}
