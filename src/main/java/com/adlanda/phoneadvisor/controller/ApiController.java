package com.adlanda.phoneadvisor.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Samsung Phone Advisor",
                "version", appVersion,
                "endpoints", Map.of(
                        "ask", "POST /api/v1/ask - Ask a question about Samsung phones",
                        "phones", "GET /api/v1/phones - List all phones in the catalog",
                        "phone", "GET /api/v1/phones/{modelName} - Get specific phone details",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
