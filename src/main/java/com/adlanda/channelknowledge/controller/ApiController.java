package com.adlanda.channelknowledge.controller;

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

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Channel Knowledge Pipeline",
                "version", appVersion,
                "endpoints", Map.of(
                        "query", "POST /api/v1/query - Search channel posts and documents",
                        "sources", "GET /api/v1/sources - Index statistics by category",
                        "channels", "GET /api/v1/channels - Monitored channels and polling state",
                        "fetch", "POST /api/v1/channels/fetch - Poll channels now",
                        "health", "GET /actuator/health - Sync loop and knowledge base status",
                        "info", "GET /actuator/info - Application info"
                )
        ));
    }
}
