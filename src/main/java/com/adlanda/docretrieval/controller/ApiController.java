package com.adlanda.docretrieval.controller;

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
                "service", "Document Retrieval",
                "version", appVersion,
                "endpoints", Map.of(
                        "upload", "POST /api/v1/upload - Upload a text or Markdown document",
                        "query", "POST /api/v1/query - Retrieve the most similar chunks",
                        "reset", "POST /api/v1/reset-vector-store - Drop all indexed documents",
                        "sources", "GET /api/v1/sources - Index statistics",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
