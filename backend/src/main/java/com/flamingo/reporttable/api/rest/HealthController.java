package com.flamingo.reporttable.api.rest;

import com.flamingo.reporttable.config.ExtractionConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and extraction settings. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final ExtractionConfig extractionConfig;

  /**
   * Returns a simple health check response. A missing contact file does not make the service
   * unhealthy since enrichment is then skipped.
   */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    ExtractionConfig.Enrichment enrichment = extractionConfig.getEnrichment();
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "report-table-extractor");
    health.put("defaultTableIndex", extractionConfig.getDefaultTableIndex());
    health.put("enrichmentEnabled", enrichment.isEnabled());
    health.put(
        "contactMapping",
        Files.isRegularFile(Path.of(enrichment.getContactFile())) ? "AVAILABLE" : "MISSING");
    return ResponseEntity.ok(health);
  }
}
