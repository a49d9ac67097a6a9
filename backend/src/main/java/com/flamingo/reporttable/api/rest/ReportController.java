package com.flamingo.reporttable.api.rest;

import com.flamingo.reporttable.api.dto.response.ReportResponse;
import com.flamingo.reporttable.service.report.ReportResult;
import com.flamingo.reporttable.service.report.ReportService;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for processing report documents into enriched tables. */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

  private final ReportService reportService;

  /** Processes a JSON report envelope. */
  @PostMapping(value = "/process", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ReportResponse> process(
      @RequestBody String envelope,
      @RequestParam(name = "enrich", defaultValue = "true") boolean enrich) {
    ReportResult result = reportService.processEnvelope(envelope, enrich);
    return ResponseEntity.ok(ReportResponse.fromResult(result));
  }

  /** Processes an uploaded HTML report or JSON report envelope. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ReportResponse> upload(
      @RequestParam("file") MultipartFile file,
      @RequestParam(name = "enrich", defaultValue = "true") boolean enrich)
      throws IOException {
    ReportResult result =
        reportService.processUpload(file.getBytes(), file.getOriginalFilename(), enrich);
    return ResponseEntity.ok(ReportResponse.fromResult(result));
  }
}
