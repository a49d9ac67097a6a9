package com.flamingo.reporttable.api.rest;

import com.flamingo.reporttable.api.dto.request.ExtractTableRequest;
import com.flamingo.reporttable.api.dto.response.TableResponse;
import com.flamingo.reporttable.config.ExtractionConfig;
import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import com.flamingo.reporttable.service.report.ReportService;
import com.flamingo.reporttable.service.table.CsvTableWriter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for extracting tables from HTML documents. */
@RestController
@RequestMapping("/api/tables")
@RequiredArgsConstructor
public class TableController {

  static final String CSV_MEDIA_TYPE = "text/csv";

  private final ReportService reportService;
  private final CsvTableWriter csvTableWriter;
  private final ExtractionConfig extractionConfig;

  /** Extracts the first table with content at or after the requested index. */
  @PostMapping(value = "/extract", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TableResponse> extract(@Valid @RequestBody ExtractTableRequest request) {
    ExtractedTable table = reportService.extractTable(request.getHtml(), tableIndex(request));
    return ResponseEntity.ok(TableResponse.fromTable(table));
  }

  /** Extracts a table and returns it as CSV, or 204 when there is no table data. */
  @PostMapping(
      value = "/extract/csv",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = CSV_MEDIA_TYPE)
  public ResponseEntity<String> extractCsv(@Valid @RequestBody ExtractTableRequest request) {
    ExtractedTable table = reportService.extractTable(request.getHtml(), tableIndex(request));
    if (table.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"extracted_table.csv\"")
        .contentType(MediaType.parseMediaType(CSV_MEDIA_TYPE))
        .body(csvTableWriter.toCsv(table));
  }

  private int tableIndex(ExtractTableRequest request) {
    return request.getTableIndex() != null
        ? request.getTableIndex()
        : extractionConfig.getDefaultTableIndex();
  }
}
