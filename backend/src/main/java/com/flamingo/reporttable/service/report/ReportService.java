package com.flamingo.reporttable.service.report;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;

/** Service interface for turning report documents into tables. */
public interface ReportService {

  /**
   * Extracts a table from HTML after checking the document size.
   *
   * @param html HTML document
   * @param tableIndex 1-based occurrence to start from
   * @return the extracted table, empty when none had content
   */
  ExtractedTable extractTable(String html, int tableIndex);

  /**
   * Processes an HTML report: extraction, rectangularization and optional contact enrichment.
   *
   * @param html HTML document
   * @param tableIndex 1-based occurrence to start from
   * @param enrich whether to fill owner and e-mail columns
   * @return the processed report
   */
  ReportResult processHtml(String html, int tableIndex, boolean enrich);

  /**
   * Processes a JSON report envelope whose first widget carries the HTML content.
   *
   * @param json report envelope
   * @param enrich whether to fill owner and e-mail columns
   * @return the processed report
   */
  ReportResult processEnvelope(String json, boolean enrich);

  /**
   * Processes an uploaded report, routed by its detected media type.
   *
   * @param content uploaded bytes, UTF-8 encoded
   * @param fileName original file name, used as a detection hint
   * @param enrich whether to fill owner and e-mail columns
   * @return the processed report
   */
  ReportResult processUpload(byte[] content, String fileName, boolean enrich);
}
