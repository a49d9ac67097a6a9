package com.flamingo.reporttable.service.report;

import com.flamingo.reporttable.service.contact.EnrichmentResult;
import com.flamingo.reporttable.service.extraction.model.ExtractedTable;

/**
 * A processed report.
 *
 * @param outcome whether a table was found
 * @param table the rectangular, possibly enriched table; empty for {@link ReportOutcome#NO_TABLE}
 * @param enrichment enrichment outcome, {@code null} when enrichment was not requested
 */
public record ReportResult(
    ReportOutcome outcome, ExtractedTable table, EnrichmentResult enrichment) {

  public static ReportResult noTable() {
    return new ReportResult(ReportOutcome.NO_TABLE, ExtractedTable.empty(), null);
  }
}
