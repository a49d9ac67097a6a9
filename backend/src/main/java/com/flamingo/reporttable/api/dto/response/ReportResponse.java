package com.flamingo.reporttable.api.dto.response;

import com.flamingo.reporttable.service.contact.EnrichmentResult;
import com.flamingo.reporttable.service.report.ReportOutcome;
import com.flamingo.reporttable.service.report.ReportResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a processed report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportResponse {

  private ReportOutcome outcome;
  private List<String> headers;
  private List<List<String>> rows;
  private int rowCount;
  private boolean enriched;
  private EnrichmentSummary enrichment;

  /** Lookup statistics of contact enrichment. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class EnrichmentSummary {
    private Integer groupColumn;
    private int found;
    private int notFound;
    private String message;
  }

  /** Creates a ReportResponse from a processed report. */
  public static ReportResponse fromResult(ReportResult result) {
    EnrichmentResult enrichment = result.enrichment();
    return ReportResponse.builder()
        .outcome(result.outcome())
        .headers(result.table().headers())
        .rows(result.table().rows())
        .rowCount(result.table().rowCount())
        .enriched(enrichment != null && enrichment.enriched())
        .enrichment(enrichment == null ? null : toSummary(enrichment))
        .build();
  }

  private static EnrichmentSummary toSummary(EnrichmentResult enrichment) {
    return EnrichmentSummary.builder()
        .groupColumn(enrichment.groupColumn() < 0 ? null : enrichment.groupColumn())
        .found(enrichment.found())
        .notFound(enrichment.notFound())
        .message(enrichment.message())
        .build();
  }
}
