package com.flamingo.reporttable.service.contact;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;

/**
 * Outcome of contact enrichment.
 *
 * @param table the enriched table, or the input table when enrichment was skipped
 * @param enriched whether owner and e-mail columns were filled in
 * @param groupColumn index of the assignment-group column, or -1 when none was found
 * @param found rows whose group had a contact
 * @param notFound rows whose group was blank or unknown
 * @param message why enrichment was skipped, {@code null} when it ran
 */
public record EnrichmentResult(
    ExtractedTable table,
    boolean enriched,
    int groupColumn,
    int found,
    int notFound,
    String message) {

  public static EnrichmentResult skipped(ExtractedTable table, String message) {
    return new EnrichmentResult(table, false, -1, 0, 0, message);
  }
}
