package com.flamingo.reporttable.service.contact;

import com.flamingo.reporttable.config.ExtractionConfig;
import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import com.flamingo.reporttable.service.table.TableShaper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fills the first two columns of a report table with the owner and e-mail of each row's
 * assignment group.
 *
 * <p>The first two report columns carry no data of their own and are renamed to the configured
 * owner and e-mail headers. The assignment-group column is found by header name, or else by
 * sampling the configured default column.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContactEnrichmentService {

  private static final String GROUP_HEADER = "AssignmentGroup";

  private final ExtractionConfig extractionConfig;
  private final TableShaper tableShaper;
  private final MeterRegistry meterRegistry;

  /**
   * Enriches {@code table} with contacts looked up by assignment group.
   *
   * @param table extracted table; rows are padded to the header width
   * @param contacts contacts keyed by assignment group
   * @return the enriched table with lookup statistics, or a skipped result when the table has no
   *     recognizable assignment-group column or there are no contacts
   */
  public EnrichmentResult enrich(ExtractedTable table, Map<String, Contact> contacts) {
    if (contacts.isEmpty()) {
      log.warn("No contact mapping data available for enrichment");
      return EnrichmentResult.skipped(table, "No contact mapping data available");
    }
    OptionalInt groupColumn = findGroupColumn(table);
    if (groupColumn.isEmpty()) {
      log.warn("AssignmentGroup column not found, available columns: {}", table.headers());
      return EnrichmentResult.skipped(table, "AssignmentGroup column not found");
    }
    int column = groupColumn.getAsInt();
    log.info("Found AssignmentGroup column at index {}", column);

    ExtractionConfig.Enrichment config = extractionConfig.getEnrichment();
    List<String> headers = new ArrayList<>(table.headers());
    renameColumn(headers, 0, config.getOwnerColumn());
    renameColumn(headers, 1, config.getEmailColumn());

    int found = 0;
    int notFound = 0;
    List<List<String>> rows = new ArrayList<>(table.rowCount());
    for (List<String> original : table.rows()) {
      List<String> row = new ArrayList<>(tableShaper.fit(original, headers.size()));
      String group = column < row.size() ? row.get(column).strip() : "";
      Contact contact = group.isEmpty() ? null : contacts.get(group);
      String owner;
      String email;
      if (contact != null) {
        owner = contact.name();
        email = contact.email();
        found++;
        log.debug("Found contact for '{}' -> {} ({})", group, owner, email);
      } else {
        owner = config.getNotFoundValue();
        email = config.getNotFoundValue();
        notFound++;
        log.debug("No contact for AssignmentGroup '{}'", group);
      }
      setCell(row, 0, owner);
      setCell(row, 1, email);
      rows.add(row);
    }

    meterRegistry.counter("contact_lookups_total", "result", "found").increment(found);
    meterRegistry.counter("contact_lookups_total", "result", "not_found").increment(notFound);
    log.info("Lookup statistics: {} found, {} not found", found, notFound);
    return new EnrichmentResult(
        new ExtractedTable(headers, rows), true, column, found, notFound, null);
  }

  /**
   * Locates the assignment-group column.
   *
   * <p>A header containing {@code AssignmentGroup} or, ignoring case, {@code assignment} wins.
   * Otherwise the configured default column is accepted when the header reaches it and one of
   * the first sampled values is longer than the minimum group name length.
   */
  public OptionalInt findGroupColumn(ExtractedTable table) {
    List<String> headers = table.headers();
    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i);
      if (header.contains(GROUP_HEADER) || header.toLowerCase(Locale.ROOT).contains("assignment")) {
        return OptionalInt.of(i);
      }
    }

    ExtractionConfig.Enrichment config = extractionConfig.getEnrichment();
    int fallback = config.getDefaultGroupColumn();
    if (headers.size() <= fallback) {
      return OptionalInt.empty();
    }
    List<String> samples =
        table.rows().stream()
            .limit(config.getSampleRows())
            .filter(row -> row.size() > fallback)
            .map(row -> row.get(fallback).strip())
            .filter(value -> !value.isEmpty())
            .toList();
    boolean looksLikeGroups =
        samples.stream().anyMatch(value -> value.length() > config.getMinimumGroupNameLength());
    if (looksLikeGroups) {
      log.info(
          "Using column {} ('{}') as AssignmentGroup column based on sampled values {}",
          fallback,
          headers.get(fallback),
          samples);
      return OptionalInt.of(fallback);
    }
    return OptionalInt.empty();
  }

  private void renameColumn(List<String> headers, int index, String name) {
    if (index < headers.size()) {
      log.info("Renamed column '{}' to '{}'", headers.get(index), name);
      headers.set(index, name);
    }
  }

  private static void setCell(List<String> row, int index, String value) {
    if (index < row.size()) {
      row.set(index, value);
    }
  }
}
