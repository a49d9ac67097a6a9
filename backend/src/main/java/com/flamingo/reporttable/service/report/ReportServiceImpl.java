package com.flamingo.reporttable.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.reporttable.config.ExtractionConfig;
import com.flamingo.reporttable.exception.ContactMappingException;
import com.flamingo.reporttable.exception.InputTooLargeException;
import com.flamingo.reporttable.exception.MalformedHtmlException;
import com.flamingo.reporttable.exception.ReportFormatException;
import com.flamingo.reporttable.exception.UnsupportedReportTypeException;
import com.flamingo.reporttable.service.contact.Contact;
import com.flamingo.reporttable.service.contact.ContactDirectory;
import com.flamingo.reporttable.service.contact.ContactEnrichmentService;
import com.flamingo.reporttable.service.contact.EnrichmentResult;
import com.flamingo.reporttable.service.extraction.TableExtractor;
import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import com.flamingo.reporttable.service.table.TableShaper;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;

/** Implementation of ReportService chaining extraction, shaping and enrichment. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportServiceImpl implements ReportService {

  private static final Set<String> HTML_MEDIA_TYPES =
      Set.of("text/html", "application/xhtml+xml", "text/plain");
  private static final String JSON_MEDIA_TYPE = "application/json";

  private static final Tika TIKA = new Tika();

  private final TableExtractor tableExtractor;
  private final TableShaper tableShaper;
  private final ContactDirectory contactDirectory;
  private final ContactEnrichmentService contactEnrichmentService;
  private final ExtractionConfig extractionConfig;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "table.extraction", description = "Time to extract a table from HTML")
  public ExtractedTable extractTable(String html, int tableIndex) {
    long limit = extractionConfig.getMaxDocumentChars();
    if (html != null && html.length() > limit) {
      throw new InputTooLargeException(html.length(), limit);
    }
    ExtractedTable table;
    try {
      table = tableExtractor.extract(html, tableIndex);
    } catch (MalformedHtmlException e) {
      incrementExtractionCounter("malformed");
      throw e;
    }
    incrementExtractionCounter(table.isEmpty() ? "empty" : "found");
    return table;
  }

  @Override
  @Timed(value = "report.processing", description = "Time to process an HTML report")
  public ReportResult processHtml(String html, int tableIndex, boolean enrich) {
    ExtractedTable table = extractTable(html, tableIndex);
    if (table.isEmpty()) {
      log.warn("No table data extracted from report");
      return ReportResult.noTable();
    }
    ExtractedTable shaped = tableShaper.rectangularize(table);
    if (!enrich) {
      return new ReportResult(ReportOutcome.EXTRACTED, shaped, null);
    }
    EnrichmentResult enrichment = enrich(shaped);
    if (!enrichment.enriched()) {
      log.warn("Contact enrichment skipped, basic extraction succeeded: {}", enrichment.message());
    }
    return new ReportResult(ReportOutcome.EXTRACTED, enrichment.table(), enrichment);
  }

  @Override
  public ReportResult processEnvelope(String json, boolean enrich) {
    String html = unwrapEnvelope(json);
    return processHtml(html, extractionConfig.getDefaultTableIndex(), enrich);
  }

  @Override
  public ReportResult processUpload(byte[] content, String fileName, boolean enrich) {
    String mediaType = TIKA.detect(content, fileName);
    String text = new String(content, StandardCharsets.UTF_8);
    log.info("Processing uploaded report '{}' detected as {}", fileName, mediaType);

    if (JSON_MEDIA_TYPE.equals(mediaType) || looksLikeJsonText(mediaType, text)) {
      return processEnvelope(text, enrich);
    }
    if (HTML_MEDIA_TYPES.contains(mediaType)) {
      return processHtml(text, extractionConfig.getDefaultTableIndex(), enrich);
    }
    throw new UnsupportedReportTypeException(mediaType);
  }

  /**
   * Returns the HTML carried in {@code widgets[0].content} of a report envelope.
   *
   * @throws ReportFormatException if the JSON is invalid or the content is missing
   */
  String unwrapEnvelope(String json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json == null ? "" : json);
    } catch (JsonProcessingException e) {
      throw new ReportFormatException("report is not valid JSON", e);
    }
    JsonNode widgets = root == null ? null : root.get("widgets");
    if (widgets == null || !widgets.isArray() || widgets.isEmpty()) {
      throw new ReportFormatException("no 'widgets' array found or widgets array is empty");
    }
    JsonNode content = widgets.get(0).get("content");
    if (content == null || !content.isTextual()) {
      throw new ReportFormatException("no 'content' field found in first widget");
    }
    if (content.asText().isBlank()) {
      throw new ReportFormatException("first widget has no HTML content");
    }
    log.info("Extracted HTML content from report envelope");
    return content.asText();
  }

  private EnrichmentResult enrich(ExtractedTable table) {
    if (!extractionConfig.getEnrichment().isEnabled()) {
      return EnrichmentResult.skipped(table, "Contact enrichment is disabled");
    }
    Map<String, Contact> contacts;
    try {
      contacts = contactDirectory.load();
    } catch (ContactMappingException e) {
      log.warn("Could not load contact mapping: {}", e.getMessage());
      return EnrichmentResult.skipped(table, e.getMessage());
    }
    return contactEnrichmentService.enrich(table, contacts);
  }

  private static boolean looksLikeJsonText(String mediaType, String text) {
    return "text/plain".equals(mediaType) && text.stripLeading().startsWith("{");
  }

  private void incrementExtractionCounter(String outcome) {
    meterRegistry.counter("table_extractions_total", "outcome", outcome).increment();
  }
}
