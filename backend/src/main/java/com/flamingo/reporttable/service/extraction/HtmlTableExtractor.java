package com.flamingo.reporttable.service.extraction;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link TableExtractor} for report HTML that is often not well-formed.
 *
 * <p>The document is first repaired by {@link HtmlPreprocessor}, then streamed once through
 * {@link HtmlTokenizer} into a {@link TableScanner}. Nothing is shared between calls.
 */
@Service
@Slf4j
public class HtmlTableExtractor implements TableExtractor {

  private static final int MAX_LOGGED_ROWS = 3;

  @Override
  public ExtractedTable extract(String html, int tableIndex) {
    if (tableIndex < 1) {
      throw new IllegalArgumentException("tableIndex must be 1 or greater, got " + tableIndex);
    }
    if (html == null || html.isEmpty()) {
      log.warn("No HTML content provided for table extraction");
      return ExtractedTable.empty();
    }

    String cleaned = HtmlPreprocessor.clean(html);
    log.debug("Original HTML length: {}, cleaned HTML length: {}", html.length(), cleaned.length());

    TableScanner scanner = new TableScanner(tableIndex);
    HtmlTokenizer.tokenize(cleaned, scanner);
    ExtractedTable table = scanner.finish();

    if (scanner.tablesSeen() == 0) {
      log.warn("No table found in HTML content");
    } else if (table.isEmpty()) {
      log.warn(
          "Found {} tables but none at or after #{} had content", scanner.tablesSeen(), tableIndex);
    } else {
      log.info(
          "Extracted table #{} with {} headers and {} rows",
          scanner.targetIndex(),
          table.headers().size(),
          table.rowCount());
      log.debug(
          "Headers: {}, first rows: {}",
          table.headers(),
          table.rows().subList(0, Math.min(MAX_LOGGED_ROWS, table.rowCount())));
    }
    return table;
  }
}
