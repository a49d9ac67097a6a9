package com.flamingo.reporttable.service.extraction;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;

/**
 * Extracts one table from an HTML document.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * requests. The caller keeps ownership of the document text.
 */
public interface TableExtractor {

  /** Occurrence extracted when the caller does not name one. */
  int DEFAULT_TABLE_INDEX = 1;

  /**
   * Extracts the first table with content, starting at the given occurrence.
   *
   * <p>Occurrences that contain no non-blank row are skipped, so {@code tableIndex} names the
   * first occurrence to consider rather than an exact one.
   *
   * @param html the HTML document
   * @param tableIndex 1-based table occurrence to start from
   * @return the extracted table, or {@link ExtractedTable#empty()} when no occurrence at or after
   *     {@code tableIndex} has content
   * @throws com.flamingo.reporttable.exception.MalformedHtmlException if the document cannot be
   *     tokenized
   */
  ExtractedTable extract(String html, int tableIndex);

  /**
   * Extracts the first table with content in the document.
   *
   * @param html the HTML document
   * @return the extracted table, possibly empty
   */
  default ExtractedTable extract(String html) {
    return extract(html, DEFAULT_TABLE_INDEX);
  }
}
