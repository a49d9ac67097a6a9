package com.flamingo.reporttable.service.extraction.model;

import java.util.List;

/**
 * A single table reconstructed from an HTML document.
 *
 * <p>Rows keep the width they were parsed with; use {@link
 * com.flamingo.reporttable.service.table.TableShaper} before accessing columns by position.
 *
 * @param headers resolved header cells, empty when the table had no header row
 * @param rows data rows in document order
 */
public record ExtractedTable(List<String> headers, List<List<String>> rows) {

  private static final ExtractedTable EMPTY = new ExtractedTable(List.of(), List.of());

  public ExtractedTable {
    headers = headers == null ? List.of() : List.copyOf(headers);
    rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
  }

  /** Returns the result used when no table at or after the requested index had content. */
  public static ExtractedTable empty() {
    return EMPTY;
  }

  /** Returns {@code true} when neither a header nor any data row was extracted. */
  public boolean isEmpty() {
    return headers.isEmpty() && rows.isEmpty();
  }

  public int rowCount() {
    return rows.size();
  }

  /** Width of the header, or of the widest row when there is no header. */
  public int columnCount() {
    if (!headers.isEmpty()) {
      return headers.size();
    }
    return rows.stream().mapToInt(List::size).max().orElse(0);
  }
}
