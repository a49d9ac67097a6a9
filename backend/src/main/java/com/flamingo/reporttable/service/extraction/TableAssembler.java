package com.flamingo.reporttable.service.extraction;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects the rows of one target table: a write-once header slot and an append-only list of
 * data rows.
 */
@Slf4j
final class TableAssembler {

  private List<String> header;
  private final List<List<String>> rows = new ArrayList<>();
  private List<String> currentRow;

  void openRow() {
    currentRow = new ArrayList<>();
  }

  void addCell(String content) {
    currentRow.add(content);
  }

  /**
   * Files the current row as header or data.
   *
   * @param headerRegion whether the row sits in an explicit header section
   * @param bodyRegion whether the row sits in an explicit body section
   */
  void closeRow(boolean headerRegion, boolean bodyRegion) {
    List<String> row = currentRow;
    currentRow = null;
    if (row == null || row.stream().allMatch(String::isEmpty)) {
      log.debug("Discarded row without content: {}", row);
      return;
    }
    if (headerRegion || (header == null && !bodyRegion)) {
      if (header == null) {
        header = row;
        log.debug("Recorded header: {}", header);
      } else {
        log.debug("Dropped additional header row: {}", row);
      }
    } else {
      rows.add(row);
      log.debug("Added row {}: {}", rows.size(), row);
    }
  }

  boolean hasContent() {
    return header != null || !rows.isEmpty();
  }

  ExtractedTable toTable() {
    return new ExtractedTable(header == null ? List.of() : header, rows);
  }
}
