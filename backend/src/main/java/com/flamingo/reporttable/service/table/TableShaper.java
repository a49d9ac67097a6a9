package com.flamingo.reporttable.service.table;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Makes extracted tables rectangular so columns can be addressed by position.
 *
 * <p>Rows shorter than the header are padded with empty strings, longer rows are truncated.
 * Without a header there is no target width and rows are left as parsed.
 */
@Component
public class TableShaper {

  public ExtractedTable rectangularize(ExtractedTable table) {
    List<String> headers = table.headers();
    if (headers.isEmpty()) {
      return table;
    }
    int width = headers.size();
    List<List<String>> shaped = new ArrayList<>(table.rowCount());
    for (List<String> row : table.rows()) {
      shaped.add(fit(row, width));
    }
    return new ExtractedTable(headers, shaped);
  }

  /** Pads or truncates a single row to {@code width} cells. */
  public List<String> fit(List<String> row, int width) {
    if (row.size() == width) {
      return row;
    }
    if (row.size() > width) {
      return row.subList(0, width);
    }
    List<String> padded = new ArrayList<>(row);
    while (padded.size() < width) {
      padded.add("");
    }
    return padded;
  }
}
