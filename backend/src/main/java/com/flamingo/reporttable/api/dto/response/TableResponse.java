package com.flamingo.reporttable.api.dto.response;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an extracted table. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableResponse {

  private boolean tableFound;
  private List<String> headers;
  private List<List<String>> rows;
  private int rowCount;
  private int columnCount;

  /** Creates a TableResponse from an extracted table. */
  public static TableResponse fromTable(ExtractedTable table) {
    return TableResponse.builder()
        .tableFound(!table.isEmpty())
        .headers(table.headers())
        .rows(table.rows())
        .rowCount(table.rowCount())
        .columnCount(table.columnCount())
        .build();
  }
}
