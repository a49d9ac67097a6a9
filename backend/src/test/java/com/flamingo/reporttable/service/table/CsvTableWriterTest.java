package com.flamingo.reporttable.service.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.reporttable.exception.TableExportException;
import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CsvTableWriter Tests")
class CsvTableWriterTest {

  private CsvTableWriter csvTableWriter;

  @BeforeEach
  void setUp() {
    csvTableWriter = new CsvTableWriter(new TableShaper());
  }

  @Test
  @DisplayName("should write the header followed by data rows, each ending in CRLF")
  void shouldWriteHeaderAndRows() {
    ExtractedTable table =
        new ExtractedTable(
            List.of("Name", "Age"), List.of(List.of("John Doe", "30"), List.of("Jane", "25")));

    String csv = csvTableWriter.toCsv(table);

    assertThat(csv).isEqualTo("Name,Age\r\nJohn Doe,30\r\nJane,25\r\n");
  }

  @Test
  @DisplayName("should quote values containing separators or quotes")
  void shouldQuoteSpecialValues() {
    ExtractedTable table =
        new ExtractedTable(List.of("City"), List.of(List.of("Paris, France"), List.of("a\"b")));

    String csv = csvTableWriter.toCsv(table);

    assertThat(csv).contains("\"Paris, France\"").contains("\"a\"\"b\"");
  }

  @Test
  @DisplayName("should truncate rows wider than the header")
  void shouldRectangularizeBeforeWriting() {
    ExtractedTable table =
        new ExtractedTable(List.of("A", "B"), List.of(List.of("1", "2", "extra")));

    String csv = csvTableWriter.toCsv(table);

    assertThat(csv).doesNotContain("extra");
    assertThat(csv.split("\r\n")).hasSize(2);
  }

  @Test
  @DisplayName("should write rows only when there is no header")
  void shouldWriteRowsWithoutHeader() {
    ExtractedTable table = new ExtractedTable(List.of(), List.of(List.of("1", "2")));

    assertThat(csvTableWriter.toCsv(table).split("\r\n")).containsExactly("1,2");
  }

  @Test
  @DisplayName("should refuse to export an empty table")
  void shouldRejectEmptyTable() {
    assertThatThrownBy(() -> csvTableWriter.toCsv(ExtractedTable.empty()))
        .isInstanceOf(TableExportException.class)
        .hasMessage("No table data to export");
  }
}
