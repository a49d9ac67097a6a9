package com.flamingo.reporttable.service.table;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flamingo.reporttable.exception.TableExportException;
import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes extracted tables as CSV, header row first. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CsvTableWriter {

  // RFC 4180 line endings; quote only values containing separators, quotes or line breaks.
  private static final ObjectWriter ROW_WRITER =
      new CsvMapper()
          .writerFor(String[].class)
          .with(CsvSchema.emptySchema().withLineSeparator("\r\n"))
          .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);

  private final TableShaper tableShaper;

  /**
   * Writes {@code table} to {@code out}. Rows are rectangularized against the header first.
   *
   * @throws TableExportException if the table is empty or writing fails
   */
  public void write(ExtractedTable table, Writer out) {
    if (table.isEmpty()) {
      throw new TableExportException("No table data to export");
    }
    ExtractedTable shaped = tableShaper.rectangularize(table);
    try (SequenceWriter rows = ROW_WRITER.writeValues(out)) {
      if (!shaped.headers().isEmpty()) {
        rows.write(toArray(shaped.headers()));
      }
      for (List<String> row : shaped.rows()) {
        rows.write(toArray(row));
      }
    } catch (IOException e) {
      throw new TableExportException("Failed to write CSV: " + e.getMessage(), e);
    }
    log.info("Wrote {} rows as CSV", shaped.rowCount());
  }

  public String toCsv(ExtractedTable table) {
    StringWriter out = new StringWriter();
    write(table, out);
    return out.toString();
  }

  private static String[] toArray(List<String> cells) {
    return cells.toArray(new String[0]);
  }
}
