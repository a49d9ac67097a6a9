package com.flamingo.reporttable.service.extraction;

import com.flamingo.reporttable.service.extraction.model.ExtractedTable;
import lombok.extern.slf4j.Slf4j;

/**
 * Tag-driven state machine that locates the target table and feeds its rows and cells to a
 * {@link TableAssembler}.
 *
 * <p>Tables are counted in document order. When the target occurrence closes without any
 * content, the target moves on to the next occurrence and scanning continues in the same pass.
 * The first target that closes with content ends the scan.
 *
 * <p>Inside the target, a nested {@code <table>} is not structural: its rows and cells are
 * ignored and its text belongs to the enclosing cell.
 */
@Slf4j
final class TableScanner implements HtmlTokenHandler {

  private int targetIndex;
  private int tablesSeen;
  private StructuralState state = StructuralState.outside();
  private TableAssembler assembler;
  private CellContext cell;
  private ExtractedTable result;

  TableScanner(int targetIndex) {
    this.targetIndex = targetIndex;
  }

  int tablesSeen() {
    return tablesSeen;
  }

  /** The occurrence the scanner ended up targeting, after skipping empty tables. */
  int targetIndex() {
    return targetIndex;
  }

  @Override
  public void startTag(String name) {
    if ("table".equals(name)) {
      tablesSeen++;
      if (state.isInTable()) {
        state.enterNestedTable();
      } else if (tablesSeen == targetIndex) {
        enterTargetTable();
      }
      return;
    }
    if (!state.isInTable()) {
      return;
    }
    if (state.isInNestedTable()) {
      openNestedElement(name);
      return;
    }
    switch (name) {
      case "thead" -> state.setHeaderRegion(true);
      case "tbody" -> state.setBodyRegion(true);
      case "tr" -> {
        closeRowIfOpen();
        assembler.openRow();
        state.openRow();
      }
      case "th", "td" -> {
        if (state.isInRow()) {
          closeCellIfOpen();
          cell = new CellContext("th".equals(name));
          state.openCell(cell.isHeader());
        }
      }
      default -> openNestedElement(name);
    }
  }

  @Override
  public void endTag(String name) {
    if (!state.isInTable()) {
      return;
    }
    if ("table".equals(name)) {
      if (state.isInNestedTable()) {
        state.leaveNestedTable();
      } else {
        closeTargetTable();
      }
      return;
    }
    if (state.isInNestedTable()) {
      closeNestedElement(name);
      return;
    }
    switch (name) {
      case "thead" -> state.setHeaderRegion(false);
      case "tbody" -> state.setBodyRegion(false);
      case "tr" -> closeRowIfOpen();
      case "th" -> {
        if (state.position() == StructuralState.Position.HEADER_CELL) {
          closeCellIfOpen();
        }
      }
      case "td" -> {
        if (state.position() == StructuralState.Position.DATA_CELL) {
          closeCellIfOpen();
        }
      }
      default -> closeNestedElement(name);
    }
  }

  @Override
  public void text(String text) {
    if (cell != null) {
      cell.append(text);
    }
  }

  @Override
  public void reference(String decoded) {
    if (cell != null) {
      cell.append(decoded);
    }
  }

  @Override
  public boolean isFinished() {
    return result != null;
  }

  /**
   * Produces the scan result once the input is exhausted. A target table left open at the end of
   * the document still yields whatever it collected.
   */
  ExtractedTable finish() {
    if (result != null) {
      return result;
    }
    if (state.isInTable()) {
      closeRowIfOpen();
      if (assembler.hasContent()) {
        log.debug("Document ended inside table #{}, keeping collected content", targetIndex);
        return assembler.toTable();
      }
    }
    return ExtractedTable.empty();
  }

  private void enterTargetTable() {
    log.debug("Entered target table #{}", targetIndex);
    state = StructuralState.inTable();
    assembler = new TableAssembler();
    cell = null;
  }

  private void closeTargetTable() {
    closeRowIfOpen();
    if (assembler.hasContent()) {
      result = assembler.toTable();
      log.debug(
          "Closed table #{} with {} header cells and {} rows",
          targetIndex,
          result.headers().size(),
          result.rowCount());
      return;
    }
    log.debug("Table #{} was empty, looking for table #{}", targetIndex, targetIndex + 1);
    targetIndex++;
    state = StructuralState.outside();
    assembler = null;
  }

  private void openNestedElement(String name) {
    if (cell != null) {
      cell.openElement(name);
    }
  }

  private void closeNestedElement(String name) {
    if (cell != null) {
      cell.closeElement(name);
    }
  }

  private void closeCellIfOpen() {
    if (cell == null) {
      return;
    }
    String content = cell.resolve();
    assembler.addCell(content);
    log.debug("Added {} cell: '{}'", cell.isHeader() ? "th" : "td", content);
    cell = null;
    state.closeCell();
  }

  private void closeRowIfOpen() {
    if (!state.isInRow()) {
      return;
    }
    closeCellIfOpen();
    assembler.closeRow(state.isHeaderRegion(), state.isBodyRegion());
    state.closeRow();
  }
}
