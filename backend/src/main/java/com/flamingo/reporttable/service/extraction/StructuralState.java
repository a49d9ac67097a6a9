package com.flamingo.reporttable.service.extraction;

/**
 * Where the scanner currently is inside the target table.
 *
 * <p>A fresh instance is created whenever a target table is entered or abandoned, so nothing
 * carries over from a previous occurrence.
 */
final class StructuralState {

  enum Position {
    OUTSIDE,
    TABLE,
    ROW,
    HEADER_CELL,
    DATA_CELL
  }

  private Position position;
  private boolean headerRegion;
  private boolean bodyRegion;
  private int nestedTables;

  private StructuralState(Position position) {
    this.position = position;
  }

  static StructuralState outside() {
    return new StructuralState(Position.OUTSIDE);
  }

  static StructuralState inTable() {
    return new StructuralState(Position.TABLE);
  }

  Position position() {
    return position;
  }

  boolean isInTable() {
    return position != Position.OUTSIDE;
  }

  boolean isInRow() {
    return position == Position.ROW || isInCell();
  }

  boolean isInCell() {
    return position == Position.HEADER_CELL || position == Position.DATA_CELL;
  }

  boolean isInNestedTable() {
    return nestedTables > 0;
  }

  boolean isHeaderRegion() {
    return headerRegion;
  }

  boolean isBodyRegion() {
    return bodyRegion;
  }

  void setHeaderRegion(boolean headerRegion) {
    this.headerRegion = headerRegion;
  }

  void setBodyRegion(boolean bodyRegion) {
    this.bodyRegion = bodyRegion;
  }

  void enterNestedTable() {
    nestedTables++;
  }

  void leaveNestedTable() {
    nestedTables--;
  }

  void openRow() {
    position = Position.ROW;
  }

  void openCell(boolean header) {
    position = header ? Position.HEADER_CELL : Position.DATA_CELL;
  }

  void closeCell() {
    position = Position.ROW;
  }

  void closeRow() {
    position = Position.TABLE;
  }
}
