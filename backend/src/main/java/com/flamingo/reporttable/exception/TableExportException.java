package com.flamingo.reporttable.exception;

/** Exception thrown when an extracted table cannot be exported. */
public class TableExportException extends RuntimeException {

  public TableExportException(String message) {
    super(message);
  }

  public TableExportException(String message, Throwable cause) {
    super(message, cause);
  }
}
