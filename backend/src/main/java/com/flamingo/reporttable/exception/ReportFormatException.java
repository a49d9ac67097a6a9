package com.flamingo.reporttable.exception;

/** Exception thrown when a report envelope does not carry HTML content where expected. */
public class ReportFormatException extends RuntimeException {

  public ReportFormatException(String message) {
    super(message);
  }

  public ReportFormatException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return "Invalid report format: " + getMessage();
  }
}
