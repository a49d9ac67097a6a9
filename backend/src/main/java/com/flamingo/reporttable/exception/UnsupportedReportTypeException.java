package com.flamingo.reporttable.exception;

/** Exception thrown when an uploaded report is neither HTML nor a JSON report envelope. */
public class UnsupportedReportTypeException extends RuntimeException {

  private final String mediaType;

  public UnsupportedReportTypeException(String mediaType) {
    super("Unsupported report media type: " + mediaType);
    this.mediaType = mediaType;
  }

  public String getMediaType() {
    return mediaType;
  }
}
