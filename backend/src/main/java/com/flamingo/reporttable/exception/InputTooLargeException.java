package com.flamingo.reporttable.exception;

/** Exception thrown when a document exceeds the configured size limit. */
public class InputTooLargeException extends RuntimeException {

  private final long size;
  private final long limit;

  public InputTooLargeException(long size, long limit) {
    super("Document of " + size + " characters exceeds the limit of " + limit);
    this.size = size;
    this.limit = limit;
  }

  public long getSize() {
    return size;
  }

  public long getLimit() {
    return limit;
  }
}
