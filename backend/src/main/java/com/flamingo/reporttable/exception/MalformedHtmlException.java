package com.flamingo.reporttable.exception;

/** Exception thrown when an HTML document cannot be tokenized. No partial table is produced. */
public class MalformedHtmlException extends RuntimeException {

  private final int offset;

  public MalformedHtmlException(String message, int offset) {
    super(message + " at offset " + offset);
    this.offset = offset;
  }

  /** Character offset in the preprocessed document where tokenizing gave up. */
  public int getOffset() {
    return offset;
  }

  public String getUserMessage() {
    return "The document could not be parsed as HTML";
  }
}
