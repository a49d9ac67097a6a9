package com.flamingo.reporttable.exception;

/** Exception thrown when the assignment-group contact mapping cannot be loaded. */
public class ContactMappingException extends RuntimeException {

  public ContactMappingException(String message) {
    super(message);
  }

  public ContactMappingException(String message, Throwable cause) {
    super(message, cause);
  }
}
