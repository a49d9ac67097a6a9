package com.flamingo.reporttable.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String MALFORMED_HTML = "TABLE_001";
  public static final String TABLE_EXPORT_FAILED = "TABLE_002";
  public static final String INVALID_REPORT = "REPORT_001";
  public static final String UNSUPPORTED_REPORT_TYPE = "REPORT_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INPUT_TOO_LARGE = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
