package com.flamingo.reporttable.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MalformedHtmlException.class)
  public ResponseEntity<ApiError> handleMalformedHtml(
      MalformedHtmlException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_html");
    String errorId = generateErrorId();
    log.warn("Malformed HTML [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.MALFORMED_HTML,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ReportFormatException.class)
  public ResponseEntity<ApiError> handleReportFormat(
      ReportFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_report");
    String errorId = generateErrorId();
    log.warn("Invalid report [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.INVALID_REPORT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(UnsupportedReportTypeException.class)
  public ResponseEntity<ApiError> handleUnsupportedReportType(
      UnsupportedReportTypeException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_report_type");
    String errorId = generateErrorId();
    log.warn("Unsupported report type [{}]: {}", errorId, ex.getMediaType());

    return error(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        errorId,
        ApiError.UNSUPPORTED_REPORT_TYPE,
        "Reports must be HTML or a JSON report envelope",
        request);
  }

  @ExceptionHandler(TableExportException.class)
  public ResponseEntity<ApiError> handleTableExport(
      TableExportException ex, HttpServletRequest request) {

    incrementErrorCounter("table_export");
    String errorId = generateErrorId();
    log.error("Table export error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.TABLE_EXPORT_FAILED,
        "Failed to export table",
        request);
  }

  @ExceptionHandler(InputTooLargeException.class)
  public ResponseEntity<ApiError> handleInputTooLarge(
      InputTooLargeException ex, HttpServletRequest request) {

    incrementErrorCounter("input_too_large");
    String errorId = generateErrorId();
    log.warn("Input too large [{}]: {} > {}", errorId, ex.getSize(), ex.getLimit());

    return error(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.INPUT_TOO_LARGE,
        "Document exceeds the maximum of " + ex.getLimit() + " characters",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableMessage(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body could not be read",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
