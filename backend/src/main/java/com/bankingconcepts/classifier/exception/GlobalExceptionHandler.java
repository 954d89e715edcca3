package com.bankingconcepts.classifier.exception;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates analysis and request failures into {@link ErrorResponse} bodies. Every body carries
 * a stable {@code error_code} so clients can branch without parsing messages.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String EMPTY_DATASET = "EMPTY_DATASET";
  static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  static final String VALIDATION_FAILED = "VALIDATION_FAILED";
  static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
  static final String NOT_FOUND = "NOT_FOUND";
  static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
  static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  private static final String FAVICON = "favicon.ico";

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(EmptyDatasetException.class)
  public ResponseEntity<ErrorResponse> handleEmptyDatasetException(
      EmptyDatasetException ex, WebRequest request) {
    log.warn("Rejected dataset: {}", ex.getMessage());
    return respond(error(HttpStatus.BAD_REQUEST, EMPTY_DATASET, ex.getMessage(), request));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return respond(error(HttpStatus.BAD_REQUEST, INVALID_ARGUMENT, ex.getMessage(), request));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> violations = new LinkedHashMap<>();
    for (ObjectError violation : ex.getBindingResult().getAllErrors()) {
      String key =
          violation instanceof FieldError
              ? ((FieldError) violation).getField()
              : violation.getObjectName();
      violations.putIfAbsent(key, violation.getDefaultMessage());
    }
    log.warn("Request validation failed on {}", violations.keySet());

    return respond(
        error(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, "Invalid request data", request)
            .error("Validation Failed")
            .validationErrors(violations));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
    return respond(
        error(HttpStatus.BAD_REQUEST, MALFORMED_REQUEST, "Malformed JSON request", request));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
      ResourceNotFoundException ex, WebRequest request) {
    log.info("Lookup miss: {}", ex.getMessage());
    return respond(error(HttpStatus.NOT_FOUND, NOT_FOUND, ex.getMessage(), request));
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFoundExceptions(Exception ex, WebRequest request) {
    String message;
    if (pathOf(request).contains(FAVICON)) {
      message = "Resource not found";
    } else if (ex instanceof NoHandlerFoundException) {
      NoHandlerFoundException noHandler = (NoHandlerFoundException) ex;
      message =
          String.format("No endpoint %s %s", noHandler.getHttpMethod(), noHandler.getRequestURL());
      log.warn(message);
    } else {
      message = "The requested resource was not found";
      log.warn("{} ({})", message, pathOf(request));
    }
    return respond(error(HttpStatus.NOT_FOUND, NOT_FOUND, message, request));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("{} on {}", message, pathOf(request));
    return respond(error(HttpStatus.METHOD_NOT_ALLOWED, METHOD_NOT_ALLOWED, message, request));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unhandled failure on {}", pathOf(request), ex);
    ErrorResponse.ErrorResponseBuilder body =
        error(
            HttpStatus.INTERNAL_SERVER_ERROR,
            INTERNAL_ERROR,
            "An unexpected error occurred",
            request);
    if (exposeDebugDetails()) {
      body.debugMessage(ex.getMessage());
    }
    return respond(body);
  }

  private boolean exposeDebugDetails() {
    return debugEnabled && !"production".equals(environment);
  }

  private static ErrorResponse.ErrorResponseBuilder error(
      HttpStatus status, String errorCode, String message, WebRequest request) {
    return ErrorResponse.builder()
        .timestamp(LocalDateTime.now())
        .status(status.value())
        .error(status.getReasonPhrase())
        .errorCode(errorCode)
        .message(message)
        .path(pathOf(request));
  }

  private static ResponseEntity<ErrorResponse> respond(ErrorResponse.ErrorResponseBuilder body) {
    ErrorResponse response = body.build();
    return ResponseEntity.status(response.getStatus()).body(response);
  }

  private static String pathOf(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Error body returned by every endpoint")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;

    @JsonProperty("error_code")
    private String errorCode;

    private String message;
    private String path;

    @JsonProperty("validation_errors")
    private Map<String, String> validationErrors;

    @JsonProperty("debug_message")
    private String debugMessage;
  }
}
