package com.bankingconcepts.classifier.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Unit Tests")
class GlobalExceptionHandlerTest {

  @Mock private WebRequest webRequest;

  @Mock private BindingResult bindingResult;

  @InjectMocks private GlobalExceptionHandler exceptionHandler;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(exceptionHandler, "environment", "test");
    ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", false);
  }

  @Nested
  @DisplayName("Client error handling")
  class ClientErrors {

    @Test
    @DisplayName("Should map an empty dataset to 400 with its message")
    void shouldHandleEmptyDataset() {
      when(webRequest.getDescription(false)).thenReturn("uri=/api/analyze/dataset");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleEmptyDatasetException(
              new EmptyDatasetException("Dataset has no rows to analyse"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody()).isNotNull();
      assertThat(response.getBody().getStatus()).isEqualTo(400);
      assertThat(response.getBody().getError()).isEqualTo("Bad Request");
      assertThat(response.getBody().getErrorCode()).isEqualTo("EMPTY_DATASET");
      assertThat(response.getBody().getMessage()).isEqualTo("Dataset has no rows to analyse");
      assertThat(response.getBody().getPath()).isEqualTo("/api/analyze/dataset");
      assertThat(response.getBody().getTimestamp()).isBefore(LocalDateTime.now().plusSeconds(1));
    }

    @Test
    @DisplayName("Should handle IllegalArgumentException with a null message")
    void shouldHandleIllegalArgumentWithNullMessage() {
      when(webRequest.getDescription(false)).thenReturn("uri=/api/test");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleIllegalArgumentException(
              new IllegalArgumentException((String) null), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getMessage()).isNull();
    }

    @Test
    @DisplayName("Should keep the first violation reported for a field")
    void shouldKeepFirstViolationPerField() throws Exception {
      MethodArgumentNotValidException exception =
          new MethodArgumentNotValidException(
              MethodParameter.forExecutable(
                  GlobalExceptionHandlerTest.class.getDeclaredMethod(
                      "parameterHolder", String.class),
                  0),
              bindingResult);
      when(bindingResult.getAllErrors())
          .thenReturn(
              List.of(
                  new FieldError("request", "maxRows", "must be greater than 0"),
                  new FieldError("request", "maxRows", "must not exceed the limit")));
      when(webRequest.getDescription(false)).thenReturn("uri=/api/analyze/dataset");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleValidationExceptions(exception, webRequest);

      assertThat(response.getBody().getValidationErrors())
          .containsExactly(Map.entry("maxRows", "must be greater than 0"));
    }

    @Test
    @DisplayName("Should collect field errors of a failed validation")
    void shouldHandleValidationErrors() throws Exception {
      FieldError columns = new FieldError("request", "columns", "must not be null");
      FieldError maxRows = new FieldError("request", "maxRows", "must be greater than 0");
      MethodArgumentNotValidException exception =
          new MethodArgumentNotValidException(
              MethodParameter.forExecutable(
                  GlobalExceptionHandlerTest.class.getDeclaredMethod(
                      "parameterHolder", String.class),
                  0),
              bindingResult);
      when(bindingResult.getAllErrors()).thenReturn(List.of(columns, maxRows));
      when(webRequest.getDescription(false)).thenReturn("uri=/api/analyze/dataset");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleValidationExceptions(exception, webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getError()).isEqualTo("Validation Failed");
      assertThat(response.getBody().getMessage()).isEqualTo("Invalid request data");
      assertThat(response.getBody().getErrorCode()).isEqualTo("VALIDATION_FAILED");
      assertThat(response.getBody().getValidationErrors())
          .containsEntry("columns", "must not be null")
          .containsEntry("maxRows", "must be greater than 0")
          .hasSize(2);
    }

    @Test
    @DisplayName("Should report malformed JSON without echoing parser details")
    void shouldHandleUnreadableMessage() {
      when(webRequest.getDescription(false)).thenReturn("uri=/api/analyze/dataset");
      HttpMessageNotReadableException exception =
          new HttpMessageNotReadableException(
              "JSON parse error: Unexpected end-of-input",
              new MockHttpInputMessage(new byte[0]));

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleHttpMessageNotReadable(exception, webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getMessage()).isEqualTo("Malformed JSON request");
      assertThat(response.getBody().getErrorCode()).isEqualTo("MALFORMED_REQUEST");
    }

    @Test
    @DisplayName("Should map an unsupported method to 405")
    void shouldHandleMethodNotSupported() {
      when(webRequest.getDescription(false)).thenReturn("uri=/api/concepts");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleHttpRequestMethodNotSupported(
              new HttpRequestMethodNotSupportedException("DELETE"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
      assertThat(response.getBody().getMessage())
          .isEqualTo("Request method 'DELETE' is not supported");
    }
  }

  @Nested
  @DisplayName("Not found handling")
  class NotFound {

    @Test
    @DisplayName("Should map an unknown concept to 404")
    void shouldHandleResourceNotFound() {
      when(webRequest.getDescription(false)).thenReturn("uri=/api/concepts/swift_code");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleResourceNotFoundException(
              new ResourceNotFoundException("Concept not found: swift_code"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("Concept not found: swift_code");
      assertThat(response.getBody().getErrorCode()).isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("Should describe the missing endpoint")
    void shouldHandleNoHandlerFound() {
      when(webRequest.getDescription(false)).thenReturn("uri=/api/missing");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleNotFoundExceptions(
              new NoHandlerFoundException("GET", "/api/missing", new HttpHeaders()), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("No endpoint GET /api/missing");
    }

    @Test
    @DisplayName("Should answer favicon requests with a plain not found")
    void shouldIgnoreFavicon() {
      when(webRequest.getDescription(false)).thenReturn("uri=/favicon.ico");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleNotFoundExceptions(
              new NoResourceFoundException(HttpMethod.GET, "favicon.ico"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("Resource not found");
    }
  }

  @Nested
  @DisplayName("Unexpected error handling")
  class UnexpectedErrors {

    @Test
    @DisplayName("Should hide the exception message by default")
    void shouldHideDebugMessage() {
      when(webRequest.getDescription(false)).thenReturn("uri=/api/analyze/dataset");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(
              new IllegalStateException("registry not loaded"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
      assertThat(response.getBody().getErrorCode()).isEqualTo("INTERNAL_ERROR");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    @DisplayName("Should include the exception message when debugging outside production")
    void shouldIncludeDebugMessage() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);
      when(webRequest.getDescription(false)).thenReturn("uri=/api/analyze/dataset");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(
              new IllegalStateException("registry not loaded"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isEqualTo("registry not loaded");
    }

    @Test
    @DisplayName("Should never include the exception message in production")
    void shouldHideDebugMessageInProduction() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);
      ReflectionTestUtils.setField(exceptionHandler, "environment", "production");
      when(webRequest.getDescription(false)).thenReturn("uri=/api/analyze/dataset");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(
              new IllegalStateException("registry not loaded"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isNull();
    }
  }

  @SuppressWarnings("unused")
  private void parameterHolder(String value) {}
}
