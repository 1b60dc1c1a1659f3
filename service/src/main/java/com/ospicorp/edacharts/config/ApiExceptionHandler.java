package com.ospicorp.edacharts.config;

import com.ospicorp.edacharts.chart.model.ChartOperationException;
import com.ospicorp.edacharts.chart.model.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String PROBLEM_BASE = "https://docs.eda-charts.dev/problems/";
  static final String ERROR_DOCS_BASE = "https://docs.eda-charts.dev/errors/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "bad-request",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.PAYLOAD_TOO_LARGE, "payload-too-large",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class,
      HttpMessageNotReadableException.class, HandlerMethodValidationException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      MissingServletRequestPartException.class, MultipartException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ProblemDetail> handleTooLarge(MaxUploadSizeExceededException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.PAYLOAD_TOO_LARGE, ex, request);
  }

  @ExceptionHandler(ChartOperationException.class)
  public ResponseEntity<?> handleChartOperation(ChartOperationException ex,
      HttpServletRequest request) {
    ErrorKind kind = ex.kind();
    if (kind.isValidation()) {
      logException(HttpStatus.BAD_REQUEST, ex, request);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("error", ex.getMessage());
      body.put("errorCode", kind.code());
      body.put("errorKind", kind.name());
      body.put("moreInfo", ERROR_DOCS_BASE + kind.code());
      body.put("path", request.getRequestURI());
      return ResponseEntity.status(HttpStatus.BAD_REQUEST)
          .contentType(MediaType.APPLICATION_JSON)
          .body(body);
    }
    HttpStatus status = kind == ErrorKind.NOT_FOUND
        ? HttpStatus.NOT_FOUND
        : HttpStatus.INTERNAL_SERVER_ERROR;
    ResponseEntity<ProblemDetail> response = buildProblem(status, ex, request);
    response.getBody().setProperty("errorKind", kind.name());
    return response;
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler({ResponseStatusException.class, NoResourceFoundException.class,
      HttpRequestMethodNotSupportedException.class, HttpMediaTypeNotSupportedException.class})
  public ResponseEntity<ProblemDetail> handleErrorResponse(Exception ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    String detailMessage = status.is5xxServerError()
        ? "Unexpected error while processing the request"
        : ex.getMessage();
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, detailMessage);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_BASE
        + TYPE_SLUGS.getOrDefault(status, status.name().toLowerCase(Locale.ROOT))));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_PROBLEM_JSON)
        .body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    if (status.is5xxServerError()) {
      log.error("Request {} {} failed with status {}: {}", request.getMethod(),
          RequestLoggingFilter.describe(request), status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} {} returned status {}: {}", request.getMethod(),
          RequestLoggingFilter.describe(request), status.value(), errorMessage);
    }
  }
}
