package com.ospicorp.netload.config;

import com.ospicorp.netload.load.exception.EmptySystemSetException;
import com.ospicorp.netload.load.exception.InvalidParameterException;
import com.ospicorp.netload.load.exception.JobNotFoundException;
import com.ospicorp.netload.load.exception.LoadDataException;
import com.ospicorp.netload.load.exception.UpstreamUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.UNPROCESSABLE_ENTITY, "empty-system-set",
      HttpStatus.SERVICE_UNAVAILABLE, "upstream-unavailable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(JobNotFoundException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(EmptySystemSetException.class)
  public ResponseEntity<ProblemDetail> handleEmptySystemSet(EmptySystemSetException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
  }

  @ExceptionHandler(UpstreamUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleUpstream(UpstreamUnavailableException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("https://docs.netload-api.dev/problems/" +
        TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    if (ex instanceof LoadDataException loadDataException) {
      detail.setProperty("errorCode", loadDataException.errorCode());
    }
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String method = request.getMethod();
    String uriWithQuery = RequestLoggingFilter.requestUriWithQuery(request);
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} failed with status {}: {}",
          method,
          uriWithQuery,
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} returned status {}: {}",
          method,
          uriWithQuery,
          status.value(),
          errorMessage);
    }
  }
}
