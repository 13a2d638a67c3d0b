package io.intellixity.restquery.examples.web;

import io.intellixity.restquery.error.RestQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps the error taxonomy onto {@code {"error": {code, message, details}}} with the code's HTTP status. */
@RestControllerAdvice
public final class RestQueryExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(RestQueryExceptionHandler.class);

  @ExceptionHandler(RestQueryException.class)
  public ResponseEntity<Map<String, Object>> handle(RestQueryException e) {
    if (e.httpStatus() >= 500) {
      log.warn("restquery.examples op=error code={} message={}", e.code().code(), e.getMessage(), e);
    } else {
      log.debug("restquery.examples op=error code={} message={}", e.code().code(), e.getMessage());
    }
    return ResponseEntity.status(e.httpStatus()).body(body(e.code().code(), e.getMessage(), e.details()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handle(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(body("BAD_REQUEST", e.getMessage(), Map.of()));
  }

  private static Map<String, Object> body(String code, String message, Map<String, Object> details) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", code);
    error.put("message", message);
    error.put("details", details);
    return Map.of("error", error);
  }
}
