package io.orion.pms.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(WbsIntegrityException.class)
  public ResponseEntity<ProblemDetail> handleWbsIntegrity(
      WbsIntegrityException ex, HttpServletRequest request) {
    log.warn(
        "WBS integrity failure: path={}, project={}, orphans={}, cycles={}, duplicates={}",
        request.getRequestURI(),
        ex.getProjectId(),
        ex.getOrphanIds().size(),
        ex.getCycleIds().size(),
        ex.getDuplicateIds().size());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(
      ResourceNotFoundException ex, HttpServletRequest request) {
    log.debug("Not found: path={}, detail={}", request.getRequestURI(), ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}
