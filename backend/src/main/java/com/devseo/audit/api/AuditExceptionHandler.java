package com.devseo.audit.api;

import com.devseo.audit.pipeline.AuditNotFoundException;
import com.devseo.audit.pipeline.InsufficientCreditsException;
import com.devseo.audit.pipeline.InvalidAuditUrlException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AuditExceptionHandler {

  @ExceptionHandler(AuditNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(AuditNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "audit_not_found", "message", "Audit not found"));
  }

  @ExceptionHandler(InsufficientCreditsException.class)
  public ResponseEntity<Map<String, String>> handleInsufficientCredits(InsufficientCreditsException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "insufficient_credits", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidAuditUrlException.class)
  public ResponseEntity<Map<String, String>> handleInvalidUrl(InvalidAuditUrlException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_url", "message", ex.getMessage()));
  }
}
