package com.delta.adinsights.search.api;

import com.delta.adinsights.search.provider.ProviderException;
import com.delta.adinsights.search.service.AllDomainsFailedException;
import com.delta.adinsights.search.service.SearchValidationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AdSearchExceptionHandler {

  @ExceptionHandler(SearchValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(SearchValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "validation_error", "message", ex.getMessage()));
  }

  @ExceptionHandler(AllDomainsFailedException.class)
  public ResponseEntity<Map<String, String>> handleAllFailed(AllDomainsFailedException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "all_domains_failed", "message", ex.getMessage()));
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<Map<String, String>> handleProvider(ProviderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "provider_error", "message", ex.getMessage()));
  }
}
