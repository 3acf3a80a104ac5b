package com.attorneyroster.scrape.api;

import com.attorneyroster.scrape.service.ActiveScrapeRunException;
import com.attorneyroster.scrape.service.InvalidJurisdictionConfigException;
import com.attorneyroster.scrape.service.ScrapeRunNotFoundException;
import com.attorneyroster.scrape.service.UnknownJurisdictionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(UnknownJurisdictionException.class)
  public ResponseEntity<Map<String, String>> handleUnknownJurisdiction(UnknownJurisdictionException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_jurisdiction", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidJurisdictionConfigException.class)
  public ResponseEntity<Map<String, String>> handleInvalidConfig(InvalidJurisdictionConfigException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_jurisdiction_config", "message", ex.getMessage()));
  }

  @ExceptionHandler(ScrapeRunNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleRunNotFound(ScrapeRunNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "scrape_run_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScrapeRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_scrape_run", "message", ex.getMessage()));
  }
}
