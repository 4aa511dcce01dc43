package com.shopcrawl.crawl.api;

import com.shopcrawl.crawl.service.CrawlJobNotFoundException;
import com.shopcrawl.crawl.service.CrawlStoreException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(CrawlExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalid(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", "Request body is missing or malformed"));
  }

  @ExceptionHandler(CrawlJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(CrawlJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(CrawlStoreException.class)
  public ResponseEntity<Map<String, String>> handleStore(CrawlStoreException ex) {
    log.warn("Crawl store unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "store_unavailable", "message", ex.getMessage()));
  }
}
