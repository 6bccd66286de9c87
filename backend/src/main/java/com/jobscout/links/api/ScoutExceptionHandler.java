package com.jobscout.links.api;

import com.jobscout.links.service.ActiveScrapeRunException;
import com.jobscout.links.service.TargetListUnavailableException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScoutExceptionHandler {

  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScrapeRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of(
            "error", "active_scrape_run",
            "message", ex.getMessage(),
            "activeSince", String.valueOf(ex.getActiveSince())));
  }

  @ExceptionHandler(TargetListUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleTargetList(TargetListUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "target_list_unavailable", "message", ex.getMessage()));
  }
}
