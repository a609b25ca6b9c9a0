package io.b2mash.taskregistry.eventlog;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RegistryEventController {

  private final RegistryEventLog eventLog;

  public RegistryEventController(RegistryEventLog eventLog) {
    this.eventLog = eventLog;
  }

  @GetMapping("/api/registry/events")
  public ResponseEntity<List<RegistryEventEntry>> listEvents(
      @RequestParam(defaultValue = "0") @Min(0) int page,
      @RequestParam(defaultValue = "50") @Min(1) @Max(200) int size) {
    return ResponseEntity.ok(eventLog.newestFirst(page, size));
  }
}
