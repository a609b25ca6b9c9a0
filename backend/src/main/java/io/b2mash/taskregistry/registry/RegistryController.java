package io.b2mash.taskregistry.registry;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.context.RequestScopes;
import io.b2mash.taskregistry.pause.PauseService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/registry")
public class RegistryController {

  private final PauseService pauseService;

  public RegistryController(PauseService pauseService) {
    this.pauseService = pauseService;
  }

  @PostMapping("/pause")
  public ResponseEntity<RegistryStatusResponse> pause() {
    Principal caller = RequestScopes.requireCaller();

    pauseService.pause(caller);
    return ResponseEntity.ok(currentStatus());
  }

  @PostMapping("/resume")
  public ResponseEntity<RegistryStatusResponse> resume() {
    Principal caller = RequestScopes.requireCaller();

    pauseService.resume(caller);
    return ResponseEntity.ok(currentStatus());
  }

  @GetMapping("/status")
  public ResponseEntity<RegistryStatusResponse> status() {
    return ResponseEntity.ok(currentStatus());
  }

  private RegistryStatusResponse currentStatus() {
    return new RegistryStatusResponse(pauseService.owner().value(), pauseService.isPaused());
  }

  // --- DTO ---

  public record RegistryStatusResponse(String owner, boolean paused) {}
}
