package io.b2mash.compliance.view;

import io.b2mash.compliance.audit.AuditEventResponse;
import io.b2mash.compliance.view.property.ViewEntityType;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/views")
public class SavedViewController {

  private final SavedViewService savedViewService;

  public SavedViewController(SavedViewService savedViewService) {
    this.savedViewService = savedViewService;
  }

  @GetMapping
  public ResponseEntity<SavedViewListResponse> list(
      @RequestParam ViewEntityType entityType,
      @RequestParam(defaultValue = "false") boolean pinnedOnly,
      @RequestParam(defaultValue = "true") boolean includeShared) {
    return ResponseEntity.ok(savedViewService.list(entityType, pinnedOnly, includeShared));
  }

  @GetMapping("/default")
  public ResponseEntity<SavedViewResponse> getDefault(@RequestParam ViewEntityType entityType) {
    return savedViewService
        .getDefault(entityType)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping("/{id}")
  public ResponseEntity<SavedViewResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(savedViewService.get(id));
  }

  @GetMapping("/{id}/history")
  public ResponseEntity<List<AuditEventResponse>> history(@PathVariable UUID id) {
    return ResponseEntity.ok(savedViewService.history(id));
  }

  @PostMapping
  public ResponseEntity<SavedViewResponse> create(
      @Valid @RequestBody CreateSavedViewRequest request) {
    var response = savedViewService.create(request);
    return ResponseEntity.created(URI.create("/api/views/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<SavedViewResponse> update(
      @PathVariable UUID id, @Valid @RequestBody UpdateSavedViewRequest request) {
    return ResponseEntity.ok(savedViewService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    savedViewService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/duplicate")
  public ResponseEntity<SavedViewResponse> duplicate(
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) DuplicateSavedViewRequest request) {
    var response = savedViewService.duplicate(id, request != null ? request.name() : null);
    return ResponseEntity.created(URI.create("/api/views/" + response.id())).body(response);
  }

  @PostMapping("/{id}/apply")
  public ResponseEntity<ApplyViewResponse> apply(@PathVariable UUID id) {
    return ResponseEntity.ok(savedViewService.apply(id));
  }

  @PutMapping("/reorder")
  public ResponseEntity<List<SavedViewResponse>> reorder(
      @Valid @RequestBody ReorderSavedViewsRequest request) {
    return ResponseEntity.ok(savedViewService.reorder(request));
  }
}
