package io.b2mash.compliance.view.property;

import io.b2mash.compliance.config.ViewsProperties;
import io.b2mash.compliance.exception.ResourceNotFoundException;
import io.b2mash.compliance.view.operator.OperatorRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/view-modules")
public class ViewModuleController {

  private final PropertyRegistry propertyRegistry;
  private final OperatorRegistry operatorRegistry;
  private final ViewsProperties viewsProperties;

  public ViewModuleController(
      PropertyRegistry propertyRegistry,
      OperatorRegistry operatorRegistry,
      ViewsProperties viewsProperties) {
    this.propertyRegistry = propertyRegistry;
    this.operatorRegistry = operatorRegistry;
    this.viewsProperties = viewsProperties;
  }

  @GetMapping("/{entityType}")
  public ResponseEntity<ViewModuleResponse> get(@PathVariable ViewEntityType entityType) {
    var config =
        propertyRegistry
            .moduleConfig(entityType)
            .orElseThrow(() -> new ResourceNotFoundException("ViewModule", entityType));
    return ResponseEntity.ok(
        ViewModuleResponse.from(config, operatorRegistry, viewsProperties.quickFilterSlots()));
  }
}
