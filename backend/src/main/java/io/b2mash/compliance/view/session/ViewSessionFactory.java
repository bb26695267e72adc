package io.b2mash.compliance.view.session;

import io.b2mash.compliance.config.ViewsProperties;
import io.b2mash.compliance.exception.InvalidStateException;
import io.b2mash.compliance.view.SavedViewService;
import io.b2mash.compliance.view.compile.FilterCompiler;
import io.b2mash.compliance.view.property.PropertyRegistry;
import io.b2mash.compliance.view.property.ViewEntityType;
import org.springframework.stereotype.Component;

@Component
public class ViewSessionFactory {

  private final PropertyRegistry propertyRegistry;
  private final FilterCompiler filterCompiler;
  private final SavedViewService savedViewService;
  private final ViewsProperties viewsProperties;

  public ViewSessionFactory(
      PropertyRegistry propertyRegistry,
      FilterCompiler filterCompiler,
      SavedViewService savedViewService,
      ViewsProperties viewsProperties) {
    this.propertyRegistry = propertyRegistry;
    this.filterCompiler = filterCompiler;
    this.savedViewService = savedViewService;
    this.viewsProperties = viewsProperties;
  }

  /**
   * Opens a fresh session for a list page.
   *
   * @param autoApplyDefault apply the caller's default view before the first query
   */
  public ViewSession open(ViewEntityType entityType, boolean autoApplyDefault) {
    var module =
        propertyRegistry
            .moduleConfig(entityType)
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Unsupported entity type", "No view configuration for " + entityType));
    return new ViewSession(
        module,
        filterCompiler,
        savedViewService,
        viewsProperties.defaultPageSize(),
        viewsProperties.maxPageSize(),
        autoApplyDefault);
  }
}
