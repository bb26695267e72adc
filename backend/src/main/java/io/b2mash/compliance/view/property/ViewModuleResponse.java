package io.b2mash.compliance.view.property;

import io.b2mash.compliance.view.operator.Operator;
import io.b2mash.compliance.view.operator.OperatorRegistry;
import io.b2mash.compliance.view.property.ModuleViewConfig.BulkAction;
import io.b2mash.compliance.view.property.ModuleViewConfig.ColumnDefinition;
import io.b2mash.compliance.view.property.ModuleViewConfig.DefaultViewTemplate;
import java.util.List;

/**
 * Module configuration as served to list pages, with the legal operators of every property.
 *
 * @param visibleQuickFilters the quick filters shown up front; the rest sit behind "more filters"
 */
public record ViewModuleResponse(
    ViewEntityType entityType,
    String singularName,
    String pluralName,
    String primaryColumn,
    List<PropertyResponse> properties,
    List<ColumnDefinition> columns,
    List<String> quickFilterProperties,
    List<String> visibleQuickFilters,
    List<String> groupByOptions,
    String defaultBoardGroupBy,
    List<BulkAction> bulkActions,
    List<DefaultViewTemplate> defaultViews) {

  public record PropertyResponse(
      String id,
      String label,
      PropertyType type,
      boolean filterable,
      boolean sortable,
      boolean groupable,
      List<String> options,
      List<Operator> operators) {}

  static ViewModuleResponse from(
      ModuleViewConfig config, OperatorRegistry operatorRegistry, int quickFilterSlots) {
    List<PropertyResponse> properties =
        config.properties().stream()
            .map(
                p ->
                    new PropertyResponse(
                        p.id(),
                        p.label(),
                        p.type(),
                        p.filterable(),
                        p.sortable(),
                        p.groupable(),
                        p.options(),
                        p.filterable() ? operatorRegistry.operatorsFor(p.type()) : List.of()))
            .toList();
    List<String> quickFilters = config.quickFilterProperties();
    return new ViewModuleResponse(
        config.entityType(),
        config.singularName(),
        config.pluralName(),
        config.primaryColumn(),
        properties,
        config.columns(),
        quickFilters,
        quickFilters.subList(0, Math.min(quickFilterSlots, quickFilters.size())),
        config.groupByOptions(),
        config.defaultBoardGroupBy(),
        config.bulkActions(),
        config.defaultViews());
  }
}
