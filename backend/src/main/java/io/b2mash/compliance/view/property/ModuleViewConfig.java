package io.b2mash.compliance.view.property;

import io.b2mash.compliance.view.ViewMode;
import io.b2mash.compliance.view.compile.SortOrder;
import java.util.List;
import java.util.Optional;

/**
 * Per-module view configuration supplied by each business module: column catalogue, property
 * catalogue, quick filters, board grouping, bulk actions and system default views.
 */
public record ModuleViewConfig(
    ViewEntityType entityType,
    String singularName,
    String pluralName,
    String primaryColumn,
    List<PropertyDescriptor> properties,
    List<ColumnDefinition> columns,
    List<String> quickFilterProperties,
    List<String> groupByOptions,
    String defaultBoardGroupBy,
    List<BulkAction> bulkActions,
    List<DefaultViewTemplate> defaultViews) {

  public ModuleViewConfig {
    properties = properties != null ? List.copyOf(properties) : List.of();
    columns = columns != null ? List.copyOf(columns) : List.of();
    quickFilterProperties =
        quickFilterProperties != null ? List.copyOf(quickFilterProperties) : List.of();
    groupByOptions = groupByOptions != null ? List.copyOf(groupByOptions) : List.of();
    bulkActions = bulkActions != null ? List.copyOf(bulkActions) : List.of();
    defaultViews = defaultViews != null ? List.copyOf(defaultViews) : List.of();
  }

  /** Module with only a property catalogue; everything else empty. */
  public static ModuleViewConfig ofProperties(
      ViewEntityType entityType, List<PropertyDescriptor> properties) {
    return new ModuleViewConfig(
        entityType,
        entityType.name(),
        entityType.name(),
        null,
        properties,
        List.of(),
        properties.stream()
            .filter(PropertyDescriptor::filterable)
            .map(PropertyDescriptor::id)
            .toList(),
        properties.stream()
            .filter(PropertyDescriptor::groupable)
            .map(PropertyDescriptor::id)
            .toList(),
        null,
        List.of(),
        List.of());
  }

  public Optional<PropertyDescriptor> property(String propertyId) {
    return properties.stream().filter(p -> p.id().equals(propertyId)).findFirst();
  }

  public boolean isQuickFilterable(String propertyId) {
    return quickFilterProperties.contains(propertyId);
  }

  /** Returns a copy without the given property, as if it had been retired from the module. */
  public ModuleViewConfig withoutProperty(String propertyId) {
    return new ModuleViewConfig(
        entityType,
        singularName,
        pluralName,
        primaryColumn,
        properties.stream().filter(p -> !p.id().equals(propertyId)).toList(),
        columns,
        quickFilterProperties.stream().filter(id -> !id.equals(propertyId)).toList(),
        groupByOptions.stream().filter(id -> !id.equals(propertyId)).toList(),
        propertyId.equals(defaultBoardGroupBy) ? null : defaultBoardGroupBy,
        bulkActions,
        defaultViews);
  }

  public record ColumnDefinition(String key, String label, boolean defaultVisible, Integer width) {}

  public record BulkAction(String id, String label, boolean destructive) {}

  public record DefaultViewTemplate(
      String name,
      String description,
      List<String> columns,
      String sortBy,
      SortOrder sortOrder,
      ViewMode viewMode,
      String boardGroupBy) {}
}
