package io.b2mash.compliance.config;

import io.b2mash.compliance.view.property.ModuleViewConfig;
import io.b2mash.compliance.view.property.ModuleViewConfig.BulkAction;
import io.b2mash.compliance.view.property.ModuleViewConfig.ColumnDefinition;
import io.b2mash.compliance.view.property.ModuleViewConfig.DefaultViewTemplate;
import io.b2mash.compliance.view.property.PropertyDescriptor;
import io.b2mash.compliance.view.property.PropertyType;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Saved view engine configuration, bound from {@code views.*}.
 *
 * @param defaultPageSize page size of a fresh view session
 * @param maxPageSize upper bound accepted by {@code setPageSize}
 * @param quickFilterSlots number of quick-filter controls shown before "more filters"
 * @param modules per-module view configuration, keyed by entity type
 */
@ConfigurationProperties(prefix = "views")
public record ViewsProperties(
    @DefaultValue("25") int defaultPageSize,
    @DefaultValue("100") int maxPageSize,
    @DefaultValue("4") int quickFilterSlots,
    Map<ViewEntityType, ModuleProperties> modules) {

  public ViewsProperties {
    modules = modules != null ? Map.copyOf(modules) : Map.of();
  }

  public List<ModuleViewConfig> toModuleConfigs() {
    return modules.entrySet().stream()
        .map(entry -> entry.getValue().toModuleConfig(entry.getKey()))
        .toList();
  }

  public record ModuleProperties(
      String singular,
      String plural,
      String primaryColumn,
      List<PropertyProperties> properties,
      List<ColumnDefinition> columns,
      List<String> quickFilterProperties,
      String defaultBoardGroupBy,
      List<BulkAction> bulkActions,
      List<DefaultViewTemplate> defaultViews) {

    ModuleViewConfig toModuleConfig(ViewEntityType entityType) {
      List<PropertyDescriptor> descriptors =
          properties != null
              ? properties.stream().map(PropertyProperties::toDescriptor).toList()
              : List.of();
      return new ModuleViewConfig(
          entityType,
          singular != null ? singular : entityType.name(),
          plural != null ? plural : entityType.name(),
          primaryColumn,
          descriptors,
          columns,
          quickFilterProperties != null
              ? quickFilterProperties
              : descriptors.stream()
                  .filter(PropertyDescriptor::filterable)
                  .map(PropertyDescriptor::id)
                  .toList(),
          descriptors.stream()
              .filter(PropertyDescriptor::groupable)
              .map(PropertyDescriptor::id)
              .toList(),
          defaultBoardGroupBy,
          bulkActions,
          defaultViews);
    }
  }

  public record PropertyProperties(
      String id,
      String label,
      PropertyType type,
      @DefaultValue("true") boolean filterable,
      @DefaultValue("true") boolean sortable,
      @DefaultValue("false") boolean groupable,
      String column,
      List<String> options) {

    PropertyDescriptor toDescriptor() {
      return new PropertyDescriptor(
          id, label, type, filterable, sortable, groupable, column, options);
    }
  }
}
