package io.b2mash.compliance.view.property;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Declares, per entity type, which properties exist and how they may be used. Built once at
 * startup from configuration and never mutated afterwards, so it is shared freely across requests.
 *
 * <p>Lookups of unknown properties return empty rather than throwing: an unknown property is a
 * validation outcome for the filter compiler, not an error here.
 */
public class PropertyRegistry {

  /** SQL columns are spliced into generated SQL, so only plain identifiers are accepted. */
  private static final Pattern SAFE_COLUMN =
      Pattern.compile("[a-z_][a-z0-9_]*(\\.[a-z_][a-z0-9_]*)?");

  private final Map<ViewEntityType, ModuleViewConfig> modules;

  public PropertyRegistry(Collection<ModuleViewConfig> moduleConfigs) {
    var byType = new EnumMap<ViewEntityType, ModuleViewConfig>(ViewEntityType.class);
    for (ModuleViewConfig config : moduleConfigs) {
      validate(config);
      if (byType.put(config.entityType(), config) != null) {
        throw new IllegalStateException(
            "Duplicate view module config for " + config.entityType());
      }
    }
    this.modules = byType;
  }

  /** All properties of the entity type; empty for an unconfigured type. */
  public List<PropertyDescriptor> describe(ViewEntityType entityType) {
    var config = modules.get(entityType);
    return config != null ? config.properties() : List.of();
  }

  public Optional<PropertyDescriptor> lookup(ViewEntityType entityType, String propertyId) {
    if (propertyId == null) {
      return Optional.empty();
    }
    var config = modules.get(entityType);
    return config != null ? config.property(propertyId) : Optional.empty();
  }

  public Optional<ModuleViewConfig> moduleConfig(ViewEntityType entityType) {
    return Optional.ofNullable(modules.get(entityType));
  }

  public Collection<ViewEntityType> entityTypes() {
    return modules.keySet();
  }

  private static void validate(ModuleViewConfig config) {
    var seen = new HashSet<String>();
    for (PropertyDescriptor descriptor : config.properties()) {
      if (!seen.add(descriptor.id())) {
        throw new IllegalStateException(
            "Duplicate property '" + descriptor.id() + "' in " + config.entityType());
      }
      if (!SAFE_COLUMN.matcher(descriptor.column()).matches()) {
        throw new IllegalStateException(
            "Illegal column '"
                + descriptor.column()
                + "' for property "
                + config.entityType()
                + "."
                + descriptor.id());
      }
    }
    for (String quickFilter : config.quickFilterProperties()) {
      if (!seen.contains(quickFilter)) {
        throw new IllegalStateException(
            "Quick filter '" + quickFilter + "' is not a property of " + config.entityType());
      }
    }
  }
}
