package io.b2mash.compliance.view.compile;

import io.b2mash.compliance.view.filter.FilterGroup;
import java.util.List;
import java.util.Map;

/**
 * Stored filter configuration after re-validation: what still applies, in persisted form, and the
 * property ids of what was dropped.
 */
public record SanitizedFilters(
    List<FilterGroup> filterGroups, Map<String, Object> quickFilters, List<String> invalidFilters) {

  public SanitizedFilters {
    filterGroups = filterGroups != null ? List.copyOf(filterGroups) : List.of();
    quickFilters = quickFilters != null ? quickFilters : Map.of();
    invalidFilters = invalidFilters != null ? List.copyOf(invalidFilters) : List.of();
  }

  public boolean isClean() {
    return invalidFilters.isEmpty();
  }
}
