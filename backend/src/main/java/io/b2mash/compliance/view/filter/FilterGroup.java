package io.b2mash.compliance.view.filter;

import java.util.List;

/** A set of conditions that must all match (AND). Groups are OR-combined with each other. */
public record FilterGroup(String id, List<FilterCondition> conditions) {

  public FilterGroup {
    conditions = conditions != null ? List.copyOf(conditions) : List.of();
  }

  public static FilterGroup of(String id, FilterCondition... conditions) {
    return new FilterGroup(id, List.of(conditions));
  }

  public FilterGroup withConditions(List<FilterCondition> newConditions) {
    return new FilterGroup(id, newConditions);
  }
}
