package io.b2mash.compliance.view;

import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Configuration of a saved view as it applies now. Conditions that no longer validate are left out
 * of {@code filters} and {@code quickFilters}; their property ids are listed in {@code
 * invalidFilters}.
 */
public record ApplyViewResponse(
    UUID viewId,
    ViewEntityType entityType,
    List<FilterGroup> filters,
    Map<String, Object> quickFilters,
    String sortBy,
    SortOrder sortOrder,
    List<ColumnConfig> columns,
    int frozenColumnCount,
    ViewMode viewMode,
    String boardGroupBy,
    List<String> invalidFilters) {}
