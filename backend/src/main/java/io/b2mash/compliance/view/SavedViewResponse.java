package io.b2mash.compliance.view;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record SavedViewResponse(
    UUID id,
    ViewEntityType entityType,
    String name,
    String description,
    String color,
    List<FilterGroup> filters,
    Map<String, Object> quickFilters,
    String sortBy,
    SortOrder sortOrder,
    List<ColumnConfig> columns,
    int frozenColumnCount,
    ViewMode viewMode,
    String boardGroupBy,
    @JsonProperty("isDefault") boolean isDefault,
    @JsonProperty("isPinned") boolean isPinned,
    @JsonProperty("isShared") boolean isShared,
    ViewVisibility visibility,
    UUID sharedWithTeamId,
    int displayOrder,
    int useCount,
    Instant lastUsedAt,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public static SavedViewResponse from(SavedView v) {
    return new SavedViewResponse(
        v.getId(),
        v.getEntityType(),
        v.getName(),
        v.getDescription(),
        v.getColor(),
        v.getFilters(),
        v.getQuickFilters(),
        v.getSortBy(),
        v.getSortOrder(),
        v.getColumns(),
        v.getFrozenColumnCount(),
        v.getViewMode(),
        v.getBoardGroupBy(),
        v.isDefault(),
        v.isPinned(),
        v.isShared(),
        v.getVisibility(),
        v.getSharedWithTeamId(),
        v.getDisplayOrder(),
        v.getUseCount(),
        v.getLastUsedAt(),
        v.getCreatedBy(),
        v.getCreatedAt(),
        v.getUpdatedAt());
  }
}
