package io.b2mash.compliance.view;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterGroup;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Partial update: every null component leaves the stored value unchanged. */
public record UpdateSavedViewRequest(
    @Size(min = 1, max = 100) String name,
    @Size(max = 500) String description,
    @Size(max = 20) String color,
    List<FilterGroup> filters,
    Map<String, Object> quickFilters,
    @Size(max = 100) String sortBy,
    SortOrder sortOrder,
    List<@Valid ColumnConfig> columns,
    @PositiveOrZero Integer frozenColumnCount,
    ViewMode viewMode,
    @Size(max = 100) String boardGroupBy,
    @JsonProperty("isDefault") Boolean isDefault,
    @JsonProperty("isPinned") Boolean isPinned,
    ViewVisibility visibility,
    UUID sharedWithTeamId,
    Integer displayOrder) {}
