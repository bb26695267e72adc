package io.b2mash.compliance.view.session;

import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ViewEntityType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ad-hoc query against a list page. When {@code viewId} is given the view is applied first and the
 * other components are layered on top of it; null components leave the session state unchanged.
 */
public record ViewQueryRequest(
    @NotNull ViewEntityType entityType,
    UUID viewId,
    boolean autoApplyDefault,
    Map<String, Object> quickFilters,
    List<FilterGroup> filterGroups,
    String sortBy,
    SortOrder sortOrder,
    @Min(1) Integer page,
    @Min(1) Integer pageSize) {}
