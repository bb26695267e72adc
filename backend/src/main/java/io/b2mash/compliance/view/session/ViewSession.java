package io.b2mash.compliance.view.session;

import io.b2mash.compliance.exception.InvalidStateException;
import io.b2mash.compliance.view.ApplyViewResponse;
import io.b2mash.compliance.view.ColumnConfig;
import io.b2mash.compliance.view.CreateSavedViewRequest;
import io.b2mash.compliance.view.SavedViewResponse;
import io.b2mash.compliance.view.SavedViewService;
import io.b2mash.compliance.view.UpdateSavedViewRequest;
import io.b2mash.compliance.view.ViewMode;
import io.b2mash.compliance.view.compile.CompiledFilter;
import io.b2mash.compliance.view.compile.FilterCompiler;
import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterCondition;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ModuleViewConfig;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime state of one list page: the active saved view, quick filters, advanced filter groups,
 * sort, layout and paging. Created by {@link ViewSessionFactory}, never persisted.
 *
 * <p>Not thread-safe; a session belongs to a single request or page. Any change to filters, sort
 * or page size moves back to page 1.
 */
public class ViewSession {

  private static final Logger log = LoggerFactory.getLogger(ViewSession.class);

  private final ModuleViewConfig module;
  private final FilterCompiler filterCompiler;
  private final SavedViewService savedViewService;
  private final int maxPageSize;

  private UUID activeViewId;
  private final Map<String, Object> quickFilters = new LinkedHashMap<>();
  private final List<FilterGroup> filterGroups = new ArrayList<>();
  private String sortBy;
  private SortOrder sortOrder;
  private int page = 1;
  private int pageSize;
  private ViewMode viewMode = ViewMode.TABLE;
  private String boardGroupBy;
  private List<ColumnConfig> columns;
  private int frozenColumnCount;

  private List<String> appliedInvalidFilters = List.of();
  private List<String> lastInvalidFilters = List.of();
  private boolean dirty;
  private boolean defaultPending;

  ViewSession(
      ModuleViewConfig module,
      FilterCompiler filterCompiler,
      SavedViewService savedViewService,
      int defaultPageSize,
      int maxPageSize,
      boolean autoApplyDefault) {
    this.module = module;
    this.filterCompiler = filterCompiler;
    this.savedViewService = savedViewService;
    this.pageSize = defaultPageSize;
    this.maxPageSize = maxPageSize;
    this.boardGroupBy = module.defaultBoardGroupBy();
    this.defaultPending = autoApplyDefault;
  }

  // --- Filters ---

  /**
   * Sets or clears ({@code null}, blank or empty list) the quick filter of a property.
   *
   * @throws InvalidStateException if the property is not a quick filter of this module
   */
  public void setQuickFilter(String propertyId, Object value) {
    if (!module.isQuickFilterable(propertyId)) {
      throw new InvalidStateException(
          "Not a quick filter",
          "Property '" + propertyId + "' is not a quick filter of " + module.entityType());
    }
    if (isEmptyValue(value)) {
      quickFilters.remove(propertyId);
    } else {
      quickFilters.put(propertyId, value);
    }
    filtersChanged();
  }

  public void addFilterGroup(FilterGroup group) {
    filterGroups.add(group);
    filtersChanged();
  }

  /** Replaces all advanced filter groups. */
  public void setFilterGroups(List<FilterGroup> groups) {
    filterGroups.clear();
    groups.stream().filter(Objects::nonNull).forEach(filterGroups::add);
    filtersChanged();
  }

  public void removeFilterGroup(String groupId) {
    if (filterGroups.removeIf(group -> Objects.equals(group.id(), groupId))) {
      filtersChanged();
    }
  }

  /** Replaces the condition with the same id in the group, or appends it if absent. */
  public void updateCondition(String groupId, FilterCondition condition) {
    int index = indexOfGroup(groupId);
    FilterGroup group = filterGroups.get(index);
    var conditions = new ArrayList<>(group.conditions());
    boolean replaced = false;
    for (int i = 0; i < conditions.size(); i++) {
      if (Objects.equals(conditions.get(i).id(), condition.id())) {
        conditions.set(i, condition);
        replaced = true;
        break;
      }
    }
    if (!replaced) {
      conditions.add(condition);
    }
    filterGroups.set(index, group.withConditions(conditions));
    filtersChanged();
  }

  public void removeCondition(String groupId, String conditionId) {
    int index = indexOfGroup(groupId);
    FilterGroup group = filterGroups.get(index);
    var remaining =
        group.conditions().stream().filter(c -> !Objects.equals(c.id(), conditionId)).toList();
    filterGroups.set(index, group.withConditions(remaining));
    filtersChanged();
  }

  /** Removes every quick filter and filter group; the active view stays selected. */
  public void clearFilters() {
    quickFilters.clear();
    filterGroups.clear();
    appliedInvalidFilters = List.of();
    filtersChanged();
  }

  // --- Sort, layout and paging ---

  public void setSort(String sortBy, SortOrder sortOrder) {
    this.sortBy = sortBy;
    this.sortOrder = sortOrder;
    dirty = true;
    page = 1;
  }

  /** Switches between table and board; a board without grouping uses the module default. */
  public void setViewMode(ViewMode viewMode, String boardGroupBy) {
    this.viewMode = viewMode != null ? viewMode : ViewMode.TABLE;
    if (this.viewMode == ViewMode.BOARD) {
      this.boardGroupBy = boardGroupBy != null ? boardGroupBy : module.defaultBoardGroupBy();
    }
    dirty = true;
  }

  public void setColumns(List<ColumnConfig> columns, int frozenColumnCount) {
    this.columns = columns != null ? List.copyOf(columns) : null;
    this.frozenColumnCount = frozenColumnCount;
    dirty = true;
  }

  public void setPage(int page) {
    if (page < 1) {
      throw new InvalidStateException("Invalid page", "Page numbers start at 1");
    }
    this.page = page;
  }

  /** Sets the page size, capped at the configured maximum, and moves back to page 1. */
  public void setPageSize(int pageSize) {
    if (pageSize < 1) {
      throw new InvalidStateException("Invalid page size", "Page size must be at least 1");
    }
    this.pageSize = Math.min(pageSize, maxPageSize);
    page = 1;
  }

  // --- Saved views ---

  /**
   * Loads a saved view into the session, replacing filters, sort and layout. Conditions the view
   * stores that no longer validate are dropped and reported by {@link #lastInvalidFilters()}. A
   * view saved for another entity type is rejected as not found.
   */
  public void applyView(UUID viewId) {
    ApplyViewResponse applied = savedViewService.apply(viewId, module.entityType());
    quickFilters.clear();
    quickFilters.putAll(applied.quickFilters());
    filterGroups.clear();
    filterGroups.addAll(applied.filters());
    sortBy = applied.sortBy();
    sortOrder = applied.sortOrder();
    columns = applied.columns();
    frozenColumnCount = applied.frozenColumnCount();
    viewMode = applied.viewMode() != null ? applied.viewMode() : ViewMode.TABLE;
    boardGroupBy =
        applied.boardGroupBy() != null ? applied.boardGroupBy() : module.defaultBoardGroupBy();
    activeViewId = viewId;
    appliedInvalidFilters = applied.invalidFilters();
    lastInvalidFilters = applied.invalidFilters();
    page = 1;
    dirty = false;
    defaultPending = false;
  }

  /**
   * Applies the caller's default view for the entity type, if they have one.
   *
   * @return whether a default view was applied
   */
  public boolean applyDefaultView() {
    defaultPending = false;
    Optional<SavedViewResponse> defaultView = savedViewService.getDefault(module.entityType());
    defaultView.ifPresent(view -> applyView(view.id()));
    return defaultView.isPresent();
  }

  /** Saves the current state as a new view of the caller and makes it the active view. */
  public SavedViewResponse saveCurrentAsView(String name, SaveViewOptions options) {
    SaveViewOptions opts = options != null ? options : SaveViewOptions.personal();
    SavedViewResponse saved =
        savedViewService.create(
            new CreateSavedViewRequest(
                module.entityType(),
                name,
                opts.description(),
                opts.color(),
                List.copyOf(filterGroups),
                new LinkedHashMap<>(quickFilters),
                sortBy,
                sortOrder,
                columns,
                frozenColumnCount,
                viewMode,
                viewMode == ViewMode.BOARD ? boardGroupBy : null,
                opts.isDefault(),
                opts.isPinned(),
                opts.visibility(),
                opts.sharedWithTeamId()));
    activeViewId = saved.id();
    dirty = false;
    log.info("Saved session as view: id={}, entityType={}", saved.id(), module.entityType());
    return saved;
  }

  /** Writes the current filters, sort and layout back to the active view. */
  public SavedViewResponse saveChangesToActiveView() {
    if (activeViewId == null) {
      throw new InvalidStateException("No active view", "Apply or save a view first");
    }
    SavedViewResponse saved =
        savedViewService.update(
            activeViewId,
            new UpdateSavedViewRequest(
                null,
                null,
                null,
                List.copyOf(filterGroups),
                new LinkedHashMap<>(quickFilters),
                sortBy,
                sortOrder,
                columns,
                frozenColumnCount,
                viewMode,
                viewMode == ViewMode.BOARD ? boardGroupBy : null,
                null,
                null,
                null,
                null,
                null));
    dirty = false;
    return saved;
  }

  // --- Query ---

  /**
   * Compiles the current state into a query. On the first call of a session opened with {@code
   * autoApplyDefault}, the caller's default view is applied first unless a view was applied or the
   * filters were changed already.
   */
  public ViewQuery query() {
    if (defaultPending && activeViewId == null && !dirty) {
      applyDefaultView();
    }
    defaultPending = false;
    CompiledFilter compiled =
        filterCompiler.compile(
            module.entityType(), quickFilters, filterGroups, sortBy, sortOrder);
    lastInvalidFilters = merge(appliedInvalidFilters, compiled.invalidFilters());
    return ViewQuery.of(compiled, page, pageSize);
  }

  // --- State ---

  public ViewEntityType entityType() {
    return module.entityType();
  }

  public UUID activeViewId() {
    return activeViewId;
  }

  public Map<String, Object> quickFilters() {
    return Map.copyOf(quickFilters);
  }

  public List<FilterGroup> filterGroups() {
    return List.copyOf(filterGroups);
  }

  public String sortBy() {
    return sortBy;
  }

  public SortOrder sortOrder() {
    return sortOrder;
  }

  public int page() {
    return page;
  }

  public int pageSize() {
    return pageSize;
  }

  public ViewMode viewMode() {
    return viewMode;
  }

  public String boardGroupBy() {
    return boardGroupBy;
  }

  public List<ColumnConfig> columns() {
    return columns;
  }

  public int frozenColumnCount() {
    return frozenColumnCount;
  }

  /** Property ids dropped or pruned by the last apply or query. */
  public List<String> lastInvalidFilters() {
    return lastInvalidFilters;
  }

  /** Whether the state differs from the active view since it was applied or saved. */
  public boolean isDirty() {
    return dirty;
  }

  private void filtersChanged() {
    dirty = true;
    page = 1;
  }

  private int indexOfGroup(String groupId) {
    for (int i = 0; i < filterGroups.size(); i++) {
      if (Objects.equals(filterGroups.get(i).id(), groupId)) {
        return i;
      }
    }
    throw new InvalidStateException("Unknown filter group", "No filter group with id " + groupId);
  }

  private static List<String> merge(List<String> first, List<String> second) {
    var merged = new LinkedHashSet<String>(first);
    merged.addAll(second);
    return List.copyOf(merged);
  }

  private static boolean isEmptyValue(Object value) {
    return value == null
        || (value instanceof String text && text.isBlank())
        || (value instanceof Collection<?> collection && collection.isEmpty());
  }
}
