package io.b2mash.compliance.view;

import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ViewEntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "saved_views")
public class SavedView {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private String organizationId;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_type", nullable = false, updatable = false, length = 30)
  private ViewEntityType entityType;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "description", length = 500)
  private String description;

  @Column(name = "color", length = 20)
  private String color;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "filters", columnDefinition = "jsonb", nullable = false)
  private List<FilterGroup> filters = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "quick_filters", columnDefinition = "jsonb", nullable = false)
  private Map<String, Object> quickFilters = new HashMap<>();

  @Column(name = "sort_by", length = 100)
  private String sortBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "sort_order", length = 4)
  private SortOrder sortOrder;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "columns", columnDefinition = "jsonb")
  private List<ColumnConfig> columns;

  @Column(name = "frozen_column_count", nullable = false)
  private int frozenColumnCount;

  @Enumerated(EnumType.STRING)
  @Column(name = "view_mode", nullable = false, length = 10)
  private ViewMode viewMode = ViewMode.TABLE;

  @Column(name = "board_group_by", length = 100)
  private String boardGroupBy;

  @Column(name = "is_default", nullable = false)
  private boolean isDefault;

  @Column(name = "is_pinned", nullable = false)
  private boolean isPinned;

  @Column(name = "is_shared", nullable = false)
  private boolean isShared;

  @Enumerated(EnumType.STRING)
  @Column(name = "visibility", nullable = false, length = 10)
  private ViewVisibility visibility = ViewVisibility.PRIVATE;

  @Column(name = "shared_with_team_id")
  private UUID sharedWithTeamId;

  @Column(name = "display_order", nullable = false)
  private int displayOrder;

  @Column(name = "use_count", nullable = false)
  private int useCount;

  @Column(name = "last_used_at")
  private Instant lastUsedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SavedView() {}

  public SavedView(
      String organizationId, UUID createdBy, ViewEntityType entityType, String name) {
    this.organizationId = organizationId;
    this.createdBy = createdBy;
    this.entityType = entityType;
    this.name = name;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateDetails(String name, String description, String color) {
    this.name = name;
    this.description = description;
    this.color = color;
    this.updatedAt = Instant.now();
  }

  /** Replaces the advanced filter groups and the quick filters. */
  public void updateFilters(List<FilterGroup> filters, Map<String, Object> quickFilters) {
    this.filters = filters != null ? new ArrayList<>(filters) : new ArrayList<>();
    this.quickFilters = quickFilters != null ? new HashMap<>(quickFilters) : new HashMap<>();
    this.updatedAt = Instant.now();
  }

  public void updateSort(String sortBy, SortOrder sortOrder) {
    this.sortBy = sortBy;
    this.sortOrder = sortOrder;
    this.updatedAt = Instant.now();
  }

  public void updateLayout(
      List<ColumnConfig> columns, int frozenColumnCount, ViewMode viewMode, String boardGroupBy) {
    this.columns = columns;
    this.frozenColumnCount = frozenColumnCount;
    this.viewMode = viewMode != null ? viewMode : ViewMode.TABLE;
    this.boardGroupBy = boardGroupBy;
    this.updatedAt = Instant.now();
  }

  /**
   * Sets who may see the view. {@code PRIVATE} unshares it; {@code TEAM} keeps the team id, any
   * other visibility clears it.
   */
  public void updateSharing(ViewVisibility visibility, UUID sharedWithTeamId) {
    this.visibility = visibility != null ? visibility : ViewVisibility.PRIVATE;
    this.isShared = this.visibility != ViewVisibility.PRIVATE;
    this.sharedWithTeamId = this.visibility == ViewVisibility.TEAM ? sharedWithTeamId : null;
    this.updatedAt = Instant.now();
  }

  public void setDefault(boolean isDefault) {
    this.isDefault = isDefault;
    this.updatedAt = Instant.now();
  }

  public void setPinned(boolean isPinned) {
    this.isPinned = isPinned;
    this.updatedAt = Instant.now();
  }

  public void setDisplayOrder(int displayOrder) {
    this.displayOrder = displayOrder;
    this.updatedAt = Instant.now();
  }

  public boolean isOwnedBy(UUID memberId) {
    return createdBy.equals(memberId);
  }

  /**
   * Whether {@code memberId}, belonging to {@code teamIds}, may see this view. The owner always
   * can; anyone else only if the view is shared and its visibility admits them.
   */
  public boolean isVisibleTo(UUID memberId, Set<UUID> teamIds) {
    if (isOwnedBy(memberId)) {
      return true;
    }
    if (!isShared) {
      return false;
    }
    return switch (visibility) {
      case EVERYONE -> true;
      case TEAM -> sharedWithTeamId != null && teamIds.contains(sharedWithTeamId);
      case PRIVATE -> false;
    };
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public ViewEntityType getEntityType() {
    return entityType;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getColor() {
    return color;
  }

  public List<FilterGroup> getFilters() {
    return filters;
  }

  public Map<String, Object> getQuickFilters() {
    return quickFilters;
  }

  public String getSortBy() {
    return sortBy;
  }

  public SortOrder getSortOrder() {
    return sortOrder;
  }

  public List<ColumnConfig> getColumns() {
    return columns;
  }

  public int getFrozenColumnCount() {
    return frozenColumnCount;
  }

  public ViewMode getViewMode() {
    return viewMode;
  }

  public String getBoardGroupBy() {
    return boardGroupBy;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public boolean isPinned() {
    return isPinned;
  }

  public boolean isShared() {
    return isShared;
  }

  public ViewVisibility getVisibility() {
    return visibility;
  }

  public UUID getSharedWithTeamId() {
    return sharedWithTeamId;
  }

  public int getDisplayOrder() {
    return displayOrder;
  }

  public int getUseCount() {
    return useCount;
  }

  public Instant getLastUsedAt() {
    return lastUsedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
