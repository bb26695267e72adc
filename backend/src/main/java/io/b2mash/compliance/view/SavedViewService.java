package io.b2mash.compliance.view;

import io.b2mash.compliance.audit.AuditEventBuilder;
import io.b2mash.compliance.audit.AuditEventResponse;
import io.b2mash.compliance.audit.AuditService;
import io.b2mash.compliance.exception.ForbiddenException;
import io.b2mash.compliance.exception.InvalidStateException;
import io.b2mash.compliance.exception.ResourceConflictException;
import io.b2mash.compliance.exception.ResourceNotFoundException;
import io.b2mash.compliance.multitenancy.RequestScopes;
import io.b2mash.compliance.view.compile.FilterCompiler;
import io.b2mash.compliance.view.compile.SanitizedFilters;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.PropertyDescriptor;
import io.b2mash.compliance.view.property.PropertyRegistry;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Saved view store. Every operation is scoped to the organization and member bound in {@link
 * RequestScopes}; views outside the caller's visibility are reported as not found and only the
 * owner may change a view.
 *
 * <p>A member has at most one default view per entity type. Setting a new default clears the
 * previous one in the same transaction; a partial unique index rejects the loser of a concurrent
 * race, which is then retried so the last writer wins.
 */
@Service
public class SavedViewService {

  private static final Logger log = LoggerFactory.getLogger(SavedViewService.class);

  static final String RESOURCE_TYPE = "SavedView";
  private static final String AUDIT_ENTITY_TYPE = "saved_view";
  private static final String COPY_SUFFIX = " (Copy)";

  private final SavedViewRepository savedViewRepository;
  private final PropertyRegistry propertyRegistry;
  private final FilterCompiler filterCompiler;
  private final AuditService auditService;

  public SavedViewService(
      SavedViewRepository savedViewRepository,
      PropertyRegistry propertyRegistry,
      FilterCompiler filterCompiler,
      AuditService auditService) {
    this.savedViewRepository = savedViewRepository;
    this.propertyRegistry = propertyRegistry;
    this.filterCompiler = filterCompiler;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public SavedViewListResponse list(
      ViewEntityType entityType, boolean pinnedOnly, boolean includeShared) {
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();
    Set<UUID> teamIds = RequestScopes.getTeamIds();

    var owned = new ArrayList<SavedViewResponse>();
    var shared = new ArrayList<SavedViewResponse>();
    for (SavedView view : savedViewRepository.findAccessible(orgId, entityType, memberId)) {
      if (pinnedOnly && !view.isPinned()) {
        continue;
      }
      if (view.isOwnedBy(memberId)) {
        owned.add(SavedViewResponse.from(view));
      } else if (includeShared && view.isVisibleTo(memberId, teamIds)) {
        shared.add(SavedViewResponse.from(view));
      }
    }
    return new SavedViewListResponse(owned, shared, owned.size() + shared.size());
  }

  @Transactional(readOnly = true)
  public SavedViewResponse get(UUID id) {
    return SavedViewResponse.from(requireVisible(id));
  }

  @Transactional
  @Retryable(
      retryFor = DataIntegrityViolationException.class,
      maxAttempts = 3,
      backoff = @Backoff(delay = 50))
  public SavedViewResponse create(CreateSavedViewRequest req) {
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();

    requireNoVisibilityGap(req.visibility(), req.sharedWithTeamId());
    validateConfiguration(
        req.entityType(), req.filters(), req.quickFilters(), req.sortBy(), req.boardGroupBy());

    if (savedViewRepository.existsOwnedByName(orgId, memberId, req.entityType(), req.name())) {
      throw ResourceConflictException.duplicateName(req.name(), req.entityType().name());
    }

    var view = new SavedView(orgId, memberId, req.entityType(), req.name());
    view.updateDetails(req.name(), req.description(), req.color());
    view.updateFilters(req.filters(), req.quickFilters());
    view.updateSort(req.sortBy(), req.sortOrder());
    view.updateLayout(
        req.columns(),
        req.frozenColumnCount() != null ? req.frozenColumnCount() : 0,
        req.viewMode(),
        req.boardGroupBy());
    view.updateSharing(req.visibility(), req.sharedWithTeamId());
    view.setPinned(req.isPinned());
    view.setDisplayOrder(savedViewRepository.nextDisplayOrder(orgId, memberId, req.entityType()));

    if (req.isDefault()) {
      savedViewRepository.clearDefaults(orgId, req.entityType(), memberId);
      view.setDefault(true);
    }

    view = savedViewRepository.saveAndFlush(view);

    log.info(
        "Created saved view: id={}, name={}, entityType={}, visibility={}, default={}",
        view.getId(),
        view.getName(),
        view.getEntityType(),
        view.getVisibility(),
        view.isDefault());
    audit("saved_view.created", view, Map.of());

    return SavedViewResponse.from(view);
  }

  @Transactional
  @Retryable(
      retryFor = DataIntegrityViolationException.class,
      maxAttempts = 3,
      backoff = @Backoff(delay = 50))
  public SavedViewResponse update(UUID id, UpdateSavedViewRequest req) {
    var view = requireOwned(id, "update");
    String orgId = view.getOrganizationId();
    UUID memberId = view.getCreatedBy();

    String name = coalesce(req.name(), view.getName());
    List<FilterGroup> filters = coalesce(req.filters(), view.getFilters());
    Map<String, Object> quickFilters = coalesce(req.quickFilters(), view.getQuickFilters());
    String sortBy = coalesce(req.sortBy(), view.getSortBy());
    String boardGroupBy = coalesce(req.boardGroupBy(), view.getBoardGroupBy());
    ViewVisibility visibility = coalesce(req.visibility(), view.getVisibility());
    UUID teamId = coalesce(req.sharedWithTeamId(), view.getSharedWithTeamId());

    requireNoVisibilityGap(visibility, teamId);
    if (req.filters() != null
        || req.quickFilters() != null
        || req.sortBy() != null
        || req.boardGroupBy() != null) {
      validateConfiguration(view.getEntityType(), filters, quickFilters, sortBy, boardGroupBy);
    }
    if (!name.equals(view.getName())
        && savedViewRepository.existsOwnedByNameExcluding(
            orgId, memberId, view.getEntityType(), name, view.getId())) {
      throw ResourceConflictException.duplicateName(name, view.getEntityType().name());
    }

    view.updateDetails(
        name,
        coalesce(req.description(), view.getDescription()),
        coalesce(req.color(), view.getColor()));
    view.updateFilters(filters, quickFilters);
    view.updateSort(sortBy, coalesce(req.sortOrder(), view.getSortOrder()));
    view.updateLayout(
        coalesce(req.columns(), view.getColumns()),
        coalesce(req.frozenColumnCount(), view.getFrozenColumnCount()),
        coalesce(req.viewMode(), view.getViewMode()),
        boardGroupBy);
    view.updateSharing(visibility, teamId);
    if (req.isPinned() != null) {
      view.setPinned(req.isPinned());
    }
    if (req.displayOrder() != null) {
      view.setDisplayOrder(req.displayOrder());
    }
    if (Boolean.TRUE.equals(req.isDefault()) && !view.isDefault()) {
      savedViewRepository.clearDefaultsExcept(
          orgId, view.getEntityType(), memberId, view.getId());
      view.setDefault(true);
    } else if (Boolean.FALSE.equals(req.isDefault())) {
      view.setDefault(false);
    }

    view = savedViewRepository.saveAndFlush(view);

    log.info("Updated saved view: id={}, name={}", view.getId(), view.getName());
    audit("saved_view.updated", view, Map.of());

    return SavedViewResponse.from(view);
  }

  @Transactional
  public void delete(UUID id) {
    var view = requireOwned(id, "delete");

    savedViewRepository.delete(view);

    log.info("Deleted saved view: id={}, name={}", view.getId(), view.getName());
    audit("saved_view.deleted", view, Map.of());
  }

  /**
   * Copies a visible view into a new personal view of the caller. The copy is private, unpinned
   * and never the default.
   */
  @Transactional
  public SavedViewResponse duplicate(UUID id, String name) {
    var source = requireVisible(id);
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();

    String copyName = name != null && !name.isBlank() ? name : source.getName() + COPY_SUFFIX;
    if (savedViewRepository.existsOwnedByName(orgId, memberId, source.getEntityType(), copyName)) {
      throw ResourceConflictException.duplicateName(copyName, source.getEntityType().name());
    }

    var copy = new SavedView(orgId, memberId, source.getEntityType(), copyName);
    copy.updateDetails(copyName, source.getDescription(), source.getColor());
    copy.updateFilters(source.getFilters(), source.getQuickFilters());
    copy.updateSort(source.getSortBy(), source.getSortOrder());
    copy.updateLayout(
        source.getColumns() != null ? List.copyOf(source.getColumns()) : null,
        source.getFrozenColumnCount(),
        source.getViewMode(),
        source.getBoardGroupBy());
    copy.updateSharing(ViewVisibility.PRIVATE, null);
    copy.setDisplayOrder(
        savedViewRepository.nextDisplayOrder(orgId, memberId, source.getEntityType()));

    copy = savedViewRepository.save(copy);

    log.info(
        "Duplicated saved view: sourceId={}, id={}, name={}",
        source.getId(),
        copy.getId(),
        copy.getName());
    audit("saved_view.duplicated", copy, Map.of("sourceId", source.getId().toString()));

    return SavedViewResponse.from(copy);
  }

  /**
   * Returns the configuration to apply for a visible view and records the use. Stored conditions
   * are re-validated against the current property registry; anything that no longer applies is
   * dropped and reported in {@code invalidFilters}.
   */
  @Transactional
  public ApplyViewResponse apply(UUID id) {
    return applyVisible(requireVisible(id));
  }

  /**
   * Same as {@link #apply(UUID)}, for a caller working on one entity type. A view saved for
   * another entity type is reported as not found and its use is not recorded.
   */
  @Transactional
  public ApplyViewResponse apply(UUID id, ViewEntityType entityType) {
    var view = requireVisible(id);
    if (view.getEntityType() != entityType) {
      log.warn(
          "Rejected saved view of other entity type: id={}, viewEntityType={}, entityType={}",
          id,
          view.getEntityType(),
          entityType);
      throw new ResourceNotFoundException(RESOURCE_TYPE, id);
    }
    return applyVisible(view);
  }

  private ApplyViewResponse applyVisible(SavedView view) {
    savedViewRepository.recordUse(view.getId(), Instant.now());

    SanitizedFilters sanitized =
        filterCompiler.sanitize(view.getEntityType(), view.getFilters(), view.getQuickFilters());

    String sortBy = view.getSortBy();
    if (sortBy != null
        && !hasProperty(view.getEntityType(), sortBy, PropertyDescriptor::sortable)) {
      log.warn("Dropping stale sort of saved view: id={}, sortBy={}", view.getId(), sortBy);
      sortBy = null;
    }
    String boardGroupBy = view.getBoardGroupBy();
    if (boardGroupBy != null
        && !hasProperty(view.getEntityType(), boardGroupBy, PropertyDescriptor::groupable)) {
      log.warn(
          "Dropping stale board grouping of saved view: id={}, boardGroupBy={}",
          view.getId(),
          boardGroupBy);
      boardGroupBy = null;
    }

    log.debug(
        "Applied saved view: id={}, invalidFilters={}", view.getId(), sanitized.invalidFilters());
    return new ApplyViewResponse(
        view.getId(),
        view.getEntityType(),
        sanitized.filterGroups(),
        sanitized.quickFilters(),
        sortBy,
        sortBy != null ? view.getSortOrder() : null,
        view.getColumns(),
        view.getFrozenColumnCount(),
        view.getViewMode(),
        boardGroupBy,
        sanitized.invalidFilters());
  }

  /** The caller's own default view for the entity type, if any. */
  @Transactional(readOnly = true)
  public Optional<SavedViewResponse> getDefault(ViewEntityType entityType) {
    return savedViewRepository
        .findDefault(RequestScopes.requireOrgId(), entityType, RequestScopes.requireMemberId())
        .map(SavedViewResponse::from);
  }

  /** Applies new display orders to the caller's own views; ids of other views are ignored. */
  @Transactional
  public List<SavedViewResponse> reorder(ReorderSavedViewsRequest req) {
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();

    Map<UUID, Integer> orders =
        req.items().stream()
            .collect(
                Collectors.toMap(
                    ReorderSavedViewsRequest.Item::id,
                    ReorderSavedViewsRequest.Item::displayOrder,
                    (first, second) -> second,
                    LinkedHashMap::new));
    List<SavedView> owned = savedViewRepository.findOwnedByIds(orgId, memberId, orders.keySet());
    for (SavedView view : owned) {
      view.setDisplayOrder(orders.get(view.getId()));
    }
    savedViewRepository.saveAll(owned);

    log.info("Reordered saved views: memberId={}, count={}", memberId, owned.size());
    return owned.stream().map(SavedViewResponse::from).toList();
  }

  /** Audit trail of a visible view. */
  @Transactional(readOnly = true)
  public List<AuditEventResponse> history(UUID id) {
    var view = requireVisible(id);
    return auditService.findForEntity(view.getId()).stream()
        .map(AuditEventResponse::from)
        .toList();
  }

  private SavedView requireVisible(UUID id) {
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();
    return savedViewRepository
        .findByIdAndOrganizationId(id, orgId)
        .filter(view -> view.isVisibleTo(memberId, RequestScopes.getTeamIds()))
        .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, id));
  }

  private SavedView requireOwned(UUID id, String action) {
    var view = requireVisible(id);
    if (!view.isOwnedBy(RequestScopes.requireMemberId())) {
      throw ForbiddenException.notOwner(RESOURCE_TYPE, id, action);
    }
    return view;
  }

  private void validateConfiguration(
      ViewEntityType entityType,
      List<FilterGroup> filters,
      Map<String, Object> quickFilters,
      String sortBy,
      String boardGroupBy) {
    if (propertyRegistry.moduleConfig(entityType).isEmpty()) {
      throw new InvalidStateException(
          "Unsupported entity type", "No view configuration for " + entityType);
    }
    List<String> invalid = filterCompiler.findInvalidFilters(entityType, filters, quickFilters);
    if (!invalid.isEmpty()) {
      throw InvalidStateException.invalidFilters(invalid);
    }
    if (sortBy != null && !hasProperty(entityType, sortBy, PropertyDescriptor::sortable)) {
      throw new InvalidStateException(
          "Invalid sort", "Property '" + sortBy + "' is not sortable for " + entityType);
    }
    if (boardGroupBy != null
        && !hasProperty(entityType, boardGroupBy, PropertyDescriptor::groupable)) {
      throw new InvalidStateException(
          "Invalid board grouping",
          "Property '" + boardGroupBy + "' cannot group a board for " + entityType);
    }
  }

  private static void requireNoVisibilityGap(ViewVisibility visibility, UUID sharedWithTeamId) {
    if (visibility == ViewVisibility.TEAM && sharedWithTeamId == null) {
      throw new InvalidStateException(
          "Missing team", "Team visibility requires sharedWithTeamId");
    }
  }

  private boolean hasProperty(
      ViewEntityType entityType, String propertyId, Function<PropertyDescriptor, Boolean> flag) {
    return propertyRegistry.lookup(entityType, propertyId).map(flag).orElse(false);
  }

  private void audit(String eventType, SavedView view, Map<String, Object> extra) {
    var details = new LinkedHashMap<String, Object>();
    details.put("name", view.getName());
    details.put("entityType", view.getEntityType().name());
    details.put("visibility", view.getVisibility().name());
    details.putAll(extra);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(AUDIT_ENTITY_TYPE)
            .entityId(view.getId())
            .details(details)
            .build());
  }

  private static <T> T coalesce(T value, T fallback) {
    return value != null ? value : fallback;
  }
}
