package io.b2mash.compliance.view;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.compliance.audit.AuditEventRecord;
import io.b2mash.compliance.audit.AuditService;
import io.b2mash.compliance.exception.ForbiddenException;
import io.b2mash.compliance.exception.InvalidStateException;
import io.b2mash.compliance.exception.ResourceConflictException;
import io.b2mash.compliance.exception.ResourceNotFoundException;
import io.b2mash.compliance.multitenancy.RequestScopes;
import io.b2mash.compliance.multitenancy.RequestScopes.RequestContext;
import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterCondition;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class SavedViewServiceTest {

  private static final String ORG_ID = "org_test";
  private static final UUID OWNER = UUID.randomUUID();
  private static final UUID OTHER = UUID.randomUUID();
  private static final UUID TEAM = UUID.randomUUID();
  private static final ViewEntityType CASES = ViewEntityType.CASES;

  @Mock private SavedViewRepository savedViewRepository;
  @Mock private AuditService auditService;

  private SavedViewService service;

  @BeforeEach
  void setUp() {
    var registry = ViewFixtures.casesRegistry();
    service =
        new SavedViewService(
            savedViewRepository, registry, ViewFixtures.compiler(registry), auditService);
  }

  // --- create ---

  @Test
  void create_personalView_persistsAndAudits() {
    stubSaveAndFlush();

    var response =
        asOwner(
            () ->
                service.create(
                    createRequest(
                        "Open cases", List.of(statusGroup("OPEN")), false, null, null)));

    assertThat(response.id()).isNotNull();
    assertThat(response.name()).isEqualTo("Open cases");
    assertThat(response.createdBy()).isEqualTo(OWNER);
    assertThat(response.visibility()).isEqualTo(ViewVisibility.PRIVATE);
    assertThat(response.isShared()).isFalse();
    assertThat(response.isDefault()).isFalse();
    verify(savedViewRepository, never()).clearDefaults(anyString(), any(), any());

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("saved_view.created");
    assertThat(captor.getValue().entityType()).isEqualTo("saved_view");
    assertThat(captor.getValue().entityId()).isEqualTo(response.id());
  }

  @Test
  void create_asDefault_clearsPreviousDefaultBeforeSaving() {
    stubSaveAndFlush();

    var response =
        asOwner(() -> service.create(createRequest("Mine", List.of(), true, null, null)));

    assertThat(response.isDefault()).isTrue();
    var order = inOrder(savedViewRepository);
    order.verify(savedViewRepository).clearDefaults(ORG_ID, CASES, OWNER);
    order.verify(savedViewRepository).saveAndFlush(any(SavedView.class));
  }

  @Test
  void create_everyoneVisibility_marksViewShared() {
    stubSaveAndFlush();

    var response =
        asOwner(
            () ->
                service.create(
                    createRequest("Team board", List.of(), false, ViewVisibility.EVERYONE, null)));

    assertThat(response.isShared()).isTrue();
    assertThat(response.sharedWithTeamId()).isNull();
  }

  @Test
  void create_invalidFilters_rejectedWithOffendingProperties() {
    var groups =
        List.of(
            FilterGroup.of(
                "g1",
                FilterCondition.of("c1", "region", "is", "EMEA"),
                FilterCondition.of("c2", "status", "contains", "OP")));

    assertThatThrownBy(
            () -> asOwner(() -> service.create(createRequest("Bad", groups, false, null, null))))
        .isInstanceOf(InvalidStateException.class)
        .satisfies(
            ex ->
                assertThat(((InvalidStateException) ex).getBody().getProperties())
                    .containsEntry("invalidFilters", List.of("region", "status")));
    verify(savedViewRepository, never()).saveAndFlush(any());
  }

  @Test
  void create_nonSortableSort_rejected() {
    var request =
        new CreateSavedViewRequest(
            CASES, "By description", null, null, List.of(), Map.of(), "description",
            SortOrder.ASC, null, null, null, null, false, false, null, null);

    assertThatThrownBy(() -> asOwner(() -> service.create(request)))
        .isInstanceOf(InvalidStateException.class)
        .satisfies(
            ex ->
                assertThat(((InvalidStateException) ex).getBody().getTitle())
                    .isEqualTo("Invalid sort"));
  }

  @Test
  void create_nonGroupableBoardGrouping_rejected() {
    var request =
        new CreateSavedViewRequest(
            CASES, "Board", null, null, List.of(), Map.of(), null, null, null, null,
            ViewMode.BOARD, "riskScore", false, false, null, null);

    assertThatThrownBy(() -> asOwner(() -> service.create(request)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void create_duplicateName_conflicts() {
    when(savedViewRepository.existsOwnedByName(ORG_ID, OWNER, CASES, "Open cases"))
        .thenReturn(true);

    var request = createRequest("Open cases", List.of(), false, null, null);

    assertThatThrownBy(() -> asOwner(() -> service.create(request)))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void create_teamVisibilityWithoutTeam_rejected() {
    assertThatThrownBy(
            () ->
                asOwner(
                    () ->
                        service.create(
                            createRequest("Team", List.of(), false, ViewVisibility.TEAM, null))))
        .isInstanceOf(InvalidStateException.class);
  }

  // --- visibility ---

  @Test
  void get_privateViewOfAnotherMember_notFound() {
    var view = stored(OTHER, "Theirs");

    assertThatThrownBy(() -> asOwner(() -> service.get(view.getId())))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void get_teamViewVisibleToTeamMember() {
    var view = stored(OTHER, "Team cases");
    view.updateSharing(ViewVisibility.TEAM, TEAM);

    var response =
        RequestScopes.callScoped(
            new RequestContext(ORG_ID, OWNER, "member", Set.of(TEAM)),
            () -> service.get(view.getId()));

    assertThat(response.name()).isEqualTo("Team cases");
  }

  @Test
  void get_teamViewHiddenFromOtherTeams() {
    var view = stored(OTHER, "Team cases");
    view.updateSharing(ViewVisibility.TEAM, TEAM);

    assertThatThrownBy(() -> asOwner(() -> service.get(view.getId())))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void list_splitsOwnedAndSharedViews() {
    var own = unsaved(OWNER, "Mine");
    var everyone = unsaved(OTHER, "Everyone");
    everyone.updateSharing(ViewVisibility.EVERYONE, null);
    var otherTeam = unsaved(OTHER, "Other team");
    otherTeam.updateSharing(ViewVisibility.TEAM, UUID.randomUUID());
    when(savedViewRepository.findAccessible(ORG_ID, CASES, OWNER))
        .thenReturn(List.of(own, everyone, otherTeam));

    var response = asOwner(() -> service.list(CASES, false, true));

    assertThat(response.owned()).extracting(SavedViewResponse::name).containsExactly("Mine");
    assertThat(response.shared()).extracting(SavedViewResponse::name).containsExactly("Everyone");
    assertThat(response.total()).isEqualTo(2);
  }

  @Test
  void list_pinnedOnlyWithoutShared() {
    var pinned = unsaved(OWNER, "Pinned");
    pinned.setPinned(true);
    var unpinned = unsaved(OWNER, "Unpinned");
    var everyone = unsaved(OTHER, "Everyone");
    everyone.updateSharing(ViewVisibility.EVERYONE, null);
    everyone.setPinned(true);
    when(savedViewRepository.findAccessible(ORG_ID, CASES, OWNER))
        .thenReturn(List.of(pinned, unpinned, everyone));

    var response = asOwner(() -> service.list(CASES, true, false));

    assertThat(response.owned()).extracting(SavedViewResponse::name).containsExactly("Pinned");
    assertThat(response.shared()).isEmpty();
  }

  // --- update / delete ---

  @Test
  void update_sharedViewOfAnotherMember_forbidden() {
    var view = stored(OTHER, "Shared");
    view.updateSharing(ViewVisibility.EVERYONE, null);

    assertThatThrownBy(() -> asOwner(() -> service.update(view.getId(), patchName("Mine now"))))
        .isInstanceOf(ForbiddenException.class);
    verify(savedViewRepository, never()).saveAndFlush(any());
  }

  @Test
  void update_partialPatch_keepsOtherFields() {
    var view = stored(OWNER, "Open cases");
    view.updateFilters(List.of(statusGroup("OPEN")), Map.of("ownerId", "u1"));
    view.updateSort("riskScore", SortOrder.ASC);
    stubSaveAndFlush();

    var response = asOwner(() -> service.update(view.getId(), patchName("Renamed")));

    assertThat(response.name()).isEqualTo("Renamed");
    assertThat(response.filters()).isEqualTo(List.of(statusGroup("OPEN")));
    assertThat(response.quickFilters()).containsEntry("ownerId", "u1");
    assertThat(response.sortBy()).isEqualTo("riskScore");
    assertThat(response.sortOrder()).isEqualTo(SortOrder.ASC);
  }

  @Test
  void update_makeDefault_clearsOtherDefaults() {
    var view = stored(OWNER, "Open cases");
    stubSaveAndFlush();
    var patch =
        new UpdateSavedViewRequest(
            null, null, null, null, null, null, null, null, null, null, null, true, null, null,
            null, null);

    var response = asOwner(() -> service.update(view.getId(), patch));

    assertThat(response.isDefault()).isTrue();
    verify(savedViewRepository).clearDefaultsExcept(ORG_ID, CASES, OWNER, view.getId());
  }

  @Test
  void update_renameToExistingName_conflicts() {
    var view = stored(OWNER, "Open cases");
    when(savedViewRepository.existsOwnedByNameExcluding(
            ORG_ID, OWNER, CASES, "Closed cases", view.getId()))
        .thenReturn(true);

    assertThatThrownBy(
            () -> asOwner(() -> service.update(view.getId(), patchName("Closed cases"))))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void delete_byOwner_deletesAndAudits() {
    var view = stored(OWNER, "Old");

    asOwner(
        () -> {
          service.delete(view.getId());
          return null;
        });

    verify(savedViewRepository).delete(view);
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("saved_view.deleted");
  }

  // --- duplicate / apply / reorder ---

  @Test
  void duplicate_sharedView_createsPrivateCopyOwnedByCaller() {
    var source = stored(OTHER, "Escalations");
    source.updateSharing(ViewVisibility.EVERYONE, null);
    source.updateFilters(List.of(statusGroup("OPEN")), Map.of());
    source.setDefault(true);
    when(savedViewRepository.save(any(SavedView.class)))
        .thenAnswer(invocation -> withId(invocation.getArgument(0)));

    var copy = asOwner(() -> service.duplicate(source.getId(), null));

    assertThat(copy.name()).isEqualTo("Escalations (Copy)");
    assertThat(copy.createdBy()).isEqualTo(OWNER);
    assertThat(copy.visibility()).isEqualTo(ViewVisibility.PRIVATE);
    assertThat(copy.isDefault()).isFalse();
    assertThat(copy.filters()).isEqualTo(source.getFilters());
    assertThat(copy.id()).isNotEqualTo(source.getId());
  }

  @Test
  void apply_dropsStaleConfigurationAndRecordsUse() {
    var view = stored(OWNER, "Legacy");
    view.updateFilters(
        List.of(
            FilterGroup.of(
                "g1",
                FilterCondition.of("c1", "status", "is_any_of", List.of("OPEN")),
                FilterCondition.of("c2", "region", "is", "EMEA"))),
        Map.of("severity", "HIGH"));
    view.updateSort("description", SortOrder.ASC);
    view.updateLayout(null, 0, ViewMode.BOARD, "riskScore");

    var applied = asOwner(() -> service.apply(view.getId()));

    assertThat(applied.viewId()).isEqualTo(view.getId());
    assertThat(applied.filters().get(0).conditions())
        .extracting(FilterCondition::propertyId)
        .containsExactly("status");
    assertThat(applied.quickFilters()).containsEntry("severity", "HIGH");
    assertThat(applied.invalidFilters()).containsExactly("region");
    assertThat(applied.sortBy()).isNull();
    assertThat(applied.sortOrder()).isNull();
    assertThat(applied.boardGroupBy()).isNull();
    verify(savedViewRepository).recordUse(eq(view.getId()), any(Instant.class));
  }

  @Test
  void apply_matchingEntityType_returnsViewEntityType() {
    var view = stored(OWNER, "Open");
    view.updateFilters(List.of(statusGroup("OPEN")), Map.of());

    var applied = asOwner(() -> service.apply(view.getId(), CASES));

    assertThat(applied.entityType()).isEqualTo(CASES);
    assertThat(applied.filters()).containsExactly(statusGroup("OPEN"));
    assertThat(applied.invalidFilters()).isEmpty();
    verify(savedViewRepository).recordUse(eq(view.getId()), any(Instant.class));
  }

  @Test
  void apply_viewOfOtherEntityType_notFoundAndUseNotRecorded() {
    var view = stored(OWNER, "Cases only");

    assertThatThrownBy(
            () -> asOwner(() -> service.apply(view.getId(), ViewEntityType.INVESTIGATIONS)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(savedViewRepository, never()).recordUse(any(), any());
  }

  @Test
  void getDefault_withoutDefault_isEmpty() {
    when(savedViewRepository.findDefault(ORG_ID, CASES, OWNER)).thenReturn(Optional.empty());

    assertThat(asOwner(() -> service.getDefault(CASES))).isEmpty();
  }

  @Test
  void reorder_updatesOnlyOwnedViews() {
    var own = stored(OWNER, "Mine");
    UUID foreignId = UUID.randomUUID();
    when(savedViewRepository.findOwnedByIds(eq(ORG_ID), eq(OWNER), any()))
        .thenReturn(List.of(own));

    var result =
        asOwner(
            () ->
                service.reorder(
                    new ReorderSavedViewsRequest(
                        List.of(
                            new ReorderSavedViewsRequest.Item(own.getId(), 5),
                            new ReorderSavedViewsRequest.Item(foreignId, 1)))));

    assertThat(result).singleElement().extracting(SavedViewResponse::displayOrder).isEqualTo(5);
  }

  // --- helpers ---

  private static <T> T asOwner(Supplier<T> action) {
    return RequestScopes.callScoped(RequestContext.of(ORG_ID, OWNER), action);
  }

  private void stubSaveAndFlush() {
    when(savedViewRepository.saveAndFlush(any(SavedView.class)))
        .thenAnswer(invocation -> withId(invocation.getArgument(0)));
  }

  private static SavedView withId(SavedView view) {
    if (view.getId() == null) {
      ReflectionTestUtils.setField(view, "id", UUID.randomUUID());
    }
    return view;
  }

  private static SavedView unsaved(UUID owner, String name) {
    return withId(new SavedView(ORG_ID, owner, CASES, name));
  }

  private SavedView stored(UUID owner, String name) {
    var view = unsaved(owner, name);
    when(savedViewRepository.findByIdAndOrganizationId(view.getId(), ORG_ID))
        .thenReturn(Optional.of(view));
    return view;
  }

  private static FilterGroup statusGroup(String status) {
    return FilterGroup.of("g1", FilterCondition.of("c1", "status", "is", status));
  }

  private static CreateSavedViewRequest createRequest(
      String name,
      List<FilterGroup> filters,
      boolean isDefault,
      ViewVisibility visibility,
      UUID teamId) {
    return new CreateSavedViewRequest(
        CASES, name, null, null, filters, Map.of(), null, null, null, null, null, null, isDefault,
        false, visibility, teamId);
  }

  private static UpdateSavedViewRequest patchName(String name) {
    return new UpdateSavedViewRequest(
        name, null, null, null, null, null, null, null, null, null, null, null, null, null, null,
        null);
  }
}
