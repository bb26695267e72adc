package io.b2mash.compliance.view;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.compliance.TestcontainersConfiguration;
import io.b2mash.compliance.exception.ResourceNotFoundException;
import io.b2mash.compliance.multitenancy.RequestScopes;
import io.b2mash.compliance.multitenancy.RequestScopes.RequestContext;
import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterCondition;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ViewEntityType;
import io.b2mash.compliance.view.session.SaveViewOptions;
import io.b2mash.compliance.view.session.ViewSessionFactory;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class SavedViewIntegrationTest {

  private static final String ORG_ID = "org_view_test";

  @Autowired private SavedViewService savedViewService;
  @Autowired private SavedViewRepository savedViewRepository;
  @Autowired private ViewSessionFactory sessionFactory;

  private UUID memberId;

  @BeforeEach
  void setUp() {
    memberId = UUID.randomUUID();
  }

  @Test
  void shouldRoundTripFiltersAndLayoutThroughJsonb() {
    var groups =
        List.of(
            FilterGroup.of(
                "g1",
                FilterCondition.of("c1", "status", "is_any_of", List.of("OPEN", "NEW")),
                FilterCondition.between("c2", "riskScore", 20, 80)),
            FilterGroup.of(
                "g2",
                FilterCondition.relative("c3", "createdAt", "is_less_than_n_ago", 3, "month"),
                FilterCondition.presence("c4", "isEscalated", "is_true")));
    var columns =
        List.of(
            new ColumnConfig("title", true, 0, 320), new ColumnConfig("status", true, 1, null));

    var created =
        asMember(
            () ->
                savedViewService.create(
                    new CreateSavedViewRequest(
                        ViewEntityType.CASES,
                        "Escalated risk",
                        null,
                        null,
                        groups,
                        Map.of("ownerId", "u1", "severity", List.of("HIGH")),
                        "riskScore",
                        SortOrder.ASC,
                        columns,
                        1,
                        ViewMode.TABLE,
                        null,
                        false,
                        false,
                        ViewVisibility.PRIVATE,
                        null)));

    var stored =
        savedViewRepository.findByIdAndOrganizationId(created.id(), ORG_ID).orElseThrow();
    assertThat(stored.getFilters()).isEqualTo(groups);
    assertThat(stored.getQuickFilters())
        .containsEntry("ownerId", "u1")
        .containsEntry("severity", List.of("HIGH"));
    assertThat(stored.getColumns()).isEqualTo(columns);
    assertThat(stored.getFrozenColumnCount()).isEqualTo(1);
    assertThat(stored.getSortOrder()).isEqualTo(SortOrder.ASC);
  }

  @Test
  void shouldKeepOneDefaultPerMemberAndEntityType() {
    var first = asMember(() -> savedViewService.create(defaultRequest(ViewEntityType.CASES, "A")));
    var second =
        asMember(() -> savedViewService.create(defaultRequest(ViewEntityType.CASES, "B")));
    var otherModule =
        asMember(() -> savedViewService.create(defaultRequest(ViewEntityType.INVESTIGATIONS, "C")));

    assertThat(savedViewRepository.findDefault(ORG_ID, ViewEntityType.CASES, memberId))
        .map(SavedView::getId)
        .contains(second.id());
    assertThat(savedViewRepository.findById(first.id()).orElseThrow().isDefault()).isFalse();
    assertThat(savedViewRepository.findById(otherModule.id()).orElseThrow().isDefault()).isTrue();
  }

  @Test
  void shouldRejectSecondDefaultWrittenAroundTheService() {
    var first = new SavedView(ORG_ID, memberId, ViewEntityType.CASES, "First");
    first.setDefault(true);
    savedViewRepository.saveAndFlush(first);

    var second = new SavedView(ORG_ID, memberId, ViewEntityType.CASES, "Second");
    second.setDefault(true);

    assertThatThrownBy(() -> savedViewRepository.saveAndFlush(second))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void shouldCountEveryApply() {
    var created =
        asMember(() -> savedViewService.create(defaultRequest(ViewEntityType.CASES, "Used")));

    asMember(() -> savedViewService.apply(created.id()));
    asMember(() -> savedViewService.apply(created.id(), ViewEntityType.CASES));

    var stored = savedViewRepository.findById(created.id()).orElseThrow();
    assertThat(stored.getUseCount()).isEqualTo(2);
    assertThat(stored.getLastUsedAt()).isNotNull();
  }

  @Test
  void shouldRestoreSessionStateFromSavedView() {
    RequestScopes.runScoped(
        context(),
        () -> {
          var original = sessionFactory.open(ViewEntityType.CASES, false);
          original.setQuickFilter("status", List.of("OPEN", "NEW"));
          original.setQuickFilter("ownerId", "u1");
          original.addFilterGroup(
              FilterGroup.of(
                  "g1",
                  FilterCondition.of("c1", "riskScore", "is_greater_than", 50),
                  FilterCondition.between("c2", "createdAt", "2024-01-01", "2024-06-30")));
          original.setSort("riskScore", SortOrder.ASC);
          original.setViewMode(ViewMode.BOARD, "severity");
          var saved = original.saveCurrentAsView("High risk", SaveViewOptions.personal());

          var restored = sessionFactory.open(ViewEntityType.CASES, false);
          restored.applyView(saved.id());

          assertThat(restored.lastInvalidFilters()).isEmpty();
          assertThat(restored.filterGroups()).isEqualTo(original.filterGroups());
          assertThat(restored.quickFilters()).isEqualTo(original.quickFilters());
          assertThat(restored.sortBy()).isEqualTo("riskScore");
          assertThat(restored.sortOrder()).isEqualTo(SortOrder.ASC);
          assertThat(restored.viewMode()).isEqualTo(ViewMode.BOARD);
          assertThat(restored.boardGroupBy()).isEqualTo("severity");
          assertThat(restored.isDirty()).isFalse();
          assertThat(restored.query().filter()).isEqualTo(original.query().filter());
        });
  }

  @Test
  void shouldReportDriftOfStoredFilters() {
    var legacy = new SavedView(ORG_ID, memberId, ViewEntityType.CASES, "Legacy");
    legacy.updateFilters(
        List.of(
            FilterGroup.of(
                "g1",
                FilterCondition.of("c1", "region", "is", "EMEA"),
                FilterCondition.of("c2", "status", "is_any_of", List.of("OPEN", "ARCHIVED")))),
        Map.of());
    legacy = savedViewRepository.saveAndFlush(legacy);
    UUID legacyId = legacy.getId();

    RequestScopes.runScoped(
        context(),
        () -> {
          var session = sessionFactory.open(ViewEntityType.CASES, false);
          session.applyView(legacyId);

          assertThat(session.lastInvalidFilters()).containsExactly("region", "status");
          assertThat(session.filterGroups())
              .singleElement()
              .satisfies(
                  group ->
                      assertThat(group.conditions())
                          .singleElement()
                          .extracting(FilterCondition::value)
                          .isEqualTo(List.of("OPEN")));
          assertThat(session.query().filter().predicate().describe())
              .isEqualTo("status in (OPEN)");
        });
  }

  @Test
  void shouldRefuseViewOfOtherEntityTypeInSession() {
    var casesView =
        asMember(() -> savedViewService.create(defaultRequest(ViewEntityType.CASES, "Cases")));

    RequestScopes.runScoped(
        context(),
        () -> {
          var session = sessionFactory.open(ViewEntityType.INVESTIGATIONS, false);

          assertThatThrownBy(() -> session.applyView(casesView.id()))
              .isInstanceOf(ResourceNotFoundException.class);
          assertThat(session.activeViewId()).isNull();
        });
    assertThat(savedViewRepository.findById(casesView.id()).orElseThrow().getUseCount()).isZero();
  }

  private CreateSavedViewRequest defaultRequest(ViewEntityType entityType, String name) {
    return new CreateSavedViewRequest(
        entityType,
        name,
        null,
        null,
        List.of(),
        Map.of(),
        null,
        null,
        null,
        0,
        ViewMode.TABLE,
        null,
        true,
        false,
        ViewVisibility.PRIVATE,
        null);
  }

  private RequestContext context() {
    return RequestContext.of(ORG_ID, memberId);
  }

  private <T> T asMember(Supplier<T> action) {
    return RequestScopes.callScoped(context(), action);
  }
}
