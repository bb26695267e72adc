package io.b2mash.compliance.view.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.compliance.view.ViewFixtures;
import io.b2mash.compliance.view.compile.CompiledFilter;
import io.b2mash.compliance.view.compile.FilterCompiler;
import io.b2mash.compliance.view.compile.SortOrder;
import io.b2mash.compliance.view.filter.FilterCondition;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ViewFilterSqlBuilderTest {

  private final FilterCompiler compiler = ViewFixtures.compiler(ViewFixtures.casesRegistry());
  private final ViewFilterSqlBuilder builder = ViewFilterSqlBuilder.withDefaultHandlers();

  private SqlFilter build(FilterCondition... conditions) {
    return build(Map.of(), List.of(FilterGroup.of("g1", conditions)));
  }

  private SqlFilter build(Map<String, Object> quickFilters, List<FilterGroup> groups) {
    CompiledFilter compiled = compiler.compile(ViewEntityType.CASES, quickFilters, groups);
    return builder.build(compiled);
  }

  @Test
  void emptyFilterMatchesEverythingWithDefaultOrder() {
    var sql = build(Map.of(), List.of());

    assertThat(sql.matchesEverything()).isTrue();
    assertThat(sql.params()).isEmpty();
    assertThat(sql.orderBy()).isEqualTo("updated_at DESC");
  }

  @Test
  void rendersSetMembershipAndEquality() {
    var sql =
        build(
            Map.of("ownerId", "u1"),
            List.of(
                FilterGroup.of(
                    "g1",
                    FilterCondition.of("c1", "status", "is_any_of", List.of("OPEN", "NEW")))));

    assertThat(sql.whereClause()).isEqualTo("status IN (:p0) AND owner_id = :p1");
    assertThat(sql.params())
        .containsEntry("p0", List.of("OPEN", "NEW"))
        .containsEntry("p1", "u1");
  }

  @Test
  void parenthesizesGroupsCombinedWithOr() {
    var groups =
        List.of(
            FilterGroup.of(
                "g1",
                FilterCondition.of("c1", "status", "is", "OPEN"),
                FilterCondition.of("c2", "severity", "is", "HIGH")),
            FilterGroup.of("g2", FilterCondition.presence("c3", "isEscalated", "is_true")));

    var sql = build(Map.of("title", "fraud"), groups);

    assertThat(sql.whereClause())
        .isEqualTo(
            "((status = :p0 AND severity = :p1) OR is_escalated = TRUE)"
                + " AND title ILIKE '%' || :p2 || '%'");
  }

  @Test
  void negationsIncludeNullRows() {
    var sql =
        build(
            FilterCondition.of("c1", "severity", "is_none_of", List.of("LOW")),
            FilterCondition.of("c2", "ownerId", "is_not", "u1"),
            FilterCondition.of("c3", "title", "does_not_contain", "test"));

    assertThat(sql.whereClause())
        .isEqualTo(
            "(severity IS NULL OR severity NOT IN (:p0))"
                + " AND (owner_id IS NULL OR owner_id <> :p1)"
                + " AND (title IS NULL OR title NOT ILIKE '%' || :p2 || '%')");
  }

  @Test
  void escapesLikeWildcardsInSearchText() {
    var sql = build(FilterCondition.of("c1", "title", "starts_with", "50%_off\\"));

    assertThat(sql.whereClause()).isEqualTo("title ILIKE :p0 || '%'");
    assertThat(sql.params()).containsEntry("p0", "50\\%\\_off\\\\");
  }

  @Test
  void comparesDatesWithoutTimeOfDay() {
    var sql = build(FilterCondition.between("c1", "createdAt", "2024-12-31", "2024-01-01"));

    assertThat(sql.whereClause()).isEqualTo("CAST(created_at AS date) BETWEEN :p0 AND :p1");
    assertThat(sql.params())
        .containsEntry("p0", LocalDate.of(2024, 1, 1))
        .containsEntry("p1", LocalDate.of(2024, 12, 31));
  }

  @Test
  void rendersNumericComparisons() {
    var sql =
        build(
            FilterCondition.of("c1", "riskScore", "is_greater_than_or_equal", 40),
            FilterCondition.of("c2", "riskScore", "is_less_than", "80.5"));

    assertThat(sql.whereClause()).isEqualTo("risk_score >= :p0 AND risk_score < :p1");
    assertThat(sql.params())
        .containsEntry("p0", new BigDecimal("40"))
        .containsEntry("p1", new BigDecimal("80.5"));
  }

  @Test
  void rendersRelativeDatesAgainstCurrentDate() {
    var sql =
        build(
            FilterCondition.relative("c1", "createdAt", "is_less_than_n_ago", 3, "month"),
            FilterCondition.relative("c2", "createdAt", "is_more_than_n_ago", 2, "week"));

    assertThat(sql.whereClause())
        .isEqualTo(
            "created_at >= CURRENT_DATE - CAST(:p0 AS interval)"
                + " AND created_at < CURRENT_DATE - CAST(:p1 AS interval)");
    assertThat(sql.params()).containsEntry("p0", "3 months").containsEntry("p1", "2 weeks");
  }

  @Test
  void rendersPresenceChecks() {
    var sql =
        build(
            FilterCondition.presence("c1", "ownerId", "is_known"),
            FilterCondition.presence("c2", "createdAt", "is_unknown"),
            FilterCondition.presence("c3", "isEscalated", "is_false"));

    assertThat(sql.whereClause())
        .isEqualTo("owner_id IS NOT NULL AND created_at IS NULL AND is_escalated = FALSE");
    assertThat(sql.params()).isEmpty();
  }

  @Test
  void ordersByResolvedSortColumn() {
    var compiled =
        compiler.compile(ViewEntityType.CASES, Map.of(), List.of(), "riskScore", SortOrder.ASC);

    assertThat(builder.build(compiled).orderBy()).isEqualTo("risk_score ASC");
  }

  @Test
  void failsWhenNoHandlerSupportsComparison() {
    var textOnly = new ViewFilterSqlBuilder(List.of(new TextFilterHandler()));
    var compiled =
        compiler.compile(
            ViewEntityType.CASES,
            Map.of(),
            List.of(FilterGroup.of("g1", FilterCondition.of("c1", "status", "is", "OPEN"))));

    assertThatThrownBy(() -> textOnly.build(compiled))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("is");
  }
}
