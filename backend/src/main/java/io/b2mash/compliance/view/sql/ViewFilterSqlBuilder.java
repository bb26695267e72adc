package io.b2mash.compliance.view.sql;

import io.b2mash.compliance.view.compile.CompiledFilter;
import io.b2mash.compliance.view.compile.FilterPredicate;
import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import io.b2mash.compliance.view.compile.SortSpec;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Translates a {@link CompiledFilter} into a parameterized SQL WHERE clause and ORDER BY
 * expression. Column names come from property descriptors, never from request input; every value
 * is passed as a named bind parameter.
 */
@Service
public class ViewFilterSqlBuilder {

  static final String DEFAULT_ORDER_BY = "updated_at DESC";

  private final List<FilterSqlHandler> handlers;

  public ViewFilterSqlBuilder(List<FilterSqlHandler> handlers) {
    this.handlers = List.copyOf(handlers);
  }

  /** Builder wired with the standard handlers, for use outside the application context. */
  public static ViewFilterSqlBuilder withDefaultHandlers() {
    return new ViewFilterSqlBuilder(
        List.of(
            new PresenceFilterHandler(),
            new DiscreteFilterHandler(),
            new TextFilterHandler(),
            new RangeFilterHandler(),
            new RelativeDateFilterHandler()));
  }

  public SqlFilter build(CompiledFilter compiled) {
    var params = new SqlParameters();
    String whereClause = render(compiled.predicate(), params);
    return new SqlFilter(whereClause, params.asMap(), orderBy(compiled.sort()));
  }

  private String render(FilterPredicate predicate, SqlParameters params) {
    if (predicate instanceof FilterPredicate.And and) {
      return join(and.children(), " AND ", params);
    }
    if (predicate instanceof FilterPredicate.Or or) {
      return join(or.children(), " OR ", params);
    }
    if (predicate instanceof Comparison comparison) {
      return handlerFor(comparison).buildPredicate(comparison, params);
    }
    return "";
  }

  private String join(List<FilterPredicate> children, String operator, SqlParameters params) {
    return children.stream()
        .map(
            child -> {
              String sql = render(child, params);
              return child instanceof Comparison ? sql : "(" + sql + ")";
            })
        .collect(Collectors.joining(operator));
  }

  private FilterSqlHandler handlerFor(Comparison comparison) {
    return handlers.stream()
        .filter(handler -> handler.supports(comparison))
        .findFirst()
        .orElseThrow(() -> FilterSqlHandler.unsupported(comparison));
  }

  private static String orderBy(SortSpec sort) {
    if (sort == null) {
      return DEFAULT_ORDER_BY;
    }
    return sort.column() + " " + sort.order().name();
  }
}
