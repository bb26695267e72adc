package io.b2mash.compliance.view.session;

import io.b2mash.compliance.view.compile.FilterPredicate;
import io.b2mash.compliance.view.compile.SortSpec;
import io.b2mash.compliance.view.sql.SqlFilter;
import java.util.List;
import java.util.UUID;

public record ViewQueryResponse(
    UUID activeViewId,
    FilterPredicate predicate,
    String description,
    SortSpec sort,
    SqlFilter sql,
    int page,
    int pageSize,
    long offset,
    List<String> invalidFilters) {

  static ViewQueryResponse of(ViewSession session, ViewQuery query, SqlFilter sql) {
    return new ViewQueryResponse(
        session.activeViewId(),
        query.filter().predicate(),
        query.filter().predicate().describe(),
        query.filter().sort(),
        sql,
        query.page(),
        query.pageSize(),
        query.offset(),
        session.lastInvalidFilters());
  }
}
