package io.b2mash.compliance.view.session;

import io.b2mash.compliance.view.sql.ViewFilterSqlBuilder;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Compiles list-page state into a predicate and its SQL translation without running it. */
@RestController
@RequestMapping("/api/view-queries")
public class ViewQueryController {

  private final ViewSessionFactory viewSessionFactory;
  private final ViewFilterSqlBuilder viewFilterSqlBuilder;

  public ViewQueryController(
      ViewSessionFactory viewSessionFactory, ViewFilterSqlBuilder viewFilterSqlBuilder) {
    this.viewSessionFactory = viewSessionFactory;
    this.viewFilterSqlBuilder = viewFilterSqlBuilder;
  }

  @PostMapping
  public ResponseEntity<ViewQueryResponse> compile(@Valid @RequestBody ViewQueryRequest request) {
    var session = viewSessionFactory.open(request.entityType(), request.autoApplyDefault());
    if (request.viewId() != null) {
      session.applyView(request.viewId());
    } else if (request.autoApplyDefault()) {
      session.applyDefaultView();
    }
    if (request.quickFilters() != null) {
      request.quickFilters().forEach(session::setQuickFilter);
    }
    if (request.filterGroups() != null) {
      session.setFilterGroups(request.filterGroups());
    }
    if (request.sortBy() != null || request.sortOrder() != null) {
      session.setSort(
          request.sortBy() != null ? request.sortBy() : session.sortBy(),
          request.sortOrder() != null ? request.sortOrder() : session.sortOrder());
    }
    if (request.pageSize() != null) {
      session.setPageSize(request.pageSize());
    }
    if (request.page() != null) {
      session.setPage(request.page());
    }

    var query = session.query();
    var sql = viewFilterSqlBuilder.build(query.filter());
    return ResponseEntity.ok(ViewQueryResponse.of(session, query, sql));
  }
}
