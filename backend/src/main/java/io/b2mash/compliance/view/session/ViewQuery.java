package io.b2mash.compliance.view.session;

import io.b2mash.compliance.view.compile.CompiledFilter;

/**
 * What the data-access layer needs to fetch one page: the compiled filter and sort plus 1-based
 * paging.
 *
 * @param offset zero-based row offset of the first row of {@code page}
 */
public record ViewQuery(CompiledFilter filter, int page, int pageSize, long offset) {

  public static ViewQuery of(CompiledFilter filter, int page, int pageSize) {
    return new ViewQuery(filter, page, pageSize, (long) (page - 1) * pageSize);
  }
}
