package io.b2mash.compliance.view.sql;

import java.util.Map;

/**
 * SQL translation of a compiled view filter for the data-access layer.
 *
 * @param whereClause predicate without the {@code WHERE} keyword; empty when every row matches
 * @param params named bindings referenced by {@code whereClause}
 * @param orderBy {@code ORDER BY} expression without the keyword
 */
public record SqlFilter(String whereClause, Map<String, Object> params, String orderBy) {

  public boolean matchesEverything() {
    return whereClause.isEmpty();
  }
}
