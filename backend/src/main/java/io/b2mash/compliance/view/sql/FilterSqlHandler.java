package io.b2mash.compliance.view.sql;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;

/** Renders the comparisons of one operator family as a parameterized SQL fragment. */
public interface FilterSqlHandler {

  boolean supports(Comparison comparison);

  /**
   * Builds the SQL predicate for {@code comparison}.
   *
   * @param params receives the named bindings the fragment references
   * @return SQL predicate fragment without a leading {@code WHERE}
   */
  String buildPredicate(Comparison comparison, SqlParameters params);

  static IllegalArgumentException unsupported(Comparison comparison) {
    return new IllegalArgumentException(
        "No SQL translation for " + comparison.operator().id() + " on " + comparison.type());
  }
}
