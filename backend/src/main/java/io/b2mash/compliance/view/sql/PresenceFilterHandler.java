package io.b2mash.compliance.view.sql;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import org.springframework.stereotype.Component;

/** Operators without a value: presence checks and boolean flags. */
@Component
public class PresenceFilterHandler implements FilterSqlHandler {

  @Override
  public boolean supports(Comparison comparison) {
    return switch (comparison.operator()) {
      case IS_KNOWN, IS_UNKNOWN, IS_TRUE, IS_FALSE -> true;
      default -> false;
    };
  }

  @Override
  public String buildPredicate(Comparison comparison, SqlParameters params) {
    String column = comparison.column();
    return switch (comparison.operator()) {
      case IS_KNOWN -> column + " IS NOT NULL";
      case IS_UNKNOWN -> column + " IS NULL";
      case IS_TRUE -> column + " = TRUE";
      case IS_FALSE -> column + " = FALSE";
      default -> throw FilterSqlHandler.unsupported(comparison);
    };
  }
}
