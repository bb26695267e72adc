package io.b2mash.compliance.view.sql;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import io.b2mash.compliance.view.filter.ConditionValue;
import org.springframework.stereotype.Component;

/**
 * Translates {@code is_less_than_n_ago} (within the last N units) and {@code is_more_than_n_ago}
 * (older than N units) against {@code CURRENT_DATE}.
 */
@Component
public class RelativeDateFilterHandler implements FilterSqlHandler {

  @Override
  public boolean supports(Comparison comparison) {
    return switch (comparison.operator()) {
      case IS_LESS_THAN_N_AGO, IS_MORE_THAN_N_AGO -> true;
      default -> false;
    };
  }

  @Override
  public String buildPredicate(Comparison comparison, SqlParameters params) {
    var relative = (ConditionValue.Relative) comparison.value();
    String placeholder = params.bind(relative.unit().toInterval(relative.amount()));
    String threshold = "CURRENT_DATE - CAST(" + placeholder + " AS interval)";
    return switch (comparison.operator()) {
      case IS_LESS_THAN_N_AGO -> comparison.column() + " >= " + threshold;
      case IS_MORE_THAN_N_AGO -> comparison.column() + " < " + threshold;
      default -> throw FilterSqlHandler.unsupported(comparison);
    };
  }
}
