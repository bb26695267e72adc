package io.b2mash.compliance.view.sql;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import io.b2mash.compliance.view.filter.ConditionValue;
import io.b2mash.compliance.view.property.PropertyType;
import org.springframework.stereotype.Component;

/**
 * Translates comparisons on number and date properties. Date columns may hold timestamps, so they
 * are compared as {@code CAST(column AS date)}.
 */
@Component
public class RangeFilterHandler implements FilterSqlHandler {

  @Override
  public boolean supports(Comparison comparison) {
    if (!comparison.type().isOrderable()) {
      return false;
    }
    return switch (comparison.operator()) {
      case IS,
          IS_NOT,
          IS_GREATER_THAN,
          IS_GREATER_THAN_OR_EQUAL,
          IS_LESS_THAN,
          IS_LESS_THAN_OR_EQUAL,
          IS_BEFORE,
          IS_AFTER,
          IS_BETWEEN -> true;
      default -> false;
    };
  }

  @Override
  public String buildPredicate(Comparison comparison, SqlParameters params) {
    String column =
        comparison.type() == PropertyType.DATE
            ? "CAST(" + comparison.column() + " AS date)"
            : comparison.column();
    if (comparison.value() instanceof ConditionValue.Range range) {
      return column + " BETWEEN " + params.bind(range.from()) + " AND " + params.bind(range.to());
    }
    String placeholder = params.bind(((ConditionValue.Single) comparison.value()).value());
    return switch (comparison.operator()) {
      case IS -> column + " = " + placeholder;
      case IS_NOT -> "(" + column + " IS NULL OR " + column + " <> " + placeholder + ")";
      case IS_GREATER_THAN, IS_AFTER -> column + " > " + placeholder;
      case IS_GREATER_THAN_OR_EQUAL -> column + " >= " + placeholder;
      case IS_LESS_THAN, IS_BEFORE -> column + " < " + placeholder;
      case IS_LESS_THAN_OR_EQUAL -> column + " <= " + placeholder;
      default -> throw FilterSqlHandler.unsupported(comparison);
    };
  }
}
