package io.b2mash.compliance.view.sql;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import io.b2mash.compliance.view.filter.ConditionValue;
import org.springframework.stereotype.Component;

/**
 * Translates equality and set membership on enum, status, severity, user and text properties into
 * {@code =} and {@code IN} predicates. Negations also match rows where the column is null.
 */
@Component
public class DiscreteFilterHandler implements FilterSqlHandler {

  @Override
  public boolean supports(Comparison comparison) {
    return switch (comparison.operator()) {
      case IS_ANY_OF, IS_NONE_OF -> true;
      case IS, IS_NOT -> !comparison.type().isOrderable();
      default -> false;
    };
  }

  @Override
  public String buildPredicate(Comparison comparison, SqlParameters params) {
    String column = comparison.column();
    return switch (comparison.operator()) {
      case IS -> column + " = " + params.bind(single(comparison));
      case IS_NOT -> {
        String placeholder = params.bind(single(comparison));
        yield "(" + column + " IS NULL OR " + column + " <> " + placeholder + ")";
      }
      case IS_ANY_OF -> column + " IN (" + params.bind(values(comparison)) + ")";
      case IS_NONE_OF -> {
        String placeholder = params.bind(values(comparison));
        yield "(" + column + " IS NULL OR " + column + " NOT IN (" + placeholder + "))";
      }
      default -> throw FilterSqlHandler.unsupported(comparison);
    };
  }

  private static Object single(Comparison comparison) {
    return ((ConditionValue.Single) comparison.value()).value();
  }

  private static Object values(Comparison comparison) {
    return ((ConditionValue.AnyOf) comparison.value()).values();
  }
}
