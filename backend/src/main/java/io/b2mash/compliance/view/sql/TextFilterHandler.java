package io.b2mash.compliance.view.sql;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import io.b2mash.compliance.view.filter.ConditionValue;
import org.springframework.stereotype.Component;

/**
 * Translates substring operators into case-insensitive {@code ILIKE} predicates. LIKE wildcards in
 * the search text are escaped so they match literally.
 */
@Component
public class TextFilterHandler implements FilterSqlHandler {

  @Override
  public boolean supports(Comparison comparison) {
    return switch (comparison.operator()) {
      case CONTAINS, DOES_NOT_CONTAIN, STARTS_WITH, ENDS_WITH -> true;
      default -> false;
    };
  }

  @Override
  public String buildPredicate(Comparison comparison, SqlParameters params) {
    String column = comparison.column();
    String text = escapeLike(((ConditionValue.Single) comparison.value()).value().toString());
    String placeholder = params.bind(text);
    return switch (comparison.operator()) {
      case CONTAINS -> column + " ILIKE '%' || " + placeholder + " || '%'";
      case DOES_NOT_CONTAIN ->
          "(" + column + " IS NULL OR " + column + " NOT ILIKE '%' || " + placeholder + " || '%')";
      case STARTS_WITH -> column + " ILIKE " + placeholder + " || '%'";
      case ENDS_WITH -> column + " ILIKE '%' || " + placeholder;
      default -> throw FilterSqlHandler.unsupported(comparison);
    };
  }

  static String escapeLike(String text) {
    return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
