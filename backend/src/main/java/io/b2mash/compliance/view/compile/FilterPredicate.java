package io.b2mash.compliance.view.compile;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.b2mash.compliance.view.filter.ConditionValue;
import io.b2mash.compliance.view.operator.FilterOperator;
import io.b2mash.compliance.view.property.PropertyType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Executable predicate tree produced by {@link FilterCompiler}. Nodes are records, so two trees
 * compiled from the same input are {@code equals}.
 *
 * <p>Use {@link #and(List)} and {@link #or(List)} to build composite nodes: they flatten nested
 * nodes of the same kind and collapse trivial ones.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FilterPredicate.MatchAll.class, name = "all"),
  @JsonSubTypes.Type(value = FilterPredicate.And.class, name = "and"),
  @JsonSubTypes.Type(value = FilterPredicate.Or.class, name = "or"),
  @JsonSubTypes.Type(value = FilterPredicate.Comparison.class, name = "comparison")
})
public sealed interface FilterPredicate {

  /** Human-readable rendering, e.g. {@code status in (OPEN,NEW) AND ownerId = u1}. */
  String describe();

  static FilterPredicate matchAll() {
    return new MatchAll();
  }

  static FilterPredicate and(List<? extends FilterPredicate> children) {
    var flat = new ArrayList<FilterPredicate>();
    for (FilterPredicate child : children) {
      if (child instanceof And nested) {
        flat.addAll(nested.children());
      } else if (!(child instanceof MatchAll)) {
        flat.add(child);
      }
    }
    if (flat.isEmpty()) {
      return new MatchAll();
    }
    return flat.size() == 1 ? flat.get(0) : new And(flat);
  }

  static FilterPredicate or(List<? extends FilterPredicate> children) {
    var flat = new ArrayList<FilterPredicate>();
    for (FilterPredicate child : children) {
      if (child instanceof MatchAll) {
        return new MatchAll();
      }
      if (child instanceof Or nested) {
        flat.addAll(nested.children());
      } else {
        flat.add(child);
      }
    }
    if (flat.isEmpty()) {
      return new MatchAll();
    }
    return flat.size() == 1 ? flat.get(0) : new Or(flat);
  }

  record MatchAll() implements FilterPredicate {
    @Override
    public String describe() {
      return "ALL";
    }
  }

  record And(List<FilterPredicate> children) implements FilterPredicate {
    public And {
      children = List.copyOf(children);
    }

    @Override
    public String describe() {
      return children.stream()
          .map(c -> c instanceof Or ? "(" + c.describe() + ")" : c.describe())
          .collect(Collectors.joining(" AND "));
    }
  }

  record Or(List<FilterPredicate> children) implements FilterPredicate {
    public Or {
      children = List.copyOf(children);
    }

    @Override
    public String describe() {
      return children.stream()
          .map(c -> c instanceof And ? "(" + c.describe() + ")" : c.describe())
          .collect(Collectors.joining(" OR "));
    }
  }

  /** One validated condition against a single column. */
  record Comparison(
      String propertyId,
      String column,
      PropertyType type,
      FilterOperator operator,
      ConditionValue value)
      implements FilterPredicate {

    @Override
    public String describe() {
      String p = propertyId;
      return switch (operator) {
        case IS -> p + " = " + scalar();
        case IS_NOT -> p + " != " + scalar();
        case IS_ANY_OF -> p + " in (" + String.join(",", values()) + ")";
        case IS_NONE_OF -> p + " not in (" + String.join(",", values()) + ")";
        case CONTAINS -> p + " contains " + scalar();
        case DOES_NOT_CONTAIN -> p + " does not contain " + scalar();
        case STARTS_WITH -> p + " starts with " + scalar();
        case ENDS_WITH -> p + " ends with " + scalar();
        case IS_GREATER_THAN, IS_AFTER -> p + " > " + scalar();
        case IS_GREATER_THAN_OR_EQUAL -> p + " >= " + scalar();
        case IS_LESS_THAN, IS_BEFORE -> p + " < " + scalar();
        case IS_LESS_THAN_OR_EQUAL -> p + " <= " + scalar();
        case IS_BETWEEN -> {
          var range = (ConditionValue.Range) value;
          yield p + " between " + render(range.from()) + " and " + render(range.to());
        }
        case IS_LESS_THAN_N_AGO -> p + " > " + relative() + " ago";
        case IS_MORE_THAN_N_AGO -> p + " < " + relative() + " ago";
        case IS_TRUE -> p + " is true";
        case IS_FALSE -> p + " is false";
        case IS_KNOWN -> p + " is known";
        case IS_UNKNOWN -> p + " is unknown";
      };
    }

    private String scalar() {
      return value instanceof ConditionValue.Single single ? render(single.value()) : "?";
    }

    private List<String> values() {
      return value instanceof ConditionValue.AnyOf anyOf ? anyOf.values() : List.of();
    }

    private String relative() {
      var relative = (ConditionValue.Relative) value;
      return relative.amount() + " " + relative.unit().id();
    }

    private static String render(Object value) {
      return value instanceof BigDecimal decimal ? decimal.toPlainString() : String.valueOf(value);
    }
  }
}
