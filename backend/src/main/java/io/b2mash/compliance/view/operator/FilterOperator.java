package io.b2mash.compliance.view.operator;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Comparison operators available to filter conditions, identified by their wire id. */
public enum FilterOperator {
  IS("is", ValueArity.ONE),
  IS_NOT("is_not", ValueArity.ONE),
  IS_ANY_OF("is_any_of", ValueArity.ONE),
  IS_NONE_OF("is_none_of", ValueArity.ONE),
  CONTAINS("contains", ValueArity.ONE),
  DOES_NOT_CONTAIN("does_not_contain", ValueArity.ONE),
  STARTS_WITH("starts_with", ValueArity.ONE),
  ENDS_WITH("ends_with", ValueArity.ONE),
  IS_GREATER_THAN("is_greater_than", ValueArity.ONE),
  IS_GREATER_THAN_OR_EQUAL("is_greater_than_or_equal", ValueArity.ONE),
  IS_LESS_THAN("is_less_than", ValueArity.ONE),
  IS_LESS_THAN_OR_EQUAL("is_less_than_or_equal", ValueArity.ONE),
  IS_BEFORE("is_before", ValueArity.ONE),
  IS_AFTER("is_after", ValueArity.ONE),
  IS_BETWEEN("is_between", ValueArity.TWO),
  IS_LESS_THAN_N_AGO("is_less_than_n_ago", ValueArity.ONE, true),
  IS_MORE_THAN_N_AGO("is_more_than_n_ago", ValueArity.ONE, true),
  IS_TRUE("is_true", ValueArity.NONE),
  IS_FALSE("is_false", ValueArity.NONE),
  IS_KNOWN("is_known", ValueArity.NONE),
  IS_UNKNOWN("is_unknown", ValueArity.NONE);

  private final String id;
  private final ValueArity arity;
  private final boolean requiresUnit;

  FilterOperator(String id, ValueArity arity) {
    this(id, arity, false);
  }

  FilterOperator(String id, ValueArity arity, boolean requiresUnit) {
    this.id = id;
    this.arity = arity;
    this.requiresUnit = requiresUnit;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public ValueArity arity() {
    return arity;
  }

  public boolean requiresUnit() {
    return requiresUnit;
  }

  /** Multi-valued operators take a list as their single value. */
  public boolean isMultiValued() {
    return this == IS_ANY_OF || this == IS_NONE_OF;
  }

  public static Optional<FilterOperator> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    for (FilterOperator operator : values()) {
      if (operator.id.equals(id)) {
        return Optional.of(operator);
      }
    }
    return Optional.empty();
  }
}
