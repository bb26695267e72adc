package io.b2mash.compliance.view.filter;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.b2mash.compliance.view.operator.RelativeDateUnit;
import java.util.List;

/**
 * Typed value of a validated condition. The shape is decided by the operator's arity and unit
 * requirement; scalar values are {@code String}, {@code BigDecimal} (number properties) or {@code
 * LocalDate} (date properties).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ConditionValue.None.class, name = "none"),
  @JsonSubTypes.Type(value = ConditionValue.Single.class, name = "single"),
  @JsonSubTypes.Type(value = ConditionValue.AnyOf.class, name = "anyOf"),
  @JsonSubTypes.Type(value = ConditionValue.Range.class, name = "range"),
  @JsonSubTypes.Type(value = ConditionValue.Relative.class, name = "relative")
})
public sealed interface ConditionValue {

  /** Presence and boolean operators. */
  record None() implements ConditionValue {}

  record Single(Object value) implements ConditionValue {}

  /** Operand of {@code is_any_of} / {@code is_none_of}; never empty. */
  record AnyOf(List<String> values) implements ConditionValue {
    public AnyOf {
      values = List.copyOf(values);
    }
  }

  /** Inclusive range with {@code from <= to}. */
  record Range(Object from, Object to) implements ConditionValue {}

  record Relative(long amount, RelativeDateUnit unit) implements ConditionValue {}
}
