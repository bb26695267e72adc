package io.b2mash.compliance.view.filter;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import java.util.List;

/** Outcome of validating one condition. Never an exception. */
public sealed interface ConditionValidation {

  /**
   * @param comparison the typed comparison ready for compilation
   * @param prunedValues option values dropped because the property no longer offers them
   */
  record Valid(Comparison comparison, List<String> prunedValues) implements ConditionValidation {
    public Valid {
      prunedValues = prunedValues != null ? List.copyOf(prunedValues) : List.of();
    }
  }

  record Invalid(String propertyId, FilterIssue issue, String reason)
      implements ConditionValidation {}

  default boolean isValid() {
    return this instanceof Valid;
  }
}
