package io.b2mash.compliance.view.operator;

import io.b2mash.compliance.view.property.PropertyType;

/**
 * An operator as offered for one property type.
 *
 * @param id wire id, e.g. {@code is_any_of}
 * @param appliesTo the property type this entry belongs to
 * @param valueArity number of values the operator takes
 * @param requiresUnit whether a relative-date unit is required
 */
public record Operator(
    String id, PropertyType appliesTo, ValueArity valueArity, boolean requiresUnit) {

  static Operator of(FilterOperator operator, PropertyType type) {
    return new Operator(operator.id(), type, operator.arity(), operator.requiresUnit());
  }
}
