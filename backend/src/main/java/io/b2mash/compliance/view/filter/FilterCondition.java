package io.b2mash.compliance.view.filter;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A filter condition as authored by a user and persisted in a saved view. Values are kept in their
 * loosely typed JSON form (string, number, boolean or list) until {@link FilterConditionValidator}
 * turns them into a typed {@link ConditionValue}; a stored condition may therefore reference a
 * property or operator that no longer exists.
 *
 * @param id client-side identity of the condition within its group
 * @param propertyId property the condition applies to
 * @param operator operator id, e.g. {@code is_any_of}
 * @param value first value; a list for multi-valued operators
 * @param secondaryValue upper bound of {@code is_between}
 * @param unit unit of relative-date operators
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterCondition(
    String id,
    String propertyId,
    String operator,
    Object value,
    Object secondaryValue,
    String unit) {

  public static FilterCondition of(String id, String propertyId, String operator, Object value) {
    return new FilterCondition(id, propertyId, operator, value, null, null);
  }

  public static FilterCondition presence(String id, String propertyId, String operator) {
    return new FilterCondition(id, propertyId, operator, null, null, null);
  }

  public static FilterCondition between(
      String id, String propertyId, Object value, Object secondaryValue) {
    return new FilterCondition(id, propertyId, "is_between", value, secondaryValue, null);
  }

  public static FilterCondition relative(
      String id, String propertyId, String operator, Object amount, String unit) {
    return new FilterCondition(id, propertyId, operator, amount, null, unit);
  }

  public FilterCondition withValue(Object newValue) {
    return new FilterCondition(id, propertyId, operator, newValue, secondaryValue, unit);
  }
}
