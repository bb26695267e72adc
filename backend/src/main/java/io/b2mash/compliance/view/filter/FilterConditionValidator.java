package io.b2mash.compliance.view.filter;

import io.b2mash.compliance.view.compile.FilterPredicate.Comparison;
import io.b2mash.compliance.view.filter.ConditionValidation.Invalid;
import io.b2mash.compliance.view.filter.ConditionValidation.Valid;
import io.b2mash.compliance.view.operator.FilterOperator;
import io.b2mash.compliance.view.operator.OperatorRegistry;
import io.b2mash.compliance.view.operator.RelativeDateUnit;
import io.b2mash.compliance.view.operator.ValueArity;
import io.b2mash.compliance.view.property.PropertyDescriptor;
import io.b2mash.compliance.view.property.PropertyType;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Validates a {@link FilterCondition} against the descriptor of its property and converts it into
 * a typed {@link Comparison}.
 *
 * <p>Checks run in order: property exists, property is filterable, operator is legal for the
 * property type (failures are {@link FilterIssue#STALE}), then value, secondary value and unit
 * presence and shape ({@link FilterIssue#MALFORMED}). An inverted {@code is_between} range is
 * swapped rather than rejected. Values of enum, status and severity properties that are no longer
 * among the descriptor's options are pruned; a condition left without values is stale.
 *
 * <p>This class never throws for bad input.
 */
@Component
public class FilterConditionValidator {

  private static final String UNKNOWN_PROPERTY = "unknown";
  private static final int DATE_ONLY_LENGTH = 10;

  private final OperatorRegistry operatorRegistry;

  public FilterConditionValidator(OperatorRegistry operatorRegistry) {
    this.operatorRegistry = operatorRegistry;
  }

  /**
   * Validates {@code condition}.
   *
   * @param descriptor the property's descriptor, or null if the entity type has no such property
   */
  public ConditionValidation validate(FilterCondition condition, PropertyDescriptor descriptor) {
    if (condition == null || condition.propertyId() == null || condition.propertyId().isBlank()) {
      return new Invalid(UNKNOWN_PROPERTY, FilterIssue.MALFORMED, "Condition has no property");
    }
    String propertyId = condition.propertyId();

    if (descriptor == null) {
      return new Invalid(propertyId, FilterIssue.STALE, "Unknown property");
    }
    if (!descriptor.filterable()) {
      return new Invalid(propertyId, FilterIssue.STALE, "Property is not filterable");
    }
    Optional<FilterOperator> found = operatorRegistry.find(condition.operator());
    if (found.isEmpty() || !operatorRegistry.isValid(descriptor.type(), condition.operator())) {
      return new Invalid(
          propertyId,
          FilterIssue.STALE,
          "Operator '" + condition.operator() + "' is not valid for " + descriptor.type());
    }
    FilterOperator operator = found.get();

    if (operator.arity() == ValueArity.NONE) {
      if (condition.value() != null
          || condition.secondaryValue() != null
          || condition.unit() != null) {
        return malformed(propertyId, operator.id() + " takes no value");
      }
      return valid(descriptor, operator, new ConditionValue.None(), List.of());
    }

    if (condition.unit() != null && !operator.requiresUnit()) {
      return malformed(propertyId, operator.id() + " takes no unit");
    }
    if (condition.secondaryValue() != null && operator.arity() != ValueArity.TWO) {
      return malformed(propertyId, operator.id() + " takes a single value");
    }
    if (condition.value() == null) {
      return malformed(propertyId, operator.id() + " requires a value");
    }

    if (operator.requiresUnit()) {
      return validateRelative(condition, descriptor, operator);
    }
    if (operator.arity() == ValueArity.TWO) {
      return validateRange(condition, descriptor, operator);
    }
    if (operator.isMultiValued()) {
      return validateMulti(condition, descriptor, operator);
    }
    return validateSingle(condition, descriptor, operator);
  }

  private ConditionValidation validateRelative(
      FilterCondition condition, PropertyDescriptor descriptor, FilterOperator operator) {
    Optional<RelativeDateUnit> unit = RelativeDateUnit.parse(condition.unit());
    if (unit.isEmpty()) {
      return malformed(
          condition.propertyId(), "Unknown or missing unit '" + condition.unit() + "'");
    }
    Optional<Long> amount = toPositiveLong(condition.value());
    if (amount.isEmpty()) {
      return malformed(condition.propertyId(), "Relative amount must be a positive integer");
    }
    if (amount.get() > RelativeDateUnit.MAX_AMOUNT) {
      return malformed(
          condition.propertyId(),
          "Relative amount must not exceed " + RelativeDateUnit.MAX_AMOUNT);
    }
    return valid(
        descriptor, operator, new ConditionValue.Relative(amount.get(), unit.get()), List.of());
  }

  private ConditionValidation validateRange(
      FilterCondition condition, PropertyDescriptor descriptor, FilterOperator operator) {
    if (condition.secondaryValue() == null) {
      return malformed(condition.propertyId(), operator.id() + " requires two values");
    }
    Optional<Object> from = coerce(descriptor.type(), condition.value());
    Optional<Object> to = coerce(descriptor.type(), condition.secondaryValue());
    if (from.isEmpty() || to.isEmpty()) {
      return malformed(condition.propertyId(), "Range bounds must be " + descriptor.type());
    }
    Object lower = from.get();
    Object upper = to.get();
    if (isAfter(lower, upper)) {
      Object swap = lower;
      lower = upper;
      upper = swap;
    }
    return valid(descriptor, operator, new ConditionValue.Range(lower, upper), List.of());
  }

  private ConditionValidation validateMulti(
      FilterCondition condition, PropertyDescriptor descriptor, FilterOperator operator) {
    List<String> values = new ArrayList<>();
    Collection<?> raw =
        condition.value() instanceof Collection<?> collection
            ? collection
            : List.of(condition.value());
    for (Object element : raw) {
      Optional<Object> coerced = coerce(descriptor.type(), element);
      if (coerced.isEmpty()) {
        return malformed(condition.propertyId(), "Unsupported list element '" + element + "'");
      }
      values.add(coerced.get().toString());
    }
    if (values.isEmpty()) {
      return malformed(condition.propertyId(), operator.id() + " requires at least one value");
    }

    List<String> pruned = List.of();
    if (descriptor.type().hasOptions() && !descriptor.options().isEmpty()) {
      pruned = values.stream().filter(v -> !descriptor.options().contains(v)).toList();
      values = values.stream().filter(descriptor.options()::contains).toList();
      if (values.isEmpty()) {
        return new Invalid(
            condition.propertyId(), FilterIssue.STALE, "No value is offered anymore: " + pruned);
      }
    }
    return valid(descriptor, operator, new ConditionValue.AnyOf(values), pruned);
  }

  private ConditionValidation validateSingle(
      FilterCondition condition, PropertyDescriptor descriptor, FilterOperator operator) {
    Optional<Object> value = coerce(descriptor.type(), condition.value());
    if (value.isEmpty()) {
      return malformed(
          condition.propertyId(),
          "Value '" + condition.value() + "' is not a valid " + descriptor.type());
    }
    if (descriptor.type().hasOptions()
        && !descriptor.options().isEmpty()
        && !descriptor.options().contains(value.get().toString())) {
      return new Invalid(
          condition.propertyId(),
          FilterIssue.STALE,
          "Value '" + value.get() + "' is no longer offered");
    }
    return valid(descriptor, operator, new ConditionValue.Single(value.get()), List.of());
  }

  /** Converts a raw JSON scalar to the property type's value class; empty if not convertible. */
  static Optional<Object> coerce(PropertyType type, Object raw) {
    if (raw == null || raw instanceof Collection<?> || raw instanceof Map<?, ?>) {
      return Optional.empty();
    }
    return switch (type) {
      case NUMBER -> toDecimal(raw);
      case DATE -> toDate(raw);
      case BOOLEAN -> Optional.empty();
      default -> {
        String text = raw.toString();
        yield text.isBlank() ? Optional.empty() : Optional.of(text);
      }
    };
  }

  private static Optional<Object> toDecimal(Object raw) {
    try {
      return Optional.of(new BigDecimal(raw.toString().trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static Optional<Object> toDate(Object raw) {
    if (raw instanceof LocalDate date) {
      return Optional.of(date);
    }
    String text = raw.toString().trim();
    try {
      if (text.length() <= DATE_ONLY_LENGTH) {
        return Optional.of(LocalDate.parse(text));
      }
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              text, OffsetDateTime::from, LocalDateTime::from);
      return Optional.of(LocalDate.from(parsed));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  // coerced bounds are BigDecimal for NUMBER and LocalDate for DATE
  private static boolean isAfter(Object lower, Object upper) {
    if (lower instanceof BigDecimal low && upper instanceof BigDecimal high) {
      return low.compareTo(high) > 0;
    }
    if (lower instanceof LocalDate lowDate && upper instanceof LocalDate highDate) {
      return lowDate.isAfter(highDate);
    }
    return false;
  }

  private static Optional<Long> toPositiveLong(Object raw) {
    if (raw instanceof Collection<?> || raw instanceof Boolean) {
      return Optional.empty();
    }
    try {
      BigDecimal decimal = new BigDecimal(raw.toString().trim());
      long amount = decimal.longValueExact();
      return amount > 0 ? Optional.of(amount) : Optional.empty();
    } catch (NumberFormatException | ArithmeticException e) {
      return Optional.empty();
    }
  }

  private static ConditionValidation valid(
      PropertyDescriptor descriptor,
      FilterOperator operator,
      ConditionValue value,
      List<String> pruned) {
    return new Valid(
        new Comparison(descriptor.id(), descriptor.column(), descriptor.type(), operator, value),
        pruned);
  }

  private static Invalid malformed(String propertyId, String reason) {
    return new Invalid(propertyId, FilterIssue.MALFORMED, reason);
  }
}
