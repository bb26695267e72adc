package io.b2mash.compliance.view.compile;

import io.b2mash.compliance.view.filter.ConditionValidation;
import io.b2mash.compliance.view.filter.ConditionValidation.Invalid;
import io.b2mash.compliance.view.filter.ConditionValidation.Valid;
import io.b2mash.compliance.view.filter.ConditionValue;
import io.b2mash.compliance.view.filter.FilterCondition;
import io.b2mash.compliance.view.filter.FilterConditionValidator;
import io.b2mash.compliance.view.filter.FilterGroup;
import io.b2mash.compliance.view.filter.FilterIssue;
import io.b2mash.compliance.view.operator.FilterOperator;
import io.b2mash.compliance.view.property.PropertyDescriptor;
import io.b2mash.compliance.view.property.PropertyRegistry;
import io.b2mash.compliance.view.property.PropertyType;
import io.b2mash.compliance.view.property.ViewEntityType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns quick filters, advanced filter groups and a sort request into a {@link CompiledFilter}.
 *
 * <p>Conditions inside a group are AND-combined, groups are OR-combined, and each quick filter is
 * AND-combined on top of that result. Conditions that fail validation are dropped and their
 * property ids reported in {@code invalidFilters}; a condition whose option values were partly
 * pruned still applies and is reported too. Stateless and safe to share.
 */
@Component
public class FilterCompiler {

  private static final Logger log = LoggerFactory.getLogger(FilterCompiler.class);

  private static final String QUICK_FILTER_PREFIX = "quick-";

  private final PropertyRegistry propertyRegistry;
  private final FilterConditionValidator validator;

  public FilterCompiler(PropertyRegistry propertyRegistry, FilterConditionValidator validator) {
    this.propertyRegistry = propertyRegistry;
    this.validator = validator;
  }

  public CompiledFilter compile(
      ViewEntityType entityType, Map<String, Object> quickFilters, List<FilterGroup> groups) {
    return compile(entityType, quickFilters, groups, null, null);
  }

  public CompiledFilter compile(
      ViewEntityType entityType,
      Map<String, Object> quickFilters,
      List<FilterGroup> groups,
      String sortBy,
      SortOrder sortOrder) {
    var invalid = new LinkedHashSet<String>();

    var groupPredicates = new ArrayList<FilterPredicate>();
    for (FilterGroup group : nullSafe(groups)) {
      if (group == null) {
        log.debug("Skipping null filter group: entityType={}", entityType);
        continue;
      }
      var comparisons = new ArrayList<FilterPredicate>();
      for (FilterCondition condition : group.conditions()) {
        validateCondition(entityType, condition, invalid)
            .ifPresent(valid -> comparisons.add(valid.comparison()));
      }
      // a group emptied by removal disappears rather than matching everything
      if (!comparisons.isEmpty()) {
        groupPredicates.add(FilterPredicate.and(comparisons));
      }
    }

    var conjuncts = new ArrayList<FilterPredicate>();
    conjuncts.add(FilterPredicate.or(groupPredicates));
    for (Map.Entry<String, Object> entry : sortedQuickFilters(quickFilters).entrySet()) {
      validateQuickFilter(entityType, entry.getKey(), entry.getValue(), invalid)
          .ifPresent(valid -> conjuncts.add(valid.comparison()));
    }
    FilterPredicate predicate = FilterPredicate.and(conjuncts);

    SortSpec sort = resolveSort(entityType, sortBy, sortOrder);
    var compiled = new CompiledFilter(predicate, sort, List.copyOf(invalid));
    log.debug(
        "Compiled view filter: entityType={}, predicate={}, invalidFilters={}",
        entityType,
        predicate.describe(),
        compiled.invalidFilters());
    return compiled;
  }

  /**
   * Re-validates stored filters and returns the parts that still apply, in their persisted form.
   * Pruned option values are removed from the surviving conditions.
   */
  public SanitizedFilters sanitize(
      ViewEntityType entityType, List<FilterGroup> groups, Map<String, Object> quickFilters) {
    var invalid = new LinkedHashSet<String>();

    var keptGroups = new ArrayList<FilterGroup>();
    for (FilterGroup group : nullSafe(groups)) {
      if (group == null) {
        continue;
      }
      var kept = new ArrayList<FilterCondition>();
      for (FilterCondition condition : group.conditions()) {
        validateCondition(entityType, condition, invalid)
            .ifPresent(valid -> kept.add(withSurvivingValues(condition, valid)));
      }
      if (!kept.isEmpty()) {
        keptGroups.add(group.withConditions(kept));
      }
    }

    var keptQuickFilters = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, Object> entry : sortedQuickFilters(quickFilters).entrySet()) {
      validateQuickFilter(entityType, entry.getKey(), entry.getValue(), invalid)
          .ifPresent(
              valid ->
                  keptQuickFilters.put(entry.getKey(), survivingValue(entry.getValue(), valid)));
    }

    if (!invalid.isEmpty()) {
      log.warn(
          "Dropped or pruned stored filters: entityType={}, invalidFilters={}",
          entityType,
          invalid);
    }
    return new SanitizedFilters(keptGroups, keptQuickFilters, List.copyOf(invalid));
  }

  /** Validates stored conditions without compiling; returns the offending property ids. */
  public List<String> findInvalidFilters(
      ViewEntityType entityType, List<FilterGroup> groups, Map<String, Object> quickFilters) {
    return compile(entityType, quickFilters, groups).invalidFilters();
  }

  /**
   * The operator a quick filter implies for a property type and value: {@code contains} for text,
   * {@code is_any_of} for a list on discrete types, {@code is_between} for a two-element date
   * list, {@code is_true}/{@code is_false} for booleans and {@code is} otherwise.
   */
  public static Optional<FilterCondition> toCondition(
      PropertyDescriptor descriptor, Object value) {
    String conditionId = QUICK_FILTER_PREFIX + descriptor.id();
    PropertyType type = descriptor.type();
    if (type == PropertyType.TEXT) {
      return Optional.of(
          FilterCondition.of(conditionId, descriptor.id(), FilterOperator.CONTAINS.id(), value));
    }
    if (type == PropertyType.BOOLEAN) {
      return toBoolean(value)
          .map(
              flag ->
                  FilterCondition.presence(
                      conditionId,
                      descriptor.id(),
                      flag ? FilterOperator.IS_TRUE.id() : FilterOperator.IS_FALSE.id()));
    }
    if (type == PropertyType.DATE && value instanceof List<?> list && list.size() == 2) {
      return Optional.of(
          FilterCondition.between(conditionId, descriptor.id(), list.get(0), list.get(1)));
    }
    if (type.isDiscrete() && value instanceof Collection<?>) {
      return Optional.of(
          FilterCondition.of(conditionId, descriptor.id(), FilterOperator.IS_ANY_OF.id(), value));
    }
    if (value instanceof Collection<?>) {
      return Optional.empty();
    }
    return Optional.of(
        FilterCondition.of(conditionId, descriptor.id(), FilterOperator.IS.id(), value));
  }

  private Optional<Valid> validateCondition(
      ViewEntityType entityType, FilterCondition condition, Set<String> invalid) {
    PropertyDescriptor descriptor =
        condition == null
            ? null
            : propertyRegistry.lookup(entityType, condition.propertyId()).orElse(null);
    return track(validator.validate(condition, descriptor), invalid);
  }

  private Optional<Valid> validateQuickFilter(
      ViewEntityType entityType, String propertyId, Object value, Set<String> invalid) {
    if (isEmptyValue(value)) {
      return Optional.empty();
    }
    Optional<PropertyDescriptor> descriptor = propertyRegistry.lookup(entityType, propertyId);
    boolean quickFilterable =
        propertyRegistry
            .moduleConfig(entityType)
            .map(config -> config.isQuickFilterable(propertyId))
            .orElse(false);
    if (descriptor.isEmpty() || !quickFilterable) {
      return track(new Invalid(propertyId, FilterIssue.STALE, "Not a quick filter"), invalid);
    }
    Optional<FilterCondition> condition = toCondition(descriptor.get(), value);
    if (condition.isEmpty()) {
      return track(
          new Invalid(propertyId, FilterIssue.MALFORMED, "Unsupported quick filter value"),
          invalid);
    }
    return track(validator.validate(condition.get(), descriptor.get()), invalid);
  }

  private static Optional<Valid> track(ConditionValidation validation, Set<String> invalid) {
    if (validation instanceof Invalid failed) {
      log.debug(
          "Dropping filter condition: propertyId={}, issue={}, reason={}",
          failed.propertyId(),
          failed.issue(),
          failed.reason());
      invalid.add(failed.propertyId());
      return Optional.empty();
    }
    var valid = (Valid) validation;
    if (!valid.prunedValues().isEmpty()) {
      invalid.add(valid.comparison().propertyId());
    }
    return Optional.of(valid);
  }

  private SortSpec resolveSort(ViewEntityType entityType, String sortBy, SortOrder sortOrder) {
    if (sortBy == null || sortBy.isBlank()) {
      return null;
    }
    Optional<PropertyDescriptor> descriptor = propertyRegistry.lookup(entityType, sortBy);
    if (descriptor.isEmpty() || !descriptor.get().sortable()) {
      log.warn(
          "Dropping sort on non-sortable property: entityType={}, sortBy={}", entityType, sortBy);
      return null;
    }
    return new SortSpec(
        sortBy, descriptor.get().column(), sortOrder != null ? sortOrder : SortOrder.DESC);
  }

  private static FilterCondition withSurvivingValues(FilterCondition condition, Valid valid) {
    return valid.prunedValues().isEmpty()
        ? condition
        : condition.withValue(survivingValue(condition.value(), valid));
  }

  private static Object survivingValue(Object original, Valid valid) {
    if (valid.prunedValues().isEmpty()) {
      return original;
    }
    return valid.comparison().value() instanceof ConditionValue.AnyOf anyOf
        ? anyOf.values()
        : original;
  }

  private static Map<String, Object> sortedQuickFilters(Map<String, Object> quickFilters) {
    var sorted = new TreeMap<String, Object>();
    if (quickFilters != null) {
      quickFilters.forEach(
          (key, value) -> {
            if (key != null) {
              sorted.put(key, value);
            }
          });
    }
    return sorted;
  }

  private static boolean isEmptyValue(Object value) {
    return value == null
        || (value instanceof String text && text.isBlank())
        || (value instanceof Collection<?> collection && collection.isEmpty());
  }

  private static Optional<Boolean> toBoolean(Object value) {
    if (value instanceof Boolean flag) {
      return Optional.of(flag);
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text)) {
      return Optional.of(true);
    }
    if ("false".equalsIgnoreCase(text)) {
      return Optional.of(false);
    }
    return Optional.empty();
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list != null ? list : List.of();
  }
}
