package io.b2mash.compliance.view.operator;

import static io.b2mash.compliance.view.operator.FilterOperator.CONTAINS;
import static io.b2mash.compliance.view.operator.FilterOperator.DOES_NOT_CONTAIN;
import static io.b2mash.compliance.view.operator.FilterOperator.ENDS_WITH;
import static io.b2mash.compliance.view.operator.FilterOperator.IS;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_AFTER;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_ANY_OF;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_BEFORE;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_BETWEEN;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_FALSE;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_GREATER_THAN;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_GREATER_THAN_OR_EQUAL;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_KNOWN;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_LESS_THAN;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_LESS_THAN_N_AGO;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_LESS_THAN_OR_EQUAL;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_MORE_THAN_N_AGO;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_NONE_OF;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_NOT;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_TRUE;
import static io.b2mash.compliance.view.operator.FilterOperator.IS_UNKNOWN;
import static io.b2mash.compliance.view.operator.FilterOperator.STARTS_WITH;

import io.b2mash.compliance.view.property.PropertyType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Legal operators per property type. Adding a filterable property only requires declaring its
 * {@link PropertyType}; comparison semantics live here, not in the business modules.
 *
 * <p>{@code is_known} and {@code is_unknown} are appended to every type.
 */
@Component
public class OperatorRegistry {

  private static final Set<FilterOperator> DISCRETE =
      EnumSet.of(IS, IS_NOT, IS_ANY_OF, IS_NONE_OF);

  private static final Map<PropertyType, List<Operator>> OPERATORS = buildCatalogue();

  public List<Operator> operatorsFor(PropertyType type) {
    return OPERATORS.getOrDefault(type, List.of());
  }

  public boolean isValid(PropertyType type, String operatorId) {
    return FilterOperator.fromId(operatorId)
        .map(op -> operatorsFor(type).stream().anyMatch(o -> o.id().equals(op.id())))
        .orElse(false);
  }

  /** Arity of a known operator id; empty for unknown ids. */
  public Optional<ValueArity> arityOf(String operatorId) {
    return FilterOperator.fromId(operatorId).map(FilterOperator::arity);
  }

  public Optional<FilterOperator> find(String operatorId) {
    return FilterOperator.fromId(operatorId);
  }

  private static Map<PropertyType, List<Operator>> buildCatalogue() {
    var byType = new EnumMap<PropertyType, Set<FilterOperator>>(PropertyType.class);
    byType.put(
        PropertyType.TEXT,
        EnumSet.of(IS, IS_NOT, CONTAINS, DOES_NOT_CONTAIN, STARTS_WITH, ENDS_WITH));
    byType.put(
        PropertyType.NUMBER,
        EnumSet.of(
            IS,
            IS_NOT,
            IS_GREATER_THAN,
            IS_GREATER_THAN_OR_EQUAL,
            IS_LESS_THAN,
            IS_LESS_THAN_OR_EQUAL,
            IS_BETWEEN));
    byType.put(
        PropertyType.DATE,
        EnumSet.of(IS, IS_BEFORE, IS_AFTER, IS_BETWEEN, IS_LESS_THAN_N_AGO, IS_MORE_THAN_N_AGO));
    byType.put(PropertyType.BOOLEAN, EnumSet.of(IS_TRUE, IS_FALSE));
    byType.put(PropertyType.ENUM, DISCRETE);
    byType.put(PropertyType.STATUS, DISCRETE);
    byType.put(PropertyType.SEVERITY, DISCRETE);
    byType.put(PropertyType.USER, DISCRETE);

    var catalogue = new EnumMap<PropertyType, List<Operator>>(PropertyType.class);
    for (PropertyType type : PropertyType.values()) {
      var operators = new ArrayList<Operator>();
      for (FilterOperator op : byType.getOrDefault(type, Set.of())) {
        operators.add(Operator.of(op, type));
      }
      operators.add(Operator.of(IS_KNOWN, type));
      operators.add(Operator.of(IS_UNKNOWN, type));
      catalogue.put(type, List.copyOf(operators));
    }
    return catalogue;
  }
}
