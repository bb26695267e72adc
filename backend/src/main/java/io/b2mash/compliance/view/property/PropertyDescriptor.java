package io.b2mash.compliance.view.property;

import java.util.List;
import java.util.Objects;

/**
 * A property of an entity type as exposed to filters, sorting and board grouping.
 *
 * @param id stable property id referenced by filter conditions and saved views
 * @param label display label
 * @param type semantic type
 * @param filterable usable in filter conditions
 * @param sortable usable as {@code sortBy}
 * @param groupable usable as board {@code boardGroupBy}
 * @param column SQL column the property maps to
 * @param options currently offered values for enum/status/severity properties; empty means any
 */
public record PropertyDescriptor(
    String id,
    String label,
    PropertyType type,
    boolean filterable,
    boolean sortable,
    boolean groupable,
    String column,
    List<String> options) {

  public PropertyDescriptor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    label = label != null ? label : id;
    column = column != null && !column.isBlank() ? column : toSnakeCase(id);
    options = options != null ? List.copyOf(options) : List.of();
  }

  /** Filterable and sortable, not groupable, no options. */
  public static PropertyDescriptor of(String id, PropertyType type) {
    return new PropertyDescriptor(id, id, type, true, true, false, null, List.of());
  }

  public PropertyDescriptor withOptions(List<String> newOptions) {
    return new PropertyDescriptor(
        id, label, type, filterable, sortable, groupable, column, newOptions);
  }

  public PropertyDescriptor withFilterable(boolean newFilterable) {
    return new PropertyDescriptor(
        id, label, type, newFilterable, sortable, groupable, column, options);
  }

  public PropertyDescriptor withGroupable(boolean newGroupable) {
    return new PropertyDescriptor(
        id, label, type, filterable, sortable, newGroupable, column, options);
  }

  static String toSnakeCase(String id) {
    var sb = new StringBuilder(id.length() + 4);
    for (char c : id.toCharArray()) {
      if (Character.isUpperCase(c)) {
        sb.append('_').append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
