package io.b2mash.compliance.view.operator;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** Unit of the relative-date operators ({@code is_less_than_n_ago}, {@code is_more_than_n_ago}). */
public enum RelativeDateUnit {
  DAY,
  WEEK,
  MONTH,
  QUARTER,
  YEAR;

  /** Largest accepted amount; keeps every unit inside PostgreSQL's interval range. */
  public static final long MAX_AMOUNT = 10_000;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parses a unit id case-insensitively; empty for unknown or null input. */
  public static Optional<RelativeDateUnit> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (RelativeDateUnit unit : values()) {
      if (unit.name().equalsIgnoreCase(value.trim())) {
        return Optional.of(unit);
      }
    }
    return Optional.empty();
  }

  /**
   * PostgreSQL interval literal for {@code amount} of this unit, e.g. {@code "6 months"}.
   *
   * @throws ArithmeticException if the quarter conversion overflows
   */
  public String toInterval(long amount) {
    return switch (this) {
      case DAY -> amount + " days";
      case WEEK -> amount + " weeks";
      case MONTH -> amount + " months";
      case QUARTER -> Math.multiplyExact(amount, 3) + " months";
      case YEAR -> amount + " years";
    };
  }
}
