package io.b2mash.compliance.view.property;

/** Semantic type of a filterable property. Determines legal operators and value shape. */
public enum PropertyType {
  TEXT,
  NUMBER,
  DATE,
  BOOLEAN,
  ENUM,
  USER,
  STATUS,
  SEVERITY;

  /** Values are compared by order (range operators, between normalization). */
  public boolean isOrderable() {
    return this == NUMBER || this == DATE;
  }

  /** Values come from a finite set (options or member ids). */
  public boolean isDiscrete() {
    return this == ENUM || this == USER || this == STATUS || this == SEVERITY;
  }

  /** Values must be one of the descriptor's configured options, when any are configured. */
  public boolean hasOptions() {
    return this == ENUM || this == STATUS || this == SEVERITY;
  }
}
