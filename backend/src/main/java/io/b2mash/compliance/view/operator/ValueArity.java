package io.b2mash.compliance.view.operator;

/** How many values an operator takes: none (presence tests), one, or two (ranges). */
public enum ValueArity {
  NONE,
  ONE,
  TWO
}
