package io.b2mash.compliance.view.filter;

/** Why a condition was dropped. */
public enum FilterIssue {
  /** Property, operator or option value no longer valid for the entity type (schema drift). */
  STALE,
  /** Value, arity or unit does not match what the operator requires. */
  MALFORMED
}
