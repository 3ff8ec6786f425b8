package io.naemailer.filter;

/** How individual filter predicates combine. */
public enum FilterMode {
  /** Every predicate must match. */
  ALL,
  /** At least one predicate must match. */
  ANY
}
