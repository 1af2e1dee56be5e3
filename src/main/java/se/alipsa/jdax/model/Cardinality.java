package se.alipsa.jdax.model;

/** How many rows on each side of a relationship may share a key. */
public enum Cardinality {
  /** Keys are unique on both sides. */
  ONE_TO_ONE,
  /** Keys are unique on the {@code to} side only. */
  ONE_TO_MANY,
  /** Not supported; registration is rejected. */
  MANY_TO_MANY
}
