package se.alipsa.jdax.model;

/** Direction in which a relationship propagates filters. */
public enum CrossFilterDirection {
  /** Filters flow from the dimension ({@code to}) side to the fact ({@code from}) side. */
  SINGLE,
  /** Filters flow both ways. */
  BOTH
}
