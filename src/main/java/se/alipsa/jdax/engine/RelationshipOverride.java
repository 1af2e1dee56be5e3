package se.alipsa.jdax.engine;

import se.alipsa.jdax.model.CrossFilterDirection;

/**
 * A per-call replacement of a relationship's filter direction, installed by
 * {@code USERELATIONSHIP} and {@code CROSSFILTER}.
 */
public enum RelationshipOverride {
  /** Active, dimension filters fact only. */
  SINGLE,
  /** Active, filters flow both ways. */
  BOTH,
  /** Active, fact filters dimension only. */
  ONE_WAY_REVERSE,
  /** Inactive for the duration of the call. */
  DISABLED;

  /**
   * The override for an activated relationship with the given direction.
   *
   * @param direction
   *          the direction
   * @return {@link #SINGLE} or {@link #BOTH}
   */
  public static RelationshipOverride active(CrossFilterDirection direction) {
    return direction == CrossFilterDirection.BOTH ? BOTH : SINGLE;
  }
}
