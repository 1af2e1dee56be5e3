package se.alipsa.jdax.engine;

import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.parser.BinaryOperator;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;

/**
 * Operator semantics shared by the evaluator and the pivot planner. The
 * short-circuit operators are handled by the callers; here both operands are
 * already evaluated.
 */
public final class Operators {

  private Operators() {
    // Utility class
  }

  /**
   * Apply a binary operator to two evaluated operands.
   *
   * @param op
   *          the operator
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @return the result
   * @throws DaxException
   *           of kind {@code TYPE} when an operand cannot be coerced
   */
  public static Value apply(BinaryOperator op, Value left, Value right) {
    return switch (op) {
      case ADD -> Value.of(Coercions.toNumber(left) + Coercions.toNumber(right));
      case SUBTRACT -> Value.of(Coercions.toNumber(left) - Coercions.toNumber(right));
      case MULTIPLY -> Value.of(Coercions.toNumber(left) * Coercions.toNumber(right));
      // raw IEEE division, DIVIDE() is the blank-aware variant
      case DIVIDE -> Value.of(Coercions.toNumber(left) / Coercions.toNumber(right));
      case CONCAT -> Value.of(Coercions.toText(left) + Coercions.toText(right));
      case AND -> Value.of(Coercions.truthy(left) && Coercions.truthy(right));
      case OR -> Value.of(Coercions.truthy(left) || Coercions.truthy(right));
      default -> Value.of(compare(op, left, right));
    };
  }

  /**
   * Evaluate a comparison operator.
   *
   * @param op
   *          a comparison operator
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @return the outcome of the comparison
   */
  public static boolean compare(BinaryOperator op, Value left, Value right) {
    int cmp = Coercions.compare(left, right);
    return switch (op) {
      case EQUALS -> cmp == 0;
      case NOT_EQUALS -> cmp != 0;
      case LESS -> cmp < 0;
      case LESS_EQUALS -> cmp <= 0;
      case GREATER -> cmp > 0;
      case GREATER_EQUALS -> cmp >= 0;
      default -> throw new IllegalArgumentException(op + " is not a comparison");
    };
  }

  /**
   * Equality as used by {@code =}, {@code SWITCH} and {@code CONTAINSROW}.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @return {@code true} when the values compare equal
   */
  public static boolean valueEquals(Value left, Value right) {
    return compare(BinaryOperator.EQUALS, left, right);
  }
}
