package se.alipsa.jdax.value;

import se.alipsa.jdax.DaxException;
import se.alipsa.jdax.value.Value.BlankValue;
import se.alipsa.jdax.value.Value.BooleanValue;
import se.alipsa.jdax.value.Value.NumberValue;
import se.alipsa.jdax.value.Value.TextValue;

/**
 * Conversion rules between value kinds. Every arithmetic, concatenation,
 * comparison and logical operator routes through exactly one of these methods.
 */
public final class Coercions {

  private Coercions() {
  }

  /**
   * Numeric coercion used by {@code + - * /} and numeric comparisons.
   *
   * @param value
   *          the value to coerce
   * @return the number; blank is zero and booleans are one or zero
   * @throws DaxException
   *           of kind {@code TYPE} for text
   */
  public static double toNumber(Value value) {
    if (value instanceof NumberValue number) {
      return number.value();
    }
    if (value instanceof BooleanValue bool) {
      return bool.value() ? 1.0 : 0.0;
    }
    if (value instanceof BlankValue) {
      return 0.0;
    }
    throw DaxException.type("cannot coerce " + describe(value) + " to number");
  }

  /**
   * Text coercion used by the {@code &} operator.
   *
   * @param value
   *          the value to coerce
   * @return the text form; blank is the empty string
   */
  public static String toText(Value value) {
    if (value instanceof TextValue text) {
      return text.value();
    }
    if (value instanceof NumberValue number) {
      return NumberValue.formatNumber(number.value());
    }
    if (value instanceof BooleanValue bool) {
      return bool.value() ? "TRUE" : "FALSE";
    }
    return "";
  }

  /**
   * Truthiness used by IF, AND, OR, NOT and the short-circuit operators.
   *
   * @param value
   *          the value to test
   * @return the boolean interpretation
   * @throws DaxException
   *           of kind {@code TYPE} for text
   */
  public static boolean truthy(Value value) {
    if (value instanceof BooleanValue bool) {
      return bool.value();
    }
    if (value instanceof NumberValue number) {
      return number.value() != 0.0;
    }
    if (value instanceof BlankValue) {
      return false;
    }
    throw DaxException.type("cannot coerce " + describe(value) + " to boolean");
  }

  /**
   * Compare two values. Text compares with text lexically (blank acts as the
   * empty string), everything else compares numerically.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @return negative, zero or positive like {@link Comparable#compareTo}
   * @throws DaxException
   *           of kind {@code TYPE} when text meets a number or boolean
   */
  public static int compare(Value left, Value right) {
    boolean leftText = left instanceof TextValue;
    boolean rightText = right instanceof TextValue;
    if (leftText || rightText) {
      if ((leftText || left.isBlank()) && (rightText || right.isBlank())) {
        return Integer.signum(toText(left).compareTo(toText(right)));
      }
      throw DaxException.type("cannot compare " + describe(left) + " and " + describe(right));
    }
    return Double.compare(toNumber(left), toNumber(right));
  }

  /**
   * Short type name used in error messages.
   *
   * @param value
   *          the value
   * @return a description including the kind
   */
  public static String describe(Value value) {
    if (value instanceof TextValue text) {
      return "text \"" + text.value() + "\"";
    }
    if (value instanceof NumberValue) {
      return "number " + value;
    }
    if (value instanceof BooleanValue) {
      return "boolean " + value;
    }
    return "BLANK";
  }

  /**
   * Kind name used when checking that relationship join columns agree.
   *
   * @param value
   *          a non-blank value
   * @return {@code Number}, {@code Text} or {@code Boolean}
   */
  public static String kindName(Value value) {
    if (value instanceof NumberValue) {
      return "Number";
    }
    if (value instanceof TextValue) {
      return "Text";
    }
    if (value instanceof BooleanValue) {
      return "Boolean";
    }
    return "Blank";
  }
}
