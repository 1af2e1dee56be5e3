package se.alipsa.jdax.value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scalar value produced and consumed by the engine. The set of kinds is closed:
 * there is no separate date type, dates and times are carried as numbers.
 */
public sealed interface Value permits Value.BlankValue, Value.NumberValue, Value.TextValue, Value.BooleanValue {

  /** The single blank value. */
  Value BLANK = new BlankValue();

  static Value blank() {
    return BLANK;
  }

  static Value of(double number) {
    return new NumberValue(number);
  }

  static Value of(String text) {
    return text == null ? BLANK : new TextValue(text);
  }

  static Value of(boolean bool) {
    return bool ? BooleanValue.TRUE : BooleanValue.FALSE;
  }

  /**
   * Convert a plain Java object into a value. {@code null} becomes blank,
   * {@link Number} becomes a number, {@link Boolean} a boolean and anything else
   * text via {@code toString()}.
   *
   * @param object
   *          the object to convert
   * @return the matching value
   */
  static Value fromObject(Object object) {
    if (object == null) {
      return BLANK;
    }
    if (object instanceof Value value) {
      return value;
    }
    if (object instanceof Number number) {
      return of(number.doubleValue());
    }
    if (object instanceof Boolean bool) {
      return of(bool.booleanValue());
    }
    return of(object.toString());
  }

  default boolean isBlank() {
    return this instanceof BlankValue;
  }

  /** Blank value. */
  record BlankValue() implements Value {
    @Override
    public String toString() {
      return "BLANK";
    }
  }

  /**
   * Numeric value.
   *
   * @param value
   *          the number; negative zero is normalized to zero so equal numbers hash
   *          alike
   */
  record NumberValue(double value) implements Value {

    public NumberValue {
      if (value == 0.0d) {
        value = 0.0d;
      }
    }

    @Override
    public String toString() {
      return formatNumber(value);
    }

    /**
     * Render a number the way text coercion does: shortest decimal form without
     * exponent and without a trailing {@code .0}.
     *
     * @param value
     *          the number to render
     * @return decimal string
     */
    public static String formatNumber(double value) {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return Double.toString(value);
      }
      if (value == Math.rint(value) && Math.abs(value) < 1e15) {
        return Long.toString((long) value);
      }
      return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }
  }

  /**
   * Text value.
   *
   * @param value
   *          the text, never {@code null}
   */
  record TextValue(String value) implements Value {

    public TextValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
      return value;
    }
  }

  /**
   * Boolean value.
   *
   * @param value
   *          the boolean
   */
  record BooleanValue(boolean value) implements Value {

    static final BooleanValue TRUE = new BooleanValue(true);
    static final BooleanValue FALSE = new BooleanValue(false);

    @Override
    public String toString() {
      return value ? "TRUE" : "FALSE";
    }
  }
}
