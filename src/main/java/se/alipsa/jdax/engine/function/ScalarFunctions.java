package se.alipsa.jdax.engine.function;

import se.alipsa.jdax.engine.Operators;
import se.alipsa.jdax.value.Coercions;
import se.alipsa.jdax.value.Value;

/**
 * Logical and conditional functions working on scalar arguments only.
 */
public final class ScalarFunctions {

  private ScalarFunctions() {
    // Utility class
  }

  static Value constant(FunctionArguments args, Value value) {
    args.requireCount(0);
    return value;
  }

  static Value isBlank(FunctionArguments args) {
    args.requireCount(1);
    return Value.of(args.value(0).isBlank());
  }

  /**
   * {@code IF(condition, then[, else])}. Only the selected branch is evaluated.
   *
   * @param args
   *          the call arguments
   * @return the selected branch, blank when the condition is false and there is
   *         no else branch
   */
  static Value ifFunction(FunctionArguments args) {
    args.requireRange(2, 3);
    if (Coercions.truthy(args.value(0))) {
      return args.value(1);
    }
    return args.size() == 3 ? args.value(2) : Value.BLANK;
  }

  /**
   * {@code SWITCH(expr, value1, result1, ...[, else])}: the first value equal to
   * {@code expr} selects its result.
   *
   * @param args
   *          the call arguments
   * @return the matching result, the else result or blank
   */
  static Value switchFunction(FunctionArguments args) {
    args.requireAtLeast(3);
    Value subject = args.value(0);
    boolean hasElse = args.size() % 2 == 0;
    int pairsEnd = hasElse ? args.size() - 1 : args.size();
    for (int i = 1; i < pairsEnd; i += 2) {
      if (Operators.valueEquals(subject, args.value(i))) {
        return args.value(i + 1);
      }
    }
    return hasElse ? args.value(args.size() - 1) : Value.BLANK;
  }

  /**
   * {@code DIVIDE(numerator, denominator[, alternate])}. The denominator is
   * evaluated first; a zero (or blank) denominator yields the alternate result
   * without evaluating the numerator.
   *
   * @param args
   *          the call arguments
   * @return the quotient, the alternate result or blank
   */
  static Value divide(FunctionArguments args) {
    args.requireRange(2, 3);
    double denominator = Coercions.toNumber(args.value(1));
    if (denominator == 0.0) {
      return args.size() == 3 ? args.value(2) : Value.BLANK;
    }
    double numerator = Coercions.toNumber(args.value(0));
    return Value.of(numerator / denominator);
  }

  static Value coalesce(FunctionArguments args) {
    args.requireAtLeast(1);
    for (int i = 0; i < args.size(); i++) {
      Value v = args.value(i);
      if (!v.isBlank()) {
        return v;
      }
    }
    return Value.BLANK;
  }

  static Value not(FunctionArguments args) {
    args.requireCount(1);
    return Value.of(!Coercions.truthy(args.value(0)));
  }

  static Value and(FunctionArguments args) {
    args.requireCount(2);
    return Value.of(Coercions.truthy(args.value(0)) && Coercions.truthy(args.value(1)));
  }

  static Value or(FunctionArguments args) {
    args.requireCount(2);
    return Value.of(Coercions.truthy(args.value(0)) || Coercions.truthy(args.value(1)));
  }
}
