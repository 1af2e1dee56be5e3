package se.alipsa.jdax.pivot;

import java.util.List;
import se.alipsa.jdax.parser.BinaryOperator;
import se.alipsa.jdax.value.Value;
import se.alipsa.jdax.value.Value.BooleanValue;
import se.alipsa.jdax.value.Value.NumberValue;
import se.alipsa.jdax.value.Value.TextValue;

/**
 * A measure rewritten over per-group aggregation results. Evaluation never
 * fails: where the general evaluator would raise a type error, a planned
 * expression yields blank.
 */
sealed interface PlannedExpr {

  /**
   * Evaluate against the aggregation results of one group.
   *
   * @param aggregations
   *          one value per planned aggregation, in planner order
   * @return the value
   */
  Value evaluate(List<Value> aggregations);

  record Const(Value value) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      return value;
    }
  }

  record AggRef(int index) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      return index < aggregations.size() ? aggregations.get(index) : Value.BLANK;
    }
  }

  record Negate(PlannedExpr operand) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      Double n = number(operand.evaluate(aggregations));
      return n == null ? Value.BLANK : Value.of(-n);
    }
  }

  record IsBlank(PlannedExpr operand) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      return Value.of(operand.evaluate(aggregations).isBlank());
    }
  }

  record Not(PlannedExpr operand) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      Boolean b = truthy(operand.evaluate(aggregations));
      return b == null ? Value.BLANK : Value.of(!b);
    }
  }

  record Binary(BinaryOperator op, PlannedExpr left, PlannedExpr right) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      Value l = left.evaluate(aggregations);
      Value r = right.evaluate(aggregations);
      switch (op) {
        case ADD, SUBTRACT, MULTIPLY, DIVIDE: {
          Double a = number(l);
          Double b = number(r);
          if (a == null || b == null) {
            return Value.BLANK;
          }
          return Value.of(switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            default -> a / b;
          });
        }
        case CONCAT:
          return Value.of(text(l) + text(r));
        case AND, OR: {
          Boolean a = truthy(l);
          Boolean b = truthy(r);
          if (a == null || b == null) {
            return Value.BLANK;
          }
          return Value.of(op == BinaryOperator.AND ? a && b : a || b);
        }
        default:
          return compare(op, l, r);
      }
    }
  }

  record If(PlannedExpr condition, PlannedExpr then, PlannedExpr otherwise) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      Boolean cond = truthy(condition.evaluate(aggregations));
      if (cond == null) {
        return Value.BLANK;
      }
      if (cond) {
        return then.evaluate(aggregations);
      }
      return otherwise == null ? Value.BLANK : otherwise.evaluate(aggregations);
    }
  }

  record Divide(PlannedExpr numerator, PlannedExpr denominator, PlannedExpr alternate) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      Value num = numerator.evaluate(aggregations);
      Double den = number(denominator.evaluate(aggregations));
      if (den == null) {
        return Value.BLANK;
      }
      if (den == 0.0) {
        return alternate == null ? Value.BLANK : alternate.evaluate(aggregations);
      }
      Double n = number(num);
      return n == null ? Value.BLANK : Value.of(n / den);
    }
  }

  record Coalesce(List<PlannedExpr> args) implements PlannedExpr {
    @Override
    public Value evaluate(List<Value> aggregations) {
      for (PlannedExpr arg : args) {
        Value v = arg.evaluate(aggregations);
        if (!v.isBlank()) {
          return v;
        }
      }
      return Value.BLANK;
    }
  }

  /** Number coercion without errors; {@code null} for text. */
  private static Double number(Value value) {
    if (value instanceof NumberValue n) {
      return n.value();
    }
    if (value instanceof BooleanValue b) {
      return b.value() ? 1.0 : 0.0;
    }
    if (value instanceof TextValue) {
      return null;
    }
    return 0.0;
  }

  private static String text(Value value) {
    if (value instanceof TextValue t) {
      return t.value();
    }
    if (value instanceof NumberValue n) {
      return NumberValue.formatNumber(n.value());
    }
    if (value instanceof BooleanValue b) {
      return b.value() ? "TRUE" : "FALSE";
    }
    return "";
  }

  /** Truthiness without errors; {@code null} for text. */
  private static Boolean truthy(Value value) {
    if (value instanceof BooleanValue b) {
      return b.value();
    }
    if (value instanceof NumberValue n) {
      return n.value() != 0.0;
    }
    if (value instanceof TextValue) {
      return null;
    }
    return false;
  }

  private static Value compare(BinaryOperator op, Value l, Value r) {
    int cmp;
    boolean lText = l instanceof TextValue;
    boolean rText = r instanceof TextValue;
    if (lText || rText) {
      if (!(lText || l.isBlank()) || !(rText || r.isBlank())) {
        return Value.BLANK;
      }
      cmp = text(l).compareTo(text(r));
    } else {
      double a = number(l);
      double b = number(r);
      if (Double.isNaN(a) || Double.isNaN(b)) {
        return Value.BLANK;
      }
      cmp = Double.compare(a, b);
    }
    return switch (op) {
      case EQUALS -> Value.of(cmp == 0);
      case NOT_EQUALS -> Value.of(cmp != 0);
      case LESS -> Value.of(cmp < 0);
      case LESS_EQUALS -> Value.of(cmp <= 0);
      case GREATER -> Value.of(cmp > 0);
      case GREATER_EQUALS -> Value.of(cmp >= 0);
      default -> Value.BLANK;
    };
  }
}
