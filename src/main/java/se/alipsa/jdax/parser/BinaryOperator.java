package se.alipsa.jdax.parser;

/** Binary operators with their binding power; higher binds tighter. */
public enum BinaryOperator {
  OR("||", 1), AND("&&", 2), EQUALS("=", 3), NOT_EQUALS("<>", 3), LESS("<", 3), LESS_EQUALS("<=", 3),
  GREATER(">", 3), GREATER_EQUALS(">=", 3), CONCAT("&", 4), ADD("+", 5), SUBTRACT("-", 5), MULTIPLY("*", 6),
  DIVIDE("/", 6);

  private final String symbol;
  private final int precedence;

  BinaryOperator(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  public String symbol() {
    return symbol;
  }

  public int precedence() {
    return precedence;
  }

  public boolean isComparison() {
    return precedence == 3;
  }

  /**
   * Look up an operator by its symbol.
   *
   * @param symbol
   *          operator text
   * @return the operator or {@code null} when the symbol is not a binary operator
   */
  public static BinaryOperator fromSymbol(String symbol) {
    for (BinaryOperator op : values()) {
      if (op.symbol.equals(symbol)) {
        return op;
      }
    }
    return null;
  }
}
