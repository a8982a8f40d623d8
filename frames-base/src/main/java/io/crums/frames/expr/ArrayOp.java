/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.Optional;
import java.util.function.DoubleBinaryOperator;

/**
 * The allowed binary operations. All arithmetic is IEEE-754 {@code double}
 * arithmetic: division by zero, for example, yields an infinity or {@code NaN}
 * rather than an exception.
 * 
 * @see #applyAsDouble(double, double)
 */
public enum ArrayOp implements DoubleBinaryOperator {
  
  /** Symbol: {@code +} */
  ADD("+"),
  /** Symbol: {@code -} */
  SUBTRACT("-"),
  /** Symbol: {@code *} */
  MULTIPLY("*"),
  /** Symbol: {@code /} */
  DIVIDE("/"),
  /**
   * Floored modulo. The result takes the sign of the divisor:
   * {@code -1 % 3 == 2}, {@code 1 % -3 == -2}. Symbol: {@code %}
   */
  MODULO("%"),
  /** Exponentiation. Right-associative. Symbol: {@code **} */
  POWER("**");
  
  
  private final String symbol;
  
  private ArrayOp(String symbol) {
    this.symbol = symbol;
  }
  
  
  /** Returns the operator symbol. */
  public String symbol() {
    return symbol;
  }
  
  
  @Override
  public double applyAsDouble(double a, double b) {
    switch (this) {
    case ADD:       return a + b;
    case SUBTRACT:  return a - b;
    case MULTIPLY:  return a * b;
    case DIVIDE:    return a / b;
    case MODULO:    return floorMod(a, b);
    case POWER:     return Math.pow(a, b);
    default:
      throw new RuntimeException("unaccounted enum: " + this);
    }
  }
  
  
  /**
   * Applies the operation element-wise. The two arrays must have the same length.
   * 
   * @return a new array
   */
  public double[] apply(double[] a, double[] b) {
    if (a.length != b.length)
      throw new IllegalArgumentException(
          "length mismatch: " + a.length + " != " + b.length);
    double[] out = new double[a.length];
    for (int index = 0; index < out.length; ++index)
      out[index] = applyAsDouble(a[index], b[index]);
    return out;
  }
  
  
  /**
   * Returns the instance with the given symbol, if any.
   */
  public static Optional<ArrayOp> lookup(String symbol) {
    for (var op : values())
      if (op.symbol.equals(symbol))
        return Optional.of(op);
    return Optional.empty();
  }
  
  
  /**
   * Returns the instance with the given symbol.
   * 
   * @throws IllegalArgumentException if there's no such operator
   */
  public static ArrayOp forSymbol(String symbol) {
    return lookup(symbol).orElseThrow(
        () -> new IllegalArgumentException("symbol: " + symbol));
  }
  
  
  private static double floorMod(double a, double b) {
    double r = a % b;
    if (r != 0 && (r < 0) != (b < 0))
      r += b;
    return r;
  }

}
