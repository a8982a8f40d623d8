/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * The single-argument functions an {@linkplain Expression} may call.
 * Out-of-domain arguments evaluate to {@code NaN} or an infinity (which the
 * expression then reports).
 */
public enum MathFunction implements DoubleUnaryOperator {
  
  /** Natural logarithm. */
  LOG("log", Math::log),
  LOG10("log10", Math::log10),
  LOG2("log2", MathFunction::log2),
  SQRT("sqrt", Math::sqrt),
  ABS("abs", Math::abs),
  SIN("sin", Math::sin),
  COS("cos", Math::cos),
  TAN("tan", Math::tan),
  EXP("exp", Math::exp);
  
  
  private final String fname;
  private final DoubleUnaryOperator func;
  
  private MathFunction(String fname, DoubleUnaryOperator func) {
    this.fname = fname;
    this.func = func;
  }
  
  
  /** Returns the name the function is called by in expressions. */
  public String functionName() {
    return fname;
  }
  
  
  @Override
  public double applyAsDouble(double operand) {
    return func.applyAsDouble(operand);
  }
  
  
  /**
   * Applies the function element-wise.
   * 
   * @return a new array
   */
  public double[] apply(double[] values) {
    double[] out = new double[values.length];
    for (int index = 0; index < out.length; ++index)
      out[index] = func.applyAsDouble(values[index]);
    return out;
  }
  
  
  /** Returns the function with the given name, if any. Names are case-sensitive. */
  public static Optional<MathFunction> lookup(String name) {
    for (var f : values())
      if (f.fname.equals(name))
        return Optional.of(f);
    return Optional.empty();
  }
  
  
  /** Returns the allowed function names. */
  public static List<String> functionNames() {
    return Arrays.stream(values()).map(MathFunction::functionName).toList();
  }
  
  
  private final static double LN2 = Math.log(2);
  
  /** Base-2 log. Exact for powers of 2. */
  private static double log2(double x) {
    if (x > 0 && x < Double.POSITIVE_INFINITY) {
      int exp = Math.getExponent(x);
      if (x == Math.scalb(1.0, exp))
        return exp;
    }
    return Math.log(x) / LN2;
  }

}
