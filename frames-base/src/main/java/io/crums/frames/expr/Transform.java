/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

import io.crums.frames.ValidationException;

/**
 * Preset, element-wise transformations. Unlike {@linkplain Expression}s,
 * these validate their input's domain up front.
 * 
 * @see #apply(double[])
 */
public enum Transform {
  
  /** Natural logarithm. Requires positive values. */
  LOG("log", Math::log),
  /** Base-10 logarithm. Requires positive values. */
  LOG10("log10", Math::log10),
  /** Base-2 logarithm. Requires positive values. */
  LOG2("log2", MathFunction.LOG2),
  SQUARE("square", x -> x * x),
  CUBE("cube", x -> x * x * x),
  /** Square root. Requires non-negative values. */
  SQRT("sqrt", Math::sqrt),
  CBRT("cbrt", Math::cbrt),
  SIN("sin", Math::sin),
  COS("cos", Math::cos),
  TAN("tan", Math::tan),
  /** Inverse sine. Requires values in [-1, 1]. */
  ARCSIN("arcsin", Math::asin),
  /** Inverse cosine. Requires values in [-1, 1]. */
  ARCCOS("arccos", Math::acos),
  ARCTAN("arctan", Math::atan),
  ABS("abs", Math::abs),
  /** {@code 1/x}. Requires non-zero values. */
  INVERSE("inverse", x -> 1.0 / x),
  EXP("exp", Math::exp),
  NEGATE("negate", x -> -x);
  
  
  private final String label;
  private final DoubleUnaryOperator func;
  
  private Transform(String label, DoubleUnaryOperator func) {
    this.label = label;
    this.func = func;
  }
  
  
  /** Returns the lowercase name, for eg {@code "log10"}. */
  public String label() {
    return label;
  }
  
  
  /**
   * Applies the transform element-wise.
   * 
   * @param data  input values (not modified)
   * 
   * @return a new array of the same length
   * 
   * @throws ValidationException if {@code data} contains values outside the
   *         transform's domain (see the constants' documentation)
   */
  public double[] apply(double[] data) throws ValidationException {
    validate(data);
    double[] out = new double[data.length];
    for (int index = 0; index < out.length; ++index)
      out[index] = func.applyAsDouble(data[index]);
    return out;
  }
  
  
  private void validate(double[] data) {
    switch (this) {
    case LOG:
    case LOG10:
    case LOG2:
      check(data, x -> x <= 0, label + " requires positive values", "contains non-positive values");
      break;
    case SQRT:
      check(data, x -> x < 0, "sqrt requires non-negative values", "contains negative values");
      break;
    case ARCSIN:
    case ARCCOS:
      check(data, x -> Math.abs(x) > 1,
          label + " requires values in [-1, 1]", "contains values outside [-1, 1]");
      break;
    case INVERSE:
      check(data, x -> x == 0, "inverse (1/x) requires non-zero values", "contains zero");
      break;
    default:
      break;
    }
  }
  
  
  private static void check(double[] data, DoublePredicate bad, String message, String value) {
    for (double x : data)
      if (bad.test(x))
        throw new ValidationException(message, "data", value);
  }
  
  
  /**
   * Returns the instance with the given {@linkplain #label() label}.
   * 
   * @throws IllegalArgumentException if there's no such transform
   */
  public static Transform forLabel(String label) {
    for (var t : values())
      if (t.label.equals(label))
        return t;
    throw new IllegalArgumentException("unknown transform: " + label);
  }

}
