/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled, vetted arithmetic expression over named columns.
 *
 * <h3>Grammar</h3>
 * <p>
 * Numeric literals ({@code 2}, {@code 0.5}, {@code 1e-3}); column names, either
 * bare ({@code energy}) or quoted ({@code "Column 1"}, {@code 'k point'});
 * binary {@code + - * / % **}; unary {@code + -}; parentheses; and calls to
 * the single-argument functions {@code log, log10, log2, sqrt, abs, sin, cos,
 * tan, exp}. Nothing else is allowed: attribute access, subscripts,
 * comparisons, boolean operators, other functions, etc. are rejected when the
 * expression is {@linkplain #compile(String) compiled}, before any evaluation.
 * </p>
 *
 * <h3>Evaluation</h3>
 * <p>
 * Literals are broadcast to the length of the referenced columns, and
 * operations are applied element-wise. A result containing {@code NaN} or an
 * infinity is an error (as are references to unknown columns).
 * </p>
 */
public final class Expression {


  /**
   * Compiles the given expression.
   *
   * @param text  not null
   *
   * @throws ExpressionException if the expression is malformed or disallowed
   */
  public static Expression compile(String text) throws ExpressionException {
    Objects.requireNonNull(text, "null expression");
    var syntax = SyntaxParser.parse(text);
    return new Expression(text, AllowList.compile(syntax, text));
  }


  /**
   * Determines whether the given expression is well-formed and allowed.
   * Does not check column references.
   */
  public static boolean isSafe(String text) {
    try {
      compile(text);
      return true;
    } catch (ExpressionException rejected) {
      return false;
    }
  }


  /**
   * Compiles and evaluates the given expression.
   *
   * @see #evaluate(Map)
   */
  public static double[] evaluate(String text, Map<String, double[]> columns)
      throws ExpressionException {
    return compile(text).evaluate(columns);
  }



  private final String text;
  private final ExprNode root;
  private final Set<String> columnNames;


  private Expression(String text, ExprNode root) {
    this.text = text;
    this.root = root;
    var names = new LinkedHashSet<String>();
    root.collectColumns(names);
    this.columnNames = Collections.unmodifiableSet(names);
  }


  /** Returns the expression text. */
  public String text() {
    return text;
  }

  /** Returns the root of the evaluation tree. */
  public ExprNode root() {
    return root;
  }

  /** Returns the names of the columns referenced, in order of first appearance. */
  public Set<String> columnNames() {
    return columnNames;
  }


  /**
   * Evaluates this expression against the given columns. The operating length
   * is that of the first referenced column; if no columns are referenced,
   * it's the length of the first column in the map (zero, if the map is empty).
   *
   * @param columns name to values map
   *
   * @return a new array
   * @see #evaluate(ColumnBindings, int)
   */
  public double[] evaluate(Map<String, double[]> columns) throws ExpressionException {
    int length = 0;
    var refed = columnNames.stream().filter(columns::containsKey).findFirst();
    if (refed.isPresent())
      length = columns.get(refed.get()).length;
    else if (!columns.isEmpty())
      length = columns.values().iterator().next().length;
    return evaluate(ColumnBindings.of(columns), length);
  }


  /**
   * Evaluates this expression.
   *
   * @param bindings  column values
   * @param length    operating length: literals are broadcast to this length, and
   *                  every referenced column must have this many values
   *
   * @return a new array of size {@code length}, with finite values only
   *
   * @throws ExpressionException if a referenced column is not bound, or has the
   *         wrong length, or if the result contains {@code NaN} or an infinity
   */
  public double[] evaluate(ColumnBindings bindings, int length) throws ExpressionException {
    if (length < 0)
      throw new IllegalArgumentException("length " + length + " < 0");

    for (var name : columnNames) {
      var values = bindings.values(name);
      if (values.isEmpty())
        throw new ExpressionException(
            "Column '" + name + "' not found",
            text,
            "Available columns: " + String.join(", ", bindings.names()));
      int size = values.get().remaining();
      if (size != length)
        throw new ExpressionException(
            "Column '" + name + "' has " + size + " values; expected " + length,
            text,
            null);
    }

    double[] result = root.evaluate(bindings, length);

    for (int index = 0; index < result.length; ++index) {
      if (Double.isNaN(result[index]))
        throw new ExpressionException(
            "Expression produced invalid result (NaN)",
            text,
            "Check for invalid operations like log of negative (first at row " + (index + 1) + ")");
    }
    for (int index = 0; index < result.length; ++index) {
      if (Double.isInfinite(result[index]))
        throw new ExpressionException(
            "Expression produced infinite result",
            text,
            "Check for division by zero (first at row " + (index + 1) + ")");
    }
    return result;
  }


  @Override
  public String toString() {
    return text;
  }

}
