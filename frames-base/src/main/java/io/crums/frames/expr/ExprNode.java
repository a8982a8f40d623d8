/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Vetted arithmetic evaluation tree. Instances are only created by
 * {@linkplain AllowList}, so every tree is made up of allowed constructs.
 *
 * <h3>Evaluation</h3>
 * <p>
 * Nodes evaluate to arrays of a given length. {@linkplain Literal}s are
 * broadcast to that length; {@linkplain ColumnRef}s must be bound to
 * exactly that many values (the caller checks this). Operations are applied
 * element-wise in {@code double} arithmetic.
 * </p>
 *
 * @see Expression
 */
public abstract sealed class ExprNode
    permits ExprNode.Literal, ExprNode.ColumnRef, ExprNode.Negation, ExprNode.Branch, ExprNode.Call {

  // package-private: only subclassed here
  ExprNode() {  }


  /**
   * Evaluates this node.
   *
   * @param bindings  column values; every referenced column must be bound
   * @param length    the operating length
   *
   * @return a new array of size {@code length}
   */
  public abstract double[] evaluate(ColumnBindings bindings, int length);


  /** Adds the names of the columns referenced in this tree, in pre-order. */
  abstract void collectColumns(Set<String> names);


  /** A numeric constant. */
  public static final class Literal extends ExprNode {

    private final double value;

    Literal(double value) {
      this.value = value;
    }

    public double value() {
      return value;
    }

    @Override
    public double[] evaluate(ColumnBindings bindings, int length) {
      double[] out = new double[length];
      Arrays.fill(out, value);
      return out;
    }

    @Override
    void collectColumns(Set<String> names) {  }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }


  /** A reference to a column by name. */
  public static final class ColumnRef extends ExprNode {

    private final String name;

    ColumnRef(String name) {
      this.name = Objects.requireNonNull(name);
    }

    public String name() {
      return name;
    }

    @Override
    public double[] evaluate(ColumnBindings bindings, int length) {
      var values = bindings.values(name).orElseThrow(
          () -> new IllegalStateException("unbound column: " + name));
      if (values.remaining() != length)
        throw new IllegalStateException(
            "column '" + name + "' has " + values.remaining() + " values; expected " + length);
      double[] out = new double[length];
      values.slice().get(out);
      return out;
    }

    @Override
    void collectColumns(Set<String> names) {
      names.add(name);
    }

    @Override
    public String toString() {
      return "\"" + name + "\"";
    }
  }


  /** Unary minus. */
  public static final class Negation extends ExprNode {

    private final ExprNode operand;

    Negation(ExprNode operand) {
      this.operand = operand;
    }

    public ExprNode operand() {
      return operand;
    }

    @Override
    public double[] evaluate(ColumnBindings bindings, int length) {
      double[] out = operand.evaluate(bindings, length);
      for (int index = 0; index < length; ++index)
        out[index] = -out[index];
      return out;
    }

    @Override
    void collectColumns(Set<String> names) {
      operand.collectColumns(names);
    }

    @Override
    public String toString() {
      return "-(" + operand + ")";
    }
  }


  /** Binary operation. */
  public static final class Branch extends ExprNode {

    private final ArrayOp op;
    private final ExprNode left;
    private final ExprNode right;

    Branch(ArrayOp op, ExprNode left, ExprNode right) {
      this.op = Objects.requireNonNull(op);
      this.left = left;
      this.right = right;
    }

    public ArrayOp op() {
      return op;
    }

    public ExprNode left() {
      return left;
    }

    public ExprNode right() {
      return right;
    }

    @Override
    public double[] evaluate(ColumnBindings bindings, int length) {
      return op.apply(left.evaluate(bindings, length), right.evaluate(bindings, length));
    }

    @Override
    void collectColumns(Set<String> names) {
      left.collectColumns(names);
      right.collectColumns(names);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }


  /** Single-argument function call. */
  public static final class Call extends ExprNode {

    private final MathFunction func;
    private final ExprNode arg;

    Call(MathFunction func, ExprNode arg) {
      this.func = Objects.requireNonNull(func);
      this.arg = arg;
    }

    public MathFunction function() {
      return func;
    }

    public ExprNode argument() {
      return arg;
    }

    @Override
    public double[] evaluate(ColumnBindings bindings, int length) {
      return func.apply(arg.evaluate(bindings, length));
    }

    @Override
    void collectColumns(Set<String> names) {
      arg.collectColumns(names);
    }

    @Override
    public String toString() {
      return func.functionName() + "(" + arg + ")";
    }
  }

}
