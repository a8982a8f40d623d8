/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


/**
 * Vets a {@linkplain SyntaxNode} tree against the allowed grammar and
 * compiles it into an {@linkplain ExprNode} tree. Only the constructs
 * enumerated here are allowed; anything else is rejected.
 * <ul>
 * <li>Numeric literals.</li>
 * <li>Column references: bare identifiers, or single quoted strings.</li>
 * <li>Binary {@code + - * / % **} (see {@linkplain ArrayOp}).</li>
 * <li>Unary {@code + -}.</li>
 * <li>Single-argument calls of {@linkplain MathFunction}s by name.</li>
 * </ul>
 * <p>
 * The whole tree is walked before anything is evaluated, so a rejected
 * expression is never partially executed.
 * </p>
 */
final class AllowList {

  // never
  private AllowList() {  }


  /**
   * Vets and compiles the given tree.
   *
   * @param node        root of the parse tree
   * @param expression  the expression text (for diagnostics)
   *
   * @throws ExpressionException if the tree contains a disallowed construct
   */
  static ExprNode compile(SyntaxNode node, String expression) throws ExpressionException {

    if (node instanceof SyntaxNode.Num num)
      return new ExprNode.Literal(num.value());

    if (node instanceof SyntaxNode.Name name)
      return new ExprNode.ColumnRef(name.id());

    if (node instanceof SyntaxNode.Str str) {
      if (str.parts().size() != 1)
        throw reject(expression, node, "string concatenation is not allowed");
      return new ExprNode.ColumnRef(str.parts().get(0));
    }

    if (node instanceof SyntaxNode.Unary unary) {
      switch (unary.op()) {
      case "-":   return new ExprNode.Negation(compile(unary.operand(), expression));
      case "+":   return compile(unary.operand(), expression);
      default:
        throw reject(expression, node, "unary operator '" + unary.op() + "' is not allowed");
      }
    }

    if (node instanceof SyntaxNode.Binary binary) {
      var op = ArrayOp.lookup(binary.op());
      if (op.isEmpty())
        throw reject(expression, node, "operator '" + binary.op() + "' is not allowed");
      return new ExprNode.Branch(
          op.get(),
          compile(binary.left(), expression),
          compile(binary.right(), expression));
    }

    if (node instanceof SyntaxNode.Call call) {
      if (!(call.callee() instanceof SyntaxNode.Name callee))
        throw reject(expression, node, "only calls to functions by name are allowed");
      var func = MathFunction.lookup(callee.id());
      if (func.isEmpty())
        throw reject(expression, node,
            "function '" + callee.id() + "' is not allowed; allowed functions: " +
            String.join(", ", MathFunction.functionNames()));
      if (call.args().size() != 1)
        throw reject(expression, node,
            "function '" + callee.id() + "' takes exactly 1 argument (" +
            call.args().size() + " given)");
      return new ExprNode.Call(func.get(), compile(call.args().get(0), expression));
    }

    if (node instanceof SyntaxNode.Attribute)
      throw reject(expression, node, "attribute access is not allowed");

    if (node instanceof SyntaxNode.Subscript)
      throw reject(expression, node, "subscripts are not allowed");

    if (node instanceof SyntaxNode.Compare)
      throw reject(expression, node, "comparison operators are not allowed");

    if (node instanceof SyntaxNode.BoolOp)
      throw reject(expression, node, "boolean operators are not allowed");

    throw reject(expression, node, "unsupported construct");
  }


  private static ExpressionException reject(String expression, SyntaxNode node, String why) {
    return new ExpressionException(
        "Invalid or unsafe expression",
        expression,
        why + " (at position " + (node.pos() + 1) + ")");
  }

}
