/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.List;

/**
 * Parse tree of an expression, before it is vetted. The tree models more
 * constructs than are allowed (see {@linkplain AllowList}) so that
 * disallowed ones are recognized for what they are.
 * Every node records the zero-based character offset it starts at.
 */
sealed interface SyntaxNode {

  int pos();


  /** Numeric literal. */
  record Num(double value, String text, int pos) implements SyntaxNode {  }

  /** Bare identifier. */
  record Name(String id, int pos) implements SyntaxNode {  }

  /**
   * Quoted string literal. More than one part means adjacent literals
   * (implicit concatenation).
   */
  record Str(List<String> parts, int pos) implements SyntaxNode {  }

  /** Prefix operator: {@code + - ~ not}. */
  record Unary(String op, SyntaxNode operand, int pos) implements SyntaxNode {  }

  /** Binary arithmetic, bitwise, or shift operator. */
  record Binary(String op, SyntaxNode left, SyntaxNode right, int pos) implements SyntaxNode {  }

  /** Comparison chain: {@code operands.size() == ops.size() + 1}. */
  record Compare(List<String> ops, List<SyntaxNode> operands, int pos) implements SyntaxNode {  }

  /** {@code and} / {@code or} chain. */
  record BoolOp(String op, List<SyntaxNode> operands, int pos) implements SyntaxNode {  }

  /** Call. The callee needn't be a name. */
  record Call(SyntaxNode callee, List<SyntaxNode> args, int pos) implements SyntaxNode {  }

  /** Attribute access: {@code target.name}. */
  record Attribute(SyntaxNode target, String name, int pos) implements SyntaxNode {  }

  /** Subscript: {@code target[index]}. */
  record Subscript(SyntaxNode target, SyntaxNode index, int pos) implements SyntaxNode {  }

}
