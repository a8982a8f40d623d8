/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import io.crums.frames.expr.Tokenizer.Kind;
import io.crums.frames.expr.Tokenizer.Token;

/**
 * Recursive descent parser producing a {@linkplain SyntaxNode} tree.
 * Precedence, lowest to highest:
 * <pre>
 *  or
 *  and
 *  not
 *  comparisons (&lt; &gt; &lt;= &gt;= == != in is)
 *  |
 *  ^
 *  &amp;
 *  &lt;&lt; &gt;&gt;
 *  + -
 *  * / // %
 *  unary + - ~
 *  **            (right-associative; binds tighter than a unary op on its left)
 *  call, attribute, subscript
 * </pre>
 * Reserved words other than the operators above can't appear as operands.
 * <p>
 * Both the number of tokens and the nesting depth are bounded, so that the
 * parse (and the tree walks that follow it) never run out of stack.
 * </p>
 */
final class SyntaxParser {

  private final static Set<String> KEYWORDS = Set.of(
      "and", "or", "not", "in", "is", "if", "else", "for", "lambda", "import",
      "from", "as", "with", "yield", "await", "async", "del", "global", "nonlocal",
      "pass", "return", "raise", "try", "except", "finally", "while", "break",
      "continue", "class", "def", "assert", "True", "False", "None");

  private final static Set<String> COMPARISONS = Set.of("<", ">", "<=", ">=", "==", "!=");

  /** Maximum number of tokens in an expression. Bounds the size (and depth) of the tree. */
  final static int MAX_TOKENS = 2000;

  /** Maximum nesting depth: parentheses, call arguments, subscripts, and prefix operators. */
  final static int MAX_DEPTH = 200;


  private final String expression;
  private final List<Token> tokens;
  private int next;
  private int depth;


  private SyntaxParser(String expression) {
    this.expression = expression;
    this.tokens = Tokenizer.tokenize(expression);
    // the last token is END
    if (tokens.size() - 1 > MAX_TOKENS)
      throw error(tokens.get(MAX_TOKENS), "expression too long (more than " + MAX_TOKENS + " tokens)");
  }


  /**
   * Parses the given expression.
   *
   * @throws ExpressionException on a syntax error
   */
  static SyntaxNode parse(String expression) throws ExpressionException {
    return new SyntaxParser(expression).parseAll();
  }


  private SyntaxNode parseAll() {
    if (peek().kind() == Kind.END)
      throw error(peek(), "empty expression");
    var node = orTest();
    if (peek().kind() != Kind.END)
      throw error(peek(), "unexpected " + describe(peek()));
    return node;
  }


  private SyntaxNode orTest() {
    var first = peek();
    enter(first);
    var node = boolChain("or", this::andTest);
    --depth;
    return node;
  }

  private SyntaxNode andTest() {
    return boolChain("and", this::notTest);
  }

  private interface Production {
    SyntaxNode parse();
  }

  private SyntaxNode boolChain(String op, Production operand) {
    var first = peek();
    var node = operand.parse();
    if (!peek().isName(op))
      return node;
    var operands = new ArrayList<SyntaxNode>();
    operands.add(node);
    while (peek().isName(op)) {
      take();
      operands.add(operand.parse());
    }
    return new SyntaxNode.BoolOp(op, operands, first.pos());
  }


  private SyntaxNode notTest() {
    if (peek().isName("not")) {
      var not = take();
      enter(not);
      var node = new SyntaxNode.Unary("not", notTest(), not.pos());
      --depth;
      return node;
    }
    return comparison();
  }


  private SyntaxNode comparison() {
    var first = peek();
    var node = bitOr();
    List<String> ops = null;
    List<SyntaxNode> operands = null;
    while (true) {
      var t = peek();
      String op;
      if (t.kind() == Kind.OP && COMPARISONS.contains(t.text()))
        op = t.text();
      else if (t.isName("in") || t.isName("is"))
        op = t.text();
      else
        break;
      take();
      if (ops == null) {
        ops = new ArrayList<>();
        operands = new ArrayList<>();
        operands.add(node);
      }
      ops.add(op);
      operands.add(bitOr());
    }
    return ops == null ? node : new SyntaxNode.Compare(ops, operands, first.pos());
  }


  private SyntaxNode bitOr() {
    return binaryChain(this::bitXor, "|");
  }

  private SyntaxNode bitXor() {
    return binaryChain(this::bitAnd, "^");
  }

  private SyntaxNode bitAnd() {
    return binaryChain(this::shift, "&");
  }

  private SyntaxNode shift() {
    return binaryChain(this::arith, "<<", ">>");
  }

  private SyntaxNode arith() {
    return binaryChain(this::term, "+", "-");
  }

  private SyntaxNode term() {
    return binaryChain(this::factor, "*", "/", "//", "%");
  }


  /** Left-associative chain of binary operators. */
  private SyntaxNode binaryChain(Production operand, String... ops) {
    var node = operand.parse();
    while (true) {
      var t = peek();
      String op = null;
      for (var o : ops) {
        if (t.is(o)) {
          op = o;
          break;
        }
      }
      if (op == null)
        return node;
      take();
      node = new SyntaxNode.Binary(op, node, operand.parse(), t.pos());
    }
  }


  private SyntaxNode factor() {
    var t = peek();
    enter(t);
    SyntaxNode node;
    if (t.is("+") || t.is("-") || t.is("~")) {
      take();
      node = new SyntaxNode.Unary(t.text(), factor(), t.pos());
    } else
      node = power();
    --depth;
    return node;
  }


  private SyntaxNode power() {
    var base = postfix();
    var t = peek();
    if (!t.is("**"))
      return base;
    take();
    // right operand is a factor: 2 ** -1, and 2 ** 3 ** 2 == 2 ** 9
    return new SyntaxNode.Binary("**", base, factor(), t.pos());
  }


  private SyntaxNode postfix() {
    var node = atom();
    while (true) {
      var t = peek();
      if (t.is("(")) {
        take();
        node = new SyntaxNode.Call(node, arguments(), t.pos());
      } else if (t.is(".")) {
        take();
        var attr = take();
        if (attr.kind() != Kind.NAME)
          throw error(attr, "expected attribute name after '.'");
        node = new SyntaxNode.Attribute(node, attr.text(), t.pos());
      } else if (t.is("[")) {
        take();
        var index = orTest();
        expect("]");
        node = new SyntaxNode.Subscript(node, index, t.pos());
      } else
        return node;
    }
  }


  private List<SyntaxNode> arguments() {
    var args = new ArrayList<SyntaxNode>();
    while (!peek().is(")")) {
      args.add(orTest());
      if (peek().is(","))
        take();
      else
        break;
    }
    expect(")");
    return args;
  }


  private SyntaxNode atom() {
    var t = take();
    switch (t.kind()) {
    case NUMBER:
      return new SyntaxNode.Num(Double.parseDouble(t.text()), t.text(), t.pos());
    case NAME:
      if (KEYWORDS.contains(t.text()))
        throw error(t, "unexpected keyword '" + t.text() + "'");
      return new SyntaxNode.Name(t.text(), t.pos());
    case STRING:
      var parts = new ArrayList<String>();
      parts.add(t.text());
      while (peek().kind() == Kind.STRING)
        parts.add(take().text());
      return new SyntaxNode.Str(parts, t.pos());
    case OP:
      if (t.is("(")) {
        var inner = orTest();
        expect(")");
        return inner;
      }
      throw error(t, "unexpected " + describe(t));
    case END:
      throw error(t, "unexpected end of expression");
    default:
      throw new RuntimeException("unaccounted enum: " + t.kind());
    }
  }


  private void enter(Token at) {
    if (++depth > MAX_DEPTH)
      throw error(at, "expression too deeply nested (more than " + MAX_DEPTH + " levels)");
  }


  private Token peek() {
    return tokens.get(next);
  }

  private Token take() {
    var t = tokens.get(next);
    if (t.kind() != Kind.END)
      ++next;
    return t;
  }

  private void expect(String op) {
    var t = take();
    if (!t.is(op))
      throw error(t, "expected '" + op + "' but found " + describe(t));
  }


  private static String describe(Token t) {
    switch (t.kind()) {
    case END:     return "end of expression";
    case STRING:  return "string";
    default:      return "'" + t.text() + "'";
    }
  }


  private ExpressionException error(Token at, String message) {
    return Tokenizer.syntaxError(expression, at.pos(), message);
  }

}
