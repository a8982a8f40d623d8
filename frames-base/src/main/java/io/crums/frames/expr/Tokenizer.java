/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.ArrayList;
import java.util.List;

/**
 * Expression tokenizer. Recognizes more operators than are allowed in an
 * expression, so that disallowed constructs (comparisons, attribute access, ..)
 * can be rejected structurally, after parsing. Characters that start no token
 * ({@code =}, {@code ;}, {@code @}, braces, ..) are rejected here.
 */
final class Tokenizer {

  enum Kind {
    NUMBER,
    NAME,
    STRING,
    OP,
    END
  }

  /**
   * @param kind    token kind
   * @param text    token text; for strings, the unquoted value
   * @param pos     zero-based character offset in the expression
   */
  record Token(Kind kind, String text, int pos) {

    boolean is(String op) {
      return kind == Kind.OP && text.equals(op);
    }

    boolean isName(String name) {
      return kind == Kind.NAME && text.equals(name);
    }
  }


  /** Multi-character operators come first (longest match wins). */
  private final static String[] OPS = {
      "**", "//", "<=", ">=", "==", "!=", "<<", ">>",
      "+", "-", "*", "/", "%", "<", ">", "&", "|", "^", "~",
      "(", ")", "[", "]", ",", ".", ":",
  };


  private final String expression;
  private int pos;

  private Tokenizer(String expression) {
    this.expression = expression;
  }


  /**
   * Tokenizes the given expression. The returned list always ends with an
   * {@linkplain Kind#END END} token.
   *
   * @throws ExpressionException on an unrecognized character, an unterminated string,
   *                             or a malformed number
   */
  static List<Token> tokenize(String expression) throws ExpressionException {
    return new Tokenizer(expression).tokens();
  }


  private List<Token> tokens() {
    var tokens = new ArrayList<Token>();
    final int len = expression.length();
    while (true) {
      while (pos < len && Character.isWhitespace(expression.charAt(pos)))
        ++pos;
      if (pos == len)
        break;

      char c = expression.charAt(pos);
      if (isDigit(c) || (c == '.' && pos + 1 < len && isDigit(expression.charAt(pos + 1))))
        tokens.add(number());
      else if (c == '_' || Character.isLetter(c))
        tokens.add(name());
      else if (c == '"' || c == '\'')
        tokens.add(string(c));
      else
        tokens.add(op());
    }
    tokens.add(new Token(Kind.END, "", len));
    return tokens;
  }


  private Token number() {
    final int start = pos;
    final int len = expression.length();
    skipDigits();
    if (pos < len && expression.charAt(pos) == '.') {
      ++pos;
      skipDigits();
    }
    if (pos < len && (expression.charAt(pos) == 'e' || expression.charAt(pos) == 'E')) {
      ++pos;
      if (pos < len && (expression.charAt(pos) == '+' || expression.charAt(pos) == '-'))
        ++pos;
      int expStart = pos;
      skipDigits();
      if (pos == expStart)
        throw syntaxError(start, "malformed number '" + expression.substring(start, pos) + "'");
    }
    if (pos < len) {
      char c = expression.charAt(pos);
      if (c == '_' || c == '.' || Character.isLetterOrDigit(c)) {
        while (pos < len && (expression.charAt(pos) == '_' ||
            Character.isLetterOrDigit(expression.charAt(pos))))
          ++pos;
        throw syntaxError(start, "malformed number '" + expression.substring(start, pos) + "'");
      }
    }
    return new Token(Kind.NUMBER, expression.substring(start, pos), start);
  }


  private void skipDigits() {
    while (pos < expression.length() && isDigit(expression.charAt(pos)))
      ++pos;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }


  private Token name() {
    final int start = pos;
    while (pos < expression.length()) {
      char c = expression.charAt(pos);
      if (c != '_' && !Character.isLetterOrDigit(c))
        break;
      ++pos;
    }
    return new Token(Kind.NAME, expression.substring(start, pos), start);
  }


  private Token string(char quote) {
    final int start = pos++;
    var value = new StringBuilder();
    while (pos < expression.length()) {
      char c = expression.charAt(pos++);
      if (c == quote)
        return new Token(Kind.STRING, value.toString(), start);
      if (c == '\\' && pos < expression.length()) {
        char next = expression.charAt(pos);
        if (next == '\\' || next == '"' || next == '\'') {
          value.append(next);
          ++pos;
          continue;
        }
      }
      value.append(c);
    }
    throw syntaxError(start, "unterminated string");
  }


  private Token op() {
    for (var op : OPS) {
      if (expression.startsWith(op, pos)) {
        var token = new Token(Kind.OP, op, pos);
        pos += op.length();
        return token;
      }
    }
    throw syntaxError(pos, "unexpected character '" + expression.charAt(pos) + "'");
  }


  private ExpressionException syntaxError(int at, String message) {
    return syntaxError(expression, at, message);
  }


  static ExpressionException syntaxError(String expression, int at, String message) {
    return new ExpressionException(
        "Invalid or unsafe expression",
        expression,
        "syntax error at position " + (at + 1) + ": " + message);
  }

}
