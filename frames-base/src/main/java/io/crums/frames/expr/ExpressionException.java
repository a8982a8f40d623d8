/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.util.Optional;

import io.crums.frames.FrameException;

/**
 * A rejected or failed arithmetic expression. Thrown when an expression
 * is outside the allowed grammar, references an unknown column, or
 * evaluates to a non-finite value.
 */
@SuppressWarnings("serial")
public class ExpressionException extends FrameException {
  
  private final String expression;
  private final String detail;

  /**
   * Full constructor.
   * 
   * @param message     human readable summary
   * @param expression  the expression text, or {@code null}
   * @param detail      additional detail, or {@code null}
   */
  public ExpressionException(String message, String expression, String detail) {
    super(message);
    this.expression = expression;
    this.detail = detail;
  }
  
  
  /** Returns the expression text, if known. */
  public Optional<String> expression() {
    return Optional.ofNullable(expression);
  }
  
  /** Returns the detail, if any. */
  public Optional<String> detail() {
    return Optional.ofNullable(detail);
  }
  
  
  /**
   * Returns a multi-line description suitable for showing the user.
   */
  public String describe() {
    var out = new StringBuilder("Expression error: ").append(getMessage());
    if (expression != null)
      out.append(System.lineSeparator()).append("  Expression: ").append(expression);
    if (detail != null)
      out.append(System.lineSeparator()).append("  Detail: ").append(detail);
    return out.toString();
  }

}
