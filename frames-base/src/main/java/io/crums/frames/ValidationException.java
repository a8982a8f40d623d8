/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import java.util.Optional;

/**
 * An invariant violated outside of parsing or expression evaluation.
 * For example, out-of-domain input to a {@linkplain io.crums.frames.expr.Transform Transform},
 * or a {@code NaN} filter bound.
 */
@SuppressWarnings("serial")
public class ValidationException extends FrameException {
  
  private final String field;
  private final String value;

  /**
   * @param message   human readable description
   */
  public ValidationException(String message) {
    this(message, null, null);
  }

  /**
   * Full constructor.
   * 
   * @param message   human readable description
   * @param field     name of the offending field, or {@code null}
   * @param value     description of the offending value, or {@code null}
   */
  public ValidationException(String message, String field, String value) {
    super(message);
    this.field = field;
    this.value = value;
  }
  
  
  /** Returns the name of the field that failed validation, if known. */
  public Optional<String> field() {
    return Optional.ofNullable(field);
  }
  
  /** Returns a description of the value that failed validation, if known. */
  public Optional<String> value() {
    return Optional.ofNullable(value);
  }
  
  
  /**
   * Returns a multi-line description suitable for showing the user.
   */
  public String describe() {
    var out = new StringBuilder("Validation failed: ").append(getMessage());
    if (field != null)
      out.append(System.lineSeparator()).append("  Field: ").append(field);
    if (value != null)
      out.append(System.lineSeparator()).append("  Value: '").append(value).append('\'');
    return out.toString();
  }

}
