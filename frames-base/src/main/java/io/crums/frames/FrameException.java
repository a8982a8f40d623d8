/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


/**
 * Base exception in the <code>frames</code> modules. Subclasses signal
 * malformed input (data files, user-typed expressions, bad arguments) and
 * carry enough context for a precise user-facing message.
 * 
 * @see ValidationException
 * @see ColumnNotFoundException
 */
@SuppressWarnings("serial")
public class FrameException extends RuntimeException {

  public FrameException(String message) {
    super(message);
  }

  public FrameException(Throwable cause) {
    super(cause);
  }

  public FrameException(String message, Throwable cause) {
    super(message, cause);
  }

}
