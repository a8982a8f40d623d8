/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;

import java.util.Objects;

/**
 * A trimmed line of text and its 1-based line number in the source.
 *
 * @param lineNo  1-based line number
 * @param text    the line, trimmed of leading and trailing whitespace
 */
public record SourceLine(int lineNo, String text) {

  public SourceLine {
    if (lineNo < 1)
      throw new IllegalArgumentException("lineNo " + lineNo + " < 1");
    Objects.requireNonNull(text, "null text");
  }

}
