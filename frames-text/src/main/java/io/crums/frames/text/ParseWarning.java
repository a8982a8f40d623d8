/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;

import java.util.Objects;
import java.util.Optional;

/**
 * A non-fatal parsing condition. Emitted when a source (or block) yields no
 * data rows.
 *
 * @param sourceId    the file path, or other source identifier
 * @param blockIndex  the block's index, if the source has more than one
 * @param lineNumber  1-based line number the condition pertains to; 0 if none
 * @param message     human readable description
 */
public record ParseWarning(
    String sourceId, Optional<Integer> blockIndex, int lineNumber, String message) {

  public ParseWarning {
    Objects.requireNonNull(sourceId, "null sourceId");
    Objects.requireNonNull(blockIndex, "null blockIndex");
    Objects.requireNonNull(message, "null message");
    if (lineNumber < 0)
      throw new IllegalArgumentException("lineNumber " + lineNumber + " < 0");
  }


  @Override
  public String toString() {
    var out = new StringBuilder(sourceId);
    if (lineNumber > 0)
      out.append(':').append(lineNumber);
    blockIndex.ifPresent(b -> out.append(" [block ").append(b).append(']'));
    return out.append(": ").append(message).toString();
  }

}
