/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;

import java.util.List;

/**
 * A run of data lines. In block mode, a maximal run of consecutive data lines;
 * in single-frame mode, all the data lines of a source.
 *
 * @param index   zero-based block number, in order of appearance
 * @param lines   the block's data lines, in source order; not empty
 */
public record Block(int index, List<SourceLine> lines) {

  public Block {
    if (index < 0)
      throw new IllegalArgumentException("index " + index + " < 0");
    lines = List.copyOf(lines);
    if (lines.isEmpty())
      throw new IllegalArgumentException("empty block");
  }


  /** Returns the number of data lines. */
  public int size() {
    return lines.size();
  }

  /** Returns the line number of the first data line. */
  public int firstLineNo() {
    return lines.get(0).lineNo();
  }

  /** Returns the line number of the last data line. */
  public int lastLineNo() {
    return lines.get(lines.size() - 1).lineNo();
  }

}
