/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import java.util.List;
import java.util.Objects;

/**
 * Frames aligned on a common column. The frames themselves are not modified
 * (no resampling or interpolation): this only records the union range of the
 * alignment column across all frames, so that they can be drawn against a
 * common axis.
 *
 * @param frames  the original frames, in the order given
 * @param column  the alignment column name
 * @param min     the minimum value of {@code column} across all frames
 * @param max     the maximum value of {@code column} across all frames
 *
 * @see Frames#align(List, String)
 */
public record AlignedFrames(List<Frame> frames, String column, double min, double max) {

  public AlignedFrames {
    frames = List.copyOf(frames);
    Objects.requireNonNull(column, "null column");
    if (frames.isEmpty())
      throw new IllegalArgumentException("empty frames list");
  }

  /** Returns the width of the range, {@code max - min}. */
  public double span() {
    return max - min;
  }

}
