/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import java.util.List;
import java.util.Objects;

/**
 * Operations on multiple {@linkplain Frame}s.
 */
public class Frames {

  // never
  private Frames() {  }


  /**
   * Aligns the given frames on a common column. Computes the union range of
   * the column's values across all frames; the frames themselves are returned
   * as-is. {@code NaN}s in the column propagate to the range.
   *
   * @param frames  not empty
   * @param column  name of a column present in every frame
   *
   * @throws IllegalArgumentException if {@code frames} is empty
   * @throws ColumnNotFoundException if any frame lacks the column
   * @throws ValidationException if the column has no values in some frame
   */
  public static AlignedFrames align(List<Frame> frames, String column)
      throws ColumnNotFoundException, ValidationException {

    Objects.requireNonNull(column, "null column");
    if (frames.isEmpty())
      throw new IllegalArgumentException("frames list cannot be empty");

    for (int index = 0; index < frames.size(); ++index) {
      var frame = frames.get(index);
      if (!frame.hasColumn(column))
        throw new ColumnNotFoundException(
            "Column '%s' not found in frame %d (source: %s)"
            .formatted(column, index, frame.sourceId()),
            column,
            frame.columnNames());
    }

    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (var frame : frames) {
      var col = frame.getColumn(column);
      if (col.size() == 0)
        throw new ValidationException(
            "cannot align empty frames",
            column,
            "no values in " + frame.sourceId() + frame.blockIndex().map(b -> " (block " + b + ")").orElse(""));
      for (int row = 0; row < col.size(); ++row) {
        double value = col.get(row);
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
    }

    return new AlignedFrames(frames, column, min, max);
  }

}
