/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import java.nio.DoubleBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * A named, dense sequence of {@code double}s. Instances are immutable.
 *
 * <h3>Index</h3>
 * <p>
 * The {@linkplain #index() index} is the column's zero-based position in
 * the source it was read from, or its append order, if it's a
 * {@linkplain #isDerived() derived} column. It survives filtering (the
 * index of a column in a filtered frame is the same as in the original).
 * </p>
 *
 * @see Frame
 */
public final class Column {

  private final String name;
  private final int index;
  private final double[] data;
  private final boolean derived;


  /**
   * Creates a non-derived instance. The {@code data} array is copied.
   *
   * @param name    not null
   * @param index   &ge; 0
   * @param data    not null
   */
  public Column(String name, int index, double[] data) {
    this(name, index, data, false);
  }


  /**
   * Full constructor. The {@code data} array is copied.
   *
   * @param name    not null
   * @param index   &ge; 0
   * @param data    not null
   * @param derived {@code true} iff the column was computed from an expression
   */
  public Column(String name, int index, double[] data, boolean derived) {
    this(data.clone(), name, index, derived);
  }


  private Column(double[] data, String name, int index, boolean derived) {
    this.name = Objects.requireNonNull(name, "null name");
    this.index = index;
    this.data = data;
    this.derived = derived;
    if (index < 0)
      throw new IllegalArgumentException("index " + index + " < 0");
  }


  /**
   * Creates an instance <em>without</em> copying the array. For use
   * only when the caller forgets the array reference.
   */
  static Column adopt(String name, int index, double[] data, boolean derived) {
    return new Column(data, name, index, derived);
  }


  public String name() {
    return name;
  }

  /** Returns the source position, or append order for derived columns. */
  public int index() {
    return index;
  }

  /** Returns {@code true} iff this column was computed from an expression. */
  public boolean isDerived() {
    return derived;
  }

  /** Returns the number of values. */
  public int size() {
    return data.length;
  }

  /** Returns the value at the given zero-based row. */
  public double get(int row) throws IndexOutOfBoundsException {
    return data[row];
  }

  /**
   * Returns a read-only view of the values. The returned buffer
   * is positioned at zero and its limit is the {@linkplain #size() size}.
   */
  public DoubleBuffer values() {
    return DoubleBuffer.wrap(data).asReadOnlyBuffer();
  }

  /** Returns a copy of the values. */
  public double[] toArray() {
    return data.clone();
  }


  /**
   * Returns a compacted copy of this column containing only the rows
   * marked in {@code keep}.
   *
   * @param keep    row mask, same length as this column
   * @param count   the number of {@code true} values in {@code keep}
   */
  Column select(boolean[] keep, int count) {
    assert keep.length == data.length;
    double[] selected = new double[count];
    for (int row = 0, next = 0; next < count; ++row) {
      if (keep[row])
        selected[next++] = data[row];
    }
    return adopt(name, index, selected, derived);
  }


  /**
   * Instances are equal if they have the same name, index, derived-flag,
   * and values.
   */
  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof Column col &&
        col.name.equals(name) &&
        col.index == index &&
        col.derived == derived &&
        Arrays.equals(col.data, data);
  }


  @Override
  public int hashCode() {
    return name.hashCode() * 31 + index;
  }


  @Override
  public String toString() {
    return "Column[" + name + ", index=" + index +
        (derived ? ", derived" : "") + ", size=" + data.length + "]";
  }

}
