/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import java.lang.System.Logger.Level;
import java.nio.DoubleBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.frames.expr.ColumnBindings;
import io.crums.frames.expr.Expression;
import io.crums.frames.expr.ExpressionException;

/**
 * An ordered set of equal-length, uniquely named numeric {@linkplain Column}s,
 * together with where they came from.
 *
 * <h3>Mutability</h3>
 * <p>
 * Frames are immutable, with one exception: {@linkplain #addDerivedColumn(String, String)}
 * appends a column. The append swaps in a new (immutable) snapshot of the
 * column set, so a reader holding a list returned by {@linkplain #columns()} or
 * {@linkplain #columnNames()} never sees a column appear mid-iteration.
 * All other operations ({@linkplain #filterRows(String, Optional, Optional) filterRows},
 * {@linkplain Frames#align(List, String) alignment}) return new instances and
 * never touch the receiver.
 * </p><p>
 * Instances may be read concurrently, but a single instance should not
 * be appended to from more than one thread.
 * </p>
 */
public class Frame {


  /**
   * Returns an empty frame with no columns (and no rows).
   *
   * @param sourceId  source identifier (for diagnostics)
   */
  public static Frame empty(String sourceId) {
    return new Frame(sourceId, 0, List.of(), Optional.empty());
  }



  /** Immutable column set. */
  private record Snapshot(List<Column> columns, List<String> names, Map<String, Column> byName) {

    static Snapshot of(List<Column> columns) {
      var byName = new HashMap<String, Column>();
      var names = new ArrayList<String>(columns.size());
      for (var col : columns) {
        if (byName.put(col.name(), col) != null)
          throw new IllegalArgumentException("duplicate column name: '" + col.name() + "'");
        names.add(col.name());
      }
      return new Snapshot(
          List.copyOf(columns),
          Collections.unmodifiableList(names),
          Collections.unmodifiableMap(byName));
    }

    Snapshot append(Column column) {
      var cols = new ArrayList<Column>(columns.size() + 1);
      cols.addAll(columns);
      cols.add(column);
      return of(cols);
    }
  }



  private final String sourceId;
  private final int rowCount;
  private final Optional<Integer> blockIndex;

  private volatile Snapshot snapshot;


  /**
   * Full constructor.
   *
   * @param sourceId    source identifier (typically a file path), used in diagnostics
   * @param rowCount    the number of rows; every column must have this many values
   * @param columns     uniquely named columns, in display order
   * @param blockIndex  zero-based block index, if this frame is one of several
   *                    blocks read from a single source
   */
  public Frame(String sourceId, int rowCount, List<Column> columns, Optional<Integer> blockIndex) {
    this.sourceId = Objects.requireNonNull(sourceId, "null sourceId");
    this.rowCount = rowCount;
    this.blockIndex = Objects.requireNonNull(blockIndex, "null blockIndex");
    this.snapshot = Snapshot.of(columns);

    if (rowCount < 0)
      throw new IllegalArgumentException("rowCount " + rowCount + " < 0");
    if (blockIndex.filter(b -> b < 0).isPresent())
      throw new IllegalArgumentException("negative blockIndex: " + blockIndex.get());
    for (var col : columns) {
      if (col.size() != rowCount)
        throw new IllegalArgumentException(
            "column '%s' has %d values; expected %d".formatted(col.name(), col.size(), rowCount));
    }
  }


  /**
   * Creates a single-block instance.
   *
   * @param sourceId    source identifier (typically a file path), used in diagnostics
   * @param rowCount    the number of rows; every column must have this many values
   * @param columns     uniquely named columns, in display order
   */
  public Frame(String sourceId, int rowCount, List<Column> columns) {
    this(sourceId, rowCount, columns, Optional.empty());
  }



  /** Returns the source identifier. Informational (used in diagnostics). */
  public String sourceId() {
    return sourceId;
  }

  /** Returns the zero-based block index, if this is one of several blocks from one source. */
  public Optional<Integer> blockIndex() {
    return blockIndex;
  }

  /** Returns the number of rows. */
  public int rowCount() {
    return rowCount;
  }

  /** Returns {@code true} iff there are no rows. There may still be columns. */
  public boolean isEmpty() {
    return rowCount == 0;
  }

  /** Returns the number of columns. */
  public int columnCount() {
    return snapshot.columns().size();
  }

  /** Returns the column names in display order. The returned list is a read-only snapshot. */
  public List<String> columnNames() {
    return snapshot.names();
  }

  /** Returns the columns in display order. The returned list is a read-only snapshot. */
  public List<Column> columns() {
    return snapshot.columns();
  }

  /** Determines whether there's a column with the given name. */
  public boolean hasColumn(String name) {
    return snapshot.byName().containsKey(name);
  }


  /**
   * Returns the column with the given name.
   *
   * @throws ColumnNotFoundException if there's no such column
   */
  public Column getColumn(String name) throws ColumnNotFoundException {
    return getColumn(snapshot, name);
  }


  /**
   * Returns a read-only view of the named column's values.
   *
   * @throws ColumnNotFoundException if there's no such column
   */
  public DoubleBuffer values(String name) throws ColumnNotFoundException {
    return getColumn(name).values();
  }


  private Column getColumn(Snapshot snap, String name) {
    var col = snap.byName().get(name);
    if (col == null)
      throw new ColumnNotFoundException(name, snap.names());
    return col;
  }



  /**
   * Evaluates the given arithmetic {@code expression} against this frame's
   * columns and appends the result as a new {@linkplain Column#isDerived() derived}
   * column. The new column's index is the number of columns before the append.
   * On failure, the frame is not modified.
   *
   * @param name        new column name; not blank, not an existing column name
   * @param expression  see {@linkplain Expression} for the grammar
   *
   * @throws ExpressionException if the expression is disallowed, references an unknown
   *                             column, or evaluates to a non-finite value
   * @throws ValidationException if {@code name} is blank or already taken
   */
  public synchronized void addDerivedColumn(String name, String expression)
      throws ExpressionException, ValidationException {

    Objects.requireNonNull(name, "null name");
    Objects.requireNonNull(expression, "null expression");

    final Snapshot snap = snapshot;
    if (name.isBlank())
      throw new ValidationException("derived column name is blank", "name", name);
    if (snap.byName().containsKey(name))
      throw new ValidationException(
          "derived column name already in use: '" + name + "'", "name", name);

    double[] result = Expression.compile(expression).evaluate(bindings(snap), rowCount);

    snapshot = snap.append(Column.adopt(name, snap.columns().size(), result, true));

    FramesConstants.getLogger().log(
        Level.DEBUG, "added derived column ''{0}'' = {1} to {2}", name, expression, sourceId);
  }


  private ColumnBindings bindings(Snapshot snap) {
    return new ColumnBindings() {
      @Override
      public Optional<DoubleBuffer> values(String name) {
        return Optional.ofNullable(snap.byName().get(name)).map(Column::values);
      }
      @Override
      public List<String> names() {
        return snap.names();
      }
    };
  }



  /**
   * Returns a new frame containing only the rows whose value in the given
   * {@code column} lies within the (inclusive) bounds. Every column is compacted
   * to the kept rows; row order, column order, derived flags, source id and
   * block index are preserved. This instance is not modified.
   * <p>
   * With no bounds, every row is kept. With any bound, rows whose value is
   * {@code NaN} are dropped (since {@code NaN} fails every comparison).
   * </p>
   *
   * @param column  name of the column to filter on
   * @param min     inclusive lower bound, if any
   * @param max     inclusive upper bound, if any
   *
   * @throws ColumnNotFoundException if there's no such column
   * @throws ValidationException if a bound is {@code NaN}
   */
  public Frame filterRows(String column, Optional<Double> min, Optional<Double> max)
      throws ColumnNotFoundException, ValidationException {

    final Snapshot snap = snapshot;
    final Column target = getColumn(snap, column);

    if (min.filter(d -> d.isNaN()).isPresent())
      throw new ValidationException("NaN filter bound", "min", "NaN");
    if (max.filter(d -> d.isNaN()).isPresent())
      throw new ValidationException("NaN filter bound", "max", "NaN");

    final boolean hasMin = min.isPresent();
    final boolean hasMax = max.isPresent();
    final double lo = min.orElse(0.0);
    final double hi = max.orElse(0.0);

    boolean[] keep = new boolean[rowCount];
    int count = 0;
    for (int row = 0; row < rowCount; ++row) {
      double value = target.get(row);
      boolean k = (!hasMin || value >= lo) && (!hasMax || value <= hi);
      keep[row] = k;
      if (k)
        ++count;
    }

    var filtered = new ArrayList<Column>(snap.columns().size());
    for (var col : snap.columns())
      filtered.add(col.select(keep, count));

    return new Frame(sourceId, count, filtered, blockIndex);
  }


  /**
   * Returns a new frame containing only the rows whose value in the given
   * {@code column} lies within the (inclusive) bounds.
   *
   * @param column  name of the column to filter on
   * @param min     inclusive lower bound; {@code null} for none
   * @param max     inclusive upper bound; {@code null} for none
   *
   * @see #filterRows(String, Optional, Optional)
   */
  public Frame filterRows(String column, Double min, Double max)
      throws ColumnNotFoundException, ValidationException {
    return filterRows(column, Optional.ofNullable(min), Optional.ofNullable(max));
  }



  @Override
  public String toString() {
    return "Frame[" + sourceId +
        blockIndex.map(b -> ", block " + b).orElse("") +
        ", rows=" + rowCount + ", columns=" + columnNames() + "]";
  }

}
