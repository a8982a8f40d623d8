/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import java.nio.DoubleBuffer;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column name to values lookup an {@linkplain Expression} is evaluated against.
 */
public interface ColumnBindings {
  
  /**
   * Returns the named column's values, if bound. The returned buffer's
   * values are read from its position to its limit.
   */
  Optional<DoubleBuffer> values(String name);
  
  /** Returns the bound names, in display order. Used in diagnostics. */
  List<String> names();
  
  
  /**
   * Returns an instance backed by the given map. The arrays are not copied.
   * 
   * @param columns name to values map; iteration order is the display order
   */
  public static ColumnBindings of(Map<String, double[]> columns) {
    final var names = List.copyOf(columns.keySet());
    return new ColumnBindings() {
      @Override
      public Optional<DoubleBuffer> values(String name) {
        return Optional.ofNullable(columns.get(name))
            .map(a -> DoubleBuffer.wrap(a).asReadOnlyBuffer());
      }
      @Override
      public List<String> names() {
        return names;
      }
    };
  }

}
