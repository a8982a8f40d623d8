/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import java.util.List;
import java.util.stream.Collectors;

/**
 * Name-based column lookup failure. The message lists the columns that
 * <em>are</em> available.
 */
@SuppressWarnings("serial")
public class ColumnNotFoundException extends FrameException {
  
  private final String column;
  private final List<String> available;

  /**
   * @param column      the name looked up
   * @param available   the names that were available, in display order
   */
  public ColumnNotFoundException(String column, List<String> available) {
    this("Column '" + column + "' not found", column, available);
  }
  
  /**
   * @param prefix      message prefix, typically naming the column and where it was looked up
   * @param column      the name looked up
   * @param available   the names that were available, in display order
   */
  public ColumnNotFoundException(String prefix, String column, List<String> available) {
    super(prefix + ". Available columns: " + quoted(available));
    this.column = column;
    this.available = List.copyOf(available);
  }
  
  
  /** Returns the column name that was not found. */
  public String column() {
    return column;
  }
  
  /** Returns the column names that were available. */
  public List<String> available() {
    return available;
  }
  
  
  static String quoted(List<String> names) {
    return names.stream().map(n -> "'" + n + "'").collect(Collectors.joining(", "));
  }

}
