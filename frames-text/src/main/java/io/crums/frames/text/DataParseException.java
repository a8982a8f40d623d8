/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;


import java.util.Objects;
import java.util.Optional;

import io.crums.frames.FrameException;

/**
 * Malformed delimited text. Carries the source, the 1-based line (and, where
 * known, column) of the fault, the offending text, and the line itself, so that
 * the fault can be {@linkplain #describe() pointed at}.
 */
@SuppressWarnings("serial")
public class DataParseException extends FrameException {

  private final String sourceId;
  private final int lineNumber;
  private final Integer column;
  private final String reason;
  private final String rawValue;
  private final String lineText;
  private final char delimiter;


  /**
   * Creates an instance with no column information.
   *
   * @param sourceId    the file path, or other source identifier
   * @param lineNumber  1-based line number
   * @param reason      what's wrong
   */
  public DataParseException(String sourceId, int lineNumber, String reason) {
    this(sourceId, lineNumber, null, reason, null, null, ParseOptions.DEFAULT_DELIMITER);
  }


  /**
   * Full constructor.
   *
   * @param sourceId    the file path, or other source identifier
   * @param lineNumber  1-based line number
   * @param column      1-based column number, or {@code null}
   * @param reason      what's wrong
   * @param rawValue    the offending field or token, or {@code null}
   * @param lineText    the (trimmed) line, or {@code null}
   * @param delimiter   the column delimiter (for locating {@code column} in {@code lineText})
   */
  public DataParseException(
      String sourceId, int lineNumber, Integer column, String reason,
      String rawValue, String lineText, char delimiter) {
    super(summary(sourceId, lineNumber, column, reason, rawValue));
    this.sourceId = Objects.requireNonNull(sourceId, "null sourceId");
    this.lineNumber = lineNumber;
    this.column = column;
    this.reason = Objects.requireNonNull(reason, "null reason");
    this.rawValue = rawValue;
    this.lineText = lineText;
    this.delimiter = delimiter;
  }


  private static String summary(
      String sourceId, int lineNumber, Integer column, String reason, String rawValue) {
    var out = new StringBuilder(reason).append(" (").append(sourceId)
        .append(", line ").append(lineNumber);
    if (column != null)
      out.append(", column ").append(column);
    out.append(')');
    if (rawValue != null)
      out.append(": got '").append(rawValue).append('\'');
    return out.toString();
  }


  /** Returns the file path, or other source identifier. */
  public String sourceId() {
    return sourceId;
  }

  /** Returns the 1-based line number. */
  public int lineNumber() {
    return lineNumber;
  }

  /** Returns the 1-based column number, if known. */
  public Optional<Integer> column() {
    return Optional.ofNullable(column);
  }

  /** Returns the fault description, without location. */
  public String reason() {
    return reason;
  }

  /** Returns the offending field or token, if known. */
  public Optional<String> rawValue() {
    return Optional.ofNullable(rawValue);
  }

  /** Returns the (trimmed) offending line, if known. */
  public Optional<String> lineText() {
    return Optional.ofNullable(lineText);
  }


  /**
   * Returns a multi-line description suitable for showing the user. If the line
   * text, column and offending value are all known, the value is underlined
   * with carets in a rendering of the line. For example,
   * <pre>
   * Parse error: Invalid numeric value
   *   File: data.tsv
   *   Line 3, Column 2: got 'abc'
   *   Context: "1.0  abc  3.0"
   *                  ^^^
   * </pre>
   */
  public String describe() {
    final String eol = System.lineSeparator();
    var out = new StringBuilder("Parse error: ").append(reason).append(eol);
    out.append("  File: ").append(sourceId).append(eol);
    out.append("  Line ").append(lineNumber);
    if (column != null)
      out.append(", Column ").append(column);
    if (rawValue != null)
      out.append(": got '").append(rawValue).append('\'');
    if (lineText != null) {
      final String prefix = "  Context: \"";
      out.append(eol).append(prefix).append(lineText).append('"');
      int offset = pointerOffset();
      if (offset >= 0) {
        out.append(eol).append(" ".repeat(prefix.length() + offset))
            .append("^".repeat(Math.max(1, rawValue.length())));
      }
    }
    return out.toString();
  }


  /**
   * Returns the offset of the offending value in the line, or -1 if it can't
   * be located.
   */
  private int pointerOffset() {
    if (column == null || rawValue == null || lineText == null)
      return -1;
    int start = 0;
    for (int skip = column - 1; skip > 0; --skip) {
      int next = lineText.indexOf(delimiter, start);
      if (next == -1)
        return -1;
      start = next + 1;
    }
    int end = lineText.indexOf(delimiter, start);
    var field = end == -1 ? lineText.substring(start) : lineText.substring(start, end);
    int within = rawValue.isEmpty() ? 0 : field.indexOf(rawValue);
    return within == -1 ? -1 : start + within;
  }

}
