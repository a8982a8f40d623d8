/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;


import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import io.crums.frames.Column;
import io.crums.frames.Frame;
import io.crums.frames.FramesConstants;

/**
 * Parses a {@linkplain Block} into a {@linkplain Frame}. If the options
 * {@linkplain ParseOptions#hasHeader() specify a header}, the block's first line
 * names the columns; otherwise, the columns are named {@code "Column 1"},
 * {@code "Column 2"}, etc., and the number of columns is taken from the first line.
 * Every other line must have exactly as many fields as there are columns, and
 * every field must be a plain decimal numeral.
 *
 * <h2>Numerals</h2>
 * <p>
 * An optional sign, decimal digits with an optional fraction, and an optional
 * exponent: {@code 1}, {@code -2.5}, {@code .5}, {@code 5.}, {@code 1e-3},
 * {@code +4E+2}. Not allowed: {@code NaN}, {@code Infinity}, grouping
 * separators, underscores, hexadecimals, type suffixes, or magnitudes too large
 * for a {@code double}.
 * </p>
 */
public class RowParser {

  private final static Pattern NUMERAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");


  /**
   * Parses the given numeral.
   *
   * @param text trimmed
   *
   * @return finite value
   * @throws NumberFormatException if {@code text} is not an allowed numeral
   */
  public static double parseNumeral(String text) throws NumberFormatException {
    if (!NUMERAL.matcher(text).matches())
      throw new NumberFormatException("not a decimal numeral: '" + text + "'");
    double value = Double.parseDouble(text);
    if (Double.isInfinite(value))
      throw new NumberFormatException("out of range: '" + text + "'");
    return value;
  }


  /**
   * Splits the given line on every occurrence of the delimiter. Fields are
   * not trimmed. Adjacent delimiters (or a delimiter at either end) yield
   * empty fields.
   *
   * @return non-empty list
   */
  public static List<String> split(String line, char delimiter) {
    var fields = new ArrayList<String>();
    int start = 0;
    for (int i = line.indexOf(delimiter); i != -1; i = line.indexOf(delimiter, start)) {
      fields.add(line.substring(start, i));
      start = i + 1;
    }
    fields.add(line.substring(start));
    return fields;
  }



  private final ParseOptions options;


  public RowParser(ParseOptions options) {
    this.options = Objects.requireNonNull(options, "null options");
  }


  /** Returns the options this instance parses with. */
  public ParseOptions options() {
    return options;
  }


  /**
   * Parses the given block.
   *
   * @param block       the block
   * @param sourceId    the file path, or other source identifier
   * @param blockIndex  recorded in the returned frame
   *
   * @return a frame with as many rows as the block has non-header lines
   *         (possibly zero)
   *
   * @throws DataParseException if a header has duplicate names, or if
   *         a line has the wrong number of fields, or a field is not a numeral
   */
  public Frame parse(Block block, String sourceId, Optional<Integer> blockIndex)
      throws DataParseException {

    var lines = block.lines();
    final List<String> names;
    final int first;
    if (options.hasHeader()) {
      names = columnNames(lines.get(0), sourceId);
      first = 1;
    } else {
      int count = split(lines.get(0).text(), options.delimiter()).size();
      names = new ArrayList<>(count);
      for (int index = 0; index < count; ++index)
        names.add(FramesConstants.syntheticColumnName(index));
      first = 0;
    }

    final int cols = names.size();
    final int rows = lines.size() - first;
    double[][] data = new double[cols][rows];

    for (int row = 0; row < rows; ++row) {
      var line = lines.get(first + row);
      var fields = split(line.text(), options.delimiter());
      if (fields.size() != cols)
        throw new DataParseException(
            sourceId, line.lineNo(), null,
            "Inconsistent column count: expected " + cols + ", got " + fields.size(),
            null, line.text(), options.delimiter());

      for (int col = 0; col < cols; ++col) {
        var field = fields.get(col).strip();
        try {
          data[col][row] = parseNumeral(field);
        } catch (NumberFormatException nfx) {
          throw new DataParseException(
              sourceId, line.lineNo(), col + 1, "Invalid numeric value",
              field, line.text(), options.delimiter());
        }
      }
    }

    var columns = new ArrayList<Column>(cols);
    for (int col = 0; col < cols; ++col)
      columns.add(new Column(names.get(col), col, data[col]));

    return new Frame(sourceId, rows, columns, blockIndex);
  }


  private List<String> columnNames(SourceLine header, String sourceId) throws DataParseException {
    var names = split(header.text(), options.delimiter());
    var positions = new HashMap<String, Integer>();
    for (int index = 0; index < names.size(); ++index) {
      var name = names.get(index).strip();
      names.set(index, name);
      var prior = positions.putIfAbsent(name, index + 1);
      if (prior != null)
        throw new DataParseException(
            sourceId, header.lineNo(), index + 1,
            "Duplicate column name '" + name + "' (first at column " + prior + ")",
            name, header.text(), options.delimiter());
    }
    return names;
  }

}
