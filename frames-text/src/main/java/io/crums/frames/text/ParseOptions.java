/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;


import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Delimited text settings.
 *
 * @param hasHeader       whether the first line of each block names the columns
 * @param commentPrefixes a (trimmed) line starting with any of these is a comment line.
 *                        May be empty (no comment lines). Each prefix is non-blank and
 *                        contains no line breaks. Prefixes are stripped of leading and
 *                        trailing whitespace, and duplicates are removed.
 * @param delimiter       column delimiter; not a line break
 * @param encoding        text encoding
 *
 * @see #DEFAULT
 */
public record ParseOptions(
    boolean hasHeader, Set<String> commentPrefixes, char delimiter, Charset encoding) {

  /** Default comment-line prefix: {@code "#"}. */
  public final static String DEFAULT_COMMENT_PREFIX = "#";

  /** Default column delimiter: tab. */
  public final static char DEFAULT_DELIMITER = '\t';

  /**
   * The default options: header row, {@code #} comment lines, tab delimited, UTF-8.
   */
  public final static ParseOptions DEFAULT =
      new ParseOptions(true, Set.of(DEFAULT_COMMENT_PREFIX), DEFAULT_DELIMITER, StandardCharsets.UTF_8);


  public ParseOptions {
    Objects.requireNonNull(encoding, "null encoding");
    var prefixes = new TreeSet<String>();
    for (var prefix : commentPrefixes) {
      if (prefix.isBlank())
        throw new IllegalArgumentException("blank comment prefix (quoted): \"" + prefix + "\"");
      if (prefix.indexOf('\n') != -1 || prefix.indexOf('\r') != -1)
        throw new IllegalArgumentException("line break in comment prefix (quoted): \"" + prefix + "\"");
      // lines are matched after stripping
      prefixes.add(prefix.strip());
    }
    commentPrefixes = Collections.unmodifiableSortedSet(prefixes);

    if (delimiter == '\n' || delimiter == '\r')
      throw new IllegalArgumentException("line break delimiter");
  }


  /**
   * Creates an instance with the encoding given by name.
   *
   * @param encoding  charset name, for eg {@code "utf-8"}
   *
   * @throws IllegalArgumentException if {@code encoding} is not supported
   */
  public ParseOptions(
      boolean hasHeader, Set<String> commentPrefixes, char delimiter, String encoding) {
    this(hasHeader, commentPrefixes, delimiter, Charset.forName(encoding));
  }


  /** Determines whether the given trimmed line is a comment line. */
  public boolean isComment(String trimmedLine) {
    for (var prefix : commentPrefixes)
      if (trimmedLine.startsWith(prefix))
        return true;
    return false;
  }


  /** Returns a possibly mutated version. */
  public ParseOptions hasHeader(boolean hasHeader) {
    return hasHeader == this.hasHeader ?
        this : new ParseOptions(hasHeader, commentPrefixes, delimiter, encoding);
  }

  /**
   * Returns a possibly mutated version.
   *
   * @param prefixes  comment-line prefixes; empty means no comment lines
   */
  public ParseOptions commentPrefixes(Set<String> prefixes) {
    var next = new ParseOptions(hasHeader, prefixes, delimiter, encoding);
    return next.equals(this) ? this : next;
  }

  /** Returns a possibly mutated version. */
  public ParseOptions delimiter(char delimiter) {
    return delimiter == this.delimiter ?
        this : new ParseOptions(hasHeader, commentPrefixes, delimiter, encoding);
  }

  /** Returns a possibly mutated version. */
  public ParseOptions encoding(Charset encoding) {
    return encoding.equals(this.encoding) ?
        this : new ParseOptions(hasHeader, commentPrefixes, delimiter, encoding);
  }


  /** Determines whether these are the default options. */
  public boolean isDefault() {
    return equals(DEFAULT);
  }

}
