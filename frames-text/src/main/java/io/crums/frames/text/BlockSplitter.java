/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Partitions the lines of a source into {@linkplain Block}s. Lines are
 * classified after trimming:
 * <ul>
 * <li>{@linkplain LineType#BLANK BLANK}: empty after trimming.</li>
 * <li>{@linkplain LineType#COMMENT COMMENT}: starts with a comment prefix.</li>
 * <li>{@linkplain LineType#DATA DATA}: anything else.</li>
 * </ul>
 * <p>
 * In {@linkplain #split(List) block mode} both blank and comment lines are
 * separators: the first one following a data line ends the current block, and
 * the next data line starts a new one. Runs of consecutive separators thus act as
 * one; leading and trailing separators produce no blocks.
 * </p>
 *
 * @see ParseOptions#commentPrefixes()
 */
public class BlockSplitter {

  /** Line classification. */
  public enum LineType {
    DATA,
    COMMENT,
    BLANK;
  }


  private enum State {
    BETWEEN_BLOCKS,
    IN_BLOCK;
  }


  private final ParseOptions options;


  public BlockSplitter(ParseOptions options) {
    this.options = Objects.requireNonNull(options, "null options");
  }


  /**
   * Classifies the given line.
   *
   * @param line  raw or trimmed
   */
  public LineType classify(String line) {
    var trimmed = line.strip();
    if (trimmed.isEmpty())
      return LineType.BLANK;
    return options.isComment(trimmed) ? LineType.COMMENT : LineType.DATA;
  }


  /**
   * Splits the given lines into blocks.
   *
   * @param rawLines  the source's lines, in order (the first is line 1)
   *
   * @return possibly empty list of blocks, indexed in order of appearance
   */
  public List<Block> split(List<String> rawLines) {
    var blocks = new ArrayList<Block>();
    var current = new ArrayList<SourceLine>();
    var state = State.BETWEEN_BLOCKS;

    for (int index = 0; index < rawLines.size(); ++index) {
      var trimmed = rawLines.get(index).strip();
      var type = classify(trimmed);

      switch (state) {
      case BETWEEN_BLOCKS:
        if (type == LineType.DATA) {
          current.add(new SourceLine(index + 1, trimmed));
          state = State.IN_BLOCK;
        }
        break;
      case IN_BLOCK:
        if (type == LineType.DATA)
          current.add(new SourceLine(index + 1, trimmed));
        else {
          blocks.add(new Block(blocks.size(), current));
          current.clear();
          state = State.BETWEEN_BLOCKS;
        }
        break;
      }
    }
    if (state == State.IN_BLOCK)
      blocks.add(new Block(blocks.size(), current));

    return blocks;
  }


  /**
   * Collects all the data lines as a single block: blank lines, like comment
   * lines, are skipped.
   *
   * @param rawLines  the source's lines, in order (the first is line 1)
   *
   * @return empty, if there are no data lines
   */
  public Optional<Block> singleBlock(List<String> rawLines) {
    var lines = new ArrayList<SourceLine>();
    for (int index = 0; index < rawLines.size(); ++index) {
      var trimmed = rawLines.get(index).strip();
      if (classify(trimmed) == LineType.DATA)
        lines.add(new SourceLine(index + 1, trimmed));
    }
    return lines.isEmpty() ? Optional.empty() : Optional.of(new Block(0, lines));
  }

}
