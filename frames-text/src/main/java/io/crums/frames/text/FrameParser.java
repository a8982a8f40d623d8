/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;


import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import io.crums.frames.Frame;

/**
 * Parses delimited numeric text into {@linkplain Frame}s. There are 2 modes:
 * <ol>
 * <li><em>Single-frame.</em> {@linkplain #parse(Path)}: all the data lines in the
 * source form one frame; blank and comment lines are skipped.</li>
 * <li><em>Block.</em> {@linkplain #parseBlocks(Path)}: blank and comment lines
 * separate the source into blocks, each parsed independently into its own
 * frame (each with its own header, if the options call for one).</li>
 * </ol>
 * <p>
 * A source (or block) with no data rows is not an error: it yields an empty
 * frame, and a {@linkplain ParseWarning} is reported to this instance's warning
 * listener. By default, warnings are logged.
 * </p>
 * <p>
 * Instances are stateless and safe to share across threads (provided the
 * warning listener is).
 * </p>
 *
 * @see ParseOptions
 * @see BlockSplitter
 * @see RowParser
 */
public class FrameParser {

  /** Logger name: {@value}. */
  public final static String LOGGER_NAME = "frames.text";

  /** Returns the logger for this package. */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }

  /** The default warning listener. Logs at {@code WARNING} level. */
  public final static Consumer<ParseWarning> LOG_WARNINGS =
      w -> getLogger().log(Level.WARNING, w.toString());


  private final ParseOptions options;
  private final Consumer<ParseWarning> warnings;
  private final BlockSplitter splitter;
  private final RowParser rowParser;


  /** Creates an instance with default options. */
  public FrameParser() {
    this(ParseOptions.DEFAULT);
  }

  /** Creates an instance that logs warnings. */
  public FrameParser(ParseOptions options) {
    this(options, LOG_WARNINGS);
  }

  /**
   * Full constructor.
   *
   * @param options   parse options
   * @param warnings  warning listener
   */
  public FrameParser(ParseOptions options, Consumer<ParseWarning> warnings) {
    this.options = Objects.requireNonNull(options, "null options");
    this.warnings = Objects.requireNonNull(warnings, "null warnings");
    this.splitter = new BlockSplitter(options);
    this.rowParser = new RowParser(options);
  }


  /** Returns the options this instance parses with. */
  public ParseOptions options() {
    return options;
  }



  /**
   * Parses the given file into a single frame.
   *
   * @param file  path to the file; its string form is the frame's source id
   *
   * @throws FileNotFoundException if {@code file} does not exist
   * @throws DataParseException if the contents are malformed
   * @throws UncheckedIOException on other I/O errors
   */
  public Frame parse(Path file) throws FileNotFoundException, DataParseException {
    return parse(readLines(file), file.toString());
  }


  /**
   * Parses the given stream into a single frame. The stream is read to the
   * end, but not closed.
   *
   * @param in        the input
   * @param sourceId  source identifier used in the frame and in diagnostics
   *
   * @throws DataParseException if the contents are malformed
   * @throws UncheckedIOException on I/O errors
   */
  public Frame parse(InputStream in, String sourceId) throws DataParseException {
    return parse(readLines(in, sourceId), sourceId);
  }


  /**
   * Parses the given files, in order, into single frames.
   *
   * @return list of frames, in the order given
   *
   * @throws FileNotFoundException if any file does not exist
   * @throws DataParseException on the first malformed file
   * @see #parse(Path)
   */
  public List<Frame> parseAll(List<Path> files) throws FileNotFoundException, DataParseException {
    var frames = new ArrayList<Frame>(files.size());
    for (var file : files)
      frames.add(parse(file));
    return Collections.unmodifiableList(frames);
  }


  /**
   * Parses the given file into one frame per block.
   *
   * @param file  path to the file; its string form is each frame's source id
   *
   * @return non-empty list of frames. If there is more than one, each
   *         is tagged with its {@linkplain Frame#blockIndex() block index}
   *
   * @throws FileNotFoundException if {@code file} does not exist
   * @throws DataParseException if any block is malformed
   * @throws UncheckedIOException on other I/O errors
   */
  public List<Frame> parseBlocks(Path file) throws FileNotFoundException, DataParseException {
    return parseBlocks(readLines(file), file.toString());
  }


  /**
   * Parses the given stream into one frame per block. The stream is read to the
   * end, but not closed.
   *
   * @param in        the input
   * @param sourceId  source identifier used in the frames and in diagnostics
   *
   * @return non-empty list of frames
   * @see #parseBlocks(Path)
   */
  public List<Frame> parseBlocks(InputStream in, String sourceId) throws DataParseException {
    return parseBlocks(readLines(in, sourceId), sourceId);
  }



  private Frame parse(List<String> lines, String sourceId) {
    var block = splitter.singleBlock(lines);
    if (block.isEmpty()) {
      warnings.accept(new ParseWarning(sourceId, Optional.empty(), 0, "no data lines"));
      return Frame.empty(sourceId);
    }
    var frame = toFrame(block.get(), sourceId, Optional.empty());
    getLogger().log(
        Level.DEBUG, "parsed {0}: {1} columns x {2} rows",
        sourceId, frame.columnCount(), frame.rowCount());
    return frame;
  }


  private List<Frame> parseBlocks(List<String> lines, String sourceId) {
    var blocks = splitter.split(lines);
    if (blocks.isEmpty()) {
      warnings.accept(new ParseWarning(sourceId, Optional.empty(), 0, "no data lines"));
      return List.of(Frame.empty(sourceId));
    }
    final boolean multi = blocks.size() > 1;
    var frames = new ArrayList<Frame>(blocks.size());
    for (var block : blocks) {
      Optional<Integer> blockIndex = multi ? Optional.of(block.index()) : Optional.empty();
      frames.add(toFrame(block, sourceId, blockIndex));
    }
    getLogger().log(Level.DEBUG, "parsed {0}: {1} block(s)", sourceId, frames.size());
    return Collections.unmodifiableList(frames);
  }


  private Frame toFrame(Block block, String sourceId, Optional<Integer> blockIndex) {
    var frame = rowParser.parse(block, sourceId, blockIndex);
    if (frame.rowCount() == 0)
      warnings.accept(
          new ParseWarning(sourceId, blockIndex, block.firstLineNo(), "header only, no data rows"));
    return frame;
  }



  private List<String> readLines(Path file) throws FileNotFoundException {
    if (!Files.exists(file))
      throw new FileNotFoundException("File not found: " + file);
    if (Files.isDirectory(file))
      throw new FileNotFoundException("not a file: " + file);
    try (var in = Files.newInputStream(file)) {
      return readLines(in, file.toString());
    } catch (IOException iox) {
      throw new UncheckedIOException("on reading " + file + ": " + iox.getMessage(), iox);
    }
  }


  /**
   * Reads all lines. Lines are terminated by {@code \n}, {@code \r\n}, or {@code \r}.
   * Undecodable input is reported as a {@linkplain DataParseException}.
   */
  private List<String> readLines(InputStream in, String sourceId) {
    var decoder = options.encoding().newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    var reader = new BufferedReader(new InputStreamReader(in, decoder));
    var lines = new ArrayList<String>();
    try {
      for (var line = reader.readLine(); line != null; line = reader.readLine())
        lines.add(line);
    } catch (CharacterCodingException ccx) {
      var dpx = new DataParseException(
          sourceId, lines.size() + 1,
          "Input is not valid " + options.encoding().name() + " text");
      dpx.initCause(ccx);
      throw dpx;
    } catch (IOException iox) {
      throw new UncheckedIOException("on reading " + sourceId + ": " + iox.getMessage(), iox);
    }
    return lines;
  }

}
