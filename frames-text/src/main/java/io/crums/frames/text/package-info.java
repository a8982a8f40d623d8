/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Delimited numeric text to {@linkplain io.crums.frames.Frame Frame}s.
 * <p>
 * A {@linkplain io.crums.frames.text.BlockSplitter BlockSplitter} classifies
 * lines and groups the data lines into blocks; a
 * {@linkplain io.crums.frames.text.RowParser RowParser} turns each block
 * into a frame. {@linkplain io.crums.frames.text.FrameParser FrameParser}
 * ties these together.
 * </p>
 */
package io.crums.frames.text;
