/*
 * Copyright 2025 Babak Farhang
 */
/**
 * The columnar data model: {@linkplain io.crums.frames.Frame Frame}s of
 * equal-length, named {@code double} {@linkplain io.crums.frames.Column Column}s.
 * <p>
 * Frames are created by a parser (see the {@code frames-text} module) or derived from
 * other frames by filtering. Derived columns are computed from user-typed
 * arithmetic expressions; see {@linkplain io.crums.frames.expr}.
 * </p>
 *
 * @see io.crums.frames.Frame Frame, the main data model.
 */
package io.crums.frames;
