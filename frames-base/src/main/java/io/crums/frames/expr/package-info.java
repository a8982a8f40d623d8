/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Safe column arithmetic.
 * <p>
 * User-typed expressions are parsed into a syntax tree that is then checked
 * against an explicit allow-list of constructs (numbers, column names, the
 * four arithmetic operators plus {@code %} and {@code **}, unary signs, and a
 * handful of math functions). Anything not on the list is rejected before
 * evaluation begins; there's no general purpose interpreter behind this.
 * </p>
 * 
 * @see io.crums.frames.expr.Expression
 */
package io.crums.frames.expr;
