/*
 * Copyright 2025 Babak Farhang
 */
/**
 * JSON forms of configuration objects, on the {@code json-simple} library.
 * 
 * @see io.crums.frames.json.ParseOptionsParser
 */
package io.crums.frames.json;
