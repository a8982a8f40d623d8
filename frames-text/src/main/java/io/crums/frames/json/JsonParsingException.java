/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.json;

import io.crums.frames.FrameException;

/**
 * Unchecked exception for illegal JSON input.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends FrameException {

  public JsonParsingException(String s) {
    super(s);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
