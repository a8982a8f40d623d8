/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import java.lang.System.Logger;

/**
 * Library constants.
 */
public class FramesConstants {
  
  /**
   * The module's logger name.
   * 
   * @see #getLogger()
   */
  public static final String LOGGER_NAME = "frames";
  
  
  /**
   * Returns the module logger.
   * 
   * @see #LOGGER_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }
  
  
  /**
   * Prefix of synthesized column names when a source has no header row.
   * Column numbers are 1-based: {@code "Column 1"}, {@code "Column 2"}, ..
   */
  public final static String SYNTHETIC_COLUMN_PREFIX = "Column ";
  
  
  /**
   * Returns the synthesized name of the column at the given zero-based index.
   * 
   * @return {@code SYNTHETIC_COLUMN_PREFIX + (index + 1)}
   */
  public static String syntheticColumnName(int index) {
    if (index < 0)
      throw new IllegalArgumentException("index " + index + " < 0");
    return SYNTHETIC_COLUMN_PREFIX + (index + 1);
  }
  

  private FramesConstants() {  }

}
