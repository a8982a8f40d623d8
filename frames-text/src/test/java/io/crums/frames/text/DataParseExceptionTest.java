/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.text;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;


public class DataParseExceptionTest {


  @Test
  public void testPointer() {
    var line = "1.0,  abc,3";
    var dpx = new DataParseException(
        "data.csv", 3, 2, "Invalid numeric value", "abc", line, ',');

    var rendered = dpx.describe().split(System.lineSeparator());
    assertEquals("Parse error: Invalid numeric value", rendered[0]);
    assertEquals("  File: data.csv", rendered[1]);
    assertEquals("  Line 3, Column 2: got 'abc'", rendered[2]);

    var context = rendered[3];
    var pointer = rendered[4];
    assertTrue(context.startsWith("  Context: \""), context);
    assertEquals(context.indexOf("abc"), pointer.indexOf('^'));
    assertEquals("^^^", pointer.strip());
  }


  @Test
  public void testPointerFirstColumn() {
    var dpx = new DataParseException(
        "t.tsv", 2, 1, "Invalid numeric value", "x1", "x1\t2", '\t');
    var rendered = dpx.describe().split(System.lineSeparator());
    assertEquals(rendered[3].indexOf("x1"), rendered[4].indexOf('^'));
    assertEquals("^^", rendered[4].strip());
  }


  @Test
  public void testNoPointerWithoutColumn() {
    var dpx = new DataParseException(
        "t.tsv", 2, null, "Inconsistent column count: expected 2, got 1", null, "1", '\t');
    var rendered = dpx.describe().split(System.lineSeparator());
    assertEquals(4, rendered.length);
    assertEquals("  Line 2", rendered[2]);
  }


  @Test
  public void testMessage() {
    var dpx = new DataParseException("t.tsv", 4, 2, "Invalid numeric value", "1,0", "3\t1,0", '\t');
    assertEquals("Invalid numeric value (t.tsv, line 4, column 2): got '1,0'", dpx.getMessage());
    assertEquals(
        "Input is not valid UTF-8 text (s, line 1)",
        new DataParseException("s", 1, "Input is not valid UTF-8 text").getMessage());
  }

}
