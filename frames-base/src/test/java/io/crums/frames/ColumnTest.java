/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;


public class ColumnTest {


  @Test
  public void testDefensiveCopy() {
    double[] data = { 1, 2, 3 };
    var col = new Column("a", 0, data);
    data[0] = 99;
    assertEquals(1.0, col.get(0));

    double[] out = col.toArray();
    out[1] = 99;
    assertEquals(2.0, col.get(1));
  }


  @Test
  public void testValuesReadOnly() {
    var col = new Column("a", 0, new double[] { 1, 2 });
    var buffer = col.values();
    assertTrue(buffer.isReadOnly());
    assertEquals(2, buffer.remaining());
  }


  @Test
  public void testEquals() {
    var a = new Column("a", 0, new double[] { 1, 2 });
    assertEquals(a, new Column("a", 0, new double[] { 1, 2 }));
    assertEquals(a.hashCode(), new Column("a", 0, new double[] { 1, 2 }).hashCode());
    assertNotEquals(a, new Column("a", 0, new double[] { 1, 2 }, true));
    assertNotEquals(a, new Column("a", 1, new double[] { 1, 2 }));
    assertNotEquals(a, new Column("b", 0, new double[] { 1, 2 }));
  }


  @Test
  public void testGetOutOfBounds() {
    var col = new Column("a", 0, new double[] { 1 });
    assertThrows(IndexOutOfBoundsException.class, () -> col.get(1));
  }


  @Test
  public void testSyntheticNames() {
    assertEquals("Column 1", FramesConstants.syntheticColumnName(0));
    assertEquals("Column 12", FramesConstants.syntheticColumnName(11));
  }

}
