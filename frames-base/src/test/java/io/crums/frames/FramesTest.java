/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;


public class FramesTest {


  private static Frame frame(String source, double... time) {
    return new Frame(source, time.length, List.of(new Column("time", 0, time)));
  }


  @Test
  public void testAlign() {
    var a = frame("a.tsv", 0, 1, 2);
    var b = frame("b.tsv", 5, 10);
    var aligned = Frames.align(List.of(a, b), "time");
    assertEquals(0.0, aligned.min());
    assertEquals(10.0, aligned.max());
    assertEquals(10.0, aligned.span());
    assertEquals("time", aligned.column());
    assertEquals(List.of(a, b), aligned.frames());
  }


  @Test
  public void testAlignOverlappingRanges() {
    var first = frame("first.tsv", 0, 1, 2, 3);
    var second = frame("second.tsv", 2, 3, 4, 5);
    var aligned = Frames.align(List.of(first, second), "time");
    assertEquals(0.0, aligned.min());
    assertEquals(5.0, aligned.max());
    assertEquals(4, aligned.frames().get(0).rowCount());
    assertEquals(4, aligned.frames().get(1).rowCount());
    assertSame(first, aligned.frames().get(0));
    assertSame(second, aligned.frames().get(1));
  }


  @Test
  public void testAlignIsTheUnionRange() {
    var frames = List.of(frame("a", 3, -1), frame("b", 2), frame("c", 7, 4));
    var aligned = Frames.align(frames, "time");
    for (var f : frames) {
      var col = f.getColumn("time");
      for (int row = 0; row < col.size(); ++row) {
        assertTrue(aligned.min() <= col.get(row));
        assertTrue(aligned.max() >= col.get(row));
      }
    }
    assertEquals(-1.0, aligned.min());
    assertEquals(7.0, aligned.max());
  }


  @Test
  public void testAlignEmptyList() {
    assertThrows(IllegalArgumentException.class, () -> Frames.align(List.of(), "time"));
  }


  @Test
  public void testAlignMissingColumn() {
    var other = new Frame("other.tsv", 1, List.of(new Column("t", 0, new double[] { 1 })));
    var cnfx = assertThrows(
        ColumnNotFoundException.class,
        () -> Frames.align(List.of(frame("a", 1), other), "time"));
    assertTrue(cnfx.getMessage().contains("frame 1"), cnfx.getMessage());
    assertTrue(cnfx.getMessage().contains("other.tsv"), cnfx.getMessage());
    assertEquals(List.of("t"), cnfx.available());
  }


  @Test
  public void testAlignEmptyColumn() {
    var vx = assertThrows(
        ValidationException.class,
        () -> Frames.align(List.of(frame("a", 1), frame("b")), "time"));
    assertEquals(Optional.of("time"), vx.field());
  }


  @Test
  public void testAlignPropagatesNaN() {
    var aligned = Frames.align(List.of(frame("a", 1, Double.NaN)), "time");
    assertTrue(Double.isNaN(aligned.min()));
  }

}
