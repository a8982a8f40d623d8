/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.crums.frames.expr.ExpressionException;


public class FrameTest {


  /** x: 1..5, y: 10, 20, .. 50 */
  static Frame newXyFrame() {
    return new Frame(
        "xy.tsv", 5,
        List.of(
            new Column("x", 0, new double[] { 1, 2, 3, 4, 5 }),
            new Column("y", 1, new double[] { 10, 20, 30, 40, 50 })));
  }


  @Test
  public void testLookup() {
    var frame = newXyFrame();
    assertEquals(List.of("x", "y"), frame.columnNames());
    assertEquals(2, frame.columnCount());
    assertEquals(5, frame.rowCount());
    assertFalse(frame.isEmpty());
    assertTrue(frame.hasColumn("y"));
    assertFalse(frame.hasColumn("z"));
    assertEquals(30.0, frame.getColumn("y").get(2));
    assertEquals(5, frame.values("x").remaining());
    assertEquals(Optional.empty(), frame.blockIndex());
  }


  @Test
  public void testColumnNotFound() {
    var frame = newXyFrame();
    var cnfx = assertThrows(ColumnNotFoundException.class, () -> frame.getColumn("z"));
    assertEquals("z", cnfx.column());
    assertEquals(List.of("x", "y"), cnfx.available());
    assertTrue(cnfx.getMessage().contains("'x', 'y'"), cnfx.getMessage());
    assertThrows(ColumnNotFoundException.class, () -> frame.values("z"));
  }


  @Test
  public void testDuplicateNamesRejected() {
    var cols = List.of(
        new Column("a", 0, new double[] { 1 }),
        new Column("a", 1, new double[] { 2 }));
    assertThrows(IllegalArgumentException.class, () -> new Frame("dup", 1, cols));
  }


  @Test
  public void testRowCountMismatchRejected() {
    var cols = List.of(new Column("a", 0, new double[] { 1, 2 }));
    assertThrows(IllegalArgumentException.class, () -> new Frame("short", 3, cols));
  }


  @Test
  public void testEmpty() {
    var frame = Frame.empty("nothing");
    assertTrue(frame.isEmpty());
    assertEquals(0, frame.columnCount());
    assertEquals("nothing", frame.sourceId());
  }


  @Test
  public void testAddDerivedColumn() {
    var frame = newXyFrame();
    frame.addDerivedColumn("z", "x * 2 + 1");
    assertEquals(List.of("x", "y", "z"), frame.columnNames());
    var z = frame.getColumn("z");
    assertTrue(z.isDerived());
    assertEquals(2, z.index());
    assertArrayEquals(new double[] { 3, 5, 7, 9, 11 }, z.toArray());
    assertFalse(frame.getColumn("x").isDerived());
  }


  @Test
  public void testDerivedOnDerived() {
    var frame = newXyFrame();
    frame.addDerivedColumn("ratio", "y / x");
    frame.addDerivedColumn("r2", "ratio ** 2");
    assertArrayEquals(new double[] { 100, 100, 100, 100, 100 }, frame.getColumn("r2").toArray());
  }


  @Test
  public void testLiteralDerivedColumnBroadcasts() {
    var frame = newXyFrame();
    frame.addDerivedColumn("c", "2 ** 3");
    assertArrayEquals(new double[] { 8, 8, 8, 8, 8 }, frame.getColumn("c").toArray());
  }


  @Test
  public void testSnapshotsUnaffectedByAppend() {
    var frame = newXyFrame();
    var names = frame.columnNames();
    var columns = frame.columns();
    frame.addDerivedColumn("z", "x + y");
    assertEquals(List.of("x", "y"), names);
    assertEquals(2, columns.size());
    assertEquals(3, frame.columnNames().size());
  }


  @Test
  public void testFailedDeriveDoesNotMutate() {
    var frame = newXyFrame();
    var before = frame.columnNames();

    var exx = assertThrows(ExpressionException.class, () -> frame.addDerivedColumn("bad", "x / 0"));
    assertEquals("Expression produced infinite result", exx.getMessage());
    assertEquals(before, frame.columnNames());

    assertThrows(ExpressionException.class, () -> frame.addDerivedColumn("bad", "nope + 1"));
    assertThrows(ExpressionException.class, () -> frame.addDerivedColumn("bad", "x.real"));
    assertEquals(before, frame.columnNames());
    assertFalse(frame.hasColumn("bad"));
  }


  @Test
  public void testDerivedNameValidation() {
    var frame = newXyFrame();
    var vx = assertThrows(ValidationException.class, () -> frame.addDerivedColumn("x", "y"));
    assertEquals(Optional.of("name"), vx.field());
    assertThrows(ValidationException.class, () -> frame.addDerivedColumn("  ", "y"));
    assertEquals(2, frame.columnCount());
  }


  @Test
  public void testFilterRows() {
    var frame = newXyFrame();
    frame.addDerivedColumn("z", "-x");
    var filtered = frame.filterRows("x", 2.0, 4.0);
    assertEquals(3, filtered.rowCount());
    assertArrayEquals(new double[] { 2, 3, 4 }, filtered.getColumn("x").toArray());
    assertArrayEquals(new double[] { 20, 30, 40 }, filtered.getColumn("y").toArray());
    assertArrayEquals(new double[] { -2, -3, -4 }, filtered.getColumn("z").toArray());
    assertTrue(filtered.getColumn("z").isDerived());
    assertEquals(frame.sourceId(), filtered.sourceId());
    // receiver untouched
    assertEquals(5, frame.rowCount());
  }


  @Test
  public void testFilterRowsOneSided() {
    var frame = newXyFrame();
    assertEquals(2, frame.filterRows("y", Optional.of(40.0), Optional.empty()).rowCount());
    assertEquals(1, frame.filterRows("y", Optional.empty(), Optional.of(10.0)).rowCount());
    assertEquals(5, frame.filterRows("y", Optional.empty(), Optional.empty()).rowCount());
  }


  @Test
  public void testFilterRowsEmptyResult() {
    var frame = newXyFrame();
    var none = frame.filterRows("x", 4.0, 2.0);
    assertEquals(0, none.rowCount());
    assertEquals(List.of("x", "y"), none.columnNames());
    assertTrue(none.isEmpty());
  }


  @Test
  public void testFilterIdempotent() {
    var frame = newXyFrame();
    var once = frame.filterRows("y", 15.0, 45.0);
    var twice = once.filterRows("y", 15.0, 45.0);
    assertEquals(once.rowCount(), twice.rowCount());
    assertEquals(once.columns(), twice.columns());

    // re-filtering with a wider range changes nothing
    var wider = once.filterRows("y", 10.0, 50.0);
    assertEquals(3, wider.rowCount());
    assertEquals(once.columns(), wider.columns());
  }


  @Test
  public void testFilterPreservesBlockIndex() {
    var frame = new Frame(
        "blocks.tsv", 2,
        List.of(new Column("a", 0, new double[] { 1, 2 })),
        Optional.of(1));
    assertEquals(Optional.of(1), frame.filterRows("a", 2.0, (Double) null).blockIndex());
  }


  @Test
  public void testFilterDropsNaNRowsWhenBounded() {
    var frame = new Frame(
        "nan", 3,
        List.of(new Column("a", 0, new double[] { 1, Double.NaN, 3 })));
    assertEquals(2, frame.filterRows("a", 0.0, (Double) null).rowCount());
    assertEquals(3, frame.filterRows("a", Optional.empty(), Optional.empty()).rowCount());
  }


  @Test
  public void testFilterRejects() {
    var frame = newXyFrame();
    assertThrows(ColumnNotFoundException.class, () -> frame.filterRows("q", 1.0, 2.0));
    var vx = assertThrows(
        ValidationException.class, () -> frame.filterRows("x", Double.NaN, (Double) null));
    assertEquals(Optional.of("min"), vx.field());
  }


  @Test
  public void testValidationDescribe() {
    var vx = new ValidationException("log requires positive values", "data", "contains 0");
    var text = vx.describe();
    assertTrue(text.startsWith("Validation failed: log requires positive values"), text);
    assertTrue(text.contains("Field: data"), text);
    assertTrue(text.contains("Value: 'contains 0'"), text);
    assertEquals("Validation failed: oops", new ValidationException("oops").describe());
  }

}
