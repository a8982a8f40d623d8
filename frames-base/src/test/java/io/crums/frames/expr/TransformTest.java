/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.expr;


import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.crums.frames.ValidationException;


public class TransformTest {


  @Test
  public void testApply() {
    double[] data = { 1, 2, 4 };
    assertArrayEquals(new double[] { 1, 4, 16 }, Transform.SQUARE.apply(data));
    assertArrayEquals(new double[] { 1, 8, 64 }, Transform.CUBE.apply(data));
    assertArrayEquals(new double[] { 0, 1, 2 }, Transform.LOG2.apply(data));
    assertArrayEquals(new double[] { 1, 0.5, 0.25 }, Transform.INVERSE.apply(data));
    assertArrayEquals(new double[] { -1, -2, -4 }, Transform.NEGATE.apply(data));
    assertArrayEquals(new double[] { 2, 3 }, Transform.CBRT.apply(new double[] { 8, 27 }), 1e-12);
    // input untouched
    assertArrayEquals(new double[] { 1, 2, 4 }, data);
  }


  @Test
  public void testLogDomain() {
    var vx = assertThrows(
        ValidationException.class, () -> Transform.LOG.apply(new double[] { 1, 0 }));
    assertEquals(Optional.of("data"), vx.field());
    assertTrue(vx.value().isPresent());
    assertThrows(ValidationException.class, () -> Transform.LOG10.apply(new double[] { -1 }));
    assertThrows(ValidationException.class, () -> Transform.LOG2.apply(new double[] { 0 }));
  }


  @Test
  public void testSqrtDomain() {
    assertArrayEquals(new double[] { 0, 3 }, Transform.SQRT.apply(new double[] { 0, 9 }));
    assertThrows(ValidationException.class, () -> Transform.SQRT.apply(new double[] { -0.5 }));
  }


  @Test
  public void testArcDomain() {
    assertArrayEquals(new double[] { 0 }, Transform.ARCSIN.apply(new double[] { 0 }));
    assertThrows(ValidationException.class, () -> Transform.ARCSIN.apply(new double[] { 1.5 }));
    assertThrows(ValidationException.class, () -> Transform.ARCCOS.apply(new double[] { -2 }));
    assertEquals(Math.PI / 4, Transform.ARCTAN.apply(new double[] { 1 })[0], 1e-12);
  }


  @Test
  public void testInverseDomain() {
    assertThrows(ValidationException.class, () -> Transform.INVERSE.apply(new double[] { 2, 0 }));
  }


  @Test
  public void testLabels() {
    for (var t : Transform.values())
      assertEquals(t, Transform.forLabel(t.label()));
    assertEquals("log10", Transform.LOG10.label());
    assertThrows(IllegalArgumentException.class, () -> Transform.forLabel("cosh"));
  }

}
