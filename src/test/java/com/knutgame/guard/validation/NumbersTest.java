package com.knutgame.guard.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void rangeAcceptsInclusiveBounds() {
    assertEquals(0.0, Numbers.requireRange("confidence", 0.0, 0.0, 1.0));
    assertEquals(1.0, Numbers.requireRange("confidence", 1.0, 0.0, 1.0));
  }

  @Test
  void rangeRejectsOutsideAndNaN() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("confidence", 1.01, 0.0, 1.0));
    assertTrue(ex.getMessage().startsWith("confidence"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("confidence", Double.NaN, 0.0, 1.0));
  }

  @Test
  void atLeastRejectsNonFinite() {
    assertEquals(2.0, Numbers.requireAtLeast("cap", 2.0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireAtLeast("cap", 0.5, 1.0));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireAtLeast("cap", Double.POSITIVE_INFINITY, 1.0));
  }

  @Test
  void blankNameFallsBackToValue() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireAtLeast(" ", -1.0, 0.0));
    assertTrue(ex.getMessage().startsWith("value"));
  }
}
