package contractnet.region;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class BoxTest {

  private static Box box(double xLo, double xHi, double yLo, double yHi) {
    return Box.builder().bound("x", xLo, xHi).bound("y", yLo, yHi).build();
  }

  @Test
  void equalityIsBoundForBound() {
    assertEquals(box(0, 1, 0, 2), box(0, 1, 0, 2));
    assertEquals(box(0, 1, 0, 2).hashCode(), box(0, 1, 0, 2).hashCode());
    assertNotEquals(box(0, 1, 0, 2), box(0, 1, 0, 2.000001));
    assertNotEquals(box(0, 1, 0, 2), Box.builder().bound("x", 0, 1).build());
  }

  @Test
  void volumeMultipliesWidths() {
    assertEquals(6.0, box(0, 2, 1, 4).volume(), 1e-12);
    assertEquals(0.0, box(1, 1, 0, 4).volume(), "zero-width dimension contributes factor 0");
    assertEquals(1.0, Box.unconstrained().volume(), "box over zero variables has volume 1");
  }

  @Test
  void containmentTreatsUndeclaredVariablesAsFree() {
    Box wide = Box.builder().bound("x", 0, 10).build();
    assertTrue(wide.contains(box(1, 2, 100, 200)));
    assertFalse(box(1, 2, 100, 200).contains(wide));
    assertTrue(Box.unconstrained().contains(wide));
  }

  @Test
  void intersectionCoversTheUnionOfVariables() {
    Box onlyX = Box.builder().bound("x", 0, 5).build();
    Box onlyY = Box.builder().bound("y", 2, 3).build();
    assertEquals(Optional.of(box(0, 5, 2, 3)), onlyX.intersect(onlyY));
    assertEquals(Optional.empty(), box(0, 1, 0, 1).intersect(box(2, 3, 0, 1)));
  }

  @Test
  void projectAndReplaceDimensions() {
    Box source = box(0, 1, 5, 6);
    assertEquals(Set.of("y"), source.project(List.of("y", "z")).variables());
    Box replaced = source.withIntervals(Box.builder().bound("y", 7, 8).build());
    assertEquals(box(0, 1, 7, 8), replaced);
    assertEquals(source, source.withIntervals(Box.unconstrained()));
  }

  @Test
  void spanKeepsSharedDimensionsOnly() {
    Box other = Box.builder().bound("x", 4, 9).bound("z", 0, 1).build();
    assertEquals(Box.builder().bound("x", 0, 9).build(), box(0, 1, 0, 1).span(other));
  }

  @Test
  void deviationClassifiesMovedBounds() {
    List<BoundDelta> deltas = Box.deviation(box(0, 10, 0, 10), box(-1, 10, 2, 12));
    assertEquals(3, deltas.size());
    BoundDelta lowerX = deltas.get(0);
    assertEquals("x", lowerX.variable());
    assertEquals(BoundDelta.Bound.LOWER, lowerX.bound());
    assertTrue(lowerX.isRelaxation());
    BoundDelta lowerY = deltas.get(1);
    assertTrue(lowerY.isStrengthening());
    assertEquals(2.0, lowerY.magnitude());
    BoundDelta upperY = deltas.get(2);
    assertTrue(upperY.isRelaxation());
    assertEquals(2.0, upperY.signedDelta());
  }

  @Test
  void undeclaredVariableLookupFails() {
    assertThrows(IllegalArgumentException.class, () -> box(0, 1, 0, 1).interval("z"));
  }
}
