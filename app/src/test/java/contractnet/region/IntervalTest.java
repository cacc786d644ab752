package contractnet.region;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

final class IntervalTest {

  @Test
  void pointIntervalIsValid() {
    Interval point = Interval.point(3.0);
    assertTrue(point.isPoint());
    assertEquals(0.0, point.width());
    assertTrue(point.contains(3.0));
  }

  @Test
  void rejectsInvertedBounds() {
    assertThrows(IllegalArgumentException.class, () -> Interval.of(2.0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> Interval.of(Double.NaN, 1.0));
  }

  @Test
  void negativeZeroBoundEqualsZero() {
    assertEquals(Interval.of(0.0, 10.0), Interval.of(-0.0, 10.0));
    assertEquals(Interval.point(0.0).hashCode(), Interval.point(-0.0).hashCode());
  }

  @Test
  void toleranceWidensContainment() {
    assertFalse(Interval.of(0, 10).contains(Interval.of(0, 10.0000001)));
    assertTrue(Interval.of(0, 10).contains(Interval.of(0, 10.0000001), 1e-6));
    assertFalse(Interval.of(0, 10).contains(Interval.of(0, 10.01), 1e-6));
  }

  @Test
  void intersectionOfTouchingIntervalsIsAPoint() {
    assertEquals(Optional.of(Interval.point(5.0)), Interval.of(0, 5).intersect(Interval.of(5, 9)));
    assertEquals(Optional.empty(), Interval.of(0, 4).intersect(Interval.of(5, 9)));
  }

  @Test
  void spanAndContainment() {
    Interval span = Interval.of(0, 2).span(Interval.of(5, 7));
    assertEquals(Interval.of(0, 7), span);
    assertTrue(span.contains(Interval.of(1, 6)));
    assertFalse(Interval.of(1, 6).contains(span));
  }
}
