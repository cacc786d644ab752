package contractnet.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import contractnet.region.Box;
import contractnet.region.Region;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ContractMergeTest {
  private static final List<String> V = List.of("V");
  private static final double TOLERANCE = 1e-6;

  private static Box box(double vLo, double vHi, double wLo, double wHi) {
    return Box.builder().bound("V", vLo, vHi).bound("W", wLo, wHi).build();
  }

  private static Box v(double lower, double upper) {
    return Box.builder().bound("V", lower, upper).build();
  }

  @Test
  void relaxationKeepsEveryPreviousBox() {
    Region assumption = Region.of(box(0, 10, 0, 1));
    Region relaxed = ContractMerge.relax(assumption, Region.of(v(0, 15), v(20, 30)), V, TOLERANCE);
    assertEquals(Region.of(box(0, 10, 0, 1), box(0, 15, 0, 1), box(20, 30, 0, 1)), relaxed);
    assertTrue(relaxed.covers(assumption));
  }

  @Test
  void relaxationWithTheSameImageIsStable() {
    Region assumption = Region.of(v(0, 10), v(0, 15));
    assertEquals(assumption, ContractMerge.relax(assumption, Region.of(v(0, 15)), V, TOLERANCE));
  }

  @Test
  void widerImageAddsOneBoxNextToTheBaseline() {
    Region assumption = Region.of(v(0, 10));
    Region relaxed = ContractMerge.relax(assumption, Region.of(v(0, 15)), V, TOLERANCE);
    assertEquals(Region.of(v(0, 10), v(0, 15)), relaxed);
  }

  @Test
  void imageAcceptedOnTheInterfaceAddsNothing() {
    Region assumption = Region.of(box(0, 10, 0, 1), box(5, 20, 2, 3));
    Region image = Region.of(v(2, 8), v(6, 19), v(0, 10.0000001));
    assertSame(assumption, ContractMerge.relax(assumption, image, V, TOLERANCE));
  }

  @Test
  void relaxedBoxesNestedInAnotherNewBoxAreLeftOut() {
    Region assumption = Region.of(box(0, 10, 0, 1), box(0, 5, 0, 4), box(0, 3, 0, 1));
    Region relaxed = ContractMerge.relax(assumption, Region.of(v(0, 15)), V, TOLERANCE);
    assertEquals(4, relaxed.size());
    assertEquals(assumption.union(box(0, 15, 0, 4)), relaxed);
    assertTrue(relaxed.covers(assumption));
  }

  @Test
  void absorptionSkipsImagesTheGuaranteeAlreadyHolds() {
    Region guarantee = Region.of(v(0, 10));
    assertSame(
        guarantee, ContractMerge.absorb(guarantee, Region.of(v(1, 9), v(0, 10)), TOLERANCE));
    assertEquals(
        Region.of(v(0, 10), v(5, 12)),
        ContractMerge.absorb(guarantee, Region.of(v(2, 3), v(5, 12)), TOLERANCE));
  }

  @Test
  void relaxationOfEmptyAssumptionStaysEmpty() {
    Region empty = Region.empty();
    assertSame(empty, ContractMerge.relax(empty, Region.of(v(0, 1)), V, TOLERANCE));
  }

  @Test
  void narrowingKeepsBoxesThatAlreadyFit() {
    Region guarantee = Region.of(box(0, 5, 0, 1));
    assertEquals(guarantee, ContractMerge.narrow(guarantee, Region.of(v(0, 10)), V));
  }

  @Test
  void narrowingClipsToTheRequirementAndDropsNestedPieces() {
    Region guarantee = Region.of(box(0, 20, 0, 1));
    Region requirement = Region.of(v(0, 10), v(2, 8), v(15, 30));
    Region narrowed = ContractMerge.narrow(guarantee, requirement, V);
    assertEquals(Region.of(box(0, 10, 0, 1), box(15, 20, 0, 1)), narrowed);
    assertTrue(guarantee.covers(narrowed));
  }

  @Test
  void narrowingAgainstNothingEmptiesTheGuarantee() {
    assertTrue(ContractMerge.narrow(Region.of(v(0, 1)), Region.empty(), V).isEmpty());
    assertTrue(ContractMerge.narrow(Region.of(v(0, 1)), Region.of(v(5, 6)), V).isEmpty());
  }

  @Test
  void intersectAllFoldsCandidates() {
    Region first = Region.of(v(0, 10), v(0, 15));
    Region second = Region.of(v(0, 10));
    assertSame(first, ContractMerge.intersectAll(List.of(first)));
    assertEquals(Region.of(v(0, 10)), ContractMerge.intersectAll(List.of(first, second)));
    assertThrows(IllegalArgumentException.class, () -> ContractMerge.intersectAll(List.of()));
  }
}
