package contractnet.diagnostics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import contractnet.model.Contract;
import contractnet.region.Box;
import contractnet.region.Region;
import org.junit.jupiter.api.Test;

final class DeviationRecordTest {

  private static Box v(double lower, double upper) {
    return Box.builder().bound("V", lower, upper).build();
  }

  @Test
  void widenedGuaranteeCountsOneRelaxation() {
    Contract baseline = Contract.of(v(0, 10), v(0, 10));
    Contract current = Contract.of(v(0, 10), v(0, 12));
    DeviationRecord record = DeviationRecord.compute(0, "C", baseline, current);
    assertEquals(1, record.count(DeviationClass.GUARANTEE_RELAXATION));
    assertEquals(2.0, record.magnitude(DeviationClass.GUARANTEE_RELAXATION));
    assertEquals(1, record.totalCount());
    assertEquals(0, record.count(DeviationClass.ASSUMPTION_RELAXATION));
  }

  @Test
  void strengthenedAssumptionAddsBothMovedBounds() {
    Contract baseline = Contract.of(v(0, 10), v(0, 10));
    Contract current = new Contract(Region.of(v(1, 7)), Region.of(v(0, 10)));
    DeviationRecord record = DeviationRecord.compute(3, "C", baseline, current);
    assertEquals(2, record.count(DeviationClass.ASSUMPTION_STRENGTHENING));
    assertEquals(4.0, record.magnitude(DeviationClass.ASSUMPTION_STRENGTHENING));
    assertEquals(4.0, record.totalMagnitude());
    assertEquals(3, record.iteration());
  }

  @Test
  void boxesAlreadyInTheBaselineAreNotDeviations() {
    Contract baseline = Contract.of(v(0, 10), v(0, 10));
    Contract current = new Contract(Region.of(v(0, 10), v(0, 15)), Region.of(v(0, 10)));
    DeviationRecord record = DeviationRecord.compute(1, "C", baseline, current);
    assertEquals(1, record.totalCount());
    assertEquals(5.0, record.magnitude(DeviationClass.ASSUMPTION_RELAXATION));
  }

  @Test
  void emptiedGuaranteeCollapsesEveryBaselineBound() {
    Contract baseline = Contract.of(v(0, 10), v(0, 10));
    Contract current = new Contract(Region.of(v(0, 10)), Region.empty());
    DeviationRecord record = DeviationRecord.compute(0, "C", baseline, current);
    assertEquals(2, record.count(DeviationClass.GUARANTEE_STRENGTHENING));
    assertEquals(10.0, record.magnitude(DeviationClass.GUARANTEE_STRENGTHENING));
    assertEquals(0, record.count(DeviationClass.ASSUMPTION_STRENGTHENING));
    assertEquals(2, record.totalCount());
  }

  @Test
  void emptiedAssumptionCountsEachVariableOfTheBaselineBox() {
    Box baselineBox = Box.builder().bound("V", 0, 10).bound("W", 2, 3).build();
    Contract baseline = Contract.of(baselineBox, v(0, 10));
    Contract current = new Contract(Region.empty(), Region.of(v(0, 10)));
    DeviationRecord record = DeviationRecord.compute(4, "C", baseline, current);
    assertEquals(4, record.count(DeviationClass.ASSUMPTION_STRENGTHENING));
    assertEquals(11.0, record.magnitude(DeviationClass.ASSUMPTION_STRENGTHENING));
    assertFalse(record.isEmpty());
  }

  @Test
  void unchangedContractHasAnEmptyRecord() {
    Contract baseline = Contract.of(v(0, 10), v(0, 10));
    DeviationRecord record = DeviationRecord.compute(0, "C", baseline, baseline);
    assertTrue(record.isEmpty());
    assertEquals(0.0, record.totalMagnitude());
    for (DeviationClass type : DeviationClass.values()) {
      assertEquals(0, record.count(type), type.symbol());
    }
  }
}
