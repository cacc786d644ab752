package contractnet.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import contractnet.region.Box;
import contractnet.region.Region;
import org.junit.jupiter.api.Test;

final class ComponentStateTest {

  private static Box v(double lower, double upper) {
    return Box.builder().bound("V", lower, upper).build();
  }

  @Test
  void evolveReportsWhetherTheContractChanged() {
    ComponentState state = ComponentState.atBaseline("C", Contract.of(v(0, 10), v(0, 10)));
    assertFalse(state.evolve(0, Region.of(v(0, 10)), Region.of(v(0, 10))));
    assertTrue(state.evolve(1, Region.of(v(0, 10), v(0, 15)), Region.of(v(0, 10))));
    assertFalse(
        state.evolve(2, Region.of(v(0, 15), v(0, 10)), Region.of(v(0, 10))),
        "box order does not matter");
    assertEquals(2, state.lastEvolvedIteration());
    assertEquals(Contract.of(v(0, 10), v(0, 10)), state.baseline());
  }

  @Test
  void evolvesAtMostOncePerIteration() {
    ComponentState state = ComponentState.atBaseline("C", Contract.of(v(0, 10), v(0, 10)));
    state.evolve(0, Region.of(v(0, 12)), Region.of(v(0, 10)));
    assertThrows(
        IllegalStateException.class,
        () -> state.evolve(0, Region.of(v(0, 13)), Region.of(v(0, 10))));
    assertEquals(Region.of(v(0, 12)), state.assumption());
  }

  @Test
  void deviationOverridesOnlyTheSidesItNames() {
    Contract baseline = Contract.of(v(0, 10), v(0, 10));
    Deviation deviation = Deviation.ofGuarantee("C", Region.of(v(0, 15)), "wider");
    assertEquals(Contract.of(v(0, 10), v(0, 15)), deviation.applyTo(baseline));
    assertThrows(IllegalArgumentException.class, () -> new Deviation("C", null, null, null, ""));
  }

  @Test
  void emptySideMakesTheContractInfeasible() {
    assertTrue(Contract.of(v(0, 1), v(0, 1)).isFeasible());
    assertFalse(new Contract(Region.empty(), Region.of(v(0, 1))).isFeasible());
  }
}
