package contractnet.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import contractnet.engine.AssumptionMergePolicy;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CliParsersTest {

  @Test
  void blankNumbersFallBackToTheDefault() {
    assertEquals(7, CliParsers.parseInt(" ", 7, "--max-iterations"));
    assertEquals(12, CliParsers.parseInt(" 12 ", 7, "--max-iterations"));
    assertEquals(500L, CliParsers.parseLong(null, 500L, "--time-limit-ms"));
    assertThrows(
        IllegalArgumentException.class, () -> CliParsers.parseInt("ten", 7, "--max-iterations"));
  }

  @Test
  void mergePolicyAcceptsShortAndLongNames() {
    assertEquals(AssumptionMergePolicy.UNION_INCREMENTAL, CliParsers.parseMergePolicy(null));
    assertEquals(AssumptionMergePolicy.UNION_INCREMENTAL, CliParsers.parseMergePolicy("Union"));
    assertEquals(
        AssumptionMergePolicy.INTERSECT_ACROSS_EDGES,
        CliParsers.parseMergePolicy("intersect-across-edges"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseMergePolicy("average"));
  }

  @Test
  void scenarioNamesAreNormalized() {
    assertEquals("motor_upgrade", CliParsers.normalizeScenarioName(" Motor-Upgrade "));
  }

  @Test
  void scenarioListExpandsAllAndValidatesNames() {
    assertEquals(
        List.of("motor_degradation", "motor_upgrade", "nav_drift_increase"),
        CliParsers.parseScenarioList("all"));
    assertEquals(
        List.of("nav_drift_increase", "motor_upgrade"),
        CliParsers.parseScenarioList("nav-drift-increase, motor_upgrade,"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseScenarioList("a,b"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseScenarioList(" , "));
  }
}
