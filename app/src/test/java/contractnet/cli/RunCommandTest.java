package contractnet.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import contractnet.engine.AssumptionMergePolicy;
import contractnet.engine.EvolutionOptions;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

final class RunCommandTest {
  private final RunCommand command = new RunCommand();

  @Test
  void parsesSeparateAndInlineValues() {
    CliOptions options =
        command.parseRunArgs(
            new String[] {
              "run",
              "--scenario",
              "Motor-Upgrade",
              "--max-iterations=5",
              "--merge-policy",
              "intersect",
              "--time-limit-ms=2500",
              "--report",
              "out/report.json",
              "--trace"
            });
    assertEquals("motor_upgrade", options.scenarioName());
    assertEquals(5, options.maxIterations());
    assertEquals(AssumptionMergePolicy.INTERSECT_ACROSS_EDGES, options.mergePolicy());
    assertEquals(2500L, options.solverTimeLimitMs());
    assertEquals(Path.of("out/report.json"), options.jsonReport());
    assertTrue(options.trace());
    assertFalse(options.hasTextReport());
    assertEquals(
        new EvolutionOptions(5, AssumptionMergePolicy.INTERSECT_ACROSS_EDGES, 2500L),
        options.evolutionOptions());
  }

  @Test
  void unspecifiedOptionsKeepEngineDefaults() {
    CliOptions options = command.parseRunArgs(new String[] {"--scenario=nav_drift_increase"});
    EvolutionOptions defaults = EvolutionOptions.defaults();
    assertEquals(defaults, options.evolutionOptions());
    assertFalse(options.trace());
  }

  @Test
  void rejectsBadArguments() {
    assertThrows(
        IllegalArgumentException.class, () -> command.parseRunArgs(new String[] {"run"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseRunArgs(new String[] {"--scenario", "unknown"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseRunArgs(new String[] {"--scenario=motor_upgrade", "--verbose"}));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            command.parseRunArgs(new String[] {"--scenario=motor_upgrade", "--max-iterations"}));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            command.parseRunArgs(
                new String[] {"--scenario=motor_upgrade", "--max-iterations=0"}));
  }
}
