package contractnet.cli;

import contractnet.engine.EvolutionEngine;
import contractnet.engine.EvolutionOptions;
import contractnet.engine.EvolutionOutcome;
import contractnet.engine.EvolutionResult;
import contractnet.milp.MilpSolver;
import contractnet.milp.OjAlgoMilpSolver;
import contractnet.model.Contract;
import contractnet.scenario.Scenario;
import contractnet.validation.SystemLevelChecker;
import contractnet.validation.SystemLevelChecker.SystemLevelCheck;
import contractnet.validation.ValidationResult;
import contractnet.validation.WellFormednessChecker;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs one scenario with the checks around it: well-formedness before and after, system level. */
final class ScenarioExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(ScenarioExecutor.class);

  private final LongFunction<MilpSolver> solverFactory;

  ScenarioExecutor() {
    this(OjAlgoMilpSolver::new);
  }

  /** @param solverFactory builds a solver for the configured time limit in milliseconds */
  ScenarioExecutor(LongFunction<MilpSolver> solverFactory) {
    this.solverFactory = Objects.requireNonNull(solverFactory, "solverFactory");
  }

  ScenarioReport execute(Scenario scenario, EvolutionOptions options) {
    EvolutionOptions normalized = EvolutionOptions.normalize(options);
    WellFormednessChecker wellFormedness = new WellFormednessChecker(scenario.network());
    ValidationResult baselineCheck =
        wellFormedness.check(baselines(scenario));
    LOG.info("Baseline: {}", baselineCheck.message());

    EvolutionEngine engine =
        new EvolutionEngine(solverFactory.apply(normalized.solverTimeLimitMs()), normalized);
    EvolutionResult result = engine.evolve(scenario);

    ValidationResult finalCheck = wellFormedness.check(result.finalContracts());
    LOG.info("After evolution: {}", finalCheck.message());
    SystemLevelCheck systemCheck =
        scenario
            .systemLevelContract()
            .map(contract -> new SystemLevelChecker().check(result.finalContracts(), contract))
            .orElse(null);
    if (systemCheck != null) {
      LOG.info("System level: {}", systemCheck.result().message());
    }
    if (result.converged() && result.iterations() < scenario.minIterationsExpected()) {
      LOG.warn(
          "Converged after {} iteration(s), fewer than the {} expected",
          result.iterations(),
          scenario.minIterationsExpected());
    }
    return new ScenarioReport(scenario, normalized, result, baselineCheck, finalCheck, systemCheck);
  }

  private static Map<String, Contract> baselines(Scenario scenario) {
    Map<String, Contract> baselines = new LinkedHashMap<>();
    for (String name : scenario.network().componentNames()) {
      baselines.put(name, scenario.network().baseline(name));
    }
    return baselines;
  }

  /** Result of one scenario run with its checks; {@code systemCheck} is null without one. */
  record ScenarioReport(
      Scenario scenario,
      EvolutionOptions options,
      EvolutionResult result,
      ValidationResult baselineCheck,
      ValidationResult finalCheck,
      SystemLevelCheck systemCheck) {

    ScenarioReport {
      Objects.requireNonNull(scenario, "scenario");
      Objects.requireNonNull(options, "options");
      Objects.requireNonNull(result, "result");
      Objects.requireNonNull(baselineCheck, "baselineCheck");
      Objects.requireNonNull(finalCheck, "finalCheck");
    }

    /** 0 converged, 2 failed solve, 3 no fixpoint or an infeasible contract. */
    int exitCode() {
      return exitCode(result.outcome());
    }

    static int exitCode(EvolutionOutcome outcome) {
      return switch (outcome) {
        case CONVERGED -> 0;
        case FAILED -> 2;
        case NON_CONVERGENCE, INFEASIBLE_CONTRACT -> 3;
      };
    }
  }
}
