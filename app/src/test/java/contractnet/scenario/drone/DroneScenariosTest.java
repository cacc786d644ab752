package contractnet.scenario.drone;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import contractnet.engine.EvolutionEngine;
import contractnet.engine.EvolutionOutcome;
import contractnet.engine.EvolutionResult;
import contractnet.milp.MilpProblem;
import contractnet.milp.Objective;
import contractnet.milp.OjAlgoMilpSolver;
import contractnet.model.Component;
import contractnet.model.Contract;
import contractnet.model.ContractNetwork;
import contractnet.region.Box;
import contractnet.region.Region;
import contractnet.scenario.Scenario;
import contractnet.testing.TestDefaults;
import contractnet.transform.ContractTransformer;
import contractnet.transform.TransformContext;
import contractnet.transform.TransformerKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class DroneScenariosTest {
  private static final int MAX_ITERATIONS = 25;
  private static final long MAX_SOLVES = 5_000L;
  private static final int MAX_BOXES = 60;

  @Test
  void networkConnectsFiveComponentsThroughElevenInterfaces() {
    ContractNetwork network = DroneNetwork.create();
    assertEquals(
        List.of(
            DroneNetwork.FLIGHT_CONTROLLER,
            DroneNetwork.MOTOR,
            DroneNetwork.POWER_MANAGER,
            DroneNetwork.BATTERY,
            DroneNetwork.NAVIGATION),
        network.componentNames());
    assertEquals(11, network.interfaces().size());
    assertEquals(
        List.of(
            DroneNetwork.FLIGHT_CONTROLLER,
            DroneNetwork.POWER_MANAGER,
            DroneNetwork.NAVIGATION),
        network.consumersOf(DroneNetwork.MOTOR).stream().distinct().toList());
  }

  @Test
  void everyComponentSitsOnOneFeedbackLoop() {
    List<List<String>> cycles = DroneNetwork.create().cycles();
    assertEquals(1, cycles.size());
    assertEquals(
        List.of(
            DroneNetwork.BATTERY,
            DroneNetwork.FLIGHT_CONTROLLER,
            DroneNetwork.MOTOR,
            DroneNetwork.NAVIGATION,
            DroneNetwork.POWER_MANAGER),
        cycles.get(0));
  }

  @Test
  void everyModelContributesConstraints() {
    ContractNetwork network = DroneNetwork.create();
    ContractTransformer transformer =
        new ContractTransformer(new OjAlgoMilpSolver(TestDefaults.solverTimeLimitMs()));
    for (Component component : network.components()) {
      Box assumption = network.baseline(component.name()).assumption().boxes().get(0);
      MilpProblem problem =
          transformer
              .formulate(TransformerKind.POST, component, assumption)
              .build(Objective.maximize(component.outputNames().get(0)));
      assertFalse(problem.constraints().isEmpty(), component.name());
      assertEquals(component.name() + "/post", problem.name());
    }
  }

  @Test
  void healthyMotorPassesTheFullCommandThrough() {
    ContractTransformer transformer =
        new ContractTransformer(new OjAlgoMilpSolver(TestDefaults.solverTimeLimitMs()));
    Box thrust =
        transformer
            .post(
                DroneNetwork.motor(),
                Region.of(
                    Box.builder()
                        .bound(DroneVariables.THRUST_COMMAND, 0.0, 30.0)
                        .bound(DroneVariables.VOLTAGE_AVAILABLE, 11.5, 12.6)
                        .build()),
                List.of(DroneVariables.MOTOR_THRUST),
                TransformContext.standalone())
            .boxes()
            .get(0);
    assertEquals(0.0, thrust.interval(DroneVariables.MOTOR_THRUST).lower(), 1e-3);
    assertEquals(30.0, thrust.interval(DroneVariables.MOTOR_THRUST).upper(), 1e-3);
  }

  @Test
  void motorDegradationReachesAFixpoint() {
    assertConvergesWithinBudget(DroneScenarios.motorDegradation());
  }

  @Test
  void motorUpgradeReachesAFixpoint() {
    assertConvergesWithinBudget(DroneScenarios.motorUpgrade());
  }

  @Test
  void navDriftIncreaseReachesAFixpoint() {
    assertConvergesWithinBudget(DroneScenarios.navDriftIncrease());
  }

  private static void assertConvergesWithinBudget(Scenario scenario) {
    EvolutionResult result =
        EvolutionEngine.withOjAlgo(TestDefaults.options(MAX_ITERATIONS)).evolve(scenario);

    assertEquals(EvolutionOutcome.CONVERGED, result.outcome(), scenario.name());
    assertTrue(result.iterations() <= MAX_ITERATIONS - 5, "iterations " + result.iterations());
    assertTrue(result.solves() <= MAX_SOLVES, "solves " + result.solves());
    for (Map.Entry<String, Contract> entry : result.finalContracts().entrySet()) {
      Contract contract = entry.getValue();
      assertFalse(contract.assumption().isEmpty(), entry.getKey());
      assertFalse(contract.guarantee().isEmpty(), entry.getKey());
      assertTrue(contract.assumption().size() <= MAX_BOXES, entry.getKey());
      assertTrue(contract.guarantee().size() <= MAX_BOXES, entry.getKey());
    }
    assertTrue(result.deviatedComponents().contains(scenario.targetComponent()));
    assertTrue(result.deviatedComponents().contains(DroneNetwork.FLIGHT_CONTROLLER));
  }

  @Test
  void scenariosTargetTheirComponentAndCarryASystemContract() {
    List<Scenario> scenarios =
        List.of(
            DroneScenarios.motorDegradation(),
            DroneScenarios.motorUpgrade(),
            DroneScenarios.navDriftIncrease());
    assertEquals(DroneNetwork.MOTOR, scenarios.get(0).targetComponent());
    assertEquals(DroneNetwork.MOTOR, scenarios.get(1).targetComponent());
    assertEquals(DroneNetwork.NAVIGATION, scenarios.get(2).targetComponent());
    for (Scenario scenario : scenarios) {
      assertTrue(scenario.systemLevelContract().isPresent(), scenario.name());
      assertTrue(scenario.minIterationsExpected() >= 1);
    }
    assertEquals(3, scenarios.get(0).deviation().guarantee().size());
  }
}
