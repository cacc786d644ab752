package contractnet.cli;

import static contractnet.testing.TwoComponentNetwork.CONSUMER;
import static contractnet.testing.TwoComponentNetwork.PRODUCER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import contractnet.cli.ScenarioExecutor.ScenarioReport;
import contractnet.milp.Direction;
import contractnet.milp.OjAlgoMilpSolver;
import contractnet.milp.SolveStatus;
import contractnet.milp.SolverOutcome;
import contractnet.testing.ScriptedSolver;
import contractnet.testing.TestDefaults;
import contractnet.testing.TwoComponentNetwork;
import org.junit.jupiter.api.Test;

final class JsonReportBuilderTest {

  private static ScenarioReport converged() {
    return new ScenarioExecutor(OjAlgoMilpSolver::new)
        .execute(TwoComponentNetwork.widenedProducer(), TestDefaults.options(10));
  }

  private static ScenarioReport failed() {
    return new ScenarioExecutor(
            limit ->
                new ScriptedSolver(new OjAlgoMilpSolver(limit))
                    .when(
                        p ->
                            p.name().equals(PRODUCER + "/post")
                                && p.objective().direction() == Direction.MAXIMIZE,
                        SolverOutcome.failed(SolveStatus.INFEASIBLE, "scripted")))
        .execute(TwoComponentNetwork.widenedProducer(), TestDefaults.options(10));
  }

  private static JsonObject json(ScenarioReport report) {
    return JsonParser.parseString(new JsonReportBuilder().build(report)).getAsJsonObject();
  }

  @Test
  void convergedRunListsEveryIterationAndFinalContract() {
    ScenarioReport report = converged();
    JsonObject root = json(report);

    assertEquals(0, report.exitCode());
    assertEquals("converged", root.get("outcome").getAsString());
    JsonObject meta = root.getAsJsonObject("meta");
    assertEquals("1.0.0", meta.get("version").getAsString());
    assertEquals("TwoComponent", meta.get("scenario").getAsString());
    assertEquals(PRODUCER, meta.get("target_component").getAsString());
    assertEquals("union_incremental", meta.get("merge_policy").getAsString());
    assertEquals(2, root.getAsJsonArray("iterations").size());
    assertEquals(
        2,
        root.getAsJsonObject("final_contracts")
            .getAsJsonObject(CONSUMER)
            .getAsJsonArray("assumption")
            .size());
    assertTrue(root.getAsJsonObject("baseline_well_formedness").get("passed").getAsBoolean());
    assertTrue(root.getAsJsonObject("final_well_formedness").get("passed").getAsBoolean());
    assertFalse(root.has("failure"));
    assertFalse(root.has("system_level"));
  }

  @Test
  void iterationEntriesCarryDeviationPerClass() {
    JsonObject first = json(converged()).getAsJsonArray("iterations").get(0).getAsJsonObject();
    assertEquals(0, first.get("iteration").getAsInt());
    assertEquals(10.0, first.get("total_magnitude").getAsDouble(), 1e-9);
    assertEquals(5.0, first.getAsJsonObject("per_class").get("ΔA_rel").getAsDouble(), 1e-9);
    assertEquals(CONSUMER, first.getAsJsonArray("changed").get(0).getAsString());
  }

  @Test
  void failedRunCarriesTheFailureReport() {
    ScenarioReport report = failed();
    JsonObject root = json(report);

    assertEquals(2, report.exitCode());
    assertEquals("failed", root.get("outcome").getAsString());
    assertEquals(0, root.getAsJsonArray("iterations").size());
    JsonObject failure = root.getAsJsonObject("failure");
    assertEquals("InfeasibleModel", failure.get("kind").getAsString());
    assertEquals(PRODUCER, failure.get("component").getAsString());
    assertEquals("post", failure.get("transformer").getAsString());
    assertEquals(TwoComponentNetwork.V, failure.get("variable").getAsString());
    assertEquals("max", failure.get("direction").getAsString());
    assertEquals(0, failure.get("iteration").getAsInt());
    assertEquals(CONSUMER, failure.getAsJsonObject("edge").get("consumer").getAsString());
    assertTrue(failure.get("problem").getAsString().contains("Problem: Producer/post"));
  }

  @Test
  void textReportNamesTheOutcomeAndFailure() {
    TextReportWriter writer = new TextReportWriter();
    String text = writer.evolutionReport(failed());
    assertTrue(text.contains("Scenario: TwoComponent"), text);
    assertTrue(text.contains("Outcome:  FAILED"), text);
    assertTrue(text.contains("MILP TRANSFORMER FAILURE"), text);

    String trace = writer.contractTrace(converged());
    assertTrue(trace.contains("Iteration 1 (changed: [])"), trace);
  }
}
