package contractnet.cli;

import contractnet.cli.ScenarioExecutor.ScenarioReport;
import contractnet.diagnostics.ComponentSnapshot;
import contractnet.diagnostics.DeviationClass;
import contractnet.diagnostics.DeviationRecord;
import contractnet.diagnostics.IterationSnapshot;
import contractnet.engine.EvolutionResult;
import contractnet.model.Component;
import contractnet.model.Contract;
import contractnet.region.Box;
import contractnet.region.Region;
import contractnet.scenario.Scenario;
import contractnet.validation.SystemLevelChecker.SystemLevelCheck;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Plain-text evolution report and contract trace. */
final class TextReportWriter {
  private static final String RULE = "=".repeat(80);
  private static final String THIN_RULE = "-".repeat(80);

  String evolutionReport(ScenarioReport report) {
    Scenario scenario = report.scenario();
    EvolutionResult result = report.result();
    StringBuilder out = new StringBuilder();
    out.append(RULE).append('\n');
    out.append("CONTRACT EVOLUTION REPORT\n");
    out.append(RULE).append('\n');
    out.append("Scenario: ").append(scenario.name()).append('\n');
    out.append("Outcome:  ").append(result.outcome()).append('\n');
    out.append('\n');

    section(out, "DESCRIPTION");
    out.append(scenario.description()).append("\n\n");

    section(out, "BASELINE CONTRACTS");
    for (Component component : scenario.network().components()) {
      Contract baseline = scenario.network().baseline(component.name());
      out.append('\n').append(component.name()).append(":\n");
      out.append("  Inputs: ").append(component.inputNames()).append('\n');
      out.append("  Outputs: ").append(component.outputNames()).append('\n');
      out.append("  Baseline Assumptions: ").append(boxCount(baseline.assumption())).append('\n');
      out.append("  Baseline Guarantees: ").append(boxCount(baseline.guarantee())).append('\n');
    }
    out.append('\n');

    section(out, "BASELINE WELL-FORMEDNESS CHECK");
    out.append(report.baselineCheck()).append("\n\n");

    section(out, "TARGET EVOLUTION");
    out.append("Component: ").append(scenario.targetComponent()).append('\n');
    out.append("Initial deviation: ").append(scenario.deviation().description()).append('\n');
    out.append("  ")
        .append(result.initialContracts().get(scenario.targetComponent()))
        .append("\n\n");

    section(out, "ITERATION SUMMARY");
    out.append("Total iterations: ").append(result.iterations()).append('\n');
    out.append("Converged: ").append(result.converged()).append('\n');
    out.append("MILP solves: ").append(result.solves()).append('\n');
    out.append("Total time: ").append(result.elapsedMillis()).append(" ms\n\n");
    out.append("Per-Iteration Metrics:\n");
    out.append(
        String.format(
            Locale.ROOT,
            "%-6s %-12s %-10s %-10s %-10s %-10s %-10s%n",
            "Iter",
            "Total Mag",
            DeviationClass.ASSUMPTION_RELAXATION.symbol(),
            DeviationClass.ASSUMPTION_STRENGTHENING.symbol(),
            DeviationClass.GUARANTEE_RELAXATION.symbol(),
            DeviationClass.GUARANTEE_STRENGTHENING.symbol(),
            "Time(ms)"));
    out.append("-".repeat(76)).append('\n');
    for (IterationSnapshot snapshot : result.snapshots()) {
      Map<DeviationClass, Double> totals = snapshot.classTotals();
      out.append(
          String.format(
              Locale.ROOT,
              "%-6d %-12.1f %-10.1f %-10.1f %-10.1f %-10.1f %-10d%n",
              snapshot.iteration(),
              snapshot.totalMagnitude(),
              totals.get(DeviationClass.ASSUMPTION_RELAXATION),
              totals.get(DeviationClass.ASSUMPTION_STRENGTHENING),
              totals.get(DeviationClass.GUARANTEE_RELAXATION),
              totals.get(DeviationClass.GUARANTEE_STRENGTHENING),
              snapshot.metrics().elapsedMillis()));
    }
    out.append('\n');

    result
        .lastSnapshot()
        .ifPresent(
            last -> {
              section(out, "FINAL DEVIATIONS");
              for (ComponentSnapshot component : last.components()) {
                DeviationRecord deviation = component.deviation();
                if (deviation.isEmpty()) {
                  continue;
                }
                out.append('\n').append(component.component()).append(":\n");
                out.append(
                    String.format(
                        Locale.ROOT, "  Total magnitude: %.1f%n", deviation.totalMagnitude()));
                for (DeviationClass type : DeviationClass.values()) {
                  out.append(
                      String.format(
                          Locale.ROOT,
                          "  %s: %d bound(s), magnitude %.2f%n",
                          type.symbol(),
                          deviation.count(type),
                          deviation.magnitude(type)));
                }
              }
              out.append('\n');
            });

    section(out, "FINAL CONTRACTS SUMMARY");
    result
        .finalContracts()
        .forEach(
            (name, contract) -> {
              out.append('\n').append(name).append(":\n");
              out.append("  Assumptions: ").append(boxCount(contract.assumption())).append('\n');
              out.append("  Guarantees: ").append(boxCount(contract.guarantee())).append('\n');
            });
    out.append('\n');

    section(out, "FINAL WELL-FORMEDNESS CHECK (After Evolution)");
    out.append(report.finalCheck()).append("\n\n");

    if (report.systemCheck() != null) {
      appendSystemLevel(out, scenario, report.systemCheck());
    }
    if (result.infeasibleComponent() != null) {
      section(out, "INFEASIBLE CONTRACT");
      out.append(result.infeasibleComponent())
          .append(" has an empty assumption or guarantee\n\n");
    }
    result.failureReport().ifPresent(failure -> out.append(failure.formatReport()));
    return out.toString();
  }

  /** Every box of every component, baseline first and then per iteration. */
  String contractTrace(ScenarioReport report) {
    EvolutionResult result = report.result();
    StringBuilder out = new StringBuilder();
    out.append(RULE).append('\n');
    out.append("CONTRACT EVOLUTION TRACE: ").append(report.scenario().name()).append('\n');
    out.append(RULE).append('\n');
    out.append("\nInitial contracts (deviation applied)\n").append(THIN_RULE).append('\n');
    result.initialContracts().forEach((name, contract) -> appendContract(out, name, contract));
    for (IterationSnapshot snapshot : result.snapshots()) {
      out.append("\nIteration ")
          .append(snapshot.iteration())
          .append(" (changed: ")
          .append(snapshot.metrics().changedComponents())
          .append(")\n")
          .append(THIN_RULE)
          .append('\n');
      for (ComponentSnapshot component : snapshot.components()) {
        appendContract(
            out,
            component.component(),
            new Contract(component.assumption(), component.guarantee()));
      }
    }
    return out.toString();
  }

  private void appendSystemLevel(StringBuilder out, Scenario scenario, SystemLevelCheck check) {
    section(out, "SYSTEM-LEVEL CONTRACT CHECK");
    out.append(check.result()).append('\n');
    out.append("\nREQUIRED by system-level contract:\n");
    List<Box> required = scenario.systemContract().guarantee().boxes();
    if (required.isEmpty()) {
      out.append("  (no guarantees required)\n");
    }
    for (int i = 0; i < required.size(); i++) {
      out.append("  [").append(i + 1).append("] ").append(required.get(i)).append('\n');
    }
    out.append("\nACHIEVED by evolved system:\n");
    check
        .achieved()
        .forEach(
            (variable, interval) ->
                out.append("  ").append(variable).append(" in ").append(interval).append('\n'));
    out.append(
        String.format(
            Locale.ROOT,
            "%n  Summary: Gap=%d variable(s), Violation=%d variable(s)%n%n",
            check.gaps().size(),
            check.violations().size()));
  }

  private void appendContract(StringBuilder out, String name, Contract contract) {
    out.append(name).append(":\n");
    out.append("  A (").append(boxCount(contract.assumption())).append("):\n");
    for (Box box : contract.assumption().boxes()) {
      out.append("    ").append(box).append('\n');
    }
    out.append("  G (").append(boxCount(contract.guarantee())).append("):\n");
    for (Box box : contract.guarantee().boxes()) {
      out.append("    ").append(box).append('\n');
    }
  }

  private static void section(StringBuilder out, String title) {
    out.append(title).append('\n').append(THIN_RULE).append('\n');
  }

  private static String boxCount(Region region) {
    return region.size() + " box(es)";
  }
}
