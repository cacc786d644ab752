package contractnet.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import contractnet.cli.ScenarioExecutor.ScenarioReport;
import contractnet.diagnostics.ComponentSnapshot;
import contractnet.diagnostics.DeviationClass;
import contractnet.diagnostics.DeviationRecord;
import contractnet.diagnostics.IterationSnapshot;
import contractnet.engine.EvolutionResult;
import contractnet.model.Contract;
import contractnet.region.Box;
import contractnet.region.Interval;
import contractnet.region.Region;
import contractnet.transform.FailureReport;
import contractnet.validation.SystemLevelChecker.SystemLevelCheck;
import contractnet.validation.ValidationResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson =
      new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();

  String build(ScenarioReport report) {
    return gson.toJson(tree(report));
  }

  /** The report as nested maps and lists, in the order they are serialized. */
  Map<String, Object> tree(ScenarioReport report) {
    EvolutionResult result = report.result();
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(report));
    root.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
    root.put("baseline_well_formedness", validation(report.baselineCheck()));
    root.put("iterations", iterations(result.snapshots()));
    root.put("final_contracts", contracts(result.finalContracts()));
    root.put("deviated_components", result.deviatedComponents());
    root.put("final_well_formedness", validation(report.finalCheck()));
    if (report.systemCheck() != null) {
      root.put("system_level", systemLevel(report.systemCheck()));
    }
    if (result.infeasibleComponent() != null) {
      root.put("infeasible_component", result.infeasibleComponent());
    }
    result.failureReport().ifPresent(failure -> root.put("failure", failure(failure)));
    return root;
  }

  private Map<String, Object> meta(ScenarioReport report) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("scenario", report.scenario().name());
    meta.put("target_component", report.scenario().targetComponent());
    meta.put("deviation", report.scenario().deviation().description());
    meta.put("max_iterations", report.options().maxIterations());
    meta.put("merge_policy", report.options().mergePolicy().name().toLowerCase(Locale.ROOT));
    meta.put("solver_time_limit_ms", report.options().solverTimeLimitMs());
    meta.put("coverage_tolerance", report.options().coverageTolerance());
    meta.put("time_ms", report.result().elapsedMillis());
    meta.put("solves", report.result().solves());
    meta.put("iteration_count", report.result().iterations());
    meta.put("min_iterations_expected", report.scenario().minIterationsExpected());
    return meta;
  }

  private List<Map<String, Object>> iterations(List<IterationSnapshot> snapshots) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (IterationSnapshot snapshot : snapshots) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("iteration", snapshot.iteration());
      entry.put("total_magnitude", snapshot.totalMagnitude());
      Map<String, Object> classes = new LinkedHashMap<>();
      snapshot.classTotals().forEach((type, value) -> classes.put(type.symbol(), value));
      entry.put("per_class", classes);
      entry.put("propagations", snapshot.metrics().propagations());
      entry.put("solves", snapshot.metrics().solves());
      entry.put("time_ms", snapshot.metrics().elapsedMillis());
      entry.put("changed", snapshot.metrics().changedComponents());
      List<Map<String, Object>> components = new ArrayList<>();
      for (ComponentSnapshot component : snapshot.components()) {
        Map<String, Object> comp = new LinkedHashMap<>();
        comp.put("name", component.component());
        comp.put("assumption", region(component.assumption()));
        comp.put("guarantee", region(component.guarantee()));
        comp.put("deviation", deviation(component.deviation()));
        components.add(comp);
      }
      entry.put("components", components);
      list.add(entry);
    }
    return list;
  }

  private Map<String, Object> deviation(DeviationRecord record) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (DeviationClass type : DeviationClass.values()) {
      Map<String, Object> values = new LinkedHashMap<>();
      values.put("count", record.count(type));
      values.put("magnitude", record.magnitude(type));
      map.put(type.symbol(), values);
    }
    map.put("total_magnitude", record.totalMagnitude());
    return map;
  }

  private Map<String, Object> contracts(Map<String, Contract> contracts) {
    Map<String, Object> map = new LinkedHashMap<>();
    contracts.forEach(
        (name, contract) -> {
          Map<String, Object> entry = new LinkedHashMap<>();
          entry.put("assumption", region(contract.assumption()));
          entry.put("guarantee", region(contract.guarantee()));
          map.put(name, entry);
        });
    return map;
  }

  private List<Map<String, List<Double>>> region(Region region) {
    List<Map<String, List<Double>>> boxes = new ArrayList<>();
    for (Box box : region.boxes()) {
      boxes.add(box(box));
    }
    return boxes;
  }

  private Map<String, List<Double>> box(Box box) {
    Map<String, List<Double>> map = new LinkedHashMap<>();
    box.intervals().forEach((variable, interval) -> map.put(variable, bounds(interval)));
    return map;
  }

  private List<Double> bounds(Interval interval) {
    return List.of(interval.lower(), interval.upper());
  }

  private Map<String, Object> validation(ValidationResult result) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("passed", result.passed());
    map.put("message", result.message());
    if (!result.details().isEmpty()) {
      map.put("details", result.details());
    }
    return map;
  }

  private Map<String, Object> systemLevel(SystemLevelCheck check) {
    Map<String, Object> map = validation(check.result());
    Map<String, List<Double>> achieved = new LinkedHashMap<>();
    check.achieved().forEach((variable, interval) -> achieved.put(variable, bounds(interval)));
    map.put("achieved", achieved);
    map.put("gap_count", check.gaps().size());
    map.put("violation_count", check.violations().size());
    return map;
  }

  private Map<String, Object> failure(FailureReport failure) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", failure.kind().label());
    map.put("component", failure.component());
    map.put("transformer", failure.transformer().label());
    map.put("variable", failure.variable());
    map.put("direction", failure.direction().label());
    map.put("status", failure.status().name());
    map.put("solver", failure.solverName());
    map.put("solver_detail", failure.solverDetail());
    map.put("iteration", failure.iteration());
    if (failure.edge() != null) {
      Map<String, Object> edge = new LinkedHashMap<>();
      edge.put("supplier", failure.edge().supplier());
      edge.put("consumer", failure.edge().consumer());
      edge.put("variables", failure.edge().variables());
      map.put("edge", edge);
    }
    map.put("input_box", box(failure.input()));
    map.put("problem", failure.problem().describe());
    return map;
  }
}
