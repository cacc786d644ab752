package contractnet.cli;

import contractnet.engine.AssumptionMergePolicy;
import contractnet.engine.EvolutionOptions;
import contractnet.scenario.ScenarioCatalog;
import java.nio.file.Path;
import java.util.Objects;

record CliOptions(
    String scenarioName,
    int maxIterations,
    AssumptionMergePolicy mergePolicy,
    long solverTimeLimitMs,
    Path jsonReport,
    Path textReport,
    boolean trace) {

  CliOptions {
    Objects.requireNonNull(scenarioName, "scenarioName");
    mergePolicy = mergePolicy == null ? EvolutionOptions.defaults().mergePolicy() : mergePolicy;
    if (maxIterations < 1) {
      throw new IllegalArgumentException("max iterations must be at least 1");
    }
    if (solverTimeLimitMs < 1) {
      throw new IllegalArgumentException("solver time limit must be positive");
    }
  }

  EvolutionOptions evolutionOptions() {
    return new EvolutionOptions(maxIterations, mergePolicy, solverTimeLimitMs);
  }

  boolean hasJsonReport() {
    return jsonReport != null;
  }

  boolean hasTextReport() {
    return textReport != null;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String scenarioName;
    private int maxIterations = EvolutionOptions.defaults().maxIterations();
    private AssumptionMergePolicy mergePolicy = EvolutionOptions.defaults().mergePolicy();
    private long solverTimeLimitMs = EvolutionOptions.defaults().solverTimeLimitMs();
    private Path jsonReport;
    private Path textReport;
    private boolean trace;

    Builder scenarioName(String scenarioName) {
      this.scenarioName = scenarioName;
      return this;
    }

    Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    Builder mergePolicy(AssumptionMergePolicy mergePolicy) {
      this.mergePolicy = mergePolicy;
      return this;
    }

    Builder solverTimeLimitMs(long solverTimeLimitMs) {
      this.solverTimeLimitMs = solverTimeLimitMs;
      return this;
    }

    Builder jsonReport(Path jsonReport) {
      this.jsonReport = jsonReport;
      return this;
    }

    Builder textReport(Path textReport) {
      this.textReport = textReport;
      return this;
    }

    Builder trace(boolean trace) {
      this.trace = trace;
      return this;
    }

    CliOptions build() {
      if (scenarioName == null || scenarioName.isBlank()) {
        throw new IllegalArgumentException(
            "Provide --scenario, one of " + ScenarioCatalog.names());
      }
      String normalized = CliParsers.normalizeScenarioName(scenarioName);
      if (!ScenarioCatalog.contains(normalized)) {
        throw new IllegalArgumentException(
            "Unknown scenario: " + scenarioName + " (available: " + ScenarioCatalog.names() + ")");
      }
      return new CliOptions(
          normalized, maxIterations, mergePolicy, solverTimeLimitMs, jsonReport, textReport, trace);
    }
  }
}
