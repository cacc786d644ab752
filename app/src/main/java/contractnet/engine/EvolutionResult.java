package contractnet.engine;

import contractnet.diagnostics.IterationSnapshot;
import contractnet.model.Contract;
import contractnet.transform.FailureReport;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one run with the snapshots of every completed iteration.
 *
 * @param failure report of the failed solve; present only for {@link EvolutionOutcome#FAILED}
 * @param infeasibleComponent set only for {@link EvolutionOutcome#INFEASIBLE_CONTRACT}
 */
public record EvolutionResult(
    String scenarioName,
    EvolutionOutcome outcome,
    List<IterationSnapshot> snapshots,
    Map<String, Contract> baselines,
    Map<String, Contract> initialContracts,
    Map<String, Contract> finalContracts,
    FailureReport failure,
    String infeasibleComponent,
    long solves,
    long elapsedMillis) {

  public EvolutionResult {
    Objects.requireNonNull(scenarioName, "scenarioName");
    Objects.requireNonNull(outcome, "outcome");
    snapshots = List.copyOf(snapshots);
    baselines = ordered(baselines);
    initialContracts = ordered(initialContracts);
    finalContracts = ordered(finalContracts);
    if ((outcome == EvolutionOutcome.FAILED) != (failure != null)) {
      throw new IllegalArgumentException("A failure report belongs to FAILED outcomes only");
    }
    if ((outcome == EvolutionOutcome.INFEASIBLE_CONTRACT) != (infeasibleComponent != null)) {
      throw new IllegalArgumentException(
          "An infeasible component belongs to INFEASIBLE_CONTRACT outcomes only");
    }
  }

  private static Map<String, Contract> ordered(Map<String, Contract> source) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /** Number of completed iterations. */
  public int iterations() {
    return snapshots.size();
  }

  public boolean converged() {
    return outcome == EvolutionOutcome.CONVERGED;
  }

  public Optional<FailureReport> failureReport() {
    return Optional.ofNullable(failure);
  }

  public Optional<IterationSnapshot> lastSnapshot() {
    return snapshots.isEmpty()
        ? Optional.empty()
        : Optional.of(snapshots.get(snapshots.size() - 1));
  }

  public Contract finalContract(String component) {
    Contract contract = finalContracts.get(component);
    if (contract == null) {
      throw new IllegalArgumentException("Unknown component " + component);
    }
    return contract;
  }

  /** Components whose final contract differs from their baseline. */
  public List<String> deviatedComponents() {
    return finalContracts.entrySet().stream()
        .filter(e -> !e.getValue().equals(baselines.get(e.getKey())))
        .map(Map.Entry::getKey)
        .toList();
  }
}
