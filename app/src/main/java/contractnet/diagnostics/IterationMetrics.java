package contractnet.diagnostics;

import java.util.List;

/**
 * Counters for one iteration.
 *
 * @param propagations merges that changed a pending region
 * @param solves solver calls issued during the iteration
 * @param changedComponents components whose contract differs from the iteration start
 */
public record IterationMetrics(
    int iteration,
    int propagations,
    long solves,
    long elapsedMillis,
    List<String> changedComponents) {

  public IterationMetrics {
    changedComponents = changedComponents == null ? List.of() : List.copyOf(changedComponents);
  }

  public boolean changed() {
    return !changedComponents.isEmpty();
  }
}
