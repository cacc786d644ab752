package contractnet.diagnostics;

import contractnet.model.ComponentState;
import contractnet.transform.FailureReport;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects one snapshot per completed iteration and, at most once, the failure that ended the
 * run. Once a failure is stored no further iteration is accepted.
 */
public final class SnapshotRecorder {
  private static final Logger LOG = LoggerFactory.getLogger(SnapshotRecorder.class);

  private final List<IterationSnapshot> snapshots = new ArrayList<>();
  private FailureReport failure;

  public IterationSnapshot recordIteration(
      int iteration, Collection<ComponentState> states, IterationMetrics metrics) {
    if (failure != null) {
      throw new IllegalStateException(
          "Run already failed at iteration " + failure.iteration() + "; no further snapshots");
    }
    List<ComponentSnapshot> components = new ArrayList<>(states.size());
    for (ComponentState state : states) {
      components.add(ComponentSnapshot.capture(iteration, state));
    }
    IterationSnapshot snapshot = new IterationSnapshot(iteration, components, metrics);
    snapshots.add(snapshot);
    LOG.debug(
        "Iteration {} recorded: magnitude {}, changed {}",
        iteration,
        snapshot.totalMagnitude(),
        metrics.changedComponents());
    return snapshot;
  }

  public void recordFailure(FailureReport report) {
    Objects.requireNonNull(report, "report");
    if (failure != null) {
      throw new IllegalStateException("A failure was already recorded");
    }
    failure = report;
  }

  public List<IterationSnapshot> snapshots() {
    return List.copyOf(snapshots);
  }

  public Optional<FailureReport> failure() {
    return Optional.ofNullable(failure);
  }

  public boolean hasFailed() {
    return failure != null;
  }
}
