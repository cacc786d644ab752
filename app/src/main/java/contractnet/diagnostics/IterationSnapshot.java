package contractnet.diagnostics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** State of every component after one completed iteration. */
public record IterationSnapshot(
    int iteration, List<ComponentSnapshot> components, IterationMetrics metrics) {

  public IterationSnapshot {
    components = List.copyOf(components);
    Objects.requireNonNull(metrics, "metrics");
  }

  public ComponentSnapshot component(String name) {
    for (ComponentSnapshot snapshot : components) {
      if (snapshot.component().equals(name)) {
        return snapshot;
      }
    }
    throw new IllegalArgumentException("No snapshot for component " + name);
  }

  public double totalMagnitude() {
    return components.stream().mapToDouble(c -> c.deviation().totalMagnitude()).sum();
  }

  /** Magnitudes summed over all components, per deviation class. */
  public Map<DeviationClass, Double> classTotals() {
    Map<DeviationClass, Double> totals = new EnumMap<>(DeviationClass.class);
    for (DeviationClass type : DeviationClass.values()) {
      totals.put(type, 0.0);
    }
    for (ComponentSnapshot snapshot : components) {
      for (DeviationClass type : DeviationClass.values()) {
        totals.merge(type, snapshot.deviation().magnitude(type), Double::sum);
      }
    }
    return Collections.unmodifiableMap(totals);
  }
}
