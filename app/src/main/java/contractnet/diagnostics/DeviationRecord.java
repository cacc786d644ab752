package contractnet.diagnostics;

import contractnet.model.Contract;
import contractnet.region.BoundDelta;
import contractnet.region.Box;
import contractnet.region.Interval;
import contractnet.region.Region;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-component deviation from the baseline contract after one iteration.
 *
 * <p>Every evolved box that is not identical to a baseline box is compared with the baseline box
 * of the same side that shares the most variables with it. Each moved bound counts once and adds
 * its absolute delta to the magnitude of its class.
 *
 * <p>A side that became empty has no evolved box to compare. Every interval of every baseline box
 * then collapses: both of its bounds count as strengthening and move inward to the midpoint, so
 * the interval contributes its width to the magnitude.
 */
public record DeviationRecord(
    int iteration,
    String component,
    Map<DeviationClass, Integer> counts,
    Map<DeviationClass, Double> magnitudes) {

  public DeviationRecord {
    Objects.requireNonNull(component, "component");
    counts = complete(counts, 0);
    magnitudes = complete(magnitudes, 0.0);
  }

  public static DeviationRecord compute(
      int iteration, String component, Contract baseline, Contract current) {
    Map<DeviationClass, Integer> counts = new EnumMap<>(DeviationClass.class);
    Map<DeviationClass, Double> magnitudes = new EnumMap<>(DeviationClass.class);
    accumulate(true, baseline.assumption(), current.assumption(), counts, magnitudes);
    accumulate(false, baseline.guarantee(), current.guarantee(), counts, magnitudes);
    return new DeviationRecord(iteration, component, counts, magnitudes);
  }

  private static void accumulate(
      boolean assumptionSide,
      Region baseline,
      Region evolved,
      Map<DeviationClass, Integer> counts,
      Map<DeviationClass, Double> magnitudes) {
    if (baseline.isEmpty()) {
      return;
    }
    if (evolved.isEmpty()) {
      collapse(assumptionSide, baseline, counts, magnitudes);
      return;
    }
    for (Box box : evolved.boxes()) {
      if (baseline.boxes().contains(box)) {
        continue;
      }
      List<BoundDelta> deltas = Box.deviation(closest(baseline, box), box);
      for (BoundDelta delta : deltas) {
        DeviationClass type = DeviationClass.of(assumptionSide, delta.isRelaxation());
        counts.merge(type, 1, Integer::sum);
        magnitudes.merge(type, delta.magnitude(), Double::sum);
      }
    }
  }

  private static void collapse(
      boolean assumptionSide,
      Region baseline,
      Map<DeviationClass, Integer> counts,
      Map<DeviationClass, Double> magnitudes) {
    DeviationClass type = DeviationClass.of(assumptionSide, false);
    for (Box box : baseline.boxes()) {
      for (Interval interval : box.intervals().values()) {
        counts.merge(type, 2, Integer::sum);
        magnitudes.merge(type, interval.width(), Double::sum);
      }
    }
  }

  private static Box closest(Region baseline, Box evolved) {
    Box best = baseline.boxes().get(0);
    int bestShared = -1;
    for (Box candidate : baseline.boxes()) {
      int shared = 0;
      for (String variable : candidate.variables()) {
        if (evolved.declares(variable)) {
          shared++;
        }
      }
      if (shared > bestShared) {
        best = candidate;
        bestShared = shared;
      }
    }
    return best;
  }

  private static <T> Map<DeviationClass, T> complete(Map<DeviationClass, T> source, T zero) {
    Map<DeviationClass, T> full = new EnumMap<>(DeviationClass.class);
    for (DeviationClass type : DeviationClass.values()) {
      T value = source == null ? null : source.get(type);
      full.put(type, value == null ? zero : value);
    }
    return Collections.unmodifiableMap(full);
  }

  public int count(DeviationClass type) {
    return counts.get(type);
  }

  public double magnitude(DeviationClass type) {
    return magnitudes.get(type);
  }

  public int totalCount() {
    return counts.values().stream().mapToInt(Integer::intValue).sum();
  }

  public double totalMagnitude() {
    return magnitudes.values().stream().mapToDouble(Double::doubleValue).sum();
  }

  public boolean isEmpty() {
    return totalCount() == 0;
  }
}
