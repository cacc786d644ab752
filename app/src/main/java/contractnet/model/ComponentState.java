package contractnet.model;

import contractnet.region.Region;
import java.util.Objects;

/**
 * Baseline and current contract of one component during a run.
 *
 * <p>The current contract changes only through {@link #evolve}, at most once per iteration.
 */
public final class ComponentState {
  private static final int NEVER = -1;

  private final String component;
  private final Contract baseline;
  private Contract current;
  private int lastEvolvedIteration = NEVER;

  public ComponentState(String component, Contract baseline, Contract initial) {
    this.component = Objects.requireNonNull(component, "component");
    this.baseline = Objects.requireNonNull(baseline, "baseline");
    this.current = Objects.requireNonNull(initial, "initial");
  }

  public static ComponentState atBaseline(String component, Contract baseline) {
    return new ComponentState(component, baseline, baseline);
  }

  public String component() {
    return component;
  }

  public Contract baseline() {
    return baseline;
  }

  public Contract current() {
    return current;
  }

  public Region assumption() {
    return current.assumption();
  }

  public Region guarantee() {
    return current.guarantee();
  }

  public int lastEvolvedIteration() {
    return lastEvolvedIteration;
  }

  /**
   * Replaces the current contract. Returns whether either side changed under box-set equality.
   *
   * @throws IllegalStateException if this state was already evolved in {@code iteration}
   */
  public boolean evolve(int iteration, Region assumption, Region guarantee) {
    if (iteration <= lastEvolvedIteration) {
      throw new IllegalStateException(
          component + " already evolved in iteration " + lastEvolvedIteration);
    }
    Contract next = new Contract(assumption, guarantee);
    lastEvolvedIteration = iteration;
    boolean changed = !next.equals(current);
    current = next;
    return changed;
  }

  @Override
  public String toString() {
    return component + ": " + current;
  }
}
