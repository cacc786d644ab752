package contractnet.diagnostics;

import contractnet.model.ComponentState;
import contractnet.region.Region;
import java.util.Objects;

/** Full contract contents of one component after an iteration, with its deviation record. */
public record ComponentSnapshot(
    String component, Region assumption, Region guarantee, DeviationRecord deviation) {

  public ComponentSnapshot {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(assumption, "assumption");
    Objects.requireNonNull(guarantee, "guarantee");
    Objects.requireNonNull(deviation, "deviation");
  }

  public static ComponentSnapshot capture(int iteration, ComponentState state) {
    return new ComponentSnapshot(
        state.component(),
        state.assumption(),
        state.guarantee(),
        DeviationRecord.compute(iteration, state.component(), state.baseline(), state.current()));
  }
}
