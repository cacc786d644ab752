package contractnet.region;

import java.util.Objects;

/** One moved bound between a baseline box and an evolved box. */
public record BoundDelta(String variable, Bound bound, double baseline, double evolved) {

  public BoundDelta {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(bound, "bound");
  }

  public double signedDelta() {
    return evolved - baseline;
  }

  public double magnitude() {
    return Math.abs(evolved - baseline);
  }

  /** Outward movement: a lower bound decreased or an upper bound increased. */
  public boolean isRelaxation() {
    return bound == Bound.LOWER ? evolved < baseline : evolved > baseline;
  }

  public boolean isStrengthening() {
    return !isRelaxation() && evolved != baseline;
  }

  public enum Bound {
    LOWER,
    UPPER
  }
}
