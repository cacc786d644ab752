package contractnet.milp;

import java.util.Objects;

/**
 * Result of one solve. Only an {@link SolveStatus#OPTIMAL} outcome carries an objective value.
 *
 * @param detail solver-specific status text, for diagnostics only
 */
public record SolverOutcome(SolveStatus status, double objectiveValue, String detail) {

  public SolverOutcome {
    Objects.requireNonNull(status, "status");
    detail = detail == null ? status.name() : detail;
    if (status.isOptimal() && !Double.isFinite(objectiveValue)) {
      throw new IllegalArgumentException("Optimal outcome needs a finite objective value");
    }
  }

  public static SolverOutcome optimal(double value) {
    return new SolverOutcome(SolveStatus.OPTIMAL, value, "OPTIMAL");
  }

  public static SolverOutcome failed(SolveStatus status, String detail) {
    if (status.isOptimal()) {
      throw new IllegalArgumentException("Use optimal(value) for optimal outcomes");
    }
    return new SolverOutcome(status, Double.NaN, detail);
  }

  public boolean isOptimal() {
    return status.isOptimal();
  }

  /** Objective value of an optimal outcome. */
  public double value() {
    if (!status.isOptimal()) {
      throw new IllegalStateException("No objective value for status " + status);
    }
    return objectiveValue;
  }
}
