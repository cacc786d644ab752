package contractnet.transform;

import contractnet.milp.SolveStatus;

/** Fail-fast taxonomy of non-optimal solver outcomes. */
public enum FailureKind {
  INFEASIBLE_MODEL("InfeasibleModel"),
  UNBOUNDED_OBJECTIVE("UnboundedObjective"),
  SOLVER_ERROR("SolverError"),
  SOLVER_TIMEOUT("SolverTimeout"),
  NON_OPTIMAL_STATUS("NonOptimalStatus");

  private final String label;

  FailureKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static FailureKind fromStatus(SolveStatus status) {
    return switch (status) {
      case INFEASIBLE -> INFEASIBLE_MODEL;
      case UNBOUNDED -> UNBOUNDED_OBJECTIVE;
      case ERROR -> SOLVER_ERROR;
      case TIMEOUT -> SOLVER_TIMEOUT;
      case SUBOPTIMAL -> NON_OPTIMAL_STATUS;
      case OPTIMAL -> throw new IllegalArgumentException("OPTIMAL is not a failure status");
    };
  }
}
