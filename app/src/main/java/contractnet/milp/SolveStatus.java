package contractnet.milp;

/** Terminal status reported by a solver for one problem. */
public enum SolveStatus {
  OPTIMAL,
  INFEASIBLE,
  UNBOUNDED,
  TIMEOUT,
  ERROR,
  /** A feasible point was found but optimality was not proven. */
  SUBOPTIMAL;

  public boolean isOptimal() {
    return this == OPTIMAL;
  }
}
