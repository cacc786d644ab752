package contractnet.milp;

/**
 * Boundary to a MILP backend. Implementations solve one problem per call, block until done and
 * never throw for model-level outcomes: infeasibility, unboundedness, time-outs and internal
 * errors are all reported through the returned {@link SolverOutcome}.
 */
public interface MilpSolver {

  /** Human-readable backend name, recorded in failure reports. */
  String name();

  SolverOutcome solve(MilpProblem problem);
}
