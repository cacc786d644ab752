package contractnet.engine;

/** Terminal state of a run. */
public enum EvolutionOutcome {
  /** An iteration left every contract unchanged. */
  CONVERGED,
  /** The iteration cap was reached without a fixpoint. */
  NON_CONVERGENCE,
  /** A transformer solve was not optimal; the result carries the failure report. */
  FAILED,
  /** Some component ended an iteration with an empty assumption or guarantee. */
  INFEASIBLE_CONTRACT;

  public boolean isSuccess() {
    return this == CONVERGED;
  }
}
