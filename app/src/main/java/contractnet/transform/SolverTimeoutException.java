package contractnet.transform;

/** The solver hit its time limit before proving optimality. */
public final class SolverTimeoutException extends MilpTransformException {
  private static final long serialVersionUID = 1L;

  public SolverTimeoutException(FailureReport report) {
    super(report);
  }
}
