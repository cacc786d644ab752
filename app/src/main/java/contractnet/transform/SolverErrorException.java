package contractnet.transform;

/** The solver failed independently of the model. */
public final class SolverErrorException extends MilpTransformException {
  private static final long serialVersionUID = 1L;

  public SolverErrorException(FailureReport report) {
    super(report);
  }
}
