package contractnet.transform;

/** The formulated MILP has no feasible point. */
public final class InfeasibleModelException extends MilpTransformException {
  private static final long serialVersionUID = 1L;

  public InfeasibleModelException(FailureReport report) {
    super(report);
  }
}
