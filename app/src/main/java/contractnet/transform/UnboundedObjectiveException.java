package contractnet.transform;

/** The objective is unbounded; a model constraint is missing. */
public final class UnboundedObjectiveException extends MilpTransformException {
  private static final long serialVersionUID = 1L;

  public UnboundedObjectiveException(FailureReport report) {
    super(report);
  }
}
