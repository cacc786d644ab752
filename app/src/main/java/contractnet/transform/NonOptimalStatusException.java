package contractnet.transform;

/** Catch-all for statuses that are neither optimal nor covered by a specific kind. */
public final class NonOptimalStatusException extends MilpTransformException {
  private static final long serialVersionUID = 1L;

  public NonOptimalStatusException(FailureReport report) {
    super(report);
  }
}
