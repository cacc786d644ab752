package contractnet.transform;

import java.util.Objects;

/**
 * Raised when a transformer solve does not end in a proven optimum. The transformer produces no
 * value in that case; the report describes the exact solve that failed.
 */
public abstract class MilpTransformException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient FailureReport report;

  protected MilpTransformException(FailureReport report) {
    super(Objects.requireNonNull(report, "report").message());
    this.report = report;
  }

  public FailureReport report() {
    return report;
  }

  public FailureKind kind() {
    return report.kind();
  }

  public static MilpTransformException of(FailureReport report) {
    return switch (report.kind()) {
      case INFEASIBLE_MODEL -> new InfeasibleModelException(report);
      case UNBOUNDED_OBJECTIVE -> new UnboundedObjectiveException(report);
      case SOLVER_ERROR -> new SolverErrorException(report);
      case SOLVER_TIMEOUT -> new SolverTimeoutException(report);
      case NON_OPTIMAL_STATUS -> new NonOptimalStatusException(report);
    };
  }
}
