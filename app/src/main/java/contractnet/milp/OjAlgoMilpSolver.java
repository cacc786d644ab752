package contractnet.milp;

import contractnet.util.Timing;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link MilpSolver} backed by ojAlgo's {@link ExpressionsBasedModel}. */
public final class OjAlgoMilpSolver implements MilpSolver {
  private static final Logger LOG = LoggerFactory.getLogger(OjAlgoMilpSolver.class);
  public static final long DEFAULT_TIME_LIMIT_MS = 30_000L;

  private final long timeLimitMs;

  public OjAlgoMilpSolver() {
    this(DEFAULT_TIME_LIMIT_MS);
  }

  public OjAlgoMilpSolver(long timeLimitMs) {
    if (timeLimitMs <= 0) {
      throw new IllegalArgumentException("timeLimitMs must be positive");
    }
    this.timeLimitMs = timeLimitMs;
  }

  public long timeLimitMs() {
    return timeLimitMs;
  }

  @Override
  public String name() {
    return "ojAlgo";
  }

  @Override
  public SolverOutcome solve(MilpProblem problem) {
    ExpressionsBasedModel model = new ExpressionsBasedModel();
    model.options.time_abort = timeLimitMs;

    Map<String, Variable> handles = new HashMap<>();
    for (MilpVariable variable : problem.variables()) {
      Variable handle = model.addVariable(variable.name());
      if (variable.hasLower()) {
        handle.lower(BigDecimal.valueOf(variable.lower()));
      }
      if (variable.hasUpper()) {
        handle.upper(BigDecimal.valueOf(variable.upper()));
      }
      if (variable.type().isIntegral()) {
        handle.integer(true);
      }
      handles.put(variable.name(), handle);
    }

    // expressions are keyed by name in the model, so prefix with the position
    List<LinearConstraint> constraints = problem.constraints();
    for (int i = 0; i < constraints.size(); i++) {
      LinearConstraint constraint = constraints.get(i);
      Expression expression = model.addExpression(i + ":" + constraint.name());
      constraint
          .coefficients()
          .forEach((name, coefficient) -> expression.set(handles.get(name), coefficient));
      BigDecimal rhs = BigDecimal.valueOf(constraint.rhs());
      switch (constraint.relation()) {
        case LESS_OR_EQUAL -> expression.upper(rhs);
        case GREATER_OR_EQUAL -> expression.lower(rhs);
        case EQUAL -> expression.level(rhs);
      }
    }

    Objective objective = problem.objective();
    handles.get(objective.variable()).weight(BigDecimal.ONE);

    Timing timer = Timing.start();
    Optimisation.Result result;
    try {
      result =
          objective.direction() == Direction.MINIMIZE ? model.minimise() : model.maximise();
    } catch (RuntimeException ex) {
      LOG.warn("ojAlgo raised while solving {}: {}", problem.name(), ex.getMessage());
      return SolverOutcome.failed(SolveStatus.ERROR, ex.getClass().getSimpleName() + ": " + ex);
    }
    long elapsed = timer.elapsedMillis();
    Optimisation.State state = result.getState();
    LOG.debug("Solved {} ({}) in {} ms: {}", problem.name(), objective, elapsed, state);
    return translate(state, result.getValue(), elapsed >= timeLimitMs);
  }

  static SolverOutcome translate(Optimisation.State state, double value, boolean timeLimitHit) {
    String detail = "ojAlgo " + state;
    return switch (state) {
      case OPTIMAL, DISTINCT ->
          Double.isFinite(value)
              ? new SolverOutcome(SolveStatus.OPTIMAL, value, detail)
              : SolverOutcome.failed(SolveStatus.ERROR, detail + " with non-finite value");
      case INFEASIBLE, INVALID -> SolverOutcome.failed(SolveStatus.INFEASIBLE, detail);
      case UNBOUNDED -> SolverOutcome.failed(SolveStatus.UNBOUNDED, detail);
      case FEASIBLE, APPROXIMATE ->
          SolverOutcome.failed(timeLimitHit ? SolveStatus.TIMEOUT : SolveStatus.SUBOPTIMAL, detail);
      default -> SolverOutcome.failed(SolveStatus.ERROR, detail);
    };
  }
}
