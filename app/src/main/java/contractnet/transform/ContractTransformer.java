package contractnet.transform;

import contractnet.milp.Direction;
import contractnet.milp.MilpProblem;
import contractnet.milp.MilpSolver;
import contractnet.milp.MilpVariable;
import contractnet.milp.Objective;
import contractnet.milp.SolveStatus;
import contractnet.milp.SolverOutcome;
import contractnet.milp.VariableType;
import contractnet.model.Component;
import contractnet.model.Variable;
import contractnet.model.VariableDomain;
import contractnet.region.Box;
import contractnet.region.Interval;
import contractnet.region.Region;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MILP-backed {@code post} and {@code pre} transformers.
 *
 * <p>For every box of the source region one problem is formulated: the component's behavior model
 * plus the box's bounds on each component variable it declares. Each requested variable is then
 * minimized and maximized; the two optima form that variable's interval in the result box. Any
 * outcome other than a proven optimum raises a {@link MilpTransformException} and the transformer
 * returns nothing.
 *
 * <p>A transformer built with {@link #reusingSolutions} answers a repeated (component, box,
 * variable) request from the interval it already solved; only proven optima are kept.
 */
public final class ContractTransformer {
  private static final Logger LOG = LoggerFactory.getLogger(ContractTransformer.class);

  /** Largest amount by which a maximum may fall below the minimum and still be read as equal. */
  static final double INVERSION_TOLERANCE = 1e-9;

  private final MilpSolver solver;
  private final Map<SolvedBound, Interval> solved;
  private long solveCount;

  public ContractTransformer(MilpSolver solver) {
    this(solver, false);
  }

  private ContractTransformer(MilpSolver solver, boolean reuseSolutions) {
    this.solver = Objects.requireNonNull(solver, "solver");
    this.solved = reuseSolutions ? new HashMap<>() : null;
  }

  /** Transformer that solves each (component, box, variable) request at most once. */
  public static ContractTransformer reusingSolutions(MilpSolver solver) {
    return new ContractTransformer(solver, true);
  }

  public MilpSolver solver() {
    return solver;
  }

  /** Number of solver calls issued so far. */
  public long solveCount() {
    return solveCount;
  }

  /** Image of {@code guarantee} on {@code variables} through the component's model. */
  public Region post(
      Component component, Region guarantee, List<String> variables, TransformContext context) {
    return transform(TransformerKind.POST, component, guarantee, variables, context);
  }

  /** Tight requirement on {@code variables} under which the component keeps {@code assumption}. */
  public Region pre(
      Component component, Region assumption, List<String> variables, TransformContext context) {
    return transform(TransformerKind.PRE, component, assumption, variables, context);
  }

  public Region transform(
      TransformerKind kind,
      Component component,
      Region source,
      List<String> variables,
      TransformContext context) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(context, "context");
    for (String variable : variables) {
      if (!component.declares(variable)) {
        throw new IllegalArgumentException(
            component.name() + " does not declare variable " + variable);
      }
    }
    List<Box> results = new ArrayList<>(source.size());
    for (Box box : source.boxes()) {
      results.add(transformBox(kind, component, box, variables, context));
    }
    Region result = Region.of(results);
    LOG.debug(
        "{}.{} over {} box(es) on {} -> {}",
        component.name(),
        kind.label(),
        source.size(),
        variables,
        result);
    return result;
  }

  /** One result box for one source box: min and max of every requested variable. */
  public Box transformBox(
      TransformerKind kind,
      Component component,
      Box box,
      List<String> variables,
      TransformContext context) {
    MilpProblem.Builder problem = null;
    Box.Builder result = Box.builder();
    for (String variable : variables) {
      SolvedBound key = new SolvedBound(component, box, variable);
      Interval interval = solved == null ? null : solved.get(key);
      if (interval == null) {
        if (problem == null) {
          problem = formulate(kind, component, box);
        }
        interval = solveInterval(kind, component, box, problem, variable, context);
        if (solved != null) {
          solved.put(key, interval);
        }
      }
      result.bound(variable, interval);
    }
    return result.build();
  }

  /** Component model constrained by the bounds {@code box} places on the component's variables. */
  public MilpProblem.Builder formulate(TransformerKind kind, Component component, Box box) {
    MilpProblem.Builder problem = MilpProblem.builder(component.name() + "/" + kind.label());
    for (Variable variable : component.variables()) {
      double lower = Double.NEGATIVE_INFINITY;
      double upper = Double.POSITIVE_INFINITY;
      if (box.declares(variable.name())) {
        Interval interval = box.interval(variable.name());
        lower = interval.lower();
        upper = interval.upper();
      }
      VariableType type =
          variable.domain() == VariableDomain.INTEGER
              ? VariableType.INTEGER
              : VariableType.CONTINUOUS;
      problem.addVariable(new MilpVariable(variable.name(), lower, upper, type));
    }
    component.model().contribute(problem);
    return problem;
  }

  private Interval solveInterval(
      TransformerKind kind,
      Component component,
      Box box,
      MilpProblem.Builder builder,
      String variable,
      TransformContext context) {
    double lower = optimize(kind, component, box, builder, variable, Direction.MINIMIZE, context);
    MilpProblem upperProblem = builder.build(new Objective(variable, Direction.MAXIMIZE));
    double upper = optimize(kind, component, box, upperProblem, context);
    if (upper >= lower) {
      return Interval.of(lower, upper);
    }
    if (lower - upper <= INVERSION_TOLERANCE) {
      // point interval reported with solver round-off
      return Interval.point(lower);
    }
    throw fail(
        kind,
        component,
        box,
        upperProblem,
        SolveStatus.ERROR,
        "maximum " + upper + " of " + variable + " lies below its minimum " + lower,
        context);
  }

  private double optimize(
      TransformerKind kind,
      Component component,
      Box box,
      MilpProblem.Builder builder,
      String variable,
      Direction direction,
      TransformContext context) {
    return optimize(
        kind, component, box, builder.build(new Objective(variable, direction)), context);
  }

  private double optimize(
      TransformerKind kind,
      Component component,
      Box box,
      MilpProblem problem,
      TransformContext context) {
    solveCount++;
    SolverOutcome outcome = solver.solve(problem);
    if (outcome.isOptimal()) {
      return outcome.value();
    }
    throw fail(kind, component, box, problem, outcome.status(), outcome.detail(), context);
  }

  private MilpTransformException fail(
      TransformerKind kind,
      Component component,
      Box box,
      MilpProblem problem,
      SolveStatus status,
      String detail,
      TransformContext context) {
    Objective objective = problem.objective();
    FailureReport report =
        new FailureReport(
            component.name(),
            kind,
            objective.variable(),
            objective.direction(),
            status,
            solver.name(),
            detail,
            problem,
            box,
            context.edge(),
            context.iteration());
    LOG.error("{}", report.message());
    return MilpTransformException.of(report);
  }

  /** Key of one solved interval; components compare by value, models by identity. */
  private record SolvedBound(Component component, Box box, String variable) {}
}
