package contractnet.transform;

import contractnet.milp.Direction;
import contractnet.milp.MilpProblem;
import contractnet.milp.SolveStatus;
import contractnet.model.ContractInterface;
import contractnet.region.Box;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything known about the first non-optimal solve of a run.
 *
 * @param input the box that was being transformed; its bounds are part of {@code problem}
 * @param edge interface being propagated, or {@code null}
 * @param iteration fixpoint iteration, or {@code null} outside a run
 */
public record FailureReport(
    String component,
    TransformerKind transformer,
    String variable,
    Direction direction,
    SolveStatus status,
    String solverName,
    String solverDetail,
    MilpProblem problem,
    Box input,
    ContractInterface edge,
    Integer iteration) {

  public FailureReport {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(transformer, "transformer");
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(solverName, "solverName");
    Objects.requireNonNull(problem, "problem");
    Objects.requireNonNull(input, "input");
    solverDetail = solverDetail == null ? status.name() : solverDetail;
    if (status.isOptimal()) {
      throw new IllegalArgumentException("An optimal solve is not a failure");
    }
  }

  public FailureKind kind() {
    return FailureKind.fromStatus(status);
  }

  /** One-line summary. */
  public String message() {
    List<String> parts = new ArrayList<>();
    parts.add("MILP optimization failed in " + component + "." + transformer.label() + "()");
    parts.add("Variable: " + variable + " (" + direction.label() + ")");
    parts.add("Solver: " + solverName);
    parts.add("Status: " + status + " [" + kind().label() + "]");
    if (iteration != null) {
      parts.add("Iteration: " + iteration);
    }
    if (edge != null) {
      parts.add("Edge: " + edge.label());
    }
    return String.join(" | ", parts);
  }

  public String formatReport() {
    String rule = "=".repeat(80);
    StringBuilder out = new StringBuilder();
    out.append(rule).append('\n');
    out.append("MILP TRANSFORMER FAILURE\n");
    out.append(rule).append('\n');
    out.append("Component:      ").append(component).append('\n');
    out.append("Transformer:    ").append(transformer.label()).append('\n');
    out.append("Variable:       ").append(variable).append('\n');
    out.append("Direction:      ").append(direction.label()).append('\n');
    out.append("Failure kind:   ").append(kind().label()).append('\n');
    out.append("Solver:         ").append(solverName).append('\n');
    out.append("Solver status:  ").append(status).append(" (").append(solverDetail).append(")\n");
    if (iteration != null) {
      out.append("Iteration:      ").append(iteration).append('\n');
    }
    if (edge != null) {
      out.append("Edge:           ").append(edge.label()).append('\n');
      out.append("Interface vars: ").append(edge.variables()).append('\n');
    }
    out.append(transformer == TransformerKind.POST ? "Input region:   " : "Output region:  ");
    out.append(input).append('\n');
    out.append("-".repeat(80)).append('\n');
    out.append(problem.describe());
    out.append(rule).append('\n');
    return out.toString();
  }
}
