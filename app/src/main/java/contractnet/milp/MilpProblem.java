package contractnet.milp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mixed-integer linear program: variables, linear constraints and one objective.
 *
 * <p>Problems are assembled with {@link #builder(String)}. A builder can emit several problems
 * that share variables and constraints but differ in their objective, which is how the min and
 * max solve of one transformer call are produced.
 */
public final class MilpProblem {
  private final String name;
  private final Map<String, MilpVariable> variables;
  private final List<LinearConstraint> constraints;
  private final Objective objective;

  private MilpProblem(
      String name,
      Map<String, MilpVariable> variables,
      List<LinearConstraint> constraints,
      Objective objective) {
    this.name = name;
    this.variables = variables;
    this.constraints = constraints;
    this.objective = objective;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public List<MilpVariable> variables() {
    return List.copyOf(variables.values());
  }

  public MilpVariable variable(String variableName) {
    MilpVariable variable = variables.get(variableName);
    if (variable == null) {
      throw new IllegalArgumentException("Unknown MILP variable " + variableName);
    }
    return variable;
  }

  public List<LinearConstraint> constraints() {
    return constraints;
  }

  public Objective objective() {
    return objective;
  }

  public boolean hasIntegralVariables() {
    return variables.values().stream().anyMatch(v -> v.type().isIntegral());
  }

  /** Multi-line dump of the whole problem, used in failure reports. */
  public String describe() {
    StringBuilder out = new StringBuilder();
    out.append("Problem: ").append(name).append('\n');
    out.append("Objective: ").append(objective).append('\n');
    out.append("Variables (").append(variables.size()).append("):\n");
    for (MilpVariable variable : variables.values()) {
      out.append("  ").append(variable).append('\n');
    }
    out.append("Constraints (").append(constraints.size()).append("):\n");
    for (LinearConstraint constraint : constraints) {
      out.append("  ").append(constraint).append('\n');
    }
    return out.toString();
  }

  @Override
  public String toString() {
    return "MilpProblem("
        + name
        + ", "
        + variables.size()
        + " variables, "
        + constraints.size()
        + " constraints, "
        + objective
        + ")";
  }

  /** Mutable assembly of a problem. */
  public static final class Builder {
    private final String name;
    private final Map<String, MilpVariable> variables = new LinkedHashMap<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
      return name;
    }

    public boolean hasVariable(String variableName) {
      return variables.containsKey(variableName);
    }

    public String addVariable(MilpVariable variable) {
      Objects.requireNonNull(variable, "variable");
      if (variables.putIfAbsent(variable.name(), variable) != null) {
        throw new IllegalArgumentException("Duplicate MILP variable " + variable.name());
      }
      return variable.name();
    }

    public String continuous(String variableName) {
      return addVariable(MilpVariable.free(variableName));
    }

    public String continuous(String variableName, double lower, double upper) {
      return addVariable(new MilpVariable(variableName, lower, upper, VariableType.CONTINUOUS));
    }

    public String integer(String variableName, double lower, double upper) {
      return addVariable(new MilpVariable(variableName, lower, upper, VariableType.INTEGER));
    }

    public String binary(String variableName) {
      return addVariable(new MilpVariable(variableName, 0.0, 1.0, VariableType.BINARY));
    }

    /** Starts a named constraint; it is added once a relation method is called. */
    public ConstraintBuilder constrain(String constraintName) {
      return new ConstraintBuilder(this, constraintName);
    }

    public Builder add(LinearConstraint constraint) {
      Objects.requireNonNull(constraint, "constraint");
      for (String variable : constraint.coefficients().keySet()) {
        if (!variables.containsKey(variable)) {
          throw new IllegalArgumentException(
              "Constraint " + constraint.name() + " references unknown variable " + variable);
        }
      }
      constraints.add(constraint);
      return this;
    }

    public MilpProblem build(Objective objective) {
      Objects.requireNonNull(objective, "objective");
      if (!variables.containsKey(objective.variable())) {
        throw new IllegalArgumentException(
            "Objective references unknown variable " + objective.variable());
      }
      return new MilpProblem(
          name,
          Collections.unmodifiableMap(new LinkedHashMap<>(variables)),
          List.copyOf(constraints),
          objective);
    }
  }

  /** Fluent term accumulation for one constraint. */
  public static final class ConstraintBuilder {
    private final Builder owner;
    private final String name;
    private final Map<String, Double> coefficients = new LinkedHashMap<>();

    private ConstraintBuilder(Builder owner, String name) {
      this.owner = owner;
      this.name = Objects.requireNonNull(name, "constraint name");
    }

    public ConstraintBuilder term(double coefficient, String variable) {
      Objects.requireNonNull(variable, "variable");
      coefficients.merge(variable, coefficient, Double::sum);
      return this;
    }

    public ConstraintBuilder term(String variable) {
      return term(1.0, variable);
    }

    public Builder atMost(double rhs) {
      return finish(Relation.LESS_OR_EQUAL, rhs);
    }

    public Builder atLeast(double rhs) {
      return finish(Relation.GREATER_OR_EQUAL, rhs);
    }

    public Builder equalTo(double rhs) {
      return finish(Relation.EQUAL, rhs);
    }

    private Builder finish(Relation relation, double rhs) {
      coefficients.values().removeIf(c -> c == 0.0);
      return owner.add(new LinearConstraint(name, coefficients, relation, rhs));
    }
  }
}
