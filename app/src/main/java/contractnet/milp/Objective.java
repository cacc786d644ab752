package contractnet.milp;

import java.util.Objects;

/** Single-variable objective. */
public record Objective(String variable, Direction direction) {

  public Objective {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(direction, "direction");
  }

  public static Objective minimize(String variable) {
    return new Objective(variable, Direction.MINIMIZE);
  }

  public static Objective maximize(String variable) {
    return new Objective(variable, Direction.MAXIMIZE);
  }

  @Override
  public String toString() {
    return direction.label() + " " + variable;
  }
}
