package contractnet.model;

import java.util.Objects;

/** Named scalar shared through contracts; identified by name. */
public record Variable(String name, VariableDomain domain, String unit) {

  public Variable {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Variable name must not be blank");
    }
    domain = domain == null ? VariableDomain.CONTINUOUS : domain;
    unit = unit == null ? "" : unit;
  }

  public static Variable continuous(String name, String unit) {
    return new Variable(name, VariableDomain.CONTINUOUS, unit);
  }

  public static Variable integer(String name, String unit) {
    return new Variable(name, VariableDomain.INTEGER, unit);
  }

  @Override
  public String toString() {
    return unit.isEmpty() ? name : name + " [" + unit + "]";
  }
}
