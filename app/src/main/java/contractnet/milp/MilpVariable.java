package contractnet.milp;

import java.util.Locale;
import java.util.Objects;

/** Decision variable; infinite bounds mean the side is free. */
public record MilpVariable(String name, double lower, double upper, VariableType type) {

  public MilpVariable {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (Double.isNaN(lower) || Double.isNaN(upper)) {
      throw new IllegalArgumentException("Bounds of " + name + " must not be NaN");
    }
    if (lower > upper) {
      throw new IllegalArgumentException(
          "Variable " + name + " has lower bound " + lower + " above upper bound " + upper);
    }
    if (type == VariableType.BINARY) {
      lower = Math.max(lower, 0.0);
      upper = Math.min(upper, 1.0);
    }
  }

  public static MilpVariable free(String name) {
    return new MilpVariable(
        name, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, VariableType.CONTINUOUS);
  }

  public boolean hasLower() {
    return lower != Double.NEGATIVE_INFINITY;
  }

  public boolean hasUpper() {
    return upper != Double.POSITIVE_INFINITY;
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "%s ∈ [%s, %s] (%s)",
        name,
        hasLower() ? Double.toString(lower) : "-∞",
        hasUpper() ? Double.toString(upper) : "+∞",
        type.name().toLowerCase(Locale.ROOT));
  }
}
