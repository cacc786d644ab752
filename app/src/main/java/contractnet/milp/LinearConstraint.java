package contractnet.milp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Named linear constraint {@code sum(coefficient * variable) relation rhs}. */
public record LinearConstraint(
    String name, Map<String, Double> coefficients, Relation relation, double rhs) {

  public LinearConstraint {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(relation, "relation");
    Objects.requireNonNull(coefficients, "coefficients");
    if (coefficients.isEmpty()) {
      throw new IllegalArgumentException("Constraint " + name + " has no terms");
    }
    coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
  }

  @Override
  public String toString() {
    StringBuilder lhs = new StringBuilder();
    for (Map.Entry<String, Double> term : coefficients.entrySet()) {
      double coefficient = term.getValue();
      if (lhs.length() > 0) {
        lhs.append(coefficient < 0 ? " - " : " + ");
      } else if (coefficient < 0) {
        lhs.append("-");
      }
      double magnitude = Math.abs(coefficient);
      if (magnitude != 1.0) {
        lhs.append(String.format(Locale.ROOT, "%s ", magnitude));
      }
      lhs.append(term.getKey());
    }
    return String.format(Locale.ROOT, "%s: %s %s %s", name, lhs, relation.symbol(), rhs);
  }
}
