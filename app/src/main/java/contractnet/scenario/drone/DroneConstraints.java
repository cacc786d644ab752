package contractnet.scenario.drone;

import contractnet.milp.MilpProblem;
import java.util.ArrayList;
import java.util.List;

/** Constraint idioms shared by the drone behavior models. */
final class DroneConstraints {
  /** Big-M used for every indicator constraint of the drone models. */
  static final double BIG_M = 1000.0;

  private DroneConstraints() {}

  static void between(MilpProblem.Builder problem, String variable, double lower, double upper) {
    problem.constrain(variable + "_lower_bound").term(variable).atLeast(lower);
    problem.constrain(variable + "_upper_bound").term(variable).atMost(upper);
  }

  /** Declares {@code count} binaries named {@code prefix_i}, exactly one of which is set. */
  static List<String> exactlyOne(MilpProblem.Builder problem, String prefix, int count) {
    List<String> selectors = new ArrayList<>(count);
    MilpProblem.ConstraintBuilder sum = problem.constrain(prefix + "_one");
    for (int i = 0; i < count; i++) {
      String selector = problem.binary(prefix + "_" + i);
      selectors.add(selector);
      sum.term(selector);
    }
    sum.equalTo(1.0);
    return selectors;
  }

  /** {@code variable = sum(i * selector_i)}: ties a discrete mode value to its selectors. */
  static void encodesIndex(MilpProblem.Builder problem, String variable, List<String> selectors) {
    MilpProblem.ConstraintBuilder link = problem.constrain(variable + "_index").term(variable);
    for (int i = 1; i < selectors.size(); i++) {
      link.term(-i, selectors.get(i));
    }
    link.equalTo(0.0);
  }

  /** {@code variable >= bound} whenever {@code indicator} is set. */
  static void atLeastWhen(
      MilpProblem.Builder problem, String name, String variable, double bound, String indicator) {
    problem.constrain(name).term(variable).term(-BIG_M, indicator).atLeast(bound - BIG_M);
  }

  /** {@code variable <= bound} whenever {@code indicator} is set. */
  static void atMostWhen(
      MilpProblem.Builder problem, String name, String variable, double bound, String indicator) {
    problem.constrain(name).term(variable).term(BIG_M, indicator).atMost(bound + BIG_M);
  }
}
