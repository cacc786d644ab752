package contractnet.milp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

final class MilpProblemTest {

  private static MilpProblem.Builder sample() {
    MilpProblem.Builder builder = MilpProblem.builder("sample");
    builder.continuous("x", 0.0, 5.0);
    builder.continuous("y");
    builder.constrain("link").term(2.0, "x").term(-1.0, "y").equalTo(0.0);
    return builder;
  }

  @Test
  void builderEmitsOneProblemPerObjective() {
    MilpProblem.Builder builder = sample();
    MilpProblem min = builder.build(Objective.minimize("y"));
    MilpProblem max = builder.build(Objective.maximize("y"));
    assertEquals(min.constraints(), max.constraints());
    assertEquals(Direction.MINIMIZE, min.objective().direction());
    assertEquals(Direction.MAXIMIZE, max.objective().direction());
  }

  @Test
  void builtProblemIsUnaffectedByLaterAdditions() {
    MilpProblem.Builder builder = sample();
    MilpProblem first = builder.build(Objective.minimize("y"));
    builder.constrain("cap").term("y").atMost(4.0);
    assertEquals(1, first.constraints().size());
    assertEquals(2, builder.build(Objective.minimize("y")).constraints().size());
  }

  @Test
  void repeatedTermsAreSummedAndZeroTermsDropped() {
    MilpProblem.Builder builder = sample();
    builder.constrain("folded").term("x").term(2.0, "x").term(1.0, "y").term(-1.0, "y").atLeast(1);
    LinearConstraint folded = builder.build(Objective.minimize("x")).constraints().get(1);
    assertEquals(Map.of("x", 3.0), folded.coefficients());
    assertEquals(Relation.GREATER_OR_EQUAL, folded.relation());
  }

  @Test
  void rejectsUnknownAndDuplicateVariables() {
    MilpProblem.Builder builder = sample();
    assertThrows(IllegalArgumentException.class, () -> builder.continuous("x"));
    assertThrows(
        IllegalArgumentException.class, () -> builder.constrain("bad").term("z").atMost(1.0));
    assertThrows(IllegalArgumentException.class, () -> builder.build(Objective.maximize("z")));
  }

  @Test
  void binaryVariablesAreClampedAndIntegral() {
    MilpProblem.Builder builder = MilpProblem.builder("flags");
    builder.binary("b");
    MilpProblem problem = builder.build(Objective.maximize("b"));
    MilpVariable b = problem.variable("b");
    assertEquals(0.0, b.lower());
    assertEquals(1.0, b.upper());
    assertTrue(problem.hasIntegralVariables());
    assertFalse(sample().build(Objective.minimize("x")).hasIntegralVariables());
  }

  @Test
  void describeListsEveryPart() {
    String text = sample().build(Objective.maximize("y")).describe();
    assertTrue(text.contains("Problem: sample"));
    assertTrue(text.contains("Objective: max y"), text);
    assertTrue(text.contains("link: 2.0 x - y = 0.0"), text);
    assertTrue(text.contains("y ∈ [-∞, +∞] (continuous)"), text);
  }
}
