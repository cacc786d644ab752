package contractnet.model;

import contractnet.milp.MilpProblem;

/**
 * Linear or mixed-integer constraints relating a component's inputs and outputs.
 *
 * <p>Before {@link #contribute} is called the builder already declares one free MILP variable per
 * component variable, named after it. Implementations may declare auxiliary variables; their names
 * must not collide with component variables, so they are conventionally prefixed with the
 * component name.
 */
@FunctionalInterface
public interface BehaviorModel {

  void contribute(MilpProblem.Builder problem);

  /** Short human-readable name for logs and reports. */
  default String describe() {
    return getClass().getSimpleName();
  }

  /** Model without constraints: only contract bounds restrict the variables. */
  static BehaviorModel unconstrained() {
    return new BehaviorModel() {
      @Override
      public void contribute(MilpProblem.Builder problem) {}

      @Override
      public String describe() {
        return "unconstrained";
      }
    };
  }
}
