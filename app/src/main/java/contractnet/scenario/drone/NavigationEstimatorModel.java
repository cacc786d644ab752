package contractnet.scenario.drone;

import contractnet.milp.MilpProblem;
import contractnet.model.BehaviorModel;
import java.util.List;

/**
 * Navigation estimator whose accuracy degrades in discrete tiers.
 *
 * <p>Tier {@code k} is forced once motor current reaches {@code 4 + 2k} A or the power mode
 * reaches {@code k / 3}; higher tiers widen the position error and drift bands. The position
 * error never drops below half the control error.
 */
public final class NavigationEstimatorModel implements BehaviorModel {
  static final int TIERS = 10;
  static final double CURRENT_BASE = 4.0;
  static final double CURRENT_STEP = 2.0;
  static final double MODE_STEP = 1.0 / 3.0;
  static final double POSITION_BASE = 0.5;
  static final double POSITION_WIDTH = 2.5;
  static final double POSITION_STEP = 0.8;
  static final double DRIFT_WIDTH = 0.5;
  static final double DRIFT_STEP = 0.15;

  @Override
  public void contribute(MilpProblem.Builder problem) {
    String controlError = DroneVariables.CONTROL_ERROR;
    String motorCurrent = DroneVariables.MOTOR_CURRENT;
    String mode = DroneVariables.POWER_MODE;
    String position = DroneVariables.NAV_POSITION_ERROR;
    String drift = DroneVariables.NAV_DRIFT;

    List<String> tiers = DroneConstraints.exactlyOne(problem, "nav_tier", TIERS);
    String level = problem.integer("nav_tier_level", 0.0, TIERS - 1);
    DroneConstraints.encodesIndex(problem, level, tiers);

    for (int k = 0; k < TIERS; k++) {
      double currentThreshold = CURRENT_BASE + CURRENT_STEP * k;
      String byCurrent = problem.binary("nav_current_trigger_" + k);
      DroneConstraints.atLeastWhen(
          problem, "nav_current_trigger_" + k + "_on", motorCurrent, currentThreshold, byCurrent);
      problem
          .constrain("nav_current_trigger_" + k + "_off")
          .term(motorCurrent)
          .term(-DroneConstraints.BIG_M, byCurrent)
          .atMost(currentThreshold);

      double modeThreshold = MODE_STEP * k;
      String byMode = problem.binary("nav_mode_trigger_" + k);
      DroneConstraints.atLeastWhen(
          problem, "nav_mode_trigger_" + k + "_on", mode, modeThreshold, byMode);
      problem
          .constrain("nav_mode_trigger_" + k + "_off")
          .term(mode)
          .term(-DroneConstraints.BIG_M, byMode)
          .atMost(modeThreshold);

      String triggered = problem.binary("nav_trigger_" + k);
      problem
          .constrain("nav_trigger_" + k + "_current")
          .term(triggered)
          .term(-1.0, byCurrent)
          .atLeast(0.0);
      problem
          .constrain("nav_trigger_" + k + "_mode")
          .term(triggered)
          .term(-1.0, byMode)
          .atLeast(0.0);
      problem
          .constrain("nav_trigger_" + k + "_either")
          .term(triggered)
          .term(-1.0, byCurrent)
          .term(-1.0, byMode)
          .atMost(0.0);
      DroneConstraints.atLeastWhen(problem, "nav_tier_floor_" + k, level, k, triggered);

      double positionLow = POSITION_BASE + POSITION_STEP * k;
      double driftLow = DRIFT_STEP * k;
      String tier = tiers.get(k);
      DroneConstraints.atLeastWhen(
          problem, "nav_position_" + k + "_low", position, positionLow, tier);
      DroneConstraints.atMostWhen(
          problem, "nav_position_" + k + "_high", position, positionLow + POSITION_WIDTH, tier);
      DroneConstraints.atLeastWhen(problem, "nav_drift_" + k + "_low", drift, driftLow, tier);
      DroneConstraints.atMostWhen(
          problem, "nav_drift_" + k + "_high", drift, driftLow + DRIFT_WIDTH, tier);
    }

    problem.constrain("nav_control_floor").term(position).term(-0.5, controlError).atLeast(0.0);
    DroneConstraints.between(problem, position, 0.0, 50.0);
    DroneConstraints.between(problem, drift, 0.0, 10.0);
  }

  @Override
  public String describe() {
    return "navigation estimator: " + TIERS + " accuracy tiers";
  }
}
