package contractnet.scenario.drone;

import contractnet.milp.MilpProblem;
import contractnet.model.BehaviorModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Battery with a piecewise-linear open-circuit voltage over state of charge, an internal
 * resistance drop and a current cap per power mode.
 *
 * <p>The voltage curve uses the lambda formulation: one convex weight per breakpoint, and only
 * the two endpoints of the selected segment may carry weight.
 */
public final class BatteryModel implements BehaviorModel {
  static final double INTERNAL_RESISTANCE = 0.06;
  static final double[] SOC_BREAKPOINTS = {20.0, 40.0, 60.0, 80.0, 100.0};
  static final double[] OCV_BREAKPOINTS = {10.8, 11.1, 11.4, 12.0, 12.6};
  /** Maximum discharge current per power mode, in amperes. */
  static final double[] MODE_CURRENT_CAP = {40.0, 30.0, 22.0, 15.0};

  @Override
  public void contribute(MilpProblem.Builder problem) {
    String mode = DroneVariables.POWER_MODE;
    String voltage = DroneVariables.BATTERY_VOLTAGE;
    String current = DroneVariables.BATTERY_CURRENT;
    String soc = DroneVariables.BATTERY_SOC;

    DroneConstraints.between(problem, soc, 20.0, 100.0);
    DroneConstraints.between(problem, current, 0.0, 40.0);

    int points = SOC_BREAKPOINTS.length;
    List<String> segments = DroneConstraints.exactlyOne(problem, "bat_segment", points - 1);
    List<String> weights = new ArrayList<>(points);
    MilpProblem.ConstraintBuilder convex = problem.constrain("bat_weights_sum");
    for (int i = 0; i < points; i++) {
      String weight = problem.continuous("bat_weight_" + i, 0.0, 1.0);
      weights.add(weight);
      convex.term(weight);
    }
    convex.equalTo(1.0);
    for (int i = 0; i < points; i++) {
      MilpProblem.ConstraintBuilder adjacency =
          problem.constrain("bat_weight_" + i + "_segment").term(weights.get(i));
      if (i > 0) {
        adjacency.term(-1.0, segments.get(i - 1));
      }
      if (i < points - 1) {
        adjacency.term(-1.0, segments.get(i));
      }
      adjacency.atMost(0.0);
    }

    String openCircuit = problem.continuous("bat_open_circuit_voltage", 10.8, 12.6);
    MilpProblem.ConstraintBuilder socCurve = problem.constrain("bat_soc_curve").term(soc);
    MilpProblem.ConstraintBuilder ocvCurve =
        problem.constrain("bat_ocv_curve").term(openCircuit);
    for (int i = 0; i < points; i++) {
      socCurve.term(-SOC_BREAKPOINTS[i], weights.get(i));
      ocvCurve.term(-OCV_BREAKPOINTS[i], weights.get(i));
    }
    socCurve.equalTo(0.0);
    ocvCurve.equalTo(0.0);

    problem
        .constrain("bat_terminal_voltage")
        .term(voltage)
        .term(-1.0, openCircuit)
        .term(INTERNAL_RESISTANCE, current)
        .equalTo(0.0);

    List<String> modes = DroneConstraints.exactlyOne(problem, "bat_mode", MODE_CURRENT_CAP.length);
    DroneConstraints.encodesIndex(problem, mode, modes);
    for (int i = 0; i < modes.size(); i++) {
      DroneConstraints.atMostWhen(
          problem, "bat_current_cap_" + i, current, MODE_CURRENT_CAP[i], modes.get(i));
    }

    DroneConstraints.between(problem, mode, 0.0, 3.0);
    DroneConstraints.between(problem, voltage, 9.5, 12.6);
  }

  @Override
  public String describe() {
    return "battery: piecewise-linear OCV, per-mode current caps";
  }
}
