package contractnet.scenario.drone;

import contractnet.milp.MilpProblem;
import contractnet.model.BehaviorModel;
import java.util.List;

/**
 * Flight controller: thrust demand proportional to the navigation error, capped by the authority
 * of the current power mode. Control error grows with navigation error, motor lag, unmet demand
 * and thrust tracking error.
 */
public final class FlightControllerModel implements BehaviorModel {
  static final double K_DEMAND = 2.0;
  static final double K_RESPONSE = 5.0;
  static final double K_SLACK = 0.2;
  static final double K_TRACKING = 0.3;
  /** Thrust authority per power mode, in percent. */
  static final double[] MODE_AUTHORITY = {100.0, 85.0, 65.0, 45.0};

  @Override
  public void contribute(MilpProblem.Builder problem) {
    String command = DroneVariables.THRUST_COMMAND;
    String controlError = DroneVariables.CONTROL_ERROR;
    String thrust = DroneVariables.MOTOR_THRUST;
    String response = DroneVariables.MOTOR_RESPONSE_TIME;
    String navError = DroneVariables.NAV_POSITION_ERROR;
    String mode = DroneVariables.POWER_MODE;

    String demand = problem.continuous("fc_demand", 0.0, 200.0);
    problem.constrain("fc_demand_law").term(demand).term(-K_DEMAND, navError).equalTo(0.0);

    List<String> modes = DroneConstraints.exactlyOne(problem, "fc_mode", MODE_AUTHORITY.length);
    DroneConstraints.encodesIndex(problem, mode, modes);
    for (int i = 0; i < modes.size(); i++) {
      DroneConstraints.atMostWhen(
          problem, "fc_authority_" + i, command, MODE_AUTHORITY[i], modes.get(i));
    }
    problem.constrain("fc_command_demand").term(command).term(-1.0, demand).atMost(0.0);
    problem.constrain("fc_command_nonnegative").term(command).atLeast(0.0);

    String slack = problem.continuous("fc_demand_slack", 0.0, Double.POSITIVE_INFINITY);
    problem.constrain("fc_slack").term(slack).term(-1.0, demand).term(command).atLeast(0.0);

    String tracking = problem.continuous("fc_tracking_error", 0.0, Double.POSITIVE_INFINITY);
    problem
        .constrain("fc_tracking_over")
        .term(tracking)
        .term(-1.0, command)
        .term(thrust)
        .atLeast(0.0);
    problem
        .constrain("fc_tracking_under")
        .term(tracking)
        .term(command)
        .term(-1.0, thrust)
        .atLeast(0.0);

    DroneConstraints.between(problem, thrust, 0.0, 100.0);
    DroneConstraints.between(problem, response, 0.0, 2.0);
    DroneConstraints.between(problem, navError, 0.0, 50.0);

    problem
        .constrain("fc_control_error_min")
        .term(controlError)
        .term(-1.0, navError)
        .term(-K_RESPONSE, response)
        .term(-K_SLACK, slack)
        .term(-K_TRACKING, tracking)
        .atLeast(0.0);
    problem
        .constrain("fc_control_error_max")
        .term(controlError)
        .term(-1.0, navError)
        .term(-K_RESPONSE, response)
        .term(-K_SLACK, slack)
        .term(-K_TRACKING, tracking)
        .atMost(0.5);

    DroneConstraints.between(problem, command, 0.0, 100.0);
    DroneConstraints.between(problem, controlError, 0.0, 100.0);
  }

  @Override
  public String describe() {
    return "flight controller: 4 power-mode authority caps";
  }
}
