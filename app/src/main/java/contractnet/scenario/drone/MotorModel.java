package contractnet.scenario.drone;

import static contractnet.scenario.drone.DroneConstraints.BIG_M;

import contractnet.milp.MilpProblem;
import contractnet.model.BehaviorModel;
import java.util.List;

/**
 * Motor with three voltage-dependent efficiency bands.
 *
 * <ul>
 *   <li>efficiency 1.0 at or above 11.5 V, 0.9 down to 10.5 V, 0.8 below
 *   <li>current between {@code 0.5 T + 2 d} and {@code 0.6 T + 2.5 d + 1}, d the voltage deficit
 *   <li>response time {@code 0.05 + 0.05 (12 - V) + 0.01 I}, plus up to 0.05 s jitter
 * </ul>
 */
public final class MotorModel implements BehaviorModel {
  static final double V_NOM = 12.0;
  static final double T_BASE_RESPONSE = 0.05;
  static final double K_VOLTAGE_RESPONSE = 0.05;
  static final double K_CURRENT_RESPONSE = 0.01;
  static final double[] BAND_THRESHOLDS = {11.5, 10.5, 0.0};
  static final double[] BAND_EFFICIENCY = {1.0, 0.9, 0.8};

  @Override
  public void contribute(MilpProblem.Builder problem) {
    String command = DroneVariables.THRUST_COMMAND;
    String voltage = DroneVariables.VOLTAGE_AVAILABLE;
    String thrust = DroneVariables.MOTOR_THRUST;
    String current = DroneVariables.MOTOR_CURRENT;
    String response = DroneVariables.MOTOR_RESPONSE_TIME;

    List<String> bands = DroneConstraints.exactlyOne(problem, "motor_band", 3);
    DroneConstraints.atLeastWhen(problem, "motor_band_0_low", voltage, 11.5, bands.get(0));
    DroneConstraints.atLeastWhen(problem, "motor_band_1_low", voltage, 10.5, bands.get(1));
    DroneConstraints.atMostWhen(problem, "motor_band_1_high", voltage, 11.5, bands.get(1));
    DroneConstraints.atMostWhen(problem, "motor_band_2_high", voltage, 10.5, bands.get(2));

    for (int i = 0; i < bands.size(); i++) {
      double eta = BAND_EFFICIENCY[i];
      problem
          .constrain("motor_thrust_band_" + i + "_max")
          .term(thrust)
          .term(-eta, command)
          .term(BIG_M, bands.get(i))
          .atMost(BIG_M);
      problem
          .constrain("motor_thrust_band_" + i + "_min")
          .term(thrust)
          .term(-eta, command)
          .term(-BIG_M, bands.get(i))
          .atLeast(-BIG_M);
    }

    String deficit = problem.continuous("motor_voltage_deficit", 0.0, Double.POSITIVE_INFINITY);
    problem.constrain("motor_deficit").term(deficit).term(voltage).atLeast(V_NOM);

    problem
        .constrain("motor_current_min")
        .term(current)
        .term(-0.5, thrust)
        .term(-2.0, deficit)
        .atLeast(0.0);
    problem
        .constrain("motor_current_max")
        .term(current)
        .term(-0.6, thrust)
        .term(-2.5, deficit)
        .atMost(1.0);

    double responseOffset = T_BASE_RESPONSE + K_VOLTAGE_RESPONSE * V_NOM;
    problem
        .constrain("motor_response_min")
        .term(response)
        .term(K_VOLTAGE_RESPONSE, voltage)
        .term(-K_CURRENT_RESPONSE, current)
        .atLeast(responseOffset);
    problem
        .constrain("motor_response_max")
        .term(response)
        .term(K_VOLTAGE_RESPONSE, voltage)
        .term(-K_CURRENT_RESPONSE, current)
        .atMost(responseOffset + 0.05);

    DroneConstraints.between(problem, command, 0.0, 100.0);
    DroneConstraints.between(problem, voltage, 8.0, 13.0);
    DroneConstraints.between(problem, thrust, 0.0, 100.0);
    DroneConstraints.between(problem, current, 0.0, 50.0);
    DroneConstraints.between(problem, response, 0.01, 3.0);
  }

  @Override
  public String describe() {
    return "motor: 3 efficiency bands";
  }
}
