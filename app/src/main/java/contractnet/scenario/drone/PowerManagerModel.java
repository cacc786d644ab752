package contractnet.scenario.drone;

import contractnet.milp.MilpProblem;
import contractnet.model.BehaviorModel;
import java.util.List;

/**
 * Power manager: bus voltage is the battery voltage minus the harness drop caused by motor
 * current. The voltage margin above 10.2 V selects the power mode; a thinner margin selects a
 * more conservative mode.
 */
public final class PowerManagerModel implements BehaviorModel {
  static final double HARNESS_RESISTANCE = 0.08;
  static final double AUXILIARY_CURRENT = 2.0;
  static final double MIN_BUS_VOLTAGE = 10.2;

  @Override
  public void contribute(MilpProblem.Builder problem) {
    String motorCurrent = DroneVariables.MOTOR_CURRENT;
    String batteryVoltage = DroneVariables.BATTERY_VOLTAGE;
    String batteryCurrent = DroneVariables.BATTERY_CURRENT;
    String available = DroneVariables.VOLTAGE_AVAILABLE;
    String margin = DroneVariables.VOLTAGE_MARGIN;
    String mode = DroneVariables.POWER_MODE;

    problem
        .constrain("pm_bus_voltage")
        .term(available)
        .term(-1.0, batteryVoltage)
        .term(HARNESS_RESISTANCE, motorCurrent)
        .equalTo(0.0);
    problem
        .constrain("pm_battery_load")
        .term(batteryCurrent)
        .term(-1.0, motorCurrent)
        .atLeast(AUXILIARY_CURRENT);
    problem.constrain("pm_margin").term(margin).term(-1.0, available).equalTo(-MIN_BUS_VOLTAGE);

    List<String> modes = DroneConstraints.exactlyOne(problem, "pm_mode", 4);
    DroneConstraints.encodesIndex(problem, mode, modes);
    DroneConstraints.atLeastWhen(problem, "pm_mode_0_low", margin, 0.6, modes.get(0));
    DroneConstraints.atLeastWhen(problem, "pm_mode_1_low", margin, 0.3, modes.get(1));
    DroneConstraints.atMostWhen(problem, "pm_mode_1_high", margin, 0.6, modes.get(1));
    DroneConstraints.atLeastWhen(problem, "pm_mode_2_low", margin, 0.1, modes.get(2));
    DroneConstraints.atMostWhen(problem, "pm_mode_2_high", margin, 0.3, modes.get(2));
    DroneConstraints.atMostWhen(problem, "pm_mode_3_high", margin, 0.1, modes.get(3));

    DroneConstraints.between(problem, available, 9.0, 12.6);
    DroneConstraints.between(problem, margin, -1.2, 2.4);
    DroneConstraints.between(problem, mode, 0.0, 3.0);
  }

  @Override
  public String describe() {
    return "power manager: margin-selected power modes";
  }
}
