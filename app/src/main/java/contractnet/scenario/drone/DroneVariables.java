package contractnet.scenario.drone;

import contractnet.model.Variable;

/** Interface variables of the drone network. */
public final class DroneVariables {
  public static final String THRUST_COMMAND = "thrust_command";
  public static final String CONTROL_ERROR = "control_error";
  public static final String MOTOR_THRUST = "motor_thrust";
  public static final String MOTOR_CURRENT = "motor_current";
  public static final String MOTOR_RESPONSE_TIME = "motor_response_time";
  public static final String VOLTAGE_AVAILABLE = "voltage_available";
  public static final String VOLTAGE_MARGIN = "voltage_margin";
  public static final String POWER_MODE = "power_mode";
  public static final String BATTERY_VOLTAGE = "battery_voltage";
  public static final String BATTERY_CURRENT = "battery_current";
  public static final String BATTERY_SOC = "battery_soc";
  public static final String NAV_POSITION_ERROR = "nav_position_error";
  public static final String NAV_DRIFT = "nav_drift";

  private DroneVariables() {}

  static Variable thrustCommand() {
    return Variable.continuous(THRUST_COMMAND, "%");
  }

  static Variable controlError() {
    return Variable.continuous(CONTROL_ERROR, "m");
  }

  static Variable motorThrust() {
    return Variable.continuous(MOTOR_THRUST, "N");
  }

  static Variable motorCurrent() {
    return Variable.continuous(MOTOR_CURRENT, "A");
  }

  static Variable motorResponseTime() {
    return Variable.continuous(MOTOR_RESPONSE_TIME, "s");
  }

  static Variable voltageAvailable() {
    return Variable.continuous(VOLTAGE_AVAILABLE, "V");
  }

  static Variable voltageMargin() {
    return Variable.continuous(VOLTAGE_MARGIN, "V");
  }

  static Variable powerMode() {
    return Variable.integer(POWER_MODE, "");
  }

  static Variable batteryVoltage() {
    return Variable.continuous(BATTERY_VOLTAGE, "V");
  }

  static Variable batteryCurrent() {
    return Variable.continuous(BATTERY_CURRENT, "A");
  }

  static Variable batterySoc() {
    return Variable.continuous(BATTERY_SOC, "%");
  }

  static Variable navPositionError() {
    return Variable.continuous(NAV_POSITION_ERROR, "m");
  }

  static Variable navDrift() {
    return Variable.continuous(NAV_DRIFT, "m");
  }
}
