package contractnet.scenario.drone;

import static contractnet.scenario.drone.DroneVariables.BATTERY_CURRENT;
import static contractnet.scenario.drone.DroneVariables.BATTERY_SOC;
import static contractnet.scenario.drone.DroneVariables.BATTERY_VOLTAGE;
import static contractnet.scenario.drone.DroneVariables.CONTROL_ERROR;
import static contractnet.scenario.drone.DroneVariables.MOTOR_CURRENT;
import static contractnet.scenario.drone.DroneVariables.MOTOR_RESPONSE_TIME;
import static contractnet.scenario.drone.DroneVariables.MOTOR_THRUST;
import static contractnet.scenario.drone.DroneVariables.NAV_DRIFT;
import static contractnet.scenario.drone.DroneVariables.NAV_POSITION_ERROR;
import static contractnet.scenario.drone.DroneVariables.POWER_MODE;
import static contractnet.scenario.drone.DroneVariables.THRUST_COMMAND;
import static contractnet.scenario.drone.DroneVariables.VOLTAGE_AVAILABLE;
import static contractnet.scenario.drone.DroneVariables.VOLTAGE_MARGIN;

import contractnet.model.Component;
import contractnet.model.Contract;
import contractnet.model.ContractNetwork;
import contractnet.region.Box;
import java.util.List;

/** Five-component drone: flight controller, motor, power manager, battery and navigation. */
public final class DroneNetwork {
  public static final String FLIGHT_CONTROLLER = "FlightController";
  public static final String MOTOR = "Motor";
  public static final String POWER_MANAGER = "PowerManager";
  public static final String BATTERY = "Battery";
  public static final String NAVIGATION = "NavigationEstimator";

  private DroneNetwork() {}

  public static ContractNetwork create() {
    return ContractNetwork.builder()
        .component(flightController(), flightControllerBaseline())
        .component(motor(), motorBaseline())
        .component(powerManager(), powerManagerBaseline())
        .component(battery(), batteryBaseline())
        .component(navigation(), navigationBaseline())
        .connect(FLIGHT_CONTROLLER, MOTOR, THRUST_COMMAND)
        .connect(MOTOR, FLIGHT_CONTROLLER, MOTOR_THRUST, MOTOR_RESPONSE_TIME)
        .connect(MOTOR, POWER_MANAGER, MOTOR_CURRENT)
        .connect(POWER_MANAGER, MOTOR, VOLTAGE_AVAILABLE)
        .connect(POWER_MANAGER, FLIGHT_CONTROLLER, POWER_MODE)
        .connect(BATTERY, POWER_MANAGER, BATTERY_VOLTAGE, BATTERY_CURRENT)
        .connect(POWER_MANAGER, BATTERY, POWER_MODE)
        .connect(NAVIGATION, FLIGHT_CONTROLLER, NAV_POSITION_ERROR)
        .connect(FLIGHT_CONTROLLER, NAVIGATION, CONTROL_ERROR)
        .connect(MOTOR, NAVIGATION, MOTOR_CURRENT)
        .connect(POWER_MANAGER, NAVIGATION, POWER_MODE)
        .build();
  }

  static Component flightController() {
    return new Component(
        FLIGHT_CONTROLLER,
        List.of(
            DroneVariables.motorThrust(),
            DroneVariables.motorResponseTime(),
            DroneVariables.navPositionError(),
            DroneVariables.powerMode()),
        List.of(DroneVariables.thrustCommand(), DroneVariables.controlError()),
        new FlightControllerModel());
  }

  static Contract flightControllerBaseline() {
    return Contract.of(
        Box.builder()
            .bound(MOTOR_THRUST, 0.0, 25.0)
            .bound(MOTOR_RESPONSE_TIME, 0.05, 0.5)
            .bound(NAV_POSITION_ERROR, 0.5, 5.0)
            .bound(POWER_MODE, 0.0, 1.0)
            .build(),
        Box.builder().bound(THRUST_COMMAND, 0.0, 30.0).bound(CONTROL_ERROR, 0.0, 15.0).build());
  }

  static Component motor() {
    return new Component(
        MOTOR,
        List.of(DroneVariables.thrustCommand(), DroneVariables.voltageAvailable()),
        List.of(
            DroneVariables.motorThrust(),
            DroneVariables.motorCurrent(),
            DroneVariables.motorResponseTime()),
        new MotorModel());
  }

  static Contract motorBaseline() {
    return Contract.of(
        Box.builder().bound(THRUST_COMMAND, 0.0, 30.0).bound(VOLTAGE_AVAILABLE, 10.5, 12.6).build(),
        Box.builder()
            .bound(MOTOR_THRUST, 0.0, 25.0)
            .bound(MOTOR_CURRENT, 0.0, 15.0)
            .bound(MOTOR_RESPONSE_TIME, 0.05, 0.5)
            .build());
  }

  static Component powerManager() {
    return new Component(
        POWER_MANAGER,
        List.of(
            DroneVariables.motorCurrent(),
            DroneVariables.batteryVoltage(),
            DroneVariables.batteryCurrent()),
        List.of(
            DroneVariables.voltageAvailable(),
            DroneVariables.powerMode(),
            DroneVariables.voltageMargin()),
        new PowerManagerModel());
  }

  static Contract powerManagerBaseline() {
    return Contract.of(
        Box.builder()
            .bound(MOTOR_CURRENT, 0.0, 15.0)
            .bound(BATTERY_VOLTAGE, 11.5, 12.6)
            .bound(BATTERY_CURRENT, 0.0, 30.0)
            .build(),
        Box.builder()
            .bound(VOLTAGE_AVAILABLE, 10.5, 12.6)
            .bound(POWER_MODE, 0.0, 1.0)
            .bound(VOLTAGE_MARGIN, 0.3, 2.4)
            .build());
  }

  static Component battery() {
    return new Component(
        BATTERY,
        List.of(DroneVariables.powerMode()),
        List.of(
            DroneVariables.batteryVoltage(),
            DroneVariables.batteryCurrent(),
            DroneVariables.batterySoc()),
        new BatteryModel());
  }

  static Contract batteryBaseline() {
    return Contract.of(
        Box.builder().bound(POWER_MODE, 0.0, 1.0).build(),
        Box.builder()
            .bound(BATTERY_VOLTAGE, 11.5, 12.6)
            .bound(BATTERY_CURRENT, 0.0, 30.0)
            .bound(BATTERY_SOC, 60.0, 100.0)
            .build());
  }

  static Component navigation() {
    return new Component(
        NAVIGATION,
        List.of(
            DroneVariables.controlError(),
            DroneVariables.motorCurrent(),
            DroneVariables.powerMode()),
        List.of(DroneVariables.navPositionError(), DroneVariables.navDrift()),
        new NavigationEstimatorModel());
  }

  static Contract navigationBaseline() {
    return Contract.of(
        Box.builder()
            .bound(CONTROL_ERROR, 0.0, 15.0)
            .bound(MOTOR_CURRENT, 0.0, 15.0)
            .bound(POWER_MODE, 0.0, 1.0)
            .build(),
        Box.builder().bound(NAV_POSITION_ERROR, 0.5, 6.0).bound(NAV_DRIFT, 0.0, 1.0).build());
  }
}
