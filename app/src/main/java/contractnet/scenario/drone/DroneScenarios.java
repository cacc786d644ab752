package contractnet.scenario.drone;

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

import contractnet.model.Contract;
import contractnet.model.Deviation;
import contractnet.region.Box;
import contractnet.region.Region;
import contractnet.scenario.Scenario;

/** Deviation scenarios on the drone network. */
public final class DroneScenarios {

  private DroneScenarios() {}

  /** Worn motor: a disjoint high-current mode and a low-voltage band appear in its contract. */
  public static Scenario motorDegradation() {
    Region assumption =
        Region.of(
            motorAssumption(0.0, 20.0, 10.0, 12.6), motorAssumption(0.0, 15.0, 9.5, 10.5));
    Region guarantee =
        Region.of(
            motorGuarantee(0.0, 18.0, 0.0, 12.0, 0.08, 0.6),
            motorGuarantee(10.0, 18.0, 8.0, 15.0, 0.3, 0.8),
            motorGuarantee(0.0, 12.0, 0.0, 8.0, 0.2, 1.0));
    Contract system =
        new Contract(
            Region.empty(),
            Region.of(
                Box.builder()
                    .bound(CONTROL_ERROR, 0.0, 10.0)
                    .bound(NAV_POSITION_ERROR, 0.0, 8.0)
                    .bound(MOTOR_RESPONSE_TIME, 0.0, 0.5)
                    .build()));
    return new Scenario(
        "MotorDegradation",
        "Motor wear: reduced thrust, slower response and a high-current mode under low voltage",
        DroneNetwork.create(),
        new Deviation(
            DroneNetwork.MOTOR, assumption, guarantee, null, "degraded motor contract"),
        system,
        5);
  }

  /** Stronger motor: narrower, faster guarantees on a higher-voltage assumption. */
  public static Scenario motorUpgrade() {
    Contract upgraded =
        Contract.of(
            motorAssumption(5.0, 25.0, 11.5, 12.6),
            motorGuarantee(5.0, 25.0, 2.0, 12.0, 0.08, 0.35));
    Contract system =
        new Contract(
            Region.empty(),
            Region.of(
                Box.builder()
                    .bound(CONTROL_ERROR, 0.0, 15.0)
                    .bound(NAV_POSITION_ERROR, 0.0, 8.0)
                    .bound(MOTOR_RESPONSE_TIME, 0.0, 0.4)
                    .bound(BATTERY_VOLTAGE, 11.0, 12.6)
                    .build()));
    return new Scenario(
        "MotorUpgrade",
        "Motor upgrade: higher thrust floor and faster response on a healthy bus",
        DroneNetwork.create(),
        Deviation.ofContract(DroneNetwork.MOTOR, upgraded, "upgraded motor contract"),
        system,
        3);
  }

  /** Navigation degradation with three accuracy levels. */
  public static Scenario navDriftIncrease() {
    Region assumption =
        Region.of(
            Box.builder()
                .bound(CONTROL_ERROR, 0.0, 15.0)
                .bound(MOTOR_CURRENT, 0.0, 15.0)
                .bound(POWER_MODE, 0.0, 1.0)
                .build());
    Region guarantee =
        Region.of(
            navGuarantee(0.5, 8.0, 0.0, 1.5),
            navGuarantee(5.0, 12.0, 0.8, 2.5),
            navGuarantee(8.0, 15.0, 1.5, 3.5));
    Contract system =
        new Contract(
            Region.empty(),
            Region.of(
                Box.builder()
                    .bound(NAV_POSITION_ERROR, 0.0, 12.0)
                    .bound(CONTROL_ERROR, 0.0, 20.0)
                    .bound(NAV_DRIFT, 0.0, 3.0)
                    .bound(MOTOR_CURRENT, 0.0, 18.0)
                    .bound(POWER_MODE, 0.0, 2.0)
                    .build()));
    return new Scenario(
        "NavDriftIncrease",
        "Navigation drift: position error and drift widen over three accuracy levels",
        DroneNetwork.create(),
        new Deviation(
            DroneNetwork.NAVIGATION, assumption, guarantee, null, "drifting navigation"),
        system,
        5);
  }

  private static Box motorAssumption(
      double commandLow, double commandHigh, double voltageLow, double voltageHigh) {
    return Box.builder()
        .bound(THRUST_COMMAND, commandLow, commandHigh)
        .bound(VOLTAGE_AVAILABLE, voltageLow, voltageHigh)
        .build();
  }

  private static Box motorGuarantee(
      double thrustLow,
      double thrustHigh,
      double currentLow,
      double currentHigh,
      double responseLow,
      double responseHigh) {
    return Box.builder()
        .bound(MOTOR_THRUST, thrustLow, thrustHigh)
        .bound(MOTOR_CURRENT, currentLow, currentHigh)
        .bound(MOTOR_RESPONSE_TIME, responseLow, responseHigh)
        .build();
  }

  private static Box navGuarantee(
      double positionLow, double positionHigh, double driftLow, double driftHigh) {
    return Box.builder()
        .bound(NAV_POSITION_ERROR, positionLow, positionHigh)
        .bound(NAV_DRIFT, driftLow, driftHigh)
        .build();
  }
}
