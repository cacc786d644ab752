package contractnet.scenario;

import contractnet.scenario.drone.DroneScenarios;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/** Built-in scenarios by command-line name. */
public final class ScenarioCatalog {
  private static final Map<String, Supplier<Scenario>> SCENARIOS = new LinkedHashMap<>();

  static {
    SCENARIOS.put("motor_degradation", DroneScenarios::motorDegradation);
    SCENARIOS.put("motor_upgrade", DroneScenarios::motorUpgrade);
    SCENARIOS.put("nav_drift_increase", DroneScenarios::navDriftIncrease);
  }

  private ScenarioCatalog() {}

  public static Set<String> names() {
    return Collections.unmodifiableSet(SCENARIOS.keySet());
  }

  public static boolean contains(String name) {
    return SCENARIOS.containsKey(name);
  }

  /** Fresh scenario for {@code name}; each call builds a new network. */
  public static Scenario load(String name) {
    Supplier<Scenario> supplier = SCENARIOS.get(name);
    if (supplier == null) {
      throw new IllegalArgumentException(
          "Unknown scenario '" + name + "'. Available: " + SCENARIOS.keySet());
    }
    return supplier.get();
  }
}
