package contractnet.scenario;

import contractnet.model.Contract;
import contractnet.model.ContractNetwork;
import contractnet.model.Deviation;
import java.util.Objects;
import java.util.Optional;

/**
 * Input of one evolution run: the baseline network and the deviation injected before the first
 * iteration.
 *
 * @param systemContract required system-level contract, or {@code null} when none is checked
 * @param minIterationsExpected lower bound on iterations the scenario is expected to need
 */
public record Scenario(
    String name,
    String description,
    ContractNetwork network,
    Deviation deviation,
    Contract systemContract,
    int minIterationsExpected) {

  public Scenario {
    Objects.requireNonNull(name, "name");
    description = description == null ? "" : description;
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(deviation, "deviation");
    if (!network.hasComponent(deviation.component())) {
      throw new IllegalArgumentException(
          "Deviation targets unknown component " + deviation.component());
    }
    minIterationsExpected = Math.max(1, minIterationsExpected);
  }

  public static Scenario of(String name, ContractNetwork network, Deviation deviation) {
    return new Scenario(name, "", network, deviation, null, 1);
  }

  public String targetComponent() {
    return deviation.component();
  }

  public Optional<Contract> systemLevelContract() {
    return Optional.ofNullable(systemContract);
  }
}
