package contractnet.validation;

import contractnet.model.Contract;
import contractnet.model.ContractInterface;
import contractnet.model.ContractNetwork;
import contractnet.region.Region;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks that along every interface the consumer's assumption, projected on the interface
 * variables, covers the supplier's guarantee projected the same way.
 */
public final class WellFormednessChecker {
  private final ContractNetwork network;

  public WellFormednessChecker(ContractNetwork network) {
    this.network = Objects.requireNonNull(network, "network");
  }

  public ValidationResult check(Map<String, Contract> contracts) {
    List<String> violations = new ArrayList<>();
    for (ContractInterface edge : network.interfaces()) {
      Contract supplier = contracts.get(edge.supplier());
      Contract consumer = contracts.get(edge.consumer());
      if (supplier == null || consumer == null) {
        violations.add("Missing contract for " + edge.supplier() + " or " + edge.consumer());
        continue;
      }
      Region offered = supplier.guarantee().project(edge.variables());
      Region accepted = consumer.assumption().project(edge.variables());
      if (!accepted.covers(offered)) {
        violations.add(
            edge.label()
                + ": consumer assumption does not contain supplier guarantee on "
                + edge.variables());
      }
    }
    return violations.isEmpty()
        ? ValidationResult.pass("Network is well-formed")
        : ValidationResult.fail("Network is NOT well-formed", violations);
  }
}
