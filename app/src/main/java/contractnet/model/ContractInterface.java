package contractnet.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/** Directed edge: the supplier writes the shared variables, the consumer reads them. */
public record ContractInterface(String supplier, String consumer, List<String> variables) {

  public ContractInterface {
    Objects.requireNonNull(supplier, "supplier");
    Objects.requireNonNull(consumer, "consumer");
    Objects.requireNonNull(variables, "variables");
    if (supplier.equals(consumer)) {
      throw new IllegalArgumentException("Interface must connect two different components");
    }
    variables = List.copyOf(new TreeSet<>(variables));
    if (variables.isEmpty()) {
      throw new IllegalArgumentException(
          "Interface " + supplier + " → " + consumer + " shares no variables");
    }
  }

  public static ContractInterface of(String supplier, String consumer, String... variables) {
    return new ContractInterface(supplier, consumer, List.of(variables));
  }

  public static ContractInterface of(
      String supplier, String consumer, Collection<String> variables) {
    return new ContractInterface(supplier, consumer, List.copyOf(variables));
  }

  public String label() {
    return supplier + " → " + consumer;
  }

  @Override
  public String toString() {
    return "Interface(" + label() + ", vars=" + variables + ")";
  }
}
