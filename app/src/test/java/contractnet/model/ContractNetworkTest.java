package contractnet.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import contractnet.region.Box;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ContractNetworkTest {

  private static Component node(String name, List<String> inputs, List<String> outputs) {
    return new Component(
        name,
        inputs.stream().map(v -> Variable.continuous(v, "")).toList(),
        outputs.stream().map(v -> Variable.continuous(v, "")).toList(),
        BehaviorModel.unconstrained());
  }

  private static Contract open() {
    return Contract.of(Box.unconstrained(), Box.unconstrained());
  }

  /** A ⇄ B cycle feeding C. */
  private static ContractNetwork loopWithTail() {
    return ContractNetwork.builder()
        .component(node("A", List.of("b"), List.of("a")), open())
        .component(node("B", List.of("a"), List.of("b", "c")), open())
        .component(node("C", List.of("c"), List.of()), open())
        .connect("A", "B", "a")
        .connect("B", "A", "b")
        .connect("B", "C", "c")
        .build();
  }

  @Test
  void tarjanGroupsTheLoopAndLeavesTheTailAlone() {
    ContractNetwork network = loopWithTail();
    assertEquals(List.of(List.of("A", "B"), List.of("C")), network.stronglyConnectedComponents());
    assertEquals(List.of(List.of("A", "B")), network.cycles());
    assertTrue(network.hasCycle());
  }

  @Test
  void chainHasNoCycle() {
    ContractNetwork chain =
        ContractNetwork.builder()
            .component(node("A", List.of(), List.of("a")), open())
            .component(node("B", List.of("a"), List.of()), open())
            .connect("A", "B", "a")
            .build();
    assertFalse(chain.hasCycle());
    assertTrue(chain.describe().contains("No cycles detected."));
  }

  @Test
  void neighbourQueriesFollowDeclarationOrder() {
    ContractNetwork network = loopWithTail();
    assertEquals(List.of("A", "C"), network.consumersOf("B"));
    assertEquals(List.of("B"), network.suppliersOf("A"));
    assertEquals(2, network.outgoing("B").size());
    assertEquals(List.of("A", "B", "C"), network.componentNames());
  }

  @Test
  void interfaceVariablesMustBeSupplierOutputsAndConsumerInputs() {
    ContractNetwork.Builder builder =
        ContractNetwork.builder()
            .component(node("A", List.of(), List.of("a")), open())
            .component(node("B", List.of("a"), List.of("x")), open());
    assertThrows(IllegalArgumentException.class, () -> builder.connect("B", "A", "x"));
    assertThrows(IllegalArgumentException.class, () -> builder.connect("A", "B", "x"));
    assertThrows(IllegalArgumentException.class, () -> builder.connect("A", "Z", "a"));
    builder.connect("A", "B", "a");
    assertThrows(IllegalArgumentException.class, () -> builder.connect("A", "B", "a"));
  }

  @Test
  void rejectsDuplicateComponentsAndEmptyNetworks() {
    ContractNetwork.Builder builder =
        ContractNetwork.builder().component(node("A", List.of(), List.of("a")), open());
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.component(node("A", List.of(), List.of("b")), open()));
    assertThrows(IllegalStateException.class, () -> ContractNetwork.builder().build());
  }

  @Test
  void interfaceRejectsSelfLoopsAndEmptyVariableSets() {
    assertThrows(IllegalArgumentException.class, () -> ContractInterface.of("A", "A", "a"));
    assertThrows(IllegalArgumentException.class, () -> ContractInterface.of("A", "B"));
    assertEquals("A → B", ContractInterface.of("A", "B", "y", "x").label());
    assertEquals(List.of("x", "y"), ContractInterface.of("A", "B", "y", "x").variables());
  }

  @Test
  void componentRejectsVariablesDeclaredTwice() {
    assertThrows(
        IllegalArgumentException.class, () -> node("A", List.of("a"), List.of("a")));
  }
}
