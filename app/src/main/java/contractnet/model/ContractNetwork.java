package contractnet.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed graph of components connected by contract interfaces.
 *
 * <p>Components keep insertion order and interfaces keep declaration order; every traversal the
 * engine performs follows these orders so runs are reproducible.
 */
public final class ContractNetwork {
  private final Map<String, Component> components;
  private final Map<String, Contract> baselines;
  private final List<ContractInterface> interfaces;

  private ContractNetwork(
      Map<String, Component> components,
      Map<String, Contract> baselines,
      List<ContractInterface> interfaces) {
    this.components = components;
    this.baselines = baselines;
    this.interfaces = interfaces;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Component> components() {
    return List.copyOf(components.values());
  }

  public List<String> componentNames() {
    return List.copyOf(components.keySet());
  }

  public boolean hasComponent(String name) {
    return components.containsKey(name);
  }

  public Component component(String name) {
    Component component = components.get(name);
    if (component == null) {
      throw new IllegalArgumentException("Unknown component " + name);
    }
    return component;
  }

  public Contract baseline(String name) {
    component(name);
    return baselines.get(name);
  }

  public List<ContractInterface> interfaces() {
    return interfaces;
  }

  public List<ContractInterface> incoming(String consumer) {
    return interfaces.stream().filter(i -> i.consumer().equals(consumer)).toList();
  }

  public List<ContractInterface> outgoing(String supplier) {
    return interfaces.stream().filter(i -> i.supplier().equals(supplier)).toList();
  }

  public List<String> suppliersOf(String consumer) {
    return incoming(consumer).stream().map(ContractInterface::supplier).toList();
  }

  public List<String> consumersOf(String supplier) {
    return outgoing(supplier).stream().map(ContractInterface::consumer).toList();
  }

  /**
   * Strongly connected components by Tarjan's algorithm. Each group is sorted by name; groups are
   * ordered largest first, ties broken by their first name.
   */
  public List<List<String>> stronglyConnectedComponents() {
    Tarjan tarjan = new Tarjan();
    for (String name : components.keySet()) {
      if (!tarjan.index.containsKey(name)) {
        tarjan.connect(name);
      }
    }
    List<List<String>> groups = new ArrayList<>(tarjan.groups);
    groups.sort(
        Comparator.<List<String>>comparingInt(g -> -g.size()).thenComparing(g -> g.get(0)));
    return List.copyOf(groups);
  }

  /** Strongly connected components with at least two members. */
  public List<List<String>> cycles() {
    return stronglyConnectedComponents().stream().filter(g -> g.size() >= 2).toList();
  }

  public boolean hasCycle() {
    return !cycles().isEmpty();
  }

  public String describe() {
    StringBuilder out = new StringBuilder();
    out.append("Contract network with ").append(components.size()).append(" components:\n");
    for (Component component : components.values()) {
      out.append("  ").append(component.name()).append('\n');
      out.append("    inputs: ").append(component.inputNames()).append('\n');
      out.append("    outputs: ").append(component.outputNames()).append('\n');
      out.append("    suppliers: ").append(suppliersOf(component.name())).append('\n');
      out.append("    consumers: ").append(consumersOf(component.name())).append('\n');
    }
    out.append("Interfaces (").append(interfaces.size()).append("):\n");
    for (ContractInterface edge : interfaces) {
      out.append("  ").append(edge).append('\n');
    }
    List<List<String>> cycles = cycles();
    if (cycles.isEmpty()) {
      out.append("No cycles detected.\n");
    } else {
      out.append("Cycles (").append(cycles.size()).append("):\n");
      for (List<String> cycle : cycles) {
        out.append("  ")
            .append(String.join(" → ", cycle))
            .append(" → ")
            .append(cycle.get(0))
            .append('\n');
      }
    }
    return out.toString();
  }

  @Override
  public String toString() {
    return "ContractNetwork("
        + components.size()
        + " components, "
        + interfaces.size()
        + " interfaces)";
  }

  private final class Tarjan {
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowlink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<List<String>> groups = new ArrayList<>();
    private int counter;

    private void connect(String node) {
      index.put(node, counter);
      lowlink.put(node, counter);
      counter++;
      stack.push(node);
      onStack.add(node);

      for (String consumer : consumersOf(node)) {
        if (!index.containsKey(consumer)) {
          connect(consumer);
          lowlink.put(node, Math.min(lowlink.get(node), lowlink.get(consumer)));
        } else if (onStack.contains(consumer)) {
          lowlink.put(node, Math.min(lowlink.get(node), index.get(consumer)));
        }
      }

      if (lowlink.get(node).equals(index.get(node))) {
        List<String> group = new ArrayList<>();
        String member;
        do {
          member = stack.pop();
          onStack.remove(member);
          group.add(member);
        } while (!member.equals(node));
        Collections.sort(group);
        groups.add(List.copyOf(group));
      }
    }
  }

  /** Validating builder; components must be added before the interfaces that use them. */
  public static final class Builder {
    private final Map<String, Component> components = new LinkedHashMap<>();
    private final Map<String, Contract> baselines = new LinkedHashMap<>();
    private final List<ContractInterface> interfaces = new ArrayList<>();

    private Builder() {}

    public Builder component(Component component, Contract baseline) {
      Objects.requireNonNull(component, "component");
      Objects.requireNonNull(baseline, "baseline");
      if (components.putIfAbsent(component.name(), component) != null) {
        throw new IllegalArgumentException("Duplicate component " + component.name());
      }
      baselines.put(component.name(), baseline);
      return this;
    }

    public Builder connect(String supplier, String consumer, String... variables) {
      return connect(ContractInterface.of(supplier, consumer, variables));
    }

    public Builder connect(ContractInterface edge) {
      Objects.requireNonNull(edge, "edge");
      Component supplier = components.get(edge.supplier());
      if (supplier == null) {
        throw new IllegalArgumentException(
            "Supplier component '" + edge.supplier() + "' not found");
      }
      Component consumer = components.get(edge.consumer());
      if (consumer == null) {
        throw new IllegalArgumentException(
            "Consumer component '" + edge.consumer() + "' not found");
      }
      for (String variable : edge.variables()) {
        if (!supplier.hasOutput(variable)) {
          throw new IllegalArgumentException(
              variable + " is not an output of supplier " + supplier.name());
        }
        if (!consumer.hasInput(variable)) {
          throw new IllegalArgumentException(
              variable + " is not an input of consumer " + consumer.name());
        }
      }
      if (interfaces.contains(edge)) {
        throw new IllegalArgumentException("Duplicate interface " + edge);
      }
      interfaces.add(edge);
      return this;
    }

    public ContractNetwork build() {
      if (components.isEmpty()) {
        throw new IllegalStateException("Network has no components");
      }
      return new ContractNetwork(
          Collections.unmodifiableMap(new LinkedHashMap<>(components)),
          Collections.unmodifiableMap(new LinkedHashMap<>(baselines)),
          List.copyOf(interfaces));
    }
  }
}
