package contractnet.engine;

import contractnet.diagnostics.SnapshotRecorder;
import contractnet.model.Component;
import contractnet.model.ComponentState;
import contractnet.model.Contract;
import contractnet.model.ContractNetwork;
import contractnet.model.Deviation;
import contractnet.scenario.Scenario;
import contractnet.transform.ContractTransformer;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State of one run: the effective components (deviation applied), one {@link ComponentState} per
 * component, the transformer and the recorder. Nothing here is shared between runs.
 */
public final class EvolutionContext {
  private final Scenario scenario;
  private final EvolutionOptions options;
  private final ContractTransformer transformer;
  private final SnapshotRecorder recorder = new SnapshotRecorder();
  private final Map<String, Component> components = new LinkedHashMap<>();
  private final Map<String, ComponentState> states = new LinkedHashMap<>();
  private final Map<String, Contract> initialContracts = new LinkedHashMap<>();
  private int iteration = -1;

  private EvolutionContext(
      Scenario scenario, EvolutionOptions options, ContractTransformer transformer) {
    this.scenario = scenario;
    this.options = options;
    this.transformer = transformer;
  }

  /** Baseline states everywhere, then the scenario's deviation on its target component. */
  public static EvolutionContext initialize(
      Scenario scenario, EvolutionOptions options, ContractTransformer transformer) {
    Objects.requireNonNull(scenario, "scenario");
    EvolutionContext context =
        new EvolutionContext(
            scenario,
            EvolutionOptions.normalize(options),
            Objects.requireNonNull(transformer, "transformer"));
    ContractNetwork network = scenario.network();
    Deviation deviation = scenario.deviation();
    for (Component component : network.components()) {
      Contract baseline = network.baseline(component.name());
      Contract initial = baseline;
      Component effective = component;
      if (component.name().equals(deviation.component())) {
        initial = deviation.applyTo(baseline);
        effective = deviation.applyTo(component);
      }
      context.components.put(component.name(), effective);
      context.states.put(component.name(), new ComponentState(component.name(), baseline, initial));
      context.initialContracts.put(component.name(), initial);
    }
    return context;
  }

  public Scenario scenario() {
    return scenario;
  }

  public ContractNetwork network() {
    return scenario.network();
  }

  public EvolutionOptions options() {
    return options;
  }

  public ContractTransformer transformer() {
    return transformer;
  }

  public SnapshotRecorder recorder() {
    return recorder;
  }

  public Component component(String name) {
    Component component = components.get(name);
    if (component == null) {
      throw new IllegalArgumentException("Unknown component " + name);
    }
    return component;
  }

  public ComponentState state(String name) {
    ComponentState state = states.get(name);
    if (state == null) {
      throw new IllegalArgumentException("Unknown component " + name);
    }
    return state;
  }

  /** States in network order. */
  public Collection<ComponentState> states() {
    return Collections.unmodifiableCollection(states.values());
  }

  public Map<String, Contract> initialContracts() {
    return Collections.unmodifiableMap(initialContracts);
  }

  public Map<String, Contract> currentContracts() {
    Map<String, Contract> current = new LinkedHashMap<>();
    states.forEach((name, state) -> current.put(name, state.current()));
    return current;
  }

  public Map<String, Contract> baselineContracts() {
    Map<String, Contract> baselines = new LinkedHashMap<>();
    states.forEach((name, state) -> baselines.put(name, state.baseline()));
    return baselines;
  }

  public int iteration() {
    return iteration;
  }

  int beginIteration() {
    return ++iteration;
  }

  /** First component, in network order, whose current contract has an empty side. */
  public String firstInfeasibleComponent() {
    for (ComponentState state : states.values()) {
      if (!state.current().isFeasible()) {
        return state.component();
      }
    }
    return null;
  }
}
