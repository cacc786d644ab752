package contractnet.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Network node: named input and output variables plus the behavior model relating them. */
public record Component(
    String name, List<Variable> inputs, List<Variable> outputs, BehaviorModel model) {

  public Component {
    Objects.requireNonNull(name, "name");
    inputs = List.copyOf(inputs);
    outputs = List.copyOf(outputs);
    Objects.requireNonNull(model, "model");
    Set<String> seen = new HashSet<>();
    for (Variable variable : inputs) {
      if (!seen.add(variable.name())) {
        throw new IllegalArgumentException(
            "Component " + name + " declares " + variable.name() + " twice");
      }
    }
    for (Variable variable : outputs) {
      if (!seen.add(variable.name())) {
        throw new IllegalArgumentException(
            "Component " + name + " declares " + variable.name() + " as input and output");
      }
    }
  }

  public List<String> inputNames() {
    return inputs.stream().map(Variable::name).toList();
  }

  public List<String> outputNames() {
    return outputs.stream().map(Variable::name).toList();
  }

  /** Inputs followed by outputs. */
  public List<Variable> variables() {
    List<Variable> all = new ArrayList<>(inputs.size() + outputs.size());
    all.addAll(inputs);
    all.addAll(outputs);
    return all;
  }

  public boolean hasInput(String variable) {
    return inputs.stream().anyMatch(v -> v.name().equals(variable));
  }

  public boolean hasOutput(String variable) {
    return outputs.stream().anyMatch(v -> v.name().equals(variable));
  }

  public boolean declares(String variable) {
    return hasInput(variable) || hasOutput(variable);
  }

  public Component withModel(BehaviorModel replacement) {
    return new Component(name, inputs, outputs, replacement);
  }

  @Override
  public String toString() {
    return name + "(in=" + inputNames() + ", out=" + outputNames() + ")";
  }
}
