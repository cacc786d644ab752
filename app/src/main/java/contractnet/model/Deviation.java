package contractnet.model;

import contractnet.region.Region;
import java.util.Objects;

/**
 * Local change injected into one component before propagation starts.
 *
 * <p>Each side that is {@code null} keeps its baseline value. A deviation may also swap the
 * component's behavior model, for example to describe a degraded part.
 */
public record Deviation(
    String component,
    Region assumption,
    Region guarantee,
    BehaviorModel model,
    String description) {

  public Deviation {
    Objects.requireNonNull(component, "component");
    description = description == null ? "" : description;
    if (assumption == null && guarantee == null && model == null) {
      throw new IllegalArgumentException("Deviation of " + component + " changes nothing");
    }
  }

  public static Deviation ofContract(String component, Contract target, String description) {
    return new Deviation(
        component, target.assumption(), target.guarantee(), null, description);
  }

  public static Deviation ofGuarantee(String component, Region guarantee, String description) {
    return new Deviation(component, null, guarantee, null, description);
  }

  public Deviation withModel(BehaviorModel replacement) {
    return new Deviation(component, assumption, guarantee, replacement, description);
  }

  public Contract applyTo(Contract baseline) {
    return new Contract(
        assumption != null ? assumption : baseline.assumption(),
        guarantee != null ? guarantee : baseline.guarantee());
  }

  public Component applyTo(Component baseline) {
    return model != null ? baseline.withModel(model) : baseline;
  }
}
