package contractnet.model;

import contractnet.region.Box;
import contractnet.region.Region;
import java.util.Objects;

/** Assume-guarantee pair of regions attached to one component. */
public record Contract(Region assumption, Region guarantee) {

  public Contract {
    Objects.requireNonNull(assumption, "assumption");
    Objects.requireNonNull(guarantee, "guarantee");
  }

  public static Contract of(Box assumption, Box guarantee) {
    return new Contract(Region.of(assumption), Region.of(guarantee));
  }

  public Contract withAssumption(Region replacement) {
    return new Contract(replacement, guarantee);
  }

  public Contract withGuarantee(Region replacement) {
    return new Contract(assumption, replacement);
  }

  /** A contract with an empty side describes an infeasible component. */
  public boolean isFeasible() {
    return !assumption.isEmpty() && !guarantee.isEmpty();
  }

  @Override
  public String toString() {
    return "A: " + assumption + " | G: " + guarantee;
  }
}
