package contractnet.engine;

import contractnet.region.Box;
import contractnet.region.Region;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Composition rules that fold transformer results into contract regions. */
final class ContractMerge {

  private ContractMerge() {}

  /**
   * Assumption relaxation: {@code A ∪ {a[I := r] : a ∈ A, r ∈ image}}, restricted to the
   * image boxes {@code r} that no box of {@code A} already accepts on {@code I} (within
   * {@code tolerance}). Of the new boxes only those not nested in another new box are added,
   * so the covered set is the same as with every pair. Boxes of {@code A} are never removed.
   */
  static Region relax(
      Region assumption, Region image, List<String> variables, double tolerance) {
    if (assumption.isEmpty() || image.isEmpty()) {
      return assumption;
    }
    Region accepted = assumption.project(variables);
    List<Box> added = new ArrayList<>();
    for (Box bound : image.boxes()) {
      Box reachable = bound.project(variables);
      if (accepted.contains(reachable, tolerance)) {
        continue;
      }
      for (Box box : assumption.boxes()) {
        added.add(box.withIntervals(reachable));
      }
    }
    return assumption.union(Region.of(maximal(added)));
  }

  /**
   * Guarantee absorption: {@code guarantee ∪ image}, leaving out image boxes that a guarantee
   * box already contains within {@code tolerance}.
   */
  static Region absorb(Region guarantee, Region image, double tolerance) {
    List<Box> added = new ArrayList<>();
    for (Box box : image.boxes()) {
      if (!guarantee.contains(box, tolerance)) {
        added.add(box);
      }
    }
    return guarantee.union(Region.of(added));
  }

  /**
   * Guarantee narrowing against a consumer requirement on {@code variables}. A box whose
   * projection fits inside one requirement box is kept as is; otherwise it is replaced by its
   * non-empty intersections with the requirement boxes, minus pieces nested in a sibling piece.
   * Every resulting box lies inside the box it came from.
   */
  static Region narrow(Region guarantee, Region requirement, List<String> variables) {
    Region required = requirement.project(variables);
    List<Box> narrowed = new ArrayList<>();
    for (Box box : guarantee.boxes()) {
      Box projected = box.project(variables);
      if (required.contains(projected)) {
        narrowed.add(box);
        continue;
      }
      List<Box> pieces = new ArrayList<>();
      for (Box bound : required.boxes()) {
        Optional<Box> overlap = projected.intersect(bound);
        overlap.ifPresent(o -> pieces.add(box.withIntervals(o)));
      }
      narrowed.addAll(maximal(pieces));
    }
    return Region.of(narrowed);
  }

  /** Intersection of the candidates; a single candidate is returned unchanged. */
  static Region intersectAll(List<Region> candidates) {
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("No candidates to intersect");
    }
    Region result = candidates.get(0);
    for (int i = 1; i < candidates.size(); i++) {
      result = result.intersect(candidates.get(i));
    }
    return result;
  }

  private static List<Box> maximal(List<Box> pieces) {
    List<Box> kept = new ArrayList<>();
    for (int i = 0; i < pieces.size(); i++) {
      Box piece = pieces.get(i);
      boolean nested = false;
      for (int j = 0; j < pieces.size() && !nested; j++) {
        if (i == j) {
          continue;
        }
        Box other = pieces.get(j);
        // of two identical pieces keep the first
        nested = other.contains(piece) && (!piece.contains(other) || j < i);
      }
      if (!nested) {
        kept.add(piece);
      }
    }
    return kept;
  }
}
