package contractnet.region;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Finite union of boxes.
 *
 * <p>Regions are immutable values. Boxes keep insertion order for reproducible reports, while
 * equality is box-set equality and ignores order. A box that is bound-for-bound identical to one
 * already present is dropped on insertion. The region with zero boxes is the empty region and
 * stands for infeasibility, not for the absence of constraints.
 */
public final class Region {
  private static final Region EMPTY = new Region(List.of());

  private final List<Box> boxes;

  private Region(List<Box> boxes) {
    this.boxes = boxes;
  }

  public static Region empty() {
    return EMPTY;
  }

  public static Region of(Box... boxes) {
    return of(List.of(boxes));
  }

  public static Region of(Collection<Box> boxes) {
    Objects.requireNonNull(boxes, "boxes");
    if (boxes.isEmpty()) {
      return EMPTY;
    }
    Set<Box> unique = new LinkedHashSet<>(boxes.size());
    for (Box box : boxes) {
      unique.add(Objects.requireNonNull(box, "box"));
    }
    return new Region(Collections.unmodifiableList(new ArrayList<>(unique)));
  }

  public List<Box> boxes() {
    return boxes;
  }

  public int size() {
    return boxes.size();
  }

  public boolean isEmpty() {
    return boxes.isEmpty();
  }

  /** Set union; candidate boxes identical to an existing box are dropped. */
  public Region union(Region other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    List<Box> merged = new ArrayList<>(boxes.size() + other.boxes.size());
    merged.addAll(boxes);
    merged.addAll(other.boxes);
    return of(merged);
  }

  public Region union(Box box) {
    return union(of(box));
  }

  /** Exact intersection: the non-empty pairwise intersections of the boxes of both regions. */
  public Region intersect(Region other) {
    List<Box> result = new ArrayList<>();
    for (Box mine : boxes) {
      for (Box theirs : other.boxes) {
        mine.intersect(theirs).ifPresent(result::add);
      }
    }
    return of(result);
  }

  /** True when some single box of this region contains {@code box}. */
  public boolean contains(Box box) {
    return contains(box, 0.0);
  }

  /** As {@link #contains(Box)}, with every box widened by {@code tolerance}. */
  public boolean contains(Box box, double tolerance) {
    for (Box candidate : boxes) {
      if (candidate.contains(box, tolerance)) {
        return true;
      }
    }
    return false;
  }

  /** True when every box of {@code other} lies inside some box of this region. */
  public boolean covers(Region other) {
    for (Box box : other.boxes) {
      if (!contains(box)) {
        return false;
      }
    }
    return true;
  }

  /** True when every box of this region intersects {@code other}. */
  public boolean intersectsAll(Region other) {
    for (Box mine : boxes) {
      boolean hit = false;
      for (Box theirs : other.boxes) {
        if (mine.intersect(theirs).isPresent()) {
          hit = true;
          break;
        }
      }
      if (!hit) {
        return false;
      }
    }
    return true;
  }

  /** Sum of box volumes; overlapping boxes are counted once per box. */
  public double volume() {
    double total = 0.0;
    for (Box box : boxes) {
      total += box.volume();
    }
    return total;
  }

  /** Bounding box over the variables every box declares; empty for the empty region. */
  public Optional<Box> hull() {
    if (boxes.isEmpty()) {
      return Optional.empty();
    }
    Box hull = boxes.get(0);
    for (int i = 1; i < boxes.size(); i++) {
      hull = hull.span(boxes.get(i));
    }
    return Optional.of(hull);
  }

  public Region project(Collection<String> variables) {
    return map(box -> box.project(variables));
  }

  public Region map(UnaryOperator<Box> mapper) {
    List<Box> mapped = new ArrayList<>(boxes.size());
    for (Box box : boxes) {
      mapped.add(mapper.apply(box));
    }
    return of(mapped);
  }

  /** Boxes of this region that are not present in {@code previous}. */
  public List<Box> boxesNotIn(Region previous) {
    Set<Box> seen = Set.copyOf(previous.boxes);
    List<Box> fresh = new ArrayList<>();
    for (Box box : boxes) {
      if (!seen.contains(box)) {
        fresh.add(box);
      }
    }
    return fresh;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Region other) || other.boxes.size() != boxes.size()) {
      return false;
    }
    return Set.copyOf(boxes).equals(Set.copyOf(other.boxes));
  }

  @Override
  public int hashCode() {
    return Set.copyOf(boxes).hashCode();
  }

  @Override
  public String toString() {
    if (boxes.isEmpty()) {
      return "∅";
    }
    return boxes.stream().map(Box::toString).collect(Collectors.joining(" ∪ "));
  }
}
