package contractnet.region;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Axis-aligned hyperrectangle over named variables.
 *
 * <p>A box is total over its declared variable set. Two boxes are equal only when they declare
 * the same variables with bound-for-bound identical intervals. Variables a box does not declare
 * are unconstrained, so containment and intersection treat boxes as cylinders over the union of
 * their variables.
 */
public final class Box {
  private static final Box UNCONSTRAINED = new Box(new TreeMap<>());

  private final SortedMap<String, Interval> intervals;

  private Box(SortedMap<String, Interval> intervals) {
    this.intervals = Collections.unmodifiableSortedMap(intervals);
  }

  public static Box of(Map<String, Interval> intervals) {
    Objects.requireNonNull(intervals, "intervals");
    SortedMap<String, Interval> copy = new TreeMap<>();
    intervals.forEach(
        (name, interval) -> {
          Objects.requireNonNull(name, "variable name");
          copy.put(name, Objects.requireNonNull(interval, "interval for " + name));
        });
    return new Box(copy);
  }

  /** Box over zero variables; contains every box. */
  public static Box unconstrained() {
    return UNCONSTRAINED;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> variables() {
    return intervals.keySet();
  }

  public SortedMap<String, Interval> intervals() {
    return intervals;
  }

  public boolean declares(String variable) {
    return intervals.containsKey(variable);
  }

  public Interval interval(String variable) {
    Interval interval = intervals.get(variable);
    if (interval == null) {
      throw new IllegalArgumentException("Box does not declare variable " + variable);
    }
    return interval;
  }

  public int dimension() {
    return intervals.size();
  }

  /** Product of interval widths; a box over zero variables has volume 1. */
  public double volume() {
    double volume = 1.0;
    for (Interval interval : intervals.values()) {
      volume *= interval.width();
    }
    return volume;
  }

  /** True when every point of {@code other} lies in this box. */
  public boolean contains(Box other) {
    return contains(other, 0.0);
  }

  /** Containment with every interval of this box widened by {@code tolerance}. */
  public boolean contains(Box other, double tolerance) {
    for (Map.Entry<String, Interval> entry : intervals.entrySet()) {
      Interval theirs = other.intervals.get(entry.getKey());
      if (theirs == null || !entry.getValue().contains(theirs, tolerance)) {
        return false;
      }
    }
    return true;
  }

  /** Intersection over the union of both variable sets; empty when some dimension is disjoint. */
  public Optional<Box> intersect(Box other) {
    SortedMap<String, Interval> result = new TreeMap<>(intervals);
    for (Map.Entry<String, Interval> entry : other.intervals.entrySet()) {
      Interval mine = result.get(entry.getKey());
      if (mine == null) {
        result.put(entry.getKey(), entry.getValue());
        continue;
      }
      Optional<Interval> overlap = mine.intersect(entry.getValue());
      if (overlap.isEmpty()) {
        return Optional.empty();
      }
      result.put(entry.getKey(), overlap.get());
    }
    return Optional.of(new Box(result));
  }

  /** Smallest box containing both; only dimensions declared by both boxes survive. */
  public Box span(Box other) {
    SortedMap<String, Interval> result = new TreeMap<>();
    for (Map.Entry<String, Interval> entry : intervals.entrySet()) {
      Interval theirs = other.intervals.get(entry.getKey());
      if (theirs != null) {
        result.put(entry.getKey(), entry.getValue().span(theirs));
      }
    }
    return new Box(result);
  }

  /** Restricts the box to the given variables; undeclared names are ignored. */
  public Box project(Collection<String> variables) {
    SortedMap<String, Interval> result = new TreeMap<>();
    for (String variable : variables) {
      Interval interval = intervals.get(variable);
      if (interval != null) {
        result.put(variable, interval);
      }
    }
    return new Box(result);
  }

  /** Returns a copy whose dimensions declared by {@code replacement} take its intervals. */
  public Box withIntervals(Box replacement) {
    if (replacement.intervals.isEmpty()) {
      return this;
    }
    SortedMap<String, Interval> result = new TreeMap<>(intervals);
    result.putAll(replacement.intervals);
    return new Box(result);
  }

  public Box with(String variable, Interval interval) {
    SortedMap<String, Interval> result = new TreeMap<>(intervals);
    result.put(Objects.requireNonNull(variable, "variable"), interval);
    return new Box(result);
  }

  /**
   * Signed bound deltas between a baseline box and an evolved box over the variables both declare.
   * A bound that did not move produces no delta.
   */
  public static List<BoundDelta> deviation(Box baseline, Box evolved) {
    List<BoundDelta> deltas = new ArrayList<>();
    for (Map.Entry<String, Interval> entry : baseline.intervals.entrySet()) {
      Interval after = evolved.intervals.get(entry.getKey());
      if (after == null) {
        continue;
      }
      Interval before = entry.getValue();
      if (before.lower() != after.lower()) {
        deltas.add(
            new BoundDelta(entry.getKey(), BoundDelta.Bound.LOWER, before.lower(), after.lower()));
      }
      if (before.upper() != after.upper()) {
        deltas.add(
            new BoundDelta(entry.getKey(), BoundDelta.Bound.UPPER, before.upper(), after.upper()));
      }
    }
    return deltas;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Box other && intervals.equals(other.intervals);
  }

  @Override
  public int hashCode() {
    return intervals.hashCode();
  }

  @Override
  public String toString() {
    return intervals.entrySet().stream()
        .map(entry -> entry.getKey() + "∈" + entry.getValue())
        .collect(Collectors.joining(", ", "{", "}"));
  }

  /** Incremental box construction in declaration order. */
  public static final class Builder {
    private final SortedMap<String, Interval> intervals = new TreeMap<>();

    private Builder() {}

    public Builder bound(String variable, double lower, double upper) {
      intervals.put(Objects.requireNonNull(variable, "variable"), new Interval(lower, upper));
      return this;
    }

    public Builder bound(String variable, Interval interval) {
      intervals.put(
          Objects.requireNonNull(variable, "variable"),
          Objects.requireNonNull(interval, "interval"));
      return this;
    }

    public Box build() {
      return new Box(new TreeMap<>(intervals));
    }
  }
}
