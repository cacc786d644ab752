package contractnet.region;

import java.util.Locale;
import java.util.Optional;

/** Closed interval {@code [lower, upper]}; a point interval is valid. */
public record Interval(double lower, double upper) {

  public Interval {
    if (Double.isNaN(lower) || Double.isNaN(upper)) {
      throw new IllegalArgumentException("Interval bounds must not be NaN");
    }
    if (lower > upper) {
      throw new IllegalArgumentException(
          "Interval lower bound " + lower + " exceeds upper bound " + upper);
    }
    // -0.0 becomes 0.0 so that record equality matches numeric equality
    lower += 0.0;
    upper += 0.0;
  }

  public static Interval of(double lower, double upper) {
    return new Interval(lower, upper);
  }

  public static Interval point(double value) {
    return new Interval(value, value);
  }

  public double width() {
    return upper - lower;
  }

  public boolean isPoint() {
    return lower == upper;
  }

  public boolean contains(double value) {
    return value >= lower && value <= upper;
  }

  public boolean contains(Interval other) {
    return other.lower >= lower && other.upper <= upper;
  }

  /** Containment after widening this interval by {@code tolerance} on both sides. */
  public boolean contains(Interval other, double tolerance) {
    return other.lower >= lower - tolerance && other.upper <= upper + tolerance;
  }

  public Optional<Interval> intersect(Interval other) {
    double lo = Math.max(lower, other.lower);
    double hi = Math.min(upper, other.upper);
    return lo <= hi ? Optional.of(new Interval(lo, hi)) : Optional.empty();
  }

  public Interval span(Interval other) {
    return new Interval(Math.min(lower, other.lower), Math.max(upper, other.upper));
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "[%s, %s]", format(lower), format(upper));
  }

  static String format(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return String.format(Locale.ROOT, "%.1f", value);
    }
    return String.format(Locale.ROOT, "%.6g", value);
  }
}
