package contractnet.validation;

import contractnet.model.Contract;
import contractnet.region.Box;
import contractnet.region.Interval;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares what the network guarantees with a required system-level guarantee.
 *
 * <p>For every variable the required guarantee bounds, the achieved interval is the span of all
 * component guarantee boxes declaring it. A variable whose achieved interval leaves the required
 * one is a violation; a variable no component guarantees is a gap.
 */
public final class SystemLevelChecker {

  public SystemLevelCheck check(Map<String, Contract> contracts, Contract systemContract) {
    Map<String, Interval> required = new LinkedHashMap<>();
    for (Box box : systemContract.guarantee().boxes()) {
      box.intervals()
          .forEach((variable, interval) -> required.merge(variable, interval, Interval::span));
    }

    Map<String, Interval> achieved = new LinkedHashMap<>();
    List<String> gaps = new ArrayList<>();
    List<String> violations = new ArrayList<>();
    for (Map.Entry<String, Interval> entry : required.entrySet()) {
      Optional<Interval> span = achievedSpan(contracts, entry.getKey());
      if (span.isEmpty()) {
        gaps.add(entry.getKey() + " required in " + entry.getValue() + " but not guaranteed");
        continue;
      }
      achieved.put(entry.getKey(), span.get());
      if (!entry.getValue().contains(span.get())) {
        violations.add(
            entry.getKey()
                + " achieved "
                + span.get()
                + " exceeds required "
                + entry.getValue());
      }
    }

    List<String> details = new ArrayList<>();
    if (!gaps.isEmpty()) {
      details.add("Gap detected: " + gaps.size() + " variable(s) required but not achieved");
      details.addAll(gaps);
    }
    if (!violations.isEmpty()) {
      details.add(
          "Violation detected: " + violations.size() + " variable(s) achieved but not required");
      details.addAll(violations);
    }
    ValidationResult result =
        details.isEmpty()
            ? ValidationResult.pass("System-level contract is SATISFIED")
            : ValidationResult.fail("System-level contract is NOT satisfied", details);
    return new SystemLevelCheck(result, achieved, gaps, violations);
  }

  private Optional<Interval> achievedSpan(Map<String, Contract> contracts, String variable) {
    Interval span = null;
    for (Contract contract : contracts.values()) {
      for (Box box : contract.guarantee().boxes()) {
        if (box.declares(variable)) {
          Interval interval = box.interval(variable);
          span = span == null ? interval : span.span(interval);
        }
      }
    }
    return Optional.ofNullable(span);
  }

  /** Check result with the per-variable achieved intervals behind it. */
  public record SystemLevelCheck(
      ValidationResult result,
      Map<String, Interval> achieved,
      List<String> gaps,
      List<String> violations) {

    public SystemLevelCheck {
      achieved = Collections.unmodifiableMap(new LinkedHashMap<>(achieved));
      gaps = List.copyOf(gaps);
      violations = List.copyOf(violations);
    }

    public boolean satisfied() {
      return result.passed();
    }
  }
}
